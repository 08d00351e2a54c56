package com.ltools.navigation;

/** Enter or leave callback of a plugin page. */
@FunctionalInterface
public interface PageHook {

    void run() throws Exception;
}
