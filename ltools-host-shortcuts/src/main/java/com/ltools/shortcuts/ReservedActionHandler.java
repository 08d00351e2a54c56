package com.ltools.shortcuts;

/** Performs a {@link ReservedAction} (toggle the search window, start a capture). */
@FunctionalInterface
public interface ReservedActionHandler {

    void handle(ReservedAction action) throws Exception;
}
