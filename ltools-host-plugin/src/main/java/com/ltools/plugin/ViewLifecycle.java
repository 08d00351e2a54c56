package com.ltools.plugin;

/**
 * Optional capability for plugins that react to their page becoming visible or hidden.
 * Hooks run on the host's hook executor, never on the navigation thread.
 */
public interface ViewLifecycle {

    void onEnter(PluginContext context) throws Exception;

    void onLeave(PluginContext context) throws Exception;
}
