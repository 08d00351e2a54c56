package com.ltools.lifecycle;

/**
 * A plugin's one-time {@code init} threw. The plugin is put into ERROR; a later enable retries init.
 */
public class PluginInitException extends RuntimeException {

    private final String pluginId;

    public PluginInitException(String pluginId, Throwable cause) {
        super("Plugin " + pluginId + " failed to initialize: " + LifecycleHookException.describe(cause), cause);
        this.pluginId = pluginId;
    }

    public String getPluginId() {
        return pluginId;
    }
}
