package com.ltools.plugin;

/**
 * Thrown when an operation names a plugin id that is not registered.
 */
public class UnknownPluginException extends RuntimeException {

    private final String pluginId;

    public UnknownPluginException(String pluginId) {
        super("Unknown plugin: " + pluginId);
        this.pluginId = pluginId;
    }

    public String getPluginId() {
        return pluginId;
    }
}
