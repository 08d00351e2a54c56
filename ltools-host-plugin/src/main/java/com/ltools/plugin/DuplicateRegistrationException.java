package com.ltools.plugin;

/**
 * Thrown when a plugin id is registered twice. The existing entry is left untouched.
 */
public class DuplicateRegistrationException extends IllegalArgumentException {

    private final String pluginId;

    public DuplicateRegistrationException(String pluginId) {
        super("Plugin already registered: " + pluginId);
        this.pluginId = pluginId;
    }

    public String getPluginId() {
        return pluginId;
    }
}
