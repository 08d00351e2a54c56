package com.ltools.plugin;

/**
 * SPI for plugin discovery. External plugins list their provider in
 * {@code META-INF/services/com.ltools.plugin.PluginProvider}; builtin providers are registered
 * explicitly by the host.
 */
public interface PluginProvider {

    /** Plugin id; must equal {@code createCapability().metadata().getId()}. */
    String getPluginId();

    /** Creates the capability. Called once per host run. */
    PluginCapability createCapability();

    /** Whether this provider should be registered. Override to skip when a prerequisite is missing. */
    default boolean isEnabled() {
        return true;
    }
}
