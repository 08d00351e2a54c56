package com.ltools.plugin;

/**
 * Write access to plugin runtime state. Obtained once from {@link PluginRegistry#mutator()} by the
 * lifecycle manager; every other component reads the registry only.
 */
public interface RegistryMutator {

    /**
     * Swaps the plugin's state (keeping its page flags) and publishes the matching lifecycle event
     * after the swap.
     *
     * @param detail failure message, kept only for {@link PluginState#ERROR}
     * @return the new runtime state
     * @throws UnknownPluginException if the id is not registered
     */
    PluginRuntimeState setState(String pluginId, PluginState state, String detail);
}
