package com.ltools.plugin.processmanager;

import com.ltools.plugin.PluginCapability;
import com.ltools.plugin.PluginProvider;

/** Builtin provider for {@link ProcessManagerPlugin}. */
public final class ProcessManagerPluginProvider implements PluginProvider {

    @Override
    public String getPluginId() {
        return ProcessManagerPlugin.ID;
    }

    @Override
    public PluginCapability createCapability() {
        return new ProcessManagerPlugin();
    }
}
