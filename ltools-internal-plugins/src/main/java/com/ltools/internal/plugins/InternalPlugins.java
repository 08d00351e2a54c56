package com.ltools.internal.plugins;

import com.ltools.config.HostConfig;
import com.ltools.plugin.PluginManager;
import com.ltools.plugin.datetime.DateTimePluginProvider;
import com.ltools.plugin.processmanager.ProcessManagerPluginProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Plugin-side bootstrap: creates a {@link PluginManager} with the builtin providers registered
 * and external plugins loaded from the configured plugins directory. The host only calls
 * {@link #createPluginManager(HostConfig)} and registers the returned providers' capabilities
 * with {@link com.ltools.plugin.PluginRegistry}.
 */
public final class InternalPlugins {

    private static final Logger log = LoggerFactory.getLogger(InternalPlugins.class);

    private InternalPlugins() {
    }

    /**
     * Creates a PluginManager with the builtin providers (date/time, process manager) registered
     * and external plugins loaded from {@link HostConfig#getPluginsDir()}. Only that directory is
     * scanned for {@code *.jar} files.
     */
    public static PluginManager createPluginManager(HostConfig config) {
        PluginManager pluginManager = new PluginManager();

        pluginManager.registerBuiltin(new DateTimePluginProvider(Duration.ofMillis(config.getClockTickMillis())));
        pluginManager.registerBuiltin(new ProcessManagerPluginProvider());

        pluginManager.loadExternalPlugins(config.getPluginsDir());

        log.info("Plugins: {} builtin, {} external (dir={})",
                pluginManager.getBuiltinCount(), pluginManager.getExternalCount(), config.getPluginsDir());

        return pluginManager;
    }
}
