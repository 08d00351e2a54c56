package com.ltools.bootstrap;

import com.ltools.config.HostConfig;
import com.ltools.config.ShortcutBinding;
import com.ltools.events.EventBus;
import com.ltools.internal.plugins.InternalPlugins;
import com.ltools.lifecycle.LifecycleManager;
import com.ltools.lifecycle.PeriodicTaskScheduler;
import com.ltools.lifecycle.TransitionResult;
import com.ltools.navigation.HookOrdering;
import com.ltools.navigation.HostRouter;
import com.ltools.navigation.NavigationSynchronizer;
import com.ltools.navigation.PageGuard;
import com.ltools.navigation.PageHookTable;
import com.ltools.plugin.PluginCapability;
import com.ltools.plugin.PluginContext;
import com.ltools.plugin.PluginManager;
import com.ltools.plugin.PluginProvider;
import com.ltools.plugin.PluginRecord;
import com.ltools.plugin.PluginRegistry;
import com.ltools.plugin.ViewLifecycle;
import com.ltools.shortcuts.KeyComboValidator;
import com.ltools.shortcuts.ShortcutDispatcher;
import com.ltools.shortcuts.ShortcutTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Bootstrap for the LTools host: builds the plugin manager, registers every provider's capability,
 * wires the lifecycle manager, page guard, router, navigation synchronizer and shortcut dispatcher
 * around one event bus, then starts the plugins that are not disabled by configuration.
 */
public final class HostBootstrap {

    private static final Logger log = LoggerFactory.getLogger(HostBootstrap.class);

    private HostBootstrap() {
    }

    /** Loads configuration from the environment and initializes the host. */
    public static HostContext initialize() {
        log.info("Bootstrap: loading configuration from environment");
        return initialize(HostConfig.fromEnvironment());
    }

    /** Initializes the host with the builtin providers and external plugins from the configured directory. */
    public static HostContext initialize(HostConfig config) {
        return initialize(config, InternalPlugins.createPluginManager(config));
    }

    /**
     * Initializes the host with the given providers. A builtin provider that fails to register
     * aborts bootstrap; an external one is logged and skipped.
     *
     * @throws com.ltools.plugin.DuplicateRegistrationException if a builtin id is registered twice
     */
    public static HostContext initialize(HostConfig config, PluginManager pluginManager) {
        log.info("Bootstrap: platform={}, dataDir={}, hookOrdering={}, disabled={}",
                config.getPlatform(), config.getDataDir(), config.getHookOrdering(), config.getDisabledPlugins());
        EventBus events = new EventBus();
        PluginRegistry registry = new PluginRegistry(events);

        int count = 0;
        for (PluginProvider provider : pluginManager.getBuiltinProviders()) {
            if (!provider.isEnabled()) continue;
            registry.register(provider.createCapability());
            count++;
            log.info("Registered builtin plugin {}", provider.getPluginId());
        }
        for (PluginProvider provider : pluginManager.getExternalProviders()) {
            try {
                if (!provider.isEnabled()) continue;
                registry.register(provider.createCapability());
                count++;
                log.info("Registered external plugin {}", provider.getPluginId());
            } catch (Exception e) {
                log.error("External plugin failed to register (skipping): pluginId={}, error={}",
                        provider.getPluginId(), e.getMessage(), e);
            }
        }
        if (count == 0) {
            log.warn("No plugins registered; check builtin providers and {} for external JARs", config.getPluginsDir());
        }

        PeriodicTaskScheduler scheduler = new PeriodicTaskScheduler(config.getSchedulerThreads());
        LifecycleManager lifecycle = new LifecycleManager(registry, events, scheduler);

        PageHookTable hooks = new PageHookTable();
        for (PluginRecord record : registry.list()) {
            PluginCapability capability = record.getCapability();
            if (capability instanceof ViewLifecycle view) {
                PluginContext context = lifecycle.contextFor(record.getId());
                hooks.register(record.getId(), () -> view.onEnter(context), () -> view.onLeave(context));
            }
        }
        PageGuard guard = new PageGuard(hooks, registry, events, config.getHookThreads(),
                HookOrdering.parse(config.getHookOrdering()));
        HostRouter router = new HostRouter(registry, guard);

        NavigationSynchronizer navigation = new NavigationSynchronizer(registry, events);
        navigation.start();

        List<ShortcutBinding> bindings = ShortcutBinding.load(config.getShortcutsFile(), config.getPlatform());
        ShortcutTable table = ShortcutTable.build(bindings, new KeyComboValidator(config.getPlatform()));
        ShortcutDispatcher dispatcher = new ShortcutDispatcher(router, table);
        dispatcher.start(events);

        List<TransitionResult> started = lifecycle.startupAll(config.getDisabledPlugins());
        long failed = started.stream().filter(r -> !r.isSuccess()).count();
        log.info("Bootstrap: {} plugin(s) registered, {} page hook(s), {} shortcut(s), {} startup failure(s)",
                registry.size(), hooks.size(), table.size(), failed);

        return new HostContext(config, pluginManager, events, registry, lifecycle, guard, router, navigation, dispatcher);
    }
}
