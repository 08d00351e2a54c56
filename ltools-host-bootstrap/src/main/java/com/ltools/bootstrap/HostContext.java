package com.ltools.bootstrap;

import com.ltools.config.HostConfig;
import com.ltools.events.EventBus;
import com.ltools.lifecycle.LifecycleManager;
import com.ltools.lifecycle.TransitionResult;
import com.ltools.navigation.NavItem;
import com.ltools.navigation.NavigationOutcome;
import com.ltools.navigation.NavigationSynchronizer;
import com.ltools.navigation.Navigator;
import com.ltools.navigation.PageGuard;
import com.ltools.navigation.PageTransition;
import com.ltools.plugin.PluginManager;
import com.ltools.plugin.PluginRegistry;
import com.ltools.plugin.PluginSnapshot;
import com.ltools.shortcuts.DispatchOutcome;
import com.ltools.shortcuts.ReservedAction;
import com.ltools.shortcuts.ReservedActionHandler;
import com.ltools.shortcuts.ShortcutDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Facade over the wired host returned from {@link HostBootstrap}. This is the surface the UI and
 * input layers talk to; it owns every component and closes them in dependency order.
 */
public final class HostContext implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HostContext.class);

    private final HostConfig config;
    private final PluginManager pluginManager;
    private final EventBus events;
    private final PluginRegistry registry;
    private final LifecycleManager lifecycle;
    private final PageGuard guard;
    private final Navigator navigator;
    private final NavigationSynchronizer navigation;
    private final ShortcutDispatcher dispatcher;
    private final AtomicBoolean closed = new AtomicBoolean();

    HostContext(HostConfig config, PluginManager pluginManager, EventBus events, PluginRegistry registry,
                LifecycleManager lifecycle, PageGuard guard, Navigator navigator,
                NavigationSynchronizer navigation, ShortcutDispatcher dispatcher) {
        this.config = Objects.requireNonNull(config, "config");
        this.pluginManager = Objects.requireNonNull(pluginManager, "pluginManager");
        this.events = Objects.requireNonNull(events, "events");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.lifecycle = Objects.requireNonNull(lifecycle, "lifecycle");
        this.guard = Objects.requireNonNull(guard, "guard");
        this.navigator = Objects.requireNonNull(navigator, "navigator");
        this.navigation = Objects.requireNonNull(navigation, "navigation");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
    }

    public HostConfig getConfig() {
        return config;
    }

    /** Snapshots of every registered plugin in registration order. */
    public List<PluginSnapshot> plugins() {
        return registry.snapshots();
    }

    /** Current navigation menu: base items followed by navigable plugin items. */
    public List<NavItem> navigationItems() {
        return navigation.current().items();
    }

    /** Bus for subscribing to lifecycle, navigation and plugin topics. */
    public EventBus events() {
        return events;
    }

    /** Routes a plugin id from the global shortcut layer. */
    public DispatchOutcome dispatchShortcut(String pluginId) {
        return dispatcher.handle(pluginId);
    }

    public DispatchOutcome dispatchKeyCombo(String keyCombo) {
        return dispatcher.handleKeyCombo(keyCombo);
    }

    public void registerReservedHandler(ReservedAction action, ReservedActionHandler handler) {
        dispatcher.registerHandler(action, handler);
    }

    /** Runs leave/enter hooks for a page change reported by the UI layer. */
    public PageTransition notifyTransition(String previousId, String nextId) {
        return guard.notifyTransition(previousId, nextId);
    }

    public NavigationOutcome navigate(String path) {
        return navigator.navigate(path);
    }

    public Navigator navigator() {
        return navigator;
    }

    public TransitionResult setEnabled(String pluginId, boolean enabled) {
        return lifecycle.setEnabled(pluginId, enabled);
    }

    public TransitionResult init(String pluginId) {
        return lifecycle.init(pluginId);
    }

    public PluginRegistry registry() {
        return registry;
    }

    /**
     * Stops shortcut intake and navigation sync, shuts every plugin down, then releases the
     * hook pool, the bus and external class loaders. Idempotent.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        log.info("Host shutting down");
        dispatcher.close();
        lifecycle.shutdownAll();
        navigation.close();
        guard.close();
        events.close();
        pluginManager.close();
        log.info("Host stopped");
    }
}
