package com.ltools.navigation;

import com.ltools.events.EventBus;
import com.ltools.events.HostTopics;
import com.ltools.events.LifecycleEvent;
import com.ltools.events.Subscription;
import com.ltools.events.Topic;
import com.ltools.plugin.PluginRegistry;
import com.ltools.plugin.PluginSnapshot;
import com.ltools.plugin.PluginState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Keeps the navigation menu in sync with plugin state. The menu is a pure function of the
 * registry snapshots ({@link #compute}); the instance recomputes it on every lifecycle event
 * that can change it and republishes it on {@link #ITEMS}. It never writes to the registry.
 */
public final class NavigationSynchronizer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(NavigationSynchronizer.class);

    public static final Topic<NavigationMenu> ITEMS = Topic.of("navigation:items", NavigationMenu.class);

    public static final String HOME_PATH = "/";
    public static final String PLUGINS_PATH = "/plugins";
    public static final String SETTINGS_PATH = "/settings";
    public static final String PLUGIN_ITEM_PREFIX = "plugin-";

    static final List<NavItem> BASE_ITEMS = List.of(
            NavItem.base("home", "Home", "home", HOME_PATH),
            NavItem.base("plugins", "Plugin Market", "puzzle-piece", PLUGINS_PATH),
            NavItem.base("settings", "Settings", "cog", SETTINGS_PATH));

    private final PluginRegistry registry;
    private final EventBus events;
    private final AtomicReference<NavigationMenu> current = new AtomicReference<>(new NavigationMenu(BASE_ITEMS));
    private volatile Subscription<LifecycleEvent> subscription;

    public NavigationSynchronizer(PluginRegistry registry, EventBus events) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.events = Objects.requireNonNull(events, "events");
    }

    /**
     * Base items, then one item per ENABLED plugin with {@code hasPage && showInMenu}, in snapshot order.
     */
    public static List<NavItem> compute(List<PluginSnapshot> snapshots) {
        List<NavItem> items = new ArrayList<>(BASE_ITEMS);
        if (snapshots != null) {
            for (PluginSnapshot p : snapshots) {
                if (p.getState() == PluginState.ENABLED && p.hasPage() && p.showInMenu()) {
                    items.add(new NavItem(PLUGIN_ITEM_PREFIX + p.getId(), p.getName(),
                            PluginIcons.iconFor(p.getId()), pluginPath(p.getId()), p.getId()));
                }
            }
        }
        return List.copyOf(items);
    }

    /** Route of a plugin page. */
    public static String pluginPath(String pluginId) {
        return PLUGINS_PATH + "/" + (pluginId != null ? pluginId.trim() : "");
    }

    /** Subscribes to lifecycle events and computes the initial menu. */
    public void start() {
        if (subscription != null) return;
        subscription = events.subscribe(HostTopics.LIFECYCLE, this::onLifecycleEvent);
        recompute();
    }

    /** Latest computed menu. */
    public NavigationMenu current() {
        return current.get();
    }

    /** Menu item highlighted for a route; unknown routes highlight {@code home}. */
    public String activeItemId(String path) {
        if (path == null || path.isBlank()) return "home";
        String p = path.trim();
        if (p.equals(HOME_PATH)) return "home";
        if (p.equals(PLUGINS_PATH)) return "plugins";
        if (p.equals(SETTINGS_PATH)) return "settings";
        if (p.startsWith(PLUGINS_PATH + "/")) {
            return PLUGIN_ITEM_PREFIX + p.substring(PLUGINS_PATH.length() + 1);
        }
        return "home";
    }

    NavigationMenu recompute() {
        NavigationMenu menu = new NavigationMenu(compute(registry.snapshots()));
        current.set(menu);
        int delivered = events.publish(ITEMS, menu);
        log.debug("Navigation menu recomputed: {} item(s), {} subscriber(s)", menu.items().size(), delivered);
        return menu;
    }

    private void onLifecycleEvent(LifecycleEvent event) {
        if (event.kind().affectsNavigation()) {
            recompute();
        }
    }

    @Override
    public void close() {
        Subscription<LifecycleEvent> s = subscription;
        if (s != null) {
            s.close();
            subscription = null;
        }
    }
}
