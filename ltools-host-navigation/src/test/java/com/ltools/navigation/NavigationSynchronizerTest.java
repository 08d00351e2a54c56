package com.ltools.navigation;

import com.ltools.events.EventBus;
import com.ltools.plugin.PluginMetadata;
import com.ltools.plugin.PluginRegistry;
import com.ltools.plugin.PluginSnapshot;
import com.ltools.plugin.PluginState;
import com.ltools.plugin.PluginType;
import com.ltools.plugin.RegistryMutator;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class NavigationSynchronizerTest {

    private static PluginSnapshot snapshot(String id, String name, PluginState state, boolean hasPage, boolean showInMenu) {
        return new PluginSnapshot(id, name, "", state, hasPage, showInMenu, PluginType.BUILTIN, "1.0.0", Set.of());
    }

    @Test
    void compute_projectsEnabledPagesAfterBaseItems() {
        List<NavItem> items = NavigationSynchronizer.compute(List.of(
                snapshot("calculator.builtin", "Calculator", PluginState.ENABLED, true, true),
                snapshot("clipboard.builtin", "Clipboard", PluginState.DISABLED, true, true),
                snapshot("clock.builtin", "Clock", PluginState.ENABLED, false, true),
                snapshot("hidden.plugin", "Hidden", PluginState.ENABLED, true, false),
                snapshot("my.plugin", "Mine", PluginState.ENABLED, true, true)));

        assertEquals(List.of("home", "plugins", "settings", "plugin-calculator.builtin", "plugin-my.plugin"),
                items.stream().map(NavItem::id).collect(Collectors.toList()));
        NavItem calculator = items.get(3);
        assertEquals("Calculator", calculator.label());
        assertEquals("calculator", calculator.icon());
        assertEquals("/plugins/calculator.builtin", calculator.path());
        assertEquals("calculator.builtin", calculator.pluginId());
        assertEquals(PluginIcons.DEFAULT_ICON, items.get(4).icon());
        assertNull(items.get(0).pluginId());
    }

    @Test
    void compute_withNoPlugins_returnsBaseItems() {
        assertEquals(NavigationSynchronizer.BASE_ITEMS, NavigationSynchronizer.compute(List.of()));
        assertEquals("/", NavigationSynchronizer.compute(null).get(0).path());
    }

    @Test
    void recomputesAndPublishesOnLifecycleEvents() {
        EventBus bus = new EventBus();
        PluginRegistry registry = new PluginRegistry(bus);
        RegistryMutator mutator = registry.mutator();
        NavigationSynchronizer sync = new NavigationSynchronizer(registry, bus);
        List<NavigationMenu> published = new ArrayList<>();
        bus.subscribe(NavigationSynchronizer.ITEMS, published::add);
        sync.start();

        registry.register(NavigationFixtures.capability("datetime.builtin", "Date & Time"));
        registry.register(NavigationFixtures.capability(PluginMetadata.builder("clock.builtin").name("Clock").hasPage(false).build()));
        mutator.setState("datetime.builtin", PluginState.ENABLED, null);
        mutator.setState("clock.builtin", PluginState.ENABLED, null);

        List<String> ids = sync.current().items().stream().map(NavItem::id).collect(Collectors.toList());
        assertEquals(List.of("home", "plugins", "settings", "plugin-datetime.builtin"), ids);
        assertEquals(5, published.size());
        assertEquals(sync.current(), published.get(published.size() - 1));

        mutator.setState("datetime.builtin", PluginState.ERROR, "crashed");
        assertEquals(3, sync.current().items().size());

        sync.close();
        mutator.setState("datetime.builtin", PluginState.ENABLED, null);
        assertEquals(3, sync.current().items().size());
    }

    @Test
    void activeItemId_followsRoute() {
        NavigationSynchronizer sync = new NavigationSynchronizer(new PluginRegistry(new EventBus()), new EventBus());

        assertEquals("home", sync.activeItemId("/"));
        assertEquals("plugins", sync.activeItemId("/plugins"));
        assertEquals("settings", sync.activeItemId("/settings"));
        assertEquals("plugin-kanban.builtin", sync.activeItemId("/plugins/kanban.builtin"));
        assertEquals("home", sync.activeItemId("/unknown"));
    }
}
