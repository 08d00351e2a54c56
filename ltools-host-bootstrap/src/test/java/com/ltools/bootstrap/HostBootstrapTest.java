package com.ltools.bootstrap;

import com.ltools.config.HostConfig;
import com.ltools.lifecycle.TransitionStatus;
import com.ltools.navigation.HookOutcome;
import com.ltools.navigation.NavItem;
import com.ltools.navigation.PageTransition;
import com.ltools.plugin.DuplicateRegistrationException;
import com.ltools.plugin.PluginCapability;
import com.ltools.plugin.PluginContext;
import com.ltools.plugin.PluginManager;
import com.ltools.plugin.PluginMetadata;
import com.ltools.plugin.PluginProvider;
import com.ltools.plugin.PluginSnapshot;
import com.ltools.plugin.PluginState;
import com.ltools.plugin.PluginType;
import com.ltools.plugin.ViewLifecycle;
import com.ltools.shortcuts.DispatchOutcome;
import com.ltools.shortcuts.ReservedAction;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HostBootstrapTest {

    @TempDir
    Path dataDir;

    private HostContext host;

    @AfterEach
    void tearDown() {
        if (host != null) host.close();
    }

    /** Page plugin counting its lifecycle and view hooks. */
    static final class PagePlugin implements PluginCapability, ViewLifecycle {
        final PluginMetadata metadata;
        final AtomicInteger startups = new AtomicInteger();
        final AtomicInteger shutdowns = new AtomicInteger();
        final AtomicInteger enters = new AtomicInteger();
        final AtomicInteger leaves = new AtomicInteger();
        final CountDownLatch entered = new CountDownLatch(1);

        PagePlugin(String id, boolean hasPage) {
            this.metadata = PluginMetadata.builder(id).name(id).type(PluginType.BUILTIN).hasPage(hasPage).build();
        }

        @Override
        public PluginMetadata metadata() {
            return metadata;
        }

        @Override
        public void startup(PluginContext context) {
            startups.incrementAndGet();
        }

        @Override
        public void shutdown() {
            shutdowns.incrementAndGet();
        }

        @Override
        public void onEnter(PluginContext context) {
            enters.incrementAndGet();
            entered.countDown();
        }

        @Override
        public void onLeave(PluginContext context) {
            leaves.incrementAndGet();
        }
    }

    private static PluginProvider provider(PluginCapability capability) {
        return new PluginProvider() {
            @Override
            public String getPluginId() {
                return capability.metadata().getId();
            }

            @Override
            public PluginCapability createCapability() {
                return capability;
            }
        };
    }

    private HostConfig config(Set<String> disabled) {
        return HostConfig.builder()
                .dataDir(dataDir)
                .platform(HostConfig.PLATFORM_LINUX)
                .disabledPlugins(disabled)
                .build();
    }

    private static List<String> itemIds(List<NavItem> items) {
        return items.stream().map(NavItem::id).collect(Collectors.toList());
    }

    @Test
    void initialize_startsPluginsAndBuildsMenu() throws Exception {
        PagePlugin notes = new PagePlugin("notes.builtin", true);
        PagePlugin clock = new PagePlugin("clock.builtin", false);
        PagePlugin calc = new PagePlugin("calc.builtin", true);
        PluginManager manager = new PluginManager();
        manager.registerBuiltin(provider(notes));
        manager.registerBuiltin(provider(clock));
        manager.registerBuiltin(provider(calc));

        host = HostBootstrap.initialize(config(Set.of("calc.builtin")), manager);

        Map<String, PluginState> states = host.plugins().stream()
                .collect(Collectors.toMap(PluginSnapshot::getId, PluginSnapshot::getState));
        assertEquals(PluginState.ENABLED, states.get("notes.builtin"));
        assertEquals(PluginState.ENABLED, states.get("clock.builtin"));
        assertEquals(PluginState.INSTALLED, states.get("calc.builtin"));
        assertEquals(1, notes.startups.get());
        assertEquals(List.of("home", "plugins", "settings", "plugin-notes.builtin"), itemIds(host.navigationItems()));

        assertEquals(TransitionStatus.APPLIED, host.setEnabled("calc.builtin", true).getStatus());
        assertEquals(List.of("home", "plugins", "settings", "plugin-notes.builtin", "plugin-calc.builtin"),
                itemIds(host.navigationItems()));

        assertEquals(TransitionStatus.APPLIED, host.setEnabled("notes.builtin", false).getStatus());
        assertFalse(itemIds(host.navigationItems()).contains("plugin-notes.builtin"));
    }

    @Test
    void shortcuts_routeThroughRouterAndRunHooks() throws Exception {
        PagePlugin notes = new PagePlugin("notes.builtin", true);
        PluginManager manager = new PluginManager();
        manager.registerBuiltin(provider(notes));
        host = HostBootstrap.initialize(config(Set.of()), manager);

        DispatchOutcome opened = host.dispatchShortcut("notes.builtin");
        assertEquals(DispatchOutcome.Kind.NAVIGATED, opened.getKind());
        assertEquals("/plugins/notes.builtin", host.navigator().currentPath());

        DispatchOutcome missing = host.dispatchShortcut("unregistered.plugin");
        assertEquals(DispatchOutcome.Kind.NO_SUCH_PAGE, missing.getKind());
        assertEquals("/plugins/unregistered.plugin", missing.getPath());

        assertEquals(DispatchOutcome.Kind.ACTION_UNHANDLED,
                host.dispatchShortcut(ReservedAction.SEARCH_WINDOW_TOGGLE.pluginId()).getKind());
        AtomicInteger searches = new AtomicInteger();
        host.registerReservedHandler(ReservedAction.SEARCH_WINDOW_TOGGLE, action -> searches.incrementAndGet());
        assertEquals(DispatchOutcome.Kind.ACTION_INVOKED, host.dispatchKeyCombo("ctrl+5").getKind());
        assertEquals(1, searches.get());

        assertTrue(notes.entered.await(5, TimeUnit.SECONDS));
        PageTransition back = host.notifyTransition("notes.builtin", null);
        assertEquals(HookOutcome.Status.SUCCEEDED, back.leave().get(5, TimeUnit.SECONDS).getStatus());
        assertEquals(1, notes.enters.get());
        assertEquals(1, notes.leaves.get());
    }

    @Test
    void close_shutsPluginsDownOnce() {
        PagePlugin notes = new PagePlugin("notes.builtin", true);
        PluginManager manager = new PluginManager();
        manager.registerBuiltin(provider(notes));
        host = HostBootstrap.initialize(config(Set.of()), manager);

        host.close();
        host.close();

        assertEquals(1, notes.shutdowns.get());
        assertEquals(TransitionStatus.FAILED, host.setEnabled("notes.builtin", true).getStatus());
    }

    @Test
    void duplicateBuiltin_abortsBootstrap() {
        PluginManager manager = new PluginManager();
        manager.registerBuiltin(provider(new PagePlugin("notes.builtin", true)));
        manager.registerBuiltin(provider(new PagePlugin("notes.builtin", true)));

        assertThrows(DuplicateRegistrationException.class, () -> HostBootstrap.initialize(config(Set.of()), manager));
    }

    @Test
    void builtinPlugins_registerWithRealProviders() {
        host = HostBootstrap.initialize(config(Set.of("processmanager.builtin")));

        List<String> ids = host.plugins().stream().map(PluginSnapshot::getId).collect(Collectors.toList());
        assertEquals(List.of("datetime.builtin", "processmanager.builtin"), ids);
        assertTrue(itemIds(host.navigationItems()).contains("plugin-datetime.builtin"));
    }
}
