package com.ltools.shortcuts;

import com.ltools.config.ShortcutBinding;
import com.ltools.events.EventBus;
import com.ltools.events.HostTopics;
import com.ltools.navigation.NavigationOutcome;
import com.ltools.navigation.Navigator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ShortcutDispatcherTest {

    /** Navigator fake that knows a fixed set of paths and records every request. */
    static final class RecordingNavigator implements Navigator {
        final List<String> requested = new ArrayList<>();
        final Set<String> known;
        String current = "/";

        RecordingNavigator(Set<String> known) {
            this.known = known;
        }

        @Override
        public NavigationOutcome navigate(String path) {
            requested.add(path);
            if (!known.contains(path)) return NavigationOutcome.NO_SUCH_PAGE;
            current = path;
            return NavigationOutcome.NAVIGATED;
        }

        @Override
        public String currentPath() {
            return current;
        }
    }

    private RecordingNavigator navigator;
    private ShortcutDispatcher dispatcher;
    private List<ReservedAction> invoked;

    @BeforeEach
    void setUp() {
        navigator = new RecordingNavigator(Set.of("/plugins/calculator.builtin", "/plugins/"));
        ShortcutTable table = ShortcutTable.build(List.of(
                new ShortcutBinding("Ctrl + Shift + C", "calculator.builtin"),
                new ShortcutBinding("ctrl+5", ShortcutBinding.SEARCH_WINDOW_ID)), new KeyComboValidator("linux"));
        dispatcher = new ShortcutDispatcher(navigator, table);
        invoked = new ArrayList<>();
    }

    @Test
    void unregisteredPlugin_fallsBackToNavigation() {
        DispatchOutcome outcome = dispatcher.handle("unregistered.plugin");

        assertEquals(List.of("/plugins/unregistered.plugin"), navigator.requested);
        assertEquals(DispatchOutcome.Kind.NO_SUCH_PAGE, outcome.getKind());
        assertEquals("/plugins/unregistered.plugin", outcome.getPath());
    }

    @Test
    void pluginId_navigatesToItsPage() {
        DispatchOutcome outcome = dispatcher.handle("calculator.builtin");

        assertEquals(DispatchOutcome.Kind.NAVIGATED, outcome.getKind());
        assertEquals("/plugins/calculator.builtin", navigator.currentPath());
    }

    @Test
    void reservedIds_runActionsWithoutNavigating() {
        dispatcher.registerHandler(ReservedAction.SEARCH_WINDOW_TOGGLE, invoked::add);
        dispatcher.registerHandler(ReservedAction.SCREENSHOT_CAPTURE, invoked::add);

        assertEquals(DispatchOutcome.Kind.ACTION_INVOKED, dispatcher.handle("search.window.builtin").getKind());
        assertEquals(DispatchOutcome.Kind.ACTION_INVOKED, dispatcher.handle("screenshot2.window.builtin").getKind());

        assertEquals(List.of(ReservedAction.SEARCH_WINDOW_TOGGLE, ReservedAction.SCREENSHOT_CAPTURE), invoked);
        assertTrue(navigator.requested.isEmpty());
    }

    @Test
    void missingOrFailingHandler_isReported() {
        assertEquals(DispatchOutcome.Kind.ACTION_UNHANDLED, dispatcher.handle("screenshot2.window.builtin").getKind());

        dispatcher.registerHandler(ReservedAction.SCREENSHOT_CAPTURE, a -> {
            throw new IllegalStateException("no display");
        });
        DispatchOutcome failed = dispatcher.handle("screenshot2.window.builtin");

        assertEquals(DispatchOutcome.Kind.ACTION_FAILED, failed.getKind());
        assertEquals("no display", failed.getError().orElseThrow().getMessage());
    }

    @Test
    void blankId_navigatesToPluginList() {
        DispatchOutcome outcome = dispatcher.handle("  ");
        dispatcher.handle(null);

        assertEquals(List.of("/plugins/", "/plugins/"), navigator.requested);
        assertEquals(DispatchOutcome.Kind.NAVIGATED, outcome.getKind());
    }

    @Test
    void keyCombo_resolvesThroughTable() {
        dispatcher.registerHandler(ReservedAction.SEARCH_WINDOW_TOGGLE, invoked::add);

        assertEquals(DispatchOutcome.Kind.NAVIGATED, dispatcher.handleKeyCombo("ctrl+shift+c").getKind());
        assertEquals(DispatchOutcome.Kind.ACTION_INVOKED, dispatcher.handleKeyCombo("CTRL+5").getKind());
        assertEquals(DispatchOutcome.Kind.UNBOUND, dispatcher.handleKeyCombo("ctrl+k").getKind());
    }

    @Test
    void triggeredTopic_isDispatched() {
        EventBus bus = new EventBus();
        dispatcher.start(bus);

        bus.publish(HostTopics.SHORTCUT_TRIGGERED, "calculator.builtin");
        dispatcher.close();
        bus.publish(HostTopics.SHORTCUT_TRIGGERED, "calculator.builtin");

        assertEquals(List.of("/plugins/calculator.builtin"), navigator.requested);
    }
}
