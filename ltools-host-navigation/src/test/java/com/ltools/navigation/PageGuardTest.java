package com.ltools.navigation;

import com.ltools.events.EventBus;
import com.ltools.events.HostTopics;
import com.ltools.events.LifecycleEvent;
import com.ltools.events.LifecycleEventKind;
import com.ltools.plugin.PluginRegistry;
import com.ltools.plugin.PluginState;
import com.ltools.plugin.RegistryMutator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PageGuardTest {

    private EventBus bus;
    private PluginRegistry registry;
    private PageHookTable hooks;
    private PageGuard guard;
    private List<String> calls;
    private List<LifecycleEvent> events;

    @BeforeEach
    void setUp() {
        bus = new EventBus();
        registry = new PluginRegistry(bus);
        RegistryMutator mutator = registry.mutator();
        for (String id : List.of("a.plugin", "b.plugin", "off.plugin")) {
            registry.register(NavigationFixtures.capability(id, id));
        }
        mutator.setState("a.plugin", PluginState.ENABLED, null);
        mutator.setState("b.plugin", PluginState.ENABLED, null);
        hooks = new PageHookTable();
        calls = new CopyOnWriteArrayList<>();
        events = new CopyOnWriteArrayList<>();
        bus.subscribe(HostTopics.LIFECYCLE, events::add);
    }

    @AfterEach
    void tearDown() {
        if (guard != null) guard.close();
    }

    private void recordHooks(String id) {
        hooks.register(id, () -> calls.add("enter " + id), () -> calls.add("leave " + id));
    }

    @Test
    void leaveIsIssuedBeforeEnter() throws Exception {
        recordHooks("a.plugin");
        recordHooks("b.plugin");
        guard = new PageGuard(hooks, registry, bus, 1, HookOrdering.CONCURRENT);

        PageTransition t = guard.notifyTransition("a.plugin", "b.plugin");
        t.completion().get(5, TimeUnit.SECONDS);

        assertEquals(List.of("leave a.plugin", "enter b.plugin"), calls);
        assertEquals(HookOutcome.Status.SUCCEEDED, t.leave().get().getStatus());
        assertEquals(HookOutcome.Status.SUCCEEDED, t.enter().get().getStatus());
        assertEquals("b.plugin", guard.currentPluginId().orElseThrow());
    }

    @Test
    void notifyTransition_doesNotWaitForHooks() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        hooks.register("b.plugin", () -> release.await(5, TimeUnit.SECONDS), null);
        guard = new PageGuard(hooks, registry, bus, 2, HookOrdering.CONCURRENT);

        PageTransition t = guard.notifyTransition(null, "b.plugin");

        assertFalse(t.enter().isDone());
        assertEquals(HookOutcome.Status.SKIPPED, t.leave().get().getStatus());
        release.countDown();
        assertEquals(HookOutcome.Status.SUCCEEDED, t.enter().get(5, TimeUnit.SECONDS).getStatus());
    }

    @Test
    void hookFailure_isReportedNotThrown() throws Exception {
        hooks.register("a.plugin", null, () -> {
            throw new IllegalStateException("leave broke");
        });
        recordHooks("b.plugin");
        guard = new PageGuard(hooks, registry, bus, 2, HookOrdering.CONCURRENT);

        PageTransition t = guard.notifyTransition("a.plugin", "b.plugin");
        t.completion().get(5, TimeUnit.SECONDS);

        HookOutcome leave = t.leave().get();
        assertEquals(HookOutcome.Status.FAILED, leave.getStatus());
        assertEquals("leave broke", leave.getError().orElseThrow().getMessage());
        assertEquals(HookOutcome.Status.SUCCEEDED, t.enter().get().getStatus());
        assertEquals("b.plugin", guard.currentPluginId().orElseThrow());
        LifecycleEvent leaveEvent = events.stream()
                .filter(e -> e.kind() == LifecycleEventKind.LEAVE_HANDLED).findFirst().orElseThrow();
        assertTrue(leaveEvent.detail().contains("leave broke"));
        assertTrue(events.stream().anyMatch(e -> e.kind() == LifecycleEventKind.ENTER_HANDLED && e.detail().isEmpty()));
    }

    @Test
    void sameId_isNoOp() throws Exception {
        recordHooks("a.plugin");
        guard = new PageGuard(hooks, registry, bus, 1, HookOrdering.CONCURRENT);

        PageTransition t = guard.notifyTransition("a.plugin", " a.plugin ");

        assertFalse(t.isChange());
        assertEquals(HookOutcome.Status.SKIPPED, t.enter().get().getStatus());
        assertTrue(calls.isEmpty());
    }

    @Test
    void sequentialOrdering_startsEnterAfterLeaveCompletes() throws Exception {
        CountDownLatch releaseLeave = new CountDownLatch(1);
        hooks.register("a.plugin", null, () -> {
            releaseLeave.await(5, TimeUnit.SECONDS);
            calls.add("leave a.plugin");
        });
        recordHooks("b.plugin");
        guard = new PageGuard(hooks, registry, bus, 4, HookOrdering.SEQUENTIAL);

        PageTransition t = guard.notifyTransition("a.plugin", "b.plugin");
        Thread.sleep(50);
        assertTrue(calls.isEmpty());

        releaseLeave.countDown();
        t.completion().get(5, TimeUnit.SECONDS);
        assertEquals(List.of("leave a.plugin", "enter b.plugin"), calls);
    }

    @Test
    void enterHookOfDisabledPlugin_isSkipped() throws Exception {
        recordHooks("off.plugin");
        guard = new PageGuard(hooks, registry, bus, 1, HookOrdering.CONCURRENT);

        PageTransition t = guard.notifyTransition(null, "off.plugin");

        assertEquals(HookOutcome.Status.SKIPPED, t.enter().get(5, TimeUnit.SECONDS).getStatus());
        assertTrue(calls.isEmpty());
        assertEquals("off.plugin", guard.currentPluginId().orElseThrow());
    }

    @Test
    void leaveHook_runsAfterPluginWasDisabled() throws Exception {
        recordHooks("a.plugin");
        guard = new PageGuard(hooks, registry, bus, 1, HookOrdering.CONCURRENT);
        guard.notifyTransition(null, "a.plugin").completion().get(5, TimeUnit.SECONDS);
        registry.mutator().setState("a.plugin", PluginState.DISABLED, null);

        PageTransition t = guard.notifyTransition("a.plugin", null);

        assertEquals(HookOutcome.Status.SUCCEEDED, t.leave().get(5, TimeUnit.SECONDS).getStatus());
        assertEquals(List.of("enter a.plugin", "leave a.plugin"), calls);
        assertTrue(events.stream().anyMatch(e ->
                e.pluginId().equals("a.plugin") && e.kind() == LifecycleEventKind.LEAVE_HANDLED));
    }

    @Test
    void hookOrdering_parse() {
        assertEquals(HookOrdering.SEQUENTIAL, HookOrdering.parse("sequential"));
        assertEquals(HookOrdering.CONCURRENT, HookOrdering.parse("bogus"));
        assertEquals(HookOrdering.CONCURRENT, HookOrdering.parse(null));
    }
}
