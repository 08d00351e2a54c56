package com.ltools.navigation;

import com.ltools.events.EventBus;
import com.ltools.events.HostTopics;
import com.ltools.events.LifecycleEvent;
import com.ltools.events.LifecycleEventKind;
import com.ltools.plugin.PluginRecord;
import com.ltools.plugin.PluginRegistry;
import com.ltools.plugin.PluginState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs plugin enter/leave hooks when the active page changes.
 * <p>
 * The leave hook of the previous plugin is submitted before the enter hook of the next one; the
 * caller is never blocked on either. With {@link HookOrdering#CONCURRENT} the two hooks may overlap;
 * with {@link HookOrdering#SEQUENTIAL} enter starts after leave has completed. Enter hooks only run
 * for ENABLED plugins; a registered leave hook always runs so a plugin disabled while its page was
 * active can still release what its enter hook acquired. Hook failures are logged, returned as failed {@link HookOutcome}s and published as
 * LEAVE_HANDLED/ENTER_HANDLED events whose detail carries the failure.
 */
public final class PageGuard implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PageGuard.class);

    private final PageHookTable hooks;
    private final PluginRegistry registry;
    private final EventBus events;
    private final ExecutorService executor;
    private final HookOrdering ordering;
    private final AtomicReference<String> currentPluginId = new AtomicReference<>();

    public PageGuard(PageHookTable hooks, PluginRegistry registry, EventBus events, int threads, HookOrdering ordering) {
        this.hooks = Objects.requireNonNull(hooks, "hooks");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.events = Objects.requireNonNull(events, "events");
        this.ordering = ordering != null ? ordering : HookOrdering.CONCURRENT;
        AtomicInteger n = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(Math.max(1, threads), r -> {
            Thread t = new Thread(r, "ltools-page-hook-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public PageHookTable hooks() {
        return hooks;
    }

    public HookOrdering ordering() {
        return ordering;
    }

    /** Plugin whose page is active; empty on base pages. */
    public Optional<String> currentPluginId() {
        return Optional.ofNullable(currentPluginId.get());
    }

    /**
     * Notifies a page change. Same id on both sides is a no-op. Returns immediately.
     *
     * @param previousId plugin id of the page being left; null or blank for a base page
     * @param nextId     plugin id of the page being entered; null or blank for a base page
     */
    public PageTransition notifyTransition(String previousId, String nextId) {
        String prev = normalize(previousId);
        String next = normalize(nextId);
        currentPluginId.set(next);
        if (Objects.equals(prev, next)) {
            return PageTransition.unchanged(next);
        }
        log.debug("Page transition {} -> {}", prev, next);
        CompletableFuture<HookOutcome> leave = submit(prev, HookPhase.LEAVE);
        CompletableFuture<HookOutcome> enter;
        if (ordering == HookOrdering.SEQUENTIAL) {
            enter = leave.thenCompose(ignored -> submit(next, HookPhase.ENTER));
        } else {
            enter = submit(next, HookPhase.ENTER);
        }
        return new PageTransition(prev, next, leave, enter);
    }

    private CompletableFuture<HookOutcome> submit(String pluginId, HookPhase phase) {
        if (pluginId == null) {
            return CompletableFuture.completedFuture(HookOutcome.skipped(null, phase));
        }
        Optional<PageHook> hook = hooks.find(pluginId, phase);
        if (hook.isEmpty()) {
            return CompletableFuture.completedFuture(HookOutcome.skipped(pluginId, phase));
        }
        try {
            return CompletableFuture.supplyAsync(() -> invoke(pluginId, phase, hook.get()), executor);
        } catch (RejectedExecutionException e) {
            log.warn("Page guard closed; {} hook of {} not run", phase, pluginId);
            return CompletableFuture.completedFuture(HookOutcome.failed(pluginId, phase, e));
        }
    }

    private HookOutcome invoke(String pluginId, HookPhase phase, PageHook hook) {
        Optional<PluginRecord> record = registry.get(pluginId);
        if (phase == HookPhase.ENTER && (record.isEmpty() || record.get().getState() != PluginState.ENABLED)) {
            log.debug("Skipping {} hook of {}: plugin not enabled", phase, pluginId);
            return HookOutcome.skipped(pluginId, phase);
        }
        HookOutcome outcome;
        String detail = "";
        try {
            hook.run();
            outcome = HookOutcome.succeeded(pluginId, phase);
        } catch (Exception e) {
            log.warn("{} hook of plugin {} failed: {}", phase, pluginId, e.getMessage(), e);
            outcome = HookOutcome.failed(pluginId, phase, e);
            detail = "failed: " + (e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
        LifecycleEventKind kind = phase == HookPhase.ENTER ? LifecycleEventKind.ENTER_HANDLED : LifecycleEventKind.LEAVE_HANDLED;
        events.publish(HostTopics.LIFECYCLE, new LifecycleEvent(pluginId, kind, detail));
        return outcome;
    }

    private static String normalize(String id) {
        return id == null || id.isBlank() ? null : id.trim();
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
