package com.ltools.lifecycle;

import com.ltools.annotations.ResourceCleanup;
import com.ltools.events.EventBus;
import com.ltools.plugin.PeriodicTaskHandle;
import com.ltools.plugin.PluginCapability;
import com.ltools.plugin.PluginContext;
import com.ltools.plugin.PluginRecord;
import com.ltools.plugin.PluginRegistry;
import com.ltools.plugin.PluginState;
import com.ltools.plugin.RegistryMutator;
import com.ltools.plugin.UnknownPluginException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Drives plugin state transitions and owns the plugins' background work.
 * <p>
 * Transitions are serialized per plugin through a slot. The slot lock only guards reading the
 * state and installing or clearing the in-flight transition; {@code startup}/{@code shutdown}
 * run outside it. A caller asking for the same target as the in-flight transition joins it and
 * gets its result, so N concurrent enables invoke startup once. A caller asking for the opposite
 * target waits for the in-flight transition and then re-evaluates.
 * <p>
 * Hook failures never propagate: the plugin goes to ERROR, an ERROR event is published and a
 * FAILED result is returned.
 * <p>
 * Periodic tasks are admitted per plugin. Tasks requested while an enable transition runs are
 * held back and start only after the ENABLED state is visible; once a disable begins, requests
 * are rejected, so nothing runs for a plugin that is not ENABLED.
 */
public final class LifecycleManager implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LifecycleManager.class);

    private final PluginRegistry registry;
    private final RegistryMutator mutator;
    private final EventBus events;
    private final PeriodicTaskScheduler scheduler;
    private final Map<String, Slot> slots = new ConcurrentHashMap<>();
    private final Map<String, PluginContext> contexts = new ConcurrentHashMap<>();
    private final AtomicBoolean closed = new AtomicBoolean();

    public LifecycleManager(PluginRegistry registry, EventBus events, PeriodicTaskScheduler scheduler) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.events = Objects.requireNonNull(events, "events");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.mutator = registry.mutator();
    }

    /**
     * Context handed to the plugin's hooks. Also used by page hooks.
     *
     * @throws UnknownPluginException if the id is not registered
     */
    public PluginContext contextFor(String pluginId) {
        PluginRecord record = registry.require(pluginId);
        return contexts.computeIfAbsent(record.getId(), id -> new HostPluginContext(id, events, this));
    }

    /**
     * Admits a periodic task for the plugin: started at once while ENABLED, deferred until the
     * ENABLED swap while an enable is in flight.
     *
     * @throws IllegalStateException if the plugin is neither ENABLED nor being enabled
     */
    PeriodicTaskHandle schedulePeriodic(String pluginId, String name, Duration period, Runnable task) {
        PluginRecord record = registry.require(pluginId);
        Slot slot = slotFor(record);
        slot.lock.lock();
        try {
            return switch (slot.admission) {
                case OPEN -> scheduler.schedule(pluginId, name, period, task);
                case PENDING -> scheduler.scheduleDeferred(pluginId, name, period, task);
                case CLOSED -> throw new IllegalStateException(
                        "Plugin " + pluginId + " is not enabled; periodic task " + name + " rejected");
            };
        } finally {
            slot.lock.unlock();
        }
    }

    /**
     * Runs the plugin's one-time {@code init}. Repeated calls after success return NO_OP.
     * A failure puts the plugin into ERROR and returns FAILED with a {@link PluginInitException}.
     */
    public TransitionResult init(String pluginId) {
        PluginRecord record = registry.get(pluginId).orElse(null);
        if (record == null) {
            log.warn("init requested for unknown plugin {}", pluginId);
            return TransitionResult.unknownPlugin(pluginId);
        }
        return ensureInitialized(record, slotFor(record));
    }

    /**
     * Enables or disables the plugin. Enabling an ENABLED plugin and disabling a plugin that is
     * not ENABLED are NO_OPs. Blocks until the transition (own or joined) completes.
     */
    public TransitionResult setEnabled(String pluginId, boolean enabled) {
        PluginRecord record = registry.get(pluginId).orElse(null);
        if (record == null) {
            log.warn("setEnabled({}) requested for unknown plugin {}", enabled, pluginId);
            return TransitionResult.unknownPlugin(pluginId);
        }
        if (enabled && closed.get()) {
            return TransitionResult.failed(record.getId(), record.getState(),
                    new IllegalStateException("Lifecycle manager is closed"));
        }
        Slot slot = slotFor(record);
        while (true) {
            Transition mine = null;
            Transition other;
            slot.lock.lock();
            try {
                other = slot.inFlight;
                if (other == null) {
                    PluginState state = record.getState();
                    if (enabled == (state == PluginState.ENABLED)) {
                        return TransitionResult.noOp(record.getId(), state);
                    }
                    mine = new Transition(enabled);
                    slot.inFlight = mine;
                }
            } finally {
                slot.lock.unlock();
            }
            if (mine != null) {
                return run(record, slot, mine);
            }
            TransitionResult joined = other.result.join();
            if (other.enable == enabled) {
                return joined;
            }
            // opposite transition finished; look at the state again
        }
    }

    /**
     * Enables every INSTALLED plugin whose id is not in {@code skipIds}, in registration order.
     *
     * @return one result per plugin attempted
     */
    public List<TransitionResult> startupAll(Set<String> skipIds) {
        Set<String> skip = skipIds != null ? skipIds : Set.of();
        List<TransitionResult> results = new ArrayList<>();
        for (PluginRecord record : registry.listByState(PluginState.INSTALLED)) {
            if (skip.contains(record.getId())) {
                log.info("Plugin {} left disabled by configuration", record.getId());
                continue;
            }
            results.add(setEnabled(record.getId(), true));
        }
        long failed = results.stream().filter(r -> !r.isSuccess()).count();
        log.info("Started {} plugin(s), {} failed", results.size() - failed, failed);
        return results;
    }

    /**
     * Disables every ENABLED plugin (reverse registration order), runs {@link ResourceCleanup#onExit()}
     * on capabilities that implement it, then stops the scheduler. Idempotent.
     */
    public List<TransitionResult> shutdownAll() {
        if (!closed.compareAndSet(false, true)) {
            return List.of();
        }
        List<PluginRecord> records = new ArrayList<>(registry.list());
        Collections.reverse(records);
        List<TransitionResult> results = new ArrayList<>();
        for (PluginRecord record : records) {
            if (record.getState() == PluginState.ENABLED) {
                results.add(setEnabled(record.getId(), false));
            }
        }
        for (PluginRecord record : records) {
            if (record.getCapability() instanceof ResourceCleanup cleanup) {
                try {
                    cleanup.onExit();
                } catch (Exception e) {
                    log.warn("onExit failed for plugin {}: {}", record.getId(), e.getMessage(), e);
                }
            }
        }
        scheduler.close();
        log.info("Lifecycle manager shut down ({} plugin(s) disabled)", results.size());
        return results;
    }

    @Override
    public void close() {
        shutdownAll();
    }

    private TransitionResult run(PluginRecord record, Slot slot, Transition mine) {
        TransitionResult result = null;
        try {
            result = mine.enable ? doEnable(record, slot) : doDisable(record, slot);
            return result;
        } finally {
            slot.lock.lock();
            try {
                slot.inFlight = null;
            } finally {
                slot.lock.unlock();
            }
            mine.result.complete(result != null ? result
                    : TransitionResult.failed(record.getId(), record.getState(),
                    new IllegalStateException("Transition aborted for " + record.getId())));
        }
    }

    private TransitionResult doEnable(PluginRecord record, Slot slot) {
        String id = record.getId();
        TransitionResult init = ensureInitialized(record, slot);
        if (init.getStatus() == TransitionStatus.FAILED) {
            return init;
        }
        PluginCapability capability = record.getCapability();
        setAdmission(slot, Admission.PENDING);
        try {
            capability.startup(contextFor(id));
        } catch (Exception e) {
            setAdmission(slot, Admission.CLOSED);
            int cancelled = scheduler.cancelAll(id);
            LifecycleHookException failure = new LifecycleHookException(id, "startup", e);
            log.error("Plugin {} startup failed ({} periodic task(s) cancelled)", id, cancelled, e);
            mutator.setState(id, PluginState.ERROR, failure.getMessage());
            return TransitionResult.failed(id, PluginState.ERROR, failure);
        }
        mutator.setState(id, PluginState.ENABLED, null);
        int started = 0;
        slot.lock.lock();
        try {
            slot.admission = Admission.OPEN;
            started = scheduler.activate(id);
        } catch (IllegalStateException e) {
            log.warn("Periodic tasks of {} not started: {}", id, e.getMessage());
        } finally {
            slot.lock.unlock();
        }
        log.info("Plugin {} enabled ({} periodic task(s) started)", id, started);
        return TransitionResult.applied(id, PluginState.ENABLED);
    }

    private TransitionResult doDisable(PluginRecord record, Slot slot) {
        String id = record.getId();
        setAdmission(slot, Admission.CLOSED);
        int cancelled = scheduler.cancelAll(id);
        try {
            record.getCapability().shutdown();
        } catch (Exception e) {
            LifecycleHookException failure = new LifecycleHookException(id, "shutdown", e);
            log.error("Plugin {} shutdown failed", id, e);
            mutator.setState(id, PluginState.ERROR, failure.getMessage());
            return TransitionResult.failed(id, PluginState.ERROR, failure);
        }
        mutator.setState(id, PluginState.DISABLED, null);
        log.info("Plugin {} disabled ({} periodic task(s) cancelled)", id, cancelled);
        return TransitionResult.applied(id, PluginState.DISABLED);
    }

    private TransitionResult ensureInitialized(PluginRecord record, Slot slot) {
        String id = record.getId();
        synchronized (slot.initMonitor) {
            if (slot.initialized) {
                return TransitionResult.noOp(id, record.getState());
            }
            try {
                record.getCapability().init(contextFor(id));
            } catch (Exception e) {
                PluginInitException failure = new PluginInitException(id, e);
                log.error("Plugin {} init failed", id, e);
                mutator.setState(id, PluginState.ERROR, failure.getMessage());
                return TransitionResult.failed(id, PluginState.ERROR, failure);
            }
            slot.initialized = true;
            log.debug("Plugin {} initialized", id);
            return TransitionResult.applied(id, record.getState());
        }
    }

    private static void setAdmission(Slot slot, Admission admission) {
        slot.lock.lock();
        try {
            slot.admission = admission;
        } finally {
            slot.lock.unlock();
        }
    }

    private Slot slotFor(PluginRecord record) {
        return slots.computeIfAbsent(record.getId(), k -> new Slot());
    }

    private static final class Slot {
        private final ReentrantLock lock = new ReentrantLock();
        private final Object initMonitor = new Object();
        private Transition inFlight;
        private boolean initialized;
        private Admission admission = Admission.CLOSED;
    }

    private enum Admission {
        CLOSED, PENDING, OPEN
    }

    private static final class Transition {
        private final boolean enable;
        private final CompletableFuture<TransitionResult> result = new CompletableFuture<>();

        Transition(boolean enable) {
            this.enable = enable;
        }
    }
}
