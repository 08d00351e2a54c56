package com.ltools.lifecycle;

import com.ltools.plugin.PeriodicTaskHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Shared scheduler for plugin background work. Tasks are grouped by plugin id so the lifecycle
 * manager can tear down everything a plugin started. Cancellation waits for a run in progress,
 * so no payload is emitted after {@link PeriodicTaskHandle#cancel()} or {@link #cancelAll} returns.
 */
public final class PeriodicTaskScheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PeriodicTaskScheduler.class);

    private final ScheduledExecutorService executor;
    private final Map<String, Set<ScheduledTask>> tasksByPlugin = new ConcurrentHashMap<>();

    public PeriodicTaskScheduler(int threads) {
        this.executor = Executors.newScheduledThreadPool(Math.max(1, threads), daemonThreads("ltools-periodic-"));
    }

    /**
     * Schedules {@code task} at a fixed rate, first run immediately.
     *
     * @throws IllegalArgumentException if period is not positive
     * @throws IllegalStateException    if the scheduler is closed
     */
    public PeriodicTaskHandle schedule(String pluginId, String name, Duration period, Runnable task) {
        ScheduledTask scheduled = register(pluginId, name, period, task);
        scheduled.start();
        log.debug("Scheduled {}/{} every {}", pluginId, scheduled.name, period);
        return scheduled;
    }

    /**
     * Registers {@code task} without running it. Deferred tasks start on {@link #activate(String)}
     * and are dropped by {@link #cancelAll(String)} like running ones.
     *
     * @throws IllegalArgumentException if period is not positive
     */
    public PeriodicTaskHandle scheduleDeferred(String pluginId, String name, Duration period, Runnable task) {
        ScheduledTask scheduled = register(pluginId, name, period, task);
        log.debug("Deferred {}/{} every {}", pluginId, scheduled.name, period);
        return scheduled;
    }

    /**
     * Starts the plugin's deferred tasks.
     *
     * @return number of tasks started
     * @throws IllegalStateException if the scheduler is closed
     */
    public int activate(String pluginId) {
        Set<ScheduledTask> owned = tasksByPlugin.get(pluginId);
        if (owned == null) return 0;
        int n = 0;
        for (ScheduledTask t : List.copyOf(owned)) {
            if (t.start()) n++;
        }
        if (n > 0) {
            log.debug("Activated {} periodic task(s) of {}", n, pluginId);
        }
        return n;
    }

    private ScheduledTask register(String pluginId, String name, Duration period, Runnable task) {
        Objects.requireNonNull(pluginId, "pluginId");
        Objects.requireNonNull(task, "task");
        if (period == null || period.isZero() || period.isNegative()) {
            throw new IllegalArgumentException("Period must be positive: " + period);
        }
        String taskName = name != null && !name.isBlank() ? name : "task";
        ScheduledTask scheduled = new ScheduledTask(pluginId, taskName, period, task);
        tasksByPlugin.computeIfAbsent(pluginId, k -> ConcurrentHashMap.newKeySet()).add(scheduled);
        return scheduled;
    }

    /**
     * Cancels every task of the plugin and waits for runs in progress.
     *
     * @return number of tasks cancelled
     */
    public int cancelAll(String pluginId) {
        Set<ScheduledTask> owned = tasksByPlugin.get(pluginId);
        if (owned == null) return 0;
        int n = 0;
        for (ScheduledTask t : List.copyOf(owned)) {
            if (t.cancelInternal()) n++;
        }
        if (n > 0) {
            log.debug("Cancelled {} periodic task(s) of {}", n, pluginId);
        }
        return n;
    }

    /** Number of live tasks owned by the plugin. */
    public int activeCount(String pluginId) {
        Set<ScheduledTask> owned = tasksByPlugin.get(pluginId);
        return owned != null ? owned.size() : 0;
    }

    /** Cancels all tasks and stops the executor. */
    @Override
    public void close() {
        for (String pluginId : List.copyOf(tasksByPlugin.keySet())) {
            cancelAll(pluginId);
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Periodic task executor did not terminate in time; forcing shutdown");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger n = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    private final class ScheduledTask implements PeriodicTaskHandle, Runnable {
        private final String pluginId;
        private final String name;
        private final Duration period;
        private final Runnable task;
        private final ReentrantLock runLock = new ReentrantLock();
        private volatile boolean cancelled;
        private volatile ScheduledFuture<?> future;

        ScheduledTask(String pluginId, String name, Duration period, Runnable task) {
            this.pluginId = pluginId;
            this.name = name;
            this.period = period;
            this.task = task;
        }

        /** Submits the task unless it already runs or was cancelled. */
        synchronized boolean start() {
            if (cancelled || future != null) return false;
            try {
                future = executor.scheduleAtFixedRate(this, 0, period.toNanos(), TimeUnit.NANOSECONDS);
            } catch (RejectedExecutionException e) {
                cancelled = true;
                removeSelf();
                throw new IllegalStateException("Scheduler is closed; cannot schedule " + pluginId + "/" + name, e);
            }
            return true;
        }

        private void removeSelf() {
            Set<ScheduledTask> owned = tasksByPlugin.get(pluginId);
            if (owned != null) {
                owned.remove(this);
            }
        }

        @Override
        public void run() {
            runLock.lock();
            try {
                if (cancelled) return;
                task.run();
            } catch (Exception e) {
                log.warn("Periodic task {}/{} failed: {}", pluginId, name, e.getMessage(), e);
            } finally {
                runLock.unlock();
            }
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public boolean isCancelled() {
            return cancelled;
        }

        @Override
        public void cancel() {
            cancelInternal();
        }

        boolean cancelInternal() {
            synchronized (this) {
                if (cancelled) return false;
                cancelled = true;
            }
            ScheduledFuture<?> f = future;
            if (f != null) {
                f.cancel(false);
            }
            // wait for a run in progress
            runLock.lock();
            runLock.unlock();
            removeSelf();
            return true;
        }
    }
}
