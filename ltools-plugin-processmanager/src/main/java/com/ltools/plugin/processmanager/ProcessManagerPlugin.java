package com.ltools.plugin.processmanager;

import com.ltools.annotations.HostPlugin;
import com.ltools.plugin.PeriodicTaskHandle;
import com.ltools.plugin.PluginCapability;
import com.ltools.plugin.PluginContext;
import com.ltools.plugin.PluginMetadata;
import com.ltools.plugin.PluginType;
import com.ltools.plugin.ViewLifecycle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Process list plugin. Sampling runs only while the plugin's page is shown: entering the page
 * schedules a refresh task (first run immediate) and leaving it cancels the task. Queries are
 * answered from the latest sample.
 */
@HostPlugin(id = ProcessManagerPlugin.ID, name = "Process Manager", author = "LTools Team",
        description = "Lists running processes and terminates them", icon = "process",
        keywords = {"process", "task", "kill", "cpu"})
public final class ProcessManagerPlugin implements PluginCapability, ViewLifecycle {

    private static final Logger log = LoggerFactory.getLogger(ProcessManagerPlugin.class);

    public static final String ID = "processmanager.builtin";
    public static final Duration DEFAULT_REFRESH = Duration.ofSeconds(10);

    private final ProcessSampler sampler;
    private final Clock clock;
    private final Duration refreshInterval;
    private final Object refreshLock = new Object();
    private PeriodicTaskHandle refresher;
    private volatile ProcessListSnapshot latest;
    private volatile PluginContext context;

    public ProcessManagerPlugin(ProcessSampler sampler, Clock clock, Duration refreshInterval) {
        this.sampler = Objects.requireNonNull(sampler, "sampler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.refreshInterval = refreshInterval != null && !refreshInterval.isZero() && !refreshInterval.isNegative()
                ? refreshInterval : DEFAULT_REFRESH;
    }

    public ProcessManagerPlugin() {
        this(new ProcessHandleSampler(), Clock.systemUTC(), DEFAULT_REFRESH);
    }

    @Override
    public PluginMetadata metadata() {
        return PluginMetadata.fromAnnotation(ProcessManagerPlugin.class, PluginType.BUILTIN);
    }

    @Override
    public void startup(PluginContext context) {
        this.context = context;
    }

    @Override
    public void shutdown() {
        stopRefreshing();
    }

    @Override
    public void onEnter(PluginContext context) {
        this.context = context;
        synchronized (refreshLock) {
            if (refresher != null && !refresher.isCancelled()) {
                return;
            }
            refresher = context.schedulePeriodic("process-refresh", refreshInterval, () -> refresh(context));
        }
        log.debug("Process refresh started every {}", refreshInterval);
    }

    @Override
    public void onLeave(PluginContext context) {
        stopRefreshing();
    }

    /** True while the page is shown and sampling is scheduled. */
    public boolean isRefreshing() {
        synchronized (refreshLock) {
            return refresher != null && !refresher.isCancelled();
        }
    }

    private void stopRefreshing() {
        synchronized (refreshLock) {
            if (refresher != null) {
                refresher.cancel();
                refresher = null;
                log.debug("Process refresh stopped");
            }
        }
    }

    /**
     * Takes a sample, stores it and publishes it. A failed sample is published on
     * {@link ProcessManagerTopics#ERROR} and keeps the previous one.
     */
    void refresh(PluginContext ctx) {
        List<ProcessInfo> processes;
        try {
            processes = sampler.sample();
        } catch (Exception e) {
            log.warn("Process sampling failed: {}", e.getMessage(), e);
            ctx.publish(ProcessManagerTopics.ERROR, "Failed to refresh process list: " + e.getMessage());
            return;
        }
        ProcessListSnapshot snapshot = new ProcessListSnapshot(clock.millis(), processes);
        latest = snapshot;
        ctx.publish(ProcessManagerTopics.PROCESSES, snapshot);
    }

    /** Samples now, outside the schedule. Requires the plugin to have been started. */
    public void forceRefresh() {
        PluginContext ctx = context;
        if (ctx == null) {
            throw new IllegalStateException("Plugin " + ID + " is not started");
        }
        refresh(ctx);
    }

    public Optional<ProcessListSnapshot> latest() {
        return Optional.ofNullable(latest);
    }

    /** Queries the latest sample; empty until the first refresh. */
    public ProcessPage getProcesses(ProcessListOptions options) {
        ProcessListSnapshot snapshot = latest;
        return ProcessQueries.query(snapshot != null ? snapshot.getProcesses() : List.of(), options);
    }

    /** Politely terminates, falling back to a forced kill. */
    public void killProcess(long pid) {
        terminate(pid, false);
    }

    public void forceKillProcess(long pid) {
        terminate(pid, true);
    }

    private void terminate(long pid, boolean force) {
        sampler.terminate(pid, force);
        log.info("Terminated process {}{}", pid, force ? " (forced)" : "");
        PluginContext ctx = context;
        if (ctx != null) {
            ctx.publish(ProcessManagerTopics.KILLED, pid);
        }
    }
}
