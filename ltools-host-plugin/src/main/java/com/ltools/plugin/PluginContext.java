package com.ltools.plugin;

import com.ltools.events.Topic;

import java.time.Duration;

/**
 * Host services handed to a capability. One context per plugin, valid for the host's lifetime.
 */
public interface PluginContext {

    String pluginId();

    /** Publishes on the host event bus; returns the number of deliveries. */
    <T> int publish(Topic<T> topic, T payload);

    /**
     * Runs {@code task} every {@code period}, first run immediately. The task is owned by the host:
     * it is cancelled when the plugin is disabled, fails to start, or the host shuts down.
     * Exceptions thrown by a run are logged and do not cancel later runs. Tasks scheduled from
     * {@code startup} first run once the plugin is ENABLED.
     *
     * @param name   task name for logs
     * @param period positive period
     * @throws IllegalStateException if the plugin is neither enabled nor being enabled
     */
    PeriodicTaskHandle schedulePeriodic(String name, Duration period, Runnable task);
}
