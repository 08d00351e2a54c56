package com.ltools.plugin;

/**
 * Handle of a periodic task scheduled through {@link PluginContext#schedulePeriodic}.
 */
public interface PeriodicTaskHandle {

    String name();

    boolean isCancelled();

    /**
     * Stops future runs and waits for a run in progress to finish. After this returns, the task
     * does not execute again. Idempotent.
     */
    void cancel();
}
