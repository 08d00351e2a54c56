package com.ltools.navigation;

import java.util.Optional;

/**
 * Completion of one page hook.
 */
public final class HookOutcome {

    public enum Status {
        SUCCEEDED,
        FAILED,
        /** No hook registered, no plugin page involved, or the plugin is not enabled. */
        SKIPPED
    }

    private final String pluginId;
    private final HookPhase phase;
    private final Status status;
    private final Throwable error;

    private HookOutcome(String pluginId, HookPhase phase, Status status, Throwable error) {
        this.pluginId = pluginId;
        this.phase = phase;
        this.status = status;
        this.error = error;
    }

    public static HookOutcome succeeded(String pluginId, HookPhase phase) {
        return new HookOutcome(pluginId, phase, Status.SUCCEEDED, null);
    }

    public static HookOutcome failed(String pluginId, HookPhase phase, Throwable error) {
        return new HookOutcome(pluginId, phase, Status.FAILED, error);
    }

    public static HookOutcome skipped(String pluginId, HookPhase phase) {
        return new HookOutcome(pluginId, phase, Status.SKIPPED, null);
    }

    /** Plugin id; null when no plugin page was involved. */
    public String getPluginId() {
        return pluginId;
    }

    public HookPhase getPhase() {
        return phase;
    }

    public Status getStatus() {
        return status;
    }

    public Optional<Throwable> getError() {
        return Optional.ofNullable(error);
    }

    @Override
    public String toString() {
        return "HookOutcome{" + phase + " " + pluginId + ": " + status + "}";
    }
}
