package com.ltools.lifecycle;

import com.ltools.plugin.PluginState;

import java.util.Optional;

/**
 * Result of {@link LifecycleManager#init}, {@link LifecycleManager#setEnabled} and the bulk operations.
 * Lifecycle requests never throw for plugin failures; they return a result.
 */
public final class TransitionResult {

    private final String pluginId;
    private final TransitionStatus status;
    private final PluginState state;
    private final Throwable error;

    private TransitionResult(String pluginId, TransitionStatus status, PluginState state, Throwable error) {
        this.pluginId = pluginId;
        this.status = status;
        this.state = state;
        this.error = error;
    }

    public static TransitionResult applied(String pluginId, PluginState state) {
        return new TransitionResult(pluginId, TransitionStatus.APPLIED, state, null);
    }

    public static TransitionResult noOp(String pluginId, PluginState state) {
        return new TransitionResult(pluginId, TransitionStatus.NO_OP, state, null);
    }

    public static TransitionResult failed(String pluginId, PluginState state, Throwable error) {
        return new TransitionResult(pluginId, TransitionStatus.FAILED, state, error);
    }

    public static TransitionResult unknownPlugin(String pluginId) {
        return new TransitionResult(pluginId, TransitionStatus.UNKNOWN_PLUGIN, null, null);
    }

    public String getPluginId() {
        return pluginId;
    }

    public TransitionStatus getStatus() {
        return status;
    }

    /** State after the request; null for {@link TransitionStatus#UNKNOWN_PLUGIN}. */
    public PluginState getState() {
        return state;
    }

    public Optional<Throwable> getError() {
        return Optional.ofNullable(error);
    }

    /** APPLIED or NO_OP. */
    public boolean isSuccess() {
        return status == TransitionStatus.APPLIED || status == TransitionStatus.NO_OP;
    }

    @Override
    public String toString() {
        return "TransitionResult{" + pluginId + ", " + status + ", state=" + state
                + (error != null ? ", error=" + error.getMessage() : "") + "}";
    }
}
