package com.ltools.lifecycle;

/**
 * A plugin's startup or shutdown hook threw. Carried in a FAILED {@link TransitionResult}.
 */
public class LifecycleHookException extends RuntimeException {

    private final String pluginId;
    private final String phase;

    public LifecycleHookException(String pluginId, String phase, Throwable cause) {
        super("Plugin " + pluginId + " failed in " + phase + ": " + describe(cause), cause);
        this.pluginId = pluginId;
        this.phase = phase;
    }

    public String getPluginId() {
        return pluginId;
    }

    /** {@code startup} or {@code shutdown}. */
    public String getPhase() {
        return phase;
    }

    static String describe(Throwable t) {
        if (t == null) return "unknown error";
        String msg = t.getMessage();
        return msg != null && !msg.isBlank() ? msg : t.getClass().getSimpleName();
    }
}
