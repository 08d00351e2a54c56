package com.ltools.plugin;

/**
 * Contract every plugin implements. The lifecycle manager calls {@link #init} once, then
 * {@link #startup} on each enable and {@link #shutdown} on each disable. Any exception thrown
 * puts the plugin into {@link PluginState#ERROR}; it never reaches the host.
 * <p>
 * Background work must be scheduled through {@link PluginContext#schedulePeriodic} so the host
 * can stop it deterministically. Implement {@link ViewLifecycle} to receive page enter/leave
 * notifications and {@link com.ltools.annotations.ResourceCleanup} for work at host exit.
 */
public interface PluginCapability {

    PluginMetadata metadata();

    /** One-time initialization before the first startup. Default does nothing. */
    default void init(PluginContext context) throws Exception {
    }

    void startup(PluginContext context) throws Exception;

    void shutdown() throws Exception;
}
