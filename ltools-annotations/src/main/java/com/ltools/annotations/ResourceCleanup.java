package com.ltools.annotations;

/**
 * Contract for releasing resources when the host is shutting down.
 * Plugins holding resources that outlive a single enable/disable cycle (caches, native handles,
 * helper processes) implement this and release them in {@link #onExit()}. The host invokes
 * {@code onExit()} once per capability after all plugins have been disabled.
 */
public interface ResourceCleanup {

    /**
     * Called once when the host is shutting down. Exceptions should be logged and not rethrown
     * so other plugins still get a chance to clean up.
     */
    void onExit();
}
