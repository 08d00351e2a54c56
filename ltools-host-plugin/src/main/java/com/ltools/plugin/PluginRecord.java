package com.ltools.plugin;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Registry entry: metadata, capability and the current runtime state.
 */
public final class PluginRecord {

    private final PluginMetadata metadata;
    private final PluginCapability capability;
    private final AtomicReference<PluginRuntimeState> runtimeState;

    PluginRecord(PluginMetadata metadata, PluginCapability capability) {
        this.metadata = Objects.requireNonNull(metadata, "metadata");
        this.capability = Objects.requireNonNull(capability, "capability");
        this.runtimeState = new AtomicReference<>(PluginRuntimeState.installed(metadata));
    }

    public String getId() {
        return metadata.getId();
    }

    public PluginMetadata getMetadata() {
        return metadata;
    }

    public PluginCapability getCapability() {
        return capability;
    }

    public PluginRuntimeState getRuntimeState() {
        return runtimeState.get();
    }

    public PluginState getState() {
        return runtimeState.get().state();
    }

    /** Read-only projection of this record at the moment of the call. */
    public PluginSnapshot snapshot() {
        return PluginSnapshot.of(metadata, runtimeState.get());
    }

    PluginRuntimeState swap(PluginRuntimeState next) {
        return runtimeState.getAndSet(next);
    }

    @Override
    public String toString() {
        return "PluginRecord{" + getId() + ", " + getState() + "}";
    }
}
