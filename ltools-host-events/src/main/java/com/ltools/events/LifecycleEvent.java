package com.ltools.events;

import java.util.Objects;

/**
 * Plugin lifecycle notification published on {@link HostTopics#LIFECYCLE}. Never stored.
 *
 * @param pluginId plugin id
 * @param kind     what happened
 * @param detail   free-form detail (failure message for ERROR); may be empty, never null
 */
public record LifecycleEvent(String pluginId, LifecycleEventKind kind, String detail) {

    public LifecycleEvent {
        Objects.requireNonNull(pluginId, "pluginId");
        Objects.requireNonNull(kind, "kind");
        detail = detail != null ? detail : "";
    }

    public static LifecycleEvent of(String pluginId, LifecycleEventKind kind) {
        return new LifecycleEvent(pluginId, kind, "");
    }

    public static LifecycleEvent error(String pluginId, String detail) {
        return new LifecycleEvent(pluginId, LifecycleEventKind.ERROR, detail);
    }
}
