package com.ltools.navigation;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Explicit table of page hooks by plugin id, owned by the {@link PageGuard}. Filled at bootstrap.
 */
public final class PageHookTable {

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();

    /**
     * Registers enter/leave hooks for a plugin. Either hook may be null.
     *
     * @throws IllegalArgumentException if the plugin already has hooks
     */
    public void register(String pluginId, PageHook onEnter, PageHook onLeave) {
        Objects.requireNonNull(pluginId, "pluginId");
        if (entries.putIfAbsent(pluginId, new Entry(onEnter, onLeave)) != null) {
            throw new IllegalArgumentException("Page hooks already registered for " + pluginId);
        }
    }

    public Optional<PageHook> find(String pluginId, HookPhase phase) {
        if (pluginId == null) return Optional.empty();
        Entry e = entries.get(pluginId);
        if (e == null) return Optional.empty();
        return Optional.ofNullable(phase == HookPhase.ENTER ? e.onEnter : e.onLeave);
    }

    public boolean contains(String pluginId) {
        return pluginId != null && entries.containsKey(pluginId);
    }

    public int size() {
        return entries.size();
    }

    private record Entry(PageHook onEnter, PageHook onLeave) {
    }
}
