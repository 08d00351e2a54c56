package com.ltools.plugin;

import com.ltools.events.EventBus;
import com.ltools.events.HostTopics;
import com.ltools.events.LifecycleEvent;
import com.ltools.events.LifecycleEventKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * Registry of plugins by id, in registration order. Reads are lock-free; registration is
 * serialized. State changes go through the {@link RegistryMutator} and publish a
 * {@link LifecycleEvent} on {@link HostTopics#LIFECYCLE} after the state is swapped.
 */
public final class PluginRegistry {

    private static final Logger log = LoggerFactory.getLogger(PluginRegistry.class);

    private final EventBus events;
    private final Map<String, PluginRecord> byId = new ConcurrentHashMap<>();
    private final List<PluginRecord> ordered = new CopyOnWriteArrayList<>();
    private final Object registrationLock = new Object();
    private final AtomicBoolean mutatorIssued = new AtomicBoolean();

    public PluginRegistry(EventBus events) {
        this.events = Objects.requireNonNull(events, "events");
    }

    /**
     * Registers a plugin in state {@link PluginState#INSTALLED} and publishes REGISTERED.
     *
     * @throws DuplicateRegistrationException if the id is already registered
     */
    public PluginRecord register(PluginMetadata metadata, PluginCapability capability) {
        PluginRecord record = new PluginRecord(metadata, capability);
        synchronized (registrationLock) {
            if (byId.putIfAbsent(record.getId(), record) != null) {
                throw new DuplicateRegistrationException(record.getId());
            }
            ordered.add(record);
        }
        log.info("Registered plugin {} ({}, {})", record.getId(), metadata.getType(), metadata.getVersion());
        events.publish(HostTopics.LIFECYCLE, LifecycleEvent.of(record.getId(), LifecycleEventKind.REGISTERED));
        return record;
    }

    /** Registers using the capability's own metadata. */
    public PluginRecord register(PluginCapability capability) {
        return register(capability.metadata(), capability);
    }

    public Optional<PluginRecord> get(String pluginId) {
        if (pluginId == null || pluginId.isBlank()) return Optional.empty();
        return Optional.ofNullable(byId.get(pluginId.trim()));
    }

    /**
     * @throws UnknownPluginException if the id is not registered
     */
    public PluginRecord require(String pluginId) {
        return get(pluginId).orElseThrow(() -> new UnknownPluginException(pluginId));
    }

    public boolean contains(String pluginId) {
        return get(pluginId).isPresent();
    }

    /** All records in registration order. */
    public List<PluginRecord> list() {
        return Collections.unmodifiableList(new ArrayList<>(ordered));
    }

    /** Snapshots of all records in registration order. */
    public List<PluginSnapshot> snapshots() {
        return ordered.stream().map(PluginRecord::snapshot).collect(Collectors.toUnmodifiableList());
    }

    public List<PluginRecord> listByState(PluginState state) {
        return ordered.stream().filter(r -> r.getState() == state).collect(Collectors.toUnmodifiableList());
    }

    public List<PluginRecord> listByType(PluginType type) {
        return ordered.stream().filter(r -> r.getMetadata().getType() == type).collect(Collectors.toUnmodifiableList());
    }

    /**
     * Plugins matching any keyword (case-insensitive over name, description, author, keywords).
     * No keywords returns every plugin.
     */
    public List<PluginRecord> search(String... keywords) {
        List<String> terms = keywords == null ? List.of()
                : Arrays.stream(keywords).filter(k -> k != null && !k.isBlank()).collect(Collectors.toList());
        if (terms.isEmpty()) return list();
        return ordered.stream()
                .filter(r -> terms.stream().anyMatch(t -> r.getMetadata().matches(t)))
                .collect(Collectors.toUnmodifiableList());
    }

    public int size() {
        return ordered.size();
    }

    /**
     * Returns the single write handle. Only the lifecycle manager should hold it.
     *
     * @throws IllegalStateException on a second call
     */
    public RegistryMutator mutator() {
        if (!mutatorIssued.compareAndSet(false, true)) {
            throw new IllegalStateException("Registry mutator already issued");
        }
        return this::setState;
    }

    private PluginRuntimeState setState(String pluginId, PluginState state, String detail) {
        Objects.requireNonNull(state, "state");
        PluginRecord record = require(pluginId);
        PluginRuntimeState next = record.getRuntimeState().withState(state, detail);
        PluginRuntimeState previous = record.swap(next);
        log.debug("Plugin {} state {} -> {}", record.getId(), previous.state(), state);
        LifecycleEventKind kind = kindFor(state);
        if (kind != null) {
            events.publish(HostTopics.LIFECYCLE, new LifecycleEvent(record.getId(), kind, next.detail()));
        }
        return next;
    }

    private static LifecycleEventKind kindFor(PluginState state) {
        return switch (state) {
            case ENABLED -> LifecycleEventKind.ENABLED;
            case DISABLED -> LifecycleEventKind.DISABLED;
            case ERROR -> LifecycleEventKind.ERROR;
            default -> null;
        };
    }
}
