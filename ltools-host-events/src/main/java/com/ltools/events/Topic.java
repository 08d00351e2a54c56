package com.ltools.events;

import java.util.Objects;

/**
 * Named, typed event channel. Two topics are the same channel when their names match; the bus rejects
 * a second use of a name with a different payload type.
 *
 * @param <T> payload type
 */
public final class Topic<T> {

    private final String name;
    private final Class<T> payloadType;

    private Topic(String name, Class<T> payloadType) {
        this.name = name;
        this.payloadType = payloadType;
    }

    /**
     * Creates a topic.
     *
     * @param name        non-blank channel name (e.g. {@code plugin:lifecycle})
     * @param payloadType payload class
     * @throws IllegalArgumentException if name is blank
     */
    public static <T> Topic<T> of(String name, Class<T> payloadType) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(payloadType, "payloadType");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Topic name must be non-blank");
        }
        return new Topic<>(name.trim(), payloadType);
    }

    public String getName() {
        return name;
    }

    public Class<T> getPayloadType() {
        return payloadType;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Topic)) return false;
        return name.equals(((Topic<?>) o).name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return name;
    }
}
