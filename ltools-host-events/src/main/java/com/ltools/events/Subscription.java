package com.ltools.events;

import java.time.Duration;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Handle for one subscriber of one topic. Created by {@link EventBus#subscribe(Topic)} (queue-backed,
 * consumed as a lazy blocking sequence) or {@link EventBus#subscribe(Topic, Consumer)} (callback,
 * invoked on the publishing thread). Closing the handle unsubscribes it; a queue-backed sequence then
 * ends after the payloads already queued.
 *
 * @param <T> payload type
 */
public final class Subscription<T> implements AutoCloseable, Iterable<T> {

    private static final Object END = new Object();

    private final long id;
    private final Topic<T> topic;
    private final Consumer<? super T> handler;
    private final BlockingQueue<Object> queue;
    private final EventBus bus;
    private final AtomicBoolean active = new AtomicBoolean(true);

    Subscription(long id, Topic<T> topic, Consumer<? super T> handler, EventBus bus) {
        this.id = id;
        this.topic = topic;
        this.handler = handler;
        this.queue = handler == null ? new LinkedBlockingQueue<>() : null;
        this.bus = bus;
    }

    public long getId() {
        return id;
    }

    public Topic<T> getTopic() {
        return topic;
    }

    public boolean isActive() {
        return active.get();
    }

    /** True if payloads are delivered to a callback rather than queued. */
    public boolean isCallback() {
        return handler != null;
    }

    /** Number of queued payloads not yet consumed; always 0 for callback subscriptions. */
    public int pending() {
        if (queue == null) return 0;
        return (int) queue.stream().filter(o -> o != END).count();
    }

    /**
     * Waits up to {@code timeout} for the next payload.
     *
     * @return the next payload, or empty on timeout or once the subscription is closed and drained
     * @throws IllegalStateException for callback subscriptions
     */
    public Optional<T> next(Duration timeout) throws InterruptedException {
        requireQueue();
        Object o = queue.poll(Objects.requireNonNull(timeout, "timeout").toNanos(), TimeUnit.NANOSECONDS);
        if (o == null) return Optional.empty();
        if (o == END) {
            queue.offer(END);
            return Optional.empty();
        }
        return Optional.of(topic.getPayloadType().cast(o));
    }

    /**
     * Blocking iterator over queued payloads. {@code hasNext()} waits until a payload arrives or the
     * subscription is closed.
     */
    @Override
    public Iterator<T> iterator() {
        requireQueue();
        return new Iterator<>() {
            private Object nextItem;

            @Override
            public boolean hasNext() {
                if (nextItem != null) return nextItem != END;
                try {
                    nextItem = queue.take();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    nextItem = END;
                }
                if (nextItem == END) {
                    queue.offer(END);
                    return false;
                }
                return true;
            }

            @Override
            public T next() {
                if (!hasNext()) throw new NoSuchElementException("Subscription closed: " + topic);
                T item = topic.getPayloadType().cast(nextItem);
                nextItem = null;
                return item;
            }
        };
    }

    /** Lazy, unbounded stream of payloads; ends when the subscription is closed. */
    public Stream<T> stream() {
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(iterator(), Spliterator.ORDERED), false);
    }

    /** Unsubscribes from the bus. Idempotent. */
    @Override
    public void close() {
        bus.unsubscribe(this);
    }

    void deliver(T payload) {
        if (handler != null) {
            handler.accept(payload);
        } else {
            queue.offer(payload);
        }
    }

    boolean terminate() {
        if (!active.compareAndSet(true, false)) return false;
        if (queue != null) queue.offer(END);
        return true;
    }

    private void requireQueue() {
        if (queue == null) {
            throw new IllegalStateException("Callback subscription has no payload sequence: " + topic);
        }
    }

    @Override
    public String toString() {
        return "Subscription{" + id + ", topic=" + topic + (handler != null ? ", callback" : ", queued") + "}";
    }
}
