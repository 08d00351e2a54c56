package com.ltools.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * In-process publish/subscribe bus with typed topics.
 * <ul>
 *   <li>Publishes to one topic are serialized, so each subscriber sees that topic's payloads in publish order.
 *       Order across topics is not defined.</li>
 *   <li>Callback subscribers run on the publishing thread. A callback that throws is logged and stays
 *       subscribed; other subscribers still receive the payload.</li>
 *   <li>Nothing is stored: a payload published while a topic has no subscribers is dropped.</li>
 * </ul>
 */
public final class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final Map<String, Channel> channels = new ConcurrentHashMap<>();
    private final AtomicLong subscriptionIds = new AtomicLong();

    /**
     * Delivers the payload to every active subscriber of the topic.
     *
     * @return number of subscribers the payload was handed to (0 if dropped)
     * @throws IllegalArgumentException if the topic name is already bound to another payload type
     */
    public <T> int publish(Topic<T> topic, T payload) {
        Objects.requireNonNull(topic, "topic");
        Objects.requireNonNull(payload, "payload");
        Channel channel = channels.get(topic.getName());
        if (channel == null || channel.subscribers.isEmpty()) {
            log.debug("No subscribers on {}; dropping payload", topic);
            return 0;
        }
        channel.checkType(topic);
        int delivered = 0;
        channel.lock.lock();
        try {
            for (Subscription<?> s : channel.subscribers) {
                if (!s.isActive()) continue;
                @SuppressWarnings("unchecked")
                Subscription<T> sub = (Subscription<T>) s;
                try {
                    sub.deliver(payload);
                    delivered++;
                } catch (Throwable t) {
                    log.warn("Subscriber {} failed on topic {}; continuing with remaining subscribers", sub.getId(), topic, t);
                }
            }
        } finally {
            channel.lock.unlock();
        }
        return delivered;
    }

    /** Subscribes with an unbounded queue; consume via {@link Subscription#next}, iterator or stream. */
    public <T> Subscription<T> subscribe(Topic<T> topic) {
        return add(topic, null);
    }

    /** Subscribes a callback invoked on the publishing thread for each payload. */
    public <T> Subscription<T> subscribe(Topic<T> topic, Consumer<? super T> handler) {
        return add(topic, Objects.requireNonNull(handler, "handler"));
    }

    /**
     * Removes the subscription. Payloads already queued remain readable; the sequence then ends.
     *
     * @return true if the subscription was active
     */
    public boolean unsubscribe(Subscription<?> subscription) {
        if (subscription == null) return false;
        Channel channel = channels.get(subscription.getTopic().getName());
        if (channel != null) {
            channel.subscribers.remove(subscription);
        }
        boolean wasActive = subscription.terminate();
        if (wasActive) {
            log.debug("Unsubscribed {} from {}", subscription.getId(), subscription.getTopic());
        }
        return wasActive;
    }

    /** Number of active subscribers on the topic. */
    public int subscriberCount(Topic<?> topic) {
        Channel channel = channels.get(topic.getName());
        return channel != null ? channel.subscribers.size() : 0;
    }

    /** Terminates every subscription (host shutdown). */
    public void close() {
        for (Channel channel : channels.values()) {
            for (Subscription<?> s : channel.subscribers) {
                s.terminate();
            }
            channel.subscribers.clear();
        }
    }

    private <T> Subscription<T> add(Topic<T> topic, Consumer<? super T> handler) {
        Objects.requireNonNull(topic, "topic");
        Channel channel = channels.computeIfAbsent(topic.getName(), k -> new Channel(topic.getPayloadType()));
        channel.checkType(topic);
        Subscription<T> subscription = new Subscription<>(subscriptionIds.incrementAndGet(), topic, handler, this);
        channel.lock.lock();
        try {
            channel.subscribers.add(subscription);
        } finally {
            channel.lock.unlock();
        }
        log.debug("Subscribed {} to {}", subscription.getId(), topic);
        return subscription;
    }

    private static final class Channel {
        private final Class<?> payloadType;
        private final ReentrantLock lock = new ReentrantLock();
        private final List<Subscription<?>> subscribers = new CopyOnWriteArrayList<>();

        Channel(Class<?> payloadType) {
            this.payloadType = payloadType;
        }

        void checkType(Topic<?> topic) {
            if (payloadType != topic.getPayloadType()) {
                throw new IllegalArgumentException("Topic " + topic.getName() + " carries " + payloadType.getName()
                        + ", not " + topic.getPayloadType().getName());
            }
        }
    }
}
