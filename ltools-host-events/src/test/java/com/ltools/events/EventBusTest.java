package com.ltools.events;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EventBusTest {

    private static final Topic<String> CLOCK = Topic.of("datetime:time", String.class);

    @Test
    void publish_withoutSubscribers_isDropped() throws InterruptedException {
        EventBus bus = new EventBus();
        assertEquals(0, bus.publish(CLOCK, "10:00:00"));

        Subscription<String> late = bus.subscribe(CLOCK);
        assertEquals(Optional.empty(), late.next(Duration.ofMillis(20)));
    }

    @Test
    void queuedSubscriber_seesPublishOrder() throws InterruptedException {
        EventBus bus = new EventBus();
        Subscription<String> sub = bus.subscribe(CLOCK);

        for (int i = 0; i < 5; i++) {
            bus.publish(CLOCK, "t" + i);
        }
        for (int i = 0; i < 5; i++) {
            assertEquals(Optional.of("t" + i), sub.next(Duration.ofSeconds(1)));
        }
    }

    @Test
    void callbackFailure_doesNotStopOtherSubscribers() {
        EventBus bus = new EventBus();
        List<String> received = new ArrayList<>();
        bus.subscribe(CLOCK, s -> {
            throw new IllegalStateException("boom");
        });
        bus.subscribe(CLOCK, received::add);

        assertEquals(1, bus.publish(CLOCK, "a"));
        bus.publish(CLOCK, "b");

        assertEquals(List.of("a", "b"), received);
        assertEquals(2, bus.subscriberCount(CLOCK));
    }

    @Test
    void close_endsStreamAfterQueuedPayloads() {
        EventBus bus = new EventBus();
        Subscription<String> sub = bus.subscribe(CLOCK);
        bus.publish(CLOCK, "x");
        bus.publish(CLOCK, "y");
        sub.close();

        assertFalse(sub.isActive());
        assertEquals(0, bus.publish(CLOCK, "z"));
        assertEquals(List.of("x", "y"), sub.stream().collect(Collectors.toList()));
        sub.close();
    }

    @Test
    void iterator_blocksUntilPublished() throws InterruptedException {
        EventBus bus = new EventBus();
        Subscription<String> sub = bus.subscribe(CLOCK);
        CountDownLatch got = new CountDownLatch(1);
        List<String> seen = new ArrayList<>();
        Thread reader = new Thread(() -> {
            for (String s : sub) {
                seen.add(s);
                got.countDown();
            }
        });
        reader.start();

        bus.publish(CLOCK, "first");
        assertTrue(got.await(2, TimeUnit.SECONDS));
        sub.close();
        reader.join(2000);

        assertFalse(reader.isAlive());
        assertEquals(List.of("first"), seen);
    }

    @Test
    void topicName_cannotBeReusedWithAnotherType() {
        EventBus bus = new EventBus();
        bus.subscribe(CLOCK);
        Topic<Integer> clash = Topic.of("datetime:time", Integer.class);

        assertThrows(IllegalArgumentException.class, () -> bus.subscribe(clash));
        assertThrows(IllegalArgumentException.class, () -> bus.publish(clash, 1));
    }

    @Test
    void callbackSubscription_hasNoSequence() {
        EventBus bus = new EventBus();
        Subscription<LifecycleEvent> sub = bus.subscribe(HostTopics.LIFECYCLE, e -> { });

        assertTrue(sub.isCallback());
        assertThrows(IllegalStateException.class, () -> sub.next(Duration.ZERO));
    }

    @Test
    void lifecycleEvent_defaultsDetail() {
        LifecycleEvent event = new LifecycleEvent("datetime.builtin", LifecycleEventKind.ENABLED, null);
        assertEquals("", event.detail());
        assertTrue(LifecycleEventKind.ERROR.affectsNavigation());
        assertFalse(LifecycleEventKind.ENTER_HANDLED.affectsNavigation());
    }
}
