package com.classmonitor.model;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RelayTest {

    private static final Duration SHORT = Duration.ofMillis(50);

    private Relay relay;

    @BeforeEach
    void setUp() {
        relay = new Relay("room-7", 4);
    }

    private static Frame frame(String marker) {
        return new Frame("room-7", "data:image/jpeg;base64," + marker, List.of(), null);
    }

    @Test
    @DisplayName("broadcast with no subscribers caches the frame and delivers nowhere")
    void broadcastWithoutSubscribers() {
        Frame first = frame("AAAA");

        assertEquals(0, relay.broadcast(first));
        assertEquals(first, relay.getLastFrame().orElseThrow());
    }

    @Test
    @DisplayName("broadcast reaches every subscriber")
    void broadcastFansOut() {
        List<BoundedChannel<Frame>> channels = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            channels.add(relay.subscribe());
        }
        Frame live = frame("BBBB");

        assertEquals(5, relay.broadcast(live));
        for (BoundedChannel<Frame> channel : channels) {
            StepVerifier.create(channel.receive(SHORT))
                    .assertNext(received -> assertSame(live, received.item()))
                    .verifyComplete();
        }
    }

    @Test
    @DisplayName("a full subscriber misses the frame without affecting others")
    void slowSubscriberIsIsolated() {
        BoundedChannel<Frame> slow = relay.subscribe();
        BoundedChannel<Frame> fast = relay.subscribe();

        for (int i = 0; i < 4; i++) {
            relay.broadcast(frame("F" + i));
            fast.receive(SHORT).block();
        }
        assertEquals(4, slow.size());

        Frame extra = frame("EXTRA");
        assertEquals(1, relay.broadcast(extra));

        assertEquals(4, slow.size());
        StepVerifier.create(slow.receive(SHORT))
                .assertNext(received -> assertEquals("data:image/jpeg;base64,F0", received.item().image()))
                .verifyComplete();
        StepVerifier.create(fast.receive(SHORT))
                .assertNext(received -> assertSame(extra, received.item()))
                .verifyComplete();
    }

    @Test
    @DisplayName("a late subscriber gets the cached frame before later frames")
    void lateSubscriberGetsCachedFrameFirst() {
        Frame cached = frame("CACHED");
        Frame next = frame("NEXT");
        relay.broadcast(cached);

        BoundedChannel<Frame> channel = relay.subscribe();
        relay.broadcast(next);

        StepVerifier.create(channel.receive(SHORT).repeat(1).map(BoundedChannel.Received::item))
                .expectNext(cached, next)
                .verifyComplete();
    }

    @Test
    @DisplayName("unsubscribe is idempotent and closes the channel")
    void unsubscribeIsIdempotent() {
        BoundedChannel<Frame> channel = relay.subscribe();
        assertEquals(1, relay.getSubscriberCount());

        relay.unsubscribe(channel);
        relay.unsubscribe(channel);

        assertEquals(0, relay.getSubscriberCount());
        assertFalse(relay.hasSubscribers());
        assertTrue(channel.isClosed());
        assertEquals(0, relay.broadcast(frame("GONE")));
    }

    @Test
    @DisplayName("a viewer that unsubscribes while taking a frame does not cut off the others")
    void unsubscribeFromInsideDeliveryKeepsFanOutGoing() {
        BoundedChannel<Frame> first = relay.subscribe();
        BoundedChannel<Frame> second = relay.subscribe();
        List<Frame> seenByFirst = new ArrayList<>();
        first.receive(Duration.ofSeconds(5)).subscribe(received -> {
            seenByFirst.add(received.item());
            relay.unsubscribe(first);
        });

        Frame live = frame("LIVE");
        int delivered = assertDoesNotThrow(() -> relay.broadcast(live));

        assertEquals(2, delivered);
        assertEquals(List.of(live), seenByFirst);
        assertTrue(first.isClosed());
        assertEquals(1, relay.getSubscriberCount());
        StepVerifier.create(second.receive(SHORT))
                .assertNext(received -> assertSame(live, received.item()))
                .verifyComplete();
    }
}
