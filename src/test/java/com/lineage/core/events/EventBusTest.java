package com.lineage.core.events;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link EventBus}.
 */
class EventBusTest {

    private EventBus eventBus;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
    }

    // -- EvolutionEvent record tests ------------------------------------------

    @Nested
    @DisplayName("EvolutionEvent")
    class EvolutionEventTests {

        @Test
        @DisplayName("of() stamps the current time")
        void ofStampsTime() {
            var event = EvolutionEvent.of("segment.started", "run-1", "trunk-0", Map.of("commits", 3));

            assertEquals("segment.started", event.eventType());
            assertEquals("trunk-0", event.segmentId());
            assertEquals(3, event.payload().get("commits"));
            assertNotNull(event.timestamp());
        }

        @Test
        @DisplayName("allows a null segmentId for run-level events")
        void allowsNullSegment() {
            assertNull(EvolutionEvent.of("evolution.started", "run-1", null, Map.of()).segmentId());
        }
    }

    // -- Subscribe and publish tests ------------------------------------------

    @Nested
    @DisplayName("subscribe and publish")
    class SubscribeAndPublishTests {

        @Test
        @DisplayName("delivers events only to subscribers of the same run")
        void deliversPerRun() {
            List<EvolutionEvent> mine = new ArrayList<>();
            List<EvolutionEvent> other = new ArrayList<>();
            eventBus.subscribe("run-1", mine::add);
            eventBus.subscribe("run-2", other::add);

            eventBus.publish(EvolutionEvent.of("step.completed", "run-1", "trunk-0", Map.of()));

            assertEquals(1, mine.size());
            assertTrue(other.isEmpty());
        }

        @Test
        @DisplayName("global subscribers receive events from every run")
        void globalSubscriber() {
            List<EvolutionEvent> received = new ArrayList<>();
            eventBus.subscribeAll(received::add);

            eventBus.publish(EvolutionEvent.of("step.completed", "run-1", "trunk-0", Map.of()));
            eventBus.publish(EvolutionEvent.of("step.completed", "run-2", "trunk-0", Map.of()));

            assertEquals(2, received.size());
        }

        @Test
        @DisplayName("unsubscribe stops delivery")
        void unsubscribe() {
            List<EvolutionEvent> received = new ArrayList<>();
            EventBus.Subscription run = eventBus.subscribe("run-1", received::add);
            EventBus.Subscription all = eventBus.subscribeAll(received::add);

            run.unsubscribe();
            all.unsubscribe();
            eventBus.publish(EvolutionEvent.of("step.completed", "run-1", "trunk-0", Map.of()));

            assertTrue(received.isEmpty());
        }

        @Test
        @DisplayName("a failing subscriber does not stop delivery to others")
        void failingSubscriber() {
            List<EvolutionEvent> received = new ArrayList<>();
            eventBus.subscribeAll(e -> {
                throw new IllegalStateException("boom");
            });
            eventBus.subscribeAll(received::add);

            assertDoesNotThrow(() ->
                    eventBus.publish(EvolutionEvent.of("segment.failed", "run-1", "branch-0", Map.of())));
            assertEquals(1, received.size());
        }
    }

    // -- Thread safety --------------------------------------------------------

    @Nested
    @DisplayName("thread safety")
    class ThreadSafetyTests {

        @Test
        @DisplayName("publishing from several worker threads delivers every event")
        void concurrentPublish() throws InterruptedException {
            var received = new CopyOnWriteArrayList<EvolutionEvent>();
            eventBus.subscribe("run-1", received::add);
            int threads = 4;
            int perThread = 50;
            var done = new CountDownLatch(threads);

            for (int t = 0; t < threads; t++) {
                String segmentId = "segment-" + t;
                new Thread(() -> {
                    for (int i = 0; i < perThread; i++) {
                        eventBus.publish(EvolutionEvent.of("step.completed", "run-1", segmentId, Map.of("index", i)));
                    }
                    done.countDown();
                }).start();
            }

            assertTrue(done.await(10, TimeUnit.SECONDS));
            assertEquals(threads * perThread, received.size());
        }
    }
}
