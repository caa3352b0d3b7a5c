package com.lineage.core.scheduler;

import com.lineage.core.segment.Segment;
import com.lineage.core.segment.SegmentKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class DependencySchedulerTest {

    private ShutdownSignal signal;

    @BeforeEach
    void setUp() {
        signal = new ShutdownSignal();
    }

    private static Segment segment(String id, String... dependsOn) {
        return new Segment(id, SegmentKind.TRUNK, List.of(id + "-c"), null, null, List.of(dependsOn));
    }

    private static SegmentResult resultOf(Segment segment) {
        return new SegmentResult(segment.id(), segment.lastCommit(), "syn-" + segment.id(),
                "artifact " + segment.id(), "");
    }

    private static void pause(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    // -- Ordering ------------------------------------------------------------

    @Nested
    @DisplayName("Ordering")
    class Ordering {

        @Test
        @DisplayName("runs every segment after its dependencies")
        void dependencyOrder() {
            var order = new CopyOnWriteArrayList<String>();
            var segments = List.of(segment("a"), segment("b", "a"), segment("c", "a"), segment("d", "b", "c"));

            ScheduleReport report = new DependencyScheduler(3).run(segments, Set.of(), (s, deps) -> {
                order.add(s.id());
                return resultOf(s);
            }, signal);

            assertEquals(ScheduleReport.Status.COMPLETED, report.status());
            assertEquals(Set.of("a", "b", "c", "d"), report.completed());
            assertEquals("a", order.get(0));
            assertEquals("d", order.get(3));
        }

        @Test
        @DisplayName("hands each segment the results of its dependencies")
        void dependencyResults() {
            var received = new ConcurrentHashMap<String, Map<String, SegmentResult>>();
            var segments = List.of(segment("a"), segment("b"), segment("m", "a", "b"));

            new DependencyScheduler(2).run(segments, Set.of(), (s, deps) -> {
                received.put(s.id(), deps);
                return resultOf(s);
            }, signal);

            assertEquals(Set.of("a", "b"), received.get("m").keySet());
            assertEquals("syn-a", received.get("m").get("a").tipSyntheticId());
            assertTrue(received.get("a").isEmpty());
        }

        @Test
        @DisplayName("skips segments completed by an earlier run")
        void alreadyComplete() {
            var ran = new CopyOnWriteArrayList<String>();
            var segments = List.of(segment("a"), segment("b", "a"));

            ScheduleReport report = new DependencyScheduler(1).run(segments, Set.of("a"), (s, deps) -> {
                ran.add(s.id());
                assertTrue(deps.isEmpty());
                return resultOf(s);
            }, signal);

            assertEquals(List.of("b"), ran);
            assertEquals(ScheduleReport.Status.COMPLETED, report.status());
        }
    }

    // -- Concurrency ---------------------------------------------------------

    @Nested
    @DisplayName("Concurrency")
    class Concurrency {

        @Test
        @DisplayName("never runs more segments at once than allowed")
        void bounded() {
            var running = new AtomicInteger();
            var peak = new AtomicInteger();
            var segments = List.of(segment("a"), segment("b"), segment("c"), segment("d"), segment("e"));

            new DependencyScheduler(2).run(segments, Set.of(), (s, deps) -> {
                peak.accumulateAndGet(running.incrementAndGet(), Math::max);
                pause(30);
                running.decrementAndGet();
                return resultOf(s);
            }, signal);

            assertTrue(peak.get() <= 2, "peak concurrency was " + peak.get());
        }

        @Test
        @DisplayName("runs segments on named worker threads")
        void workerThreads() {
            var threads = new CopyOnWriteArrayList<String>();

            new DependencyScheduler(1).run(List.of(segment("a")), Set.of(), (s, deps) -> {
                threads.add(Thread.currentThread().getName());
                return resultOf(s);
            }, signal);

            assertTrue(threads.get(0).startsWith("segment-worker-"));
        }

        @Test
        @DisplayName("rejects a concurrency below one")
        void invalidConcurrency() {
            assertThrows(IllegalArgumentException.class, () -> new DependencyScheduler(0));
        }
    }

    // -- Failure -------------------------------------------------------------

    @Nested
    @DisplayName("Failure")
    class Failure {

        @Test
        @DisplayName("a failure blocks dependents but independent segments still run")
        void failureHalts() {
            var segments = List.of(segment("a"), segment("bad"), segment("after-bad", "bad"), segment("other", "a"));

            ScheduleReport report = new DependencyScheduler(2).run(segments, Set.of(), (s, deps) -> {
                if (s.id().equals("bad")) {
                    throw new IllegalStateException("processor unavailable");
                }
                return resultOf(s);
            }, signal);

            assertEquals(ScheduleReport.Status.FAILED, report.status());
            assertEquals(Map.of("bad", "processor unavailable"), report.failures());
            assertEquals(Set.of("a", "other"), report.completed());
            assertEquals(Set.of("after-bad"), report.unfinished());
        }

        @Test
        @DisplayName("throws when segments can never become ready without a failure to explain it")
        void deadlock() {
            var segments = List.of(segment("a"), segment("orphan", "missing"));

            var ex = assertThrows(SchedulerDeadlockException.class,
                    () -> new DependencyScheduler(2).run(segments, Set.of(), (s, deps) -> resultOf(s), signal));
            assertTrue(ex.getMessage().contains("orphan"));
        }
    }

    // -- Shutdown ------------------------------------------------------------

    @Nested
    @DisplayName("Shutdown")
    class Shutdown {

        @Test
        @DisplayName("starts nothing new once shutdown is requested")
        void stopsLaunching() {
            var ran = new CopyOnWriteArrayList<String>();
            var segments = List.of(segment("a"), segment("b", "a"));

            ScheduleReport report = new DependencyScheduler(1).run(segments, Set.of(), (s, deps) -> {
                ran.add(s.id());
                signal.request();
                return resultOf(s);
            }, signal);

            assertEquals(ScheduleReport.Status.SHUTDOWN, report.status());
            assertEquals(List.of("a"), ran);
            assertEquals(Set.of("b"), report.unfinished());
        }

        @Test
        @DisplayName("a segment stopping for shutdown is not a failure")
        void gracefulStop() {
            ScheduleReport report = new DependencyScheduler(1).run(List.of(segment("a")), Set.of(), (s, deps) -> {
                signal.request();
                signal.assertContinue();
                return resultOf(s);
            }, signal);

            assertEquals(ScheduleReport.Status.SHUTDOWN, report.status());
            assertTrue(report.failures().isEmpty());
            assertEquals(Set.of("a"), report.unfinished());
        }

        @Test
        @DisplayName("assertContinue passes until shutdown is requested")
        void assertContinue() {
            assertDoesNotThrow(signal::assertContinue);
            signal.request();
            assertThrows(GracefulShutdownException.class, signal::assertContinue);
        }
    }
}
