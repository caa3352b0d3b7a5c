package com.lineage.core.scheduler;

import com.lineage.core.metrics.EvolutionMetrics;
import com.lineage.core.segment.Segment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs segments on a bounded worker pool, starting each one as soon as all of its
 * dependencies have completed.
 * <p>
 * Segments are offered in the order given, which is expected to be dependency order.
 * A failed segment blocks its dependents but not independent work; the run halts once
 * nothing else can start. Completion of one segment is observed on the calling thread,
 * which then launches whatever became ready.
 */
public class DependencyScheduler {

    private static final Logger log = LoggerFactory.getLogger(DependencyScheduler.class);

    private final int maxConcurrency;
    private final EvolutionMetrics metrics;

    public DependencyScheduler(int maxConcurrency, EvolutionMetrics metrics) {
        if (maxConcurrency < 1) {
            throw new IllegalArgumentException("maxConcurrency must be at least 1, got " + maxConcurrency);
        }
        this.maxConcurrency = maxConcurrency;
        this.metrics = metrics;
    }

    DependencyScheduler(int maxConcurrency) {
        this(maxConcurrency, null);
    }

    private enum OutcomeKind { COMPLETED, SHUTDOWN, FAILED }

    private record Outcome(String segmentId, OutcomeKind kind, SegmentResult result, String error) {}

    /**
     * @param segments          all segments, in dependency order
     * @param alreadyComplete   ids of segments completed by an earlier run
     * @param executor          runs one segment
     * @param signal            checked before each launch; once requested, nothing new starts
     * @throws SchedulerDeadlockException if segments remain that can never become ready and no
     *                                    failure explains it
     */
    public ScheduleReport run(List<Segment> segments, Set<String> alreadyComplete,
                              SegmentExecutor executor, ShutdownSignal signal) {
        var completed = new LinkedHashSet<String>();
        for (Segment segment : segments) {
            if (alreadyComplete.contains(segment.id())) {
                completed.add(segment.id());
            }
        }
        var results = new HashMap<String, SegmentResult>();
        var failures = new LinkedHashMap<String, String>();
        var inFlight = new HashSet<String>();
        boolean shutdown = false;

        log.info("Scheduling {} segment(s), {} already complete, max concurrency {}",
                segments.size(), completed.size(), maxConcurrency);

        var threadCount = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(maxConcurrency, r -> {
            Thread t = new Thread(r, "segment-worker-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        CompletionService<Outcome> completion = new ExecutorCompletionService<>(pool);

        try {
            while (true) {
                if (!shutdown && signal.isRequested()) {
                    shutdown = true;
                    log.info("Shutdown requested; waiting for {} in-flight segment(s)", inFlight.size());
                }

                if (!shutdown) {
                    for (Segment segment : segments) {
                        if (inFlight.size() >= maxConcurrency) {
                            break;
                        }
                        if (!isReady(segment, completed, inFlight, failures)) {
                            continue;
                        }
                        var dependencyResults = new HashMap<String, SegmentResult>();
                        for (String depId : segment.dependsOn()) {
                            SegmentResult depResult = results.get(depId);
                            if (depResult != null) {
                                dependencyResults.put(depId, depResult);
                            }
                        }
                        inFlight.add(segment.id());
                        if (metrics != null) {
                            metrics.recordInFlight(inFlight.size());
                        }
                        log.debug("Launching {} (dependencies {})", segment.id(), segment.dependsOn());
                        completion.submit(() -> runOne(executor, segment, Map.copyOf(dependencyResults)));
                    }
                }

                if (inFlight.isEmpty()) {
                    return finish(segments, completed, failures, shutdown);
                }

                Outcome outcome = take(completion);
                inFlight.remove(outcome.segmentId());
                switch (outcome.kind()) {
                    case COMPLETED -> {
                        completed.add(outcome.segmentId());
                        results.put(outcome.segmentId(), outcome.result());
                    }
                    case SHUTDOWN -> shutdown = true;
                    case FAILED -> failures.put(outcome.segmentId(), outcome.error());
                }
            }
        } finally {
            pool.shutdown();
        }
    }

    private ScheduleReport finish(List<Segment> segments, Set<String> completed,
                                  Map<String, String> failures, boolean shutdown) {
        var unfinished = new LinkedHashSet<String>();
        for (Segment segment : segments) {
            if (!completed.contains(segment.id()) && !failures.containsKey(segment.id())) {
                unfinished.add(segment.id());
            }
        }
        if (unfinished.isEmpty() && failures.isEmpty()) {
            log.info("All {} segment(s) complete", completed.size());
            return new ScheduleReport(ScheduleReport.Status.COMPLETED, Set.copyOf(completed), Map.of(), Set.of());
        }
        if (shutdown) {
            log.info("Stopped after graceful shutdown: {} complete, {} not finished",
                    completed.size(), unfinished.size());
            return new ScheduleReport(ScheduleReport.Status.SHUTDOWN, Set.copyOf(completed),
                    Map.copyOf(failures), unfinished);
        }
        if (!failures.isEmpty()) {
            log.error("Evolution halted: segments {} failed. Resume to retry.", failures.keySet());
            return new ScheduleReport(ScheduleReport.Status.FAILED, Set.copyOf(completed),
                    Map.copyOf(failures), unfinished);
        }
        throw new SchedulerDeadlockException(unfinished);
    }

    private static boolean isReady(Segment segment, Set<String> completed, Set<String> inFlight,
                                   Map<String, String> failures) {
        String id = segment.id();
        return !completed.contains(id) && !inFlight.contains(id) && !failures.containsKey(id)
                && completed.containsAll(segment.dependsOn());
    }

    private static Outcome runOne(SegmentExecutor executor, Segment segment,
                                  Map<String, SegmentResult> dependencyResults) {
        try {
            SegmentResult result = executor.execute(segment, dependencyResults);
            return new Outcome(segment.id(), OutcomeKind.COMPLETED, result, null);
        } catch (GracefulShutdownException e) {
            log.info("Segment {} stopped for shutdown", segment.id());
            return new Outcome(segment.id(), OutcomeKind.SHUTDOWN, null, null);
        } catch (RuntimeException e) {
            log.error("Segment {} failed: {}", segment.id(), e.getMessage(), e);
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return new Outcome(segment.id(), OutcomeKind.FAILED, null, message);
        }
    }

    private static Outcome take(CompletionService<Outcome> completion) {
        try {
            return completion.take().get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for segment executions", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Segment execution raised " + e.getCause(), e.getCause());
        }
    }
}
