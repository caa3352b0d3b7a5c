package com.lineage.core.engine;

import com.lineage.core.graph.CommitGraph;
import com.lineage.core.graph.TrunkMarker;
import com.lineage.core.ledger.CompletedStep;
import com.lineage.core.ledger.EvolutionState;
import com.lineage.core.ledger.SegmentProgress;
import com.lineage.core.ledger.SegmentStatus;
import com.lineage.core.process.StepKind;
import com.lineage.core.segment.Segment;
import com.lineage.core.segment.SegmentDecomposer;
import com.lineage.core.segment.SegmentKind;
import com.lineage.testsupport.GraphFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EvolutionEstimatorTest {

    private CommitGraph graph;
    private List<Segment> segments;
    private EvolutionEstimator estimator;

    @BeforeEach
    void setUp() {
        graph = GraphFixtures.referenceGraph();
        segments = new SegmentDecomposer().decompose(graph, TrunkMarker.mark(graph, "F"));
        estimator = new EvolutionEstimator();
    }

    @Test
    @DisplayName("counts all steps by kind for a fresh run")
    void freshRun() {
        SetupStats stats = estimator.estimate(graph, segments, new EvolutionState(), 4);

        assertEquals(15, stats.totalCommits());
        assertEquals(15, stats.remainingSteps());
        assertEquals(0, stats.completedSteps());
        assertEquals(2, stats.mergePoints());
        assertEquals(1, stats.remainingByStepKind().get(StepKind.INITIAL));
        assertEquals(2, stats.remainingByStepKind().get(StepKind.MERGE));
        assertEquals(12, stats.remainingByStepKind().get(StepKind.EVOLVE));
        assertEquals(6, stats.segmentCount());
        assertEquals(3, stats.segmentsByKind().get(SegmentKind.TRUNK));
    }

    @Test
    @DisplayName("the critical path follows the longest dependency chain")
    void criticalPath() {
        SetupStats stats = estimator.estimate(graph, segments, new EvolutionState(), 4);

        // trunk-0 (3) -> branch x (2) -> trunk-1 (3) -> trunk-2 (2)
        assertEquals(10, stats.criticalPath());
        assertEquals(10 * EvolutionEstimator.STEP_SECONDS_LOW, stats.wallClockLowSeconds());
    }

    @Test
    @DisplayName("a single worker is bound by the total step count")
    void sequential() {
        SetupStats stats = estimator.estimate(graph, segments, new EvolutionState(), 1);

        assertEquals(15 * EvolutionEstimator.STEP_SECONDS_HIGH, stats.wallClockHighSeconds());
    }

    @Test
    @DisplayName("completed and partially covered segments are subtracted")
    void partialProgress() {
        var state = new EvolutionState();
        Segment first = segments.get(0);
        var done = SegmentProgress.pending();
        done.setStatus(SegmentStatus.COMPLETE);
        state.getSegmentProgress().put(first.id(), done);
        Segment branch = segments.stream().filter(s -> s.firstCommit().equals("X1")).findFirst().orElseThrow();
        var partial = SegmentProgress.pending();
        partial.setStatus(SegmentStatus.IN_PROGRESS);
        partial.getCompletedSteps().add(new CompletedStep("X1", "s", "fake", 0.02, Instant.now()));
        state.getSegmentProgress().put(branch.id(), partial);
        state.setTotalCost(0.02);

        SetupStats stats = estimator.estimate(graph, segments, state, 4);

        assertEquals(4, stats.completedSteps());
        assertEquals(11, stats.remainingSteps());
        assertEquals(0, stats.remainingByStepKind().get(StepKind.INITIAL));
        assertEquals(0.02, stats.costSoFar(), 1e-9);
        assertTrue(stats.costLow() < stats.costHigh());
    }

    @Test
    @DisplayName("formats a readable summary")
    void summary() {
        String text = EvolutionEstimator.formatSummary(estimator.estimate(graph, segments, new EvolutionState(), 4));

        assertTrue(text.contains("Total commits:   15"));
        assertTrue(text.contains("Segments:        6 (trunk 3, branch 2, dead-end 1)"));
        assertTrue(text.contains("Merge points:    2"));
        assertTrue(text.contains("Time estimate:   7m - 15m"));
    }

    @Test
    @DisplayName("formats durations in the largest sensible unit")
    void durations() {
        assertEquals("30s", EvolutionEstimator.formatDuration(30));
        assertEquals("2m", EvolutionEstimator.formatDuration(150));
        assertEquals("1h 5m", EvolutionEstimator.formatDuration(3900));
    }
}
