package com.lineage.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EvolutionMetricsTest {

    private SimpleMeterRegistry registry;
    private EvolutionMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new EvolutionMetrics(registry);
    }

    @Test
    @DisplayName("recordStep counts by processor and times the step")
    void recordStep() {
        metrics.recordStep("gpt-4o", 1200, 0.02);
        metrics.recordStep("gpt-4o", 800, 0.01);

        var counter = registry.find("lineage.steps.total").tag("processor", "gpt-4o").counter();
        var timer = registry.find("lineage.step.duration").timer();
        var cost = registry.find("lineage.cost.usd").summary();

        assertNotNull(counter);
        assertEquals(2.0, counter.count());
        assertNotNull(timer);
        assertEquals(2, timer.count());
        assertNotNull(cost);
        assertEquals(0.03, cost.totalAmount(), 1e-9);
    }

    @Test
    @DisplayName("recordCost ignores zero cost")
    void zeroCost() {
        metrics.recordCost(0.0);

        assertNull(registry.find("lineage.cost.usd").summary());
    }

    @Test
    @DisplayName("recordSegmentResult increments by kind and status")
    void recordSegmentResult() {
        metrics.recordSegmentResult("trunk", "complete");
        metrics.recordSegmentResult("branch", "failed");

        var complete = registry.find("lineage.segments.total")
                .tag("kind", "trunk").tag("status", "complete").counter();
        var failed = registry.find("lineage.segments.total")
                .tag("kind", "branch").tag("status", "failed").counter();

        assertNotNull(complete);
        assertNotNull(failed);
        assertEquals(1.0, complete.count());
        assertEquals(1.0, failed.count());
    }

    @Test
    @DisplayName("recordMerge tags the branch count")
    void recordMerge() {
        metrics.recordMerge(2);

        var counter = registry.find("lineage.merges.total").tag("branches", "2").counter();
        assertNotNull(counter);
        assertEquals(1.0, counter.count());
    }

    @Test
    @DisplayName("recordReconciliation increments by outcome")
    void recordReconciliation() {
        metrics.recordReconciliation("applied");
        metrics.recordReconciliation("failed");
        metrics.recordReconciliation("applied");

        var applied = registry.find("lineage.reconciliations.total").tag("outcome", "applied").counter();
        assertNotNull(applied);
        assertEquals(2.0, applied.count());
    }

    @Test
    @DisplayName("recordInFlight records to distribution summary")
    void recordInFlight() {
        metrics.recordInFlight(1);
        metrics.recordInFlight(2);

        var summary = registry.find("lineage.scheduler.in_flight").summary();
        assertNotNull(summary);
        assertEquals(2, summary.count());
        assertEquals(2.0, summary.max());
    }
}
