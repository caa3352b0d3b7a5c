package com.lineage.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for evolution runs.
 */
@Service
public class EvolutionMetrics {

    private final MeterRegistry registry;

    public EvolutionMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordStep(String processorTag, long ms, double cost) {
        Counter.builder("lineage.steps.total")
                .tag("processor", processorTag)
                .register(registry)
                .increment();
        Timer.builder("lineage.step.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
        recordCost(cost);
    }

    public void recordSegmentResult(String kind, String status) {
        Counter.builder("lineage.segments.total")
                .tag("kind", kind)
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordMerge(int branchCount) {
        Counter.builder("lineage.merges.total")
                .tag("branches", String.valueOf(branchCount))
                .register(registry)
                .increment();
    }

    /**
     * @param outcome "applied" or "failed"
     */
    public void recordReconciliation(String outcome) {
        Counter.builder("lineage.reconciliations.total")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordCost(double cost) {
        if (cost > 0) {
            DistributionSummary.builder("lineage.cost.usd")
                    .description("Cost of collaborator calls in USD")
                    .register(registry)
                    .record(cost);
        }
    }

    /**
     * Records how many segments were executing when the scheduler launched another.
     */
    public void recordInFlight(int count) {
        DistributionSummary.builder("lineage.scheduler.in_flight")
                .description("Segments executing concurrently")
                .register(registry)
                .record(count);
    }
}
