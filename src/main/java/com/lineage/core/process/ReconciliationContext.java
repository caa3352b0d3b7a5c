package com.lineage.core.process;

import com.lineage.core.segment.SegmentKind;

/**
 * Progress counters consulted by a {@link ReconciliationPolicy} after each step.
 *
 * @param segmentKind                 kind of the segment that just recorded a step
 * @param totalSteps                  steps recorded across all segments
 * @param trunkSteps                  steps recorded in trunk segments
 * @param lastReconciliationStep      value of {@code totalSteps} at the last reconciliation
 * @param lastReconciliationTrunkStep value of {@code trunkSteps} at the last reconciliation
 * @param diffTokensSinceReconciliation estimated diff tokens processed since the last reconciliation
 */
public record ReconciliationContext(
        SegmentKind segmentKind,
        int totalSteps,
        int trunkSteps,
        int lastReconciliationStep,
        int lastReconciliationTrunkStep,
        long diffTokensSinceReconciliation
) {}
