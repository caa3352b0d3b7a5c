package com.lineage.core.process;

import com.lineage.core.segment.SegmentKind;

/**
 * Reconciles every {@code interval} trunk steps, and only from within trunk segments.
 */
public class NTrunkCommitsPolicy implements ReconciliationPolicy {

    private final int interval;

    public NTrunkCommitsPolicy(int interval) {
        this.interval = interval;
    }

    @Override
    public boolean shouldReconcile(ReconciliationContext context) {
        if (context.segmentKind() != SegmentKind.TRUNK) {
            return false;
        }
        return context.trunkSteps() - context.lastReconciliationTrunkStep() >= interval;
    }
}
