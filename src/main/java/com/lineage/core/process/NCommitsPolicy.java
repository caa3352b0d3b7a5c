package com.lineage.core.process;

/**
 * Reconciles every {@code interval} steps, counted across all segments.
 */
public class NCommitsPolicy implements ReconciliationPolicy {

    private final int interval;

    public NCommitsPolicy(int interval) {
        this.interval = interval;
    }

    @Override
    public boolean shouldReconcile(ReconciliationContext context) {
        return context.totalSteps() - context.lastReconciliationStep() >= interval;
    }
}
