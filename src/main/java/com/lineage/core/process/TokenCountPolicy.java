package com.lineage.core.process;

/**
 * Reconciles once the diff text processed since the last reconciliation reaches a token threshold.
 */
public class TokenCountPolicy implements ReconciliationPolicy {

    private final long threshold;

    public TokenCountPolicy(long threshold) {
        this.threshold = threshold;
    }

    @Override
    public boolean shouldReconcile(ReconciliationContext context) {
        return context.diffTokensSinceReconciliation() >= threshold;
    }
}
