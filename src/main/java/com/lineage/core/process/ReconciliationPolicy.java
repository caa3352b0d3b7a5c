package com.lineage.core.process;

/**
 * Decides when to reconcile the artifact against the source tree.
 */
@FunctionalInterface
public interface ReconciliationPolicy {

    ReconciliationPolicy NONE = context -> false;

    boolean shouldReconcile(ReconciliationContext context);
}
