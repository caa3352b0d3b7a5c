package com.lineage.core.process;

/**
 * Combines the artifacts of a trunk and a branch at a merge commit into one.
 */
public interface MergeReconciler {

    MergeResult reconcile(MergeRequest request);
}
