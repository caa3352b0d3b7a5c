package com.lineage.core.process;

/**
 * Output of a {@link MergeReconciler}.
 */
public record MergeResult(
        String unifiedArtifact,
        String unifiedLogEntry,
        String commitSummary,
        double cost
) {}
