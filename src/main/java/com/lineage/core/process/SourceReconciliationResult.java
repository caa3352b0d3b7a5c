package com.lineage.core.process;

public record SourceReconciliationResult(
        String updatedArtifact,
        String logEntry,
        String commitSummary,
        double cost
) {}
