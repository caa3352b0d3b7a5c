package com.lineage.core.process;

/**
 * Output of a {@link StepProcessor}.
 *
 * @param newArtifact   the full updated artifact
 * @param logEntry      change-log entry for this step
 * @param commitSummary one-line summary used as the synthetic commit subject
 * @param cost          cost of producing this result, in USD
 * @param processorTag  identifies what produced the result (e.g. a model name)
 */
public record StepResult(
        String newArtifact,
        String logEntry,
        String commitSummary,
        double cost,
        String processorTag
) {}
