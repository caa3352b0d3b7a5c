package com.lineage.core.ledger;

import java.time.Instant;

/**
 * One processed commit and the synthetic commit written for it.
 * <p>
 * A step tagged {@link #CHECKPOINT_TAG} was recovered from shadow history and stands
 * for every commit of its segment up to and including {@code originalId}.
 */
public record CompletedStep(
        String originalId,
        String syntheticId,
        String processorTag,
        double cost,
        Instant timestamp
) {

    public static final String CHECKPOINT_TAG = "checkpoint";
    public static final String MERGE_TAG = "merge";
}
