package com.lineage.core.ledger;

import java.time.Instant;

/**
 * A source reconciliation written on top of the step for {@code afterOriginalId}.
 */
public record CompletedReconciliation(
        String segmentId,
        String afterOriginalId,
        String syntheticId,
        int atStep,
        double cost,
        Instant timestamp
) {}
