package com.lineage.core.ledger;

import java.time.Instant;
import java.util.List;

public record CompletedMerge(
        String mergeId,
        String syntheticId,
        String trunkSegmentId,
        List<String> branchSegmentIds,
        double cost,
        Instant timestamp
) {}
