package com.lineage.core.ledger;

public enum SegmentStatus {
    PENDING,
    IN_PROGRESS,
    COMPLETE,
    FAILED
}
