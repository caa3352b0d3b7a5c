package com.lineage.core.segment;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SegmentKind {
    TRUNK("trunk"),
    BRANCH("branch"),
    DEAD_END("dead-end");

    private final String label;

    SegmentKind(String label) {
        this.label = label;
    }

    /** Label used in segment ids and in persisted state. */
    @JsonValue
    public String label() {
        return label;
    }
}
