package com.lineage.core.ledger;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ReplayLogTest {

    private static final List<String> COMMITS = List.of("A", "B", "C", "D");

    private static CompletedStep step(String id) {
        return new CompletedStep(id, "s-" + id, "fake", 0.0, Instant.EPOCH);
    }

    private static CompletedStep checkpoint(String id) {
        return new CompletedStep(id, "s-" + id, CompletedStep.CHECKPOINT_TAG, 0.0, Instant.EPOCH);
    }

    @Test
    @DisplayName("no steps cover nothing")
    void empty() {
        assertEquals(0, ReplayLog.coveredCount(COMMITS, List.of()));
    }

    @Test
    @DisplayName("a prefix of the commits is valid")
    void prefix() {
        assertEquals(2, ReplayLog.coveredCount(COMMITS, List.of(step("A"), step("B"))));
        assertEquals(4, ReplayLog.coveredCount(COMMITS,
                List.of(step("A"), step("B"), step("C"), step("D"))));
    }

    @Test
    @DisplayName("a checkpoint stands for every commit up to it")
    void checkpointCoversPrefix() {
        assertEquals(3, ReplayLog.coveredCount(COMMITS, List.of(checkpoint("C"))));
        assertEquals(4, ReplayLog.coveredCount(COMMITS, List.of(checkpoint("C"), step("D"))));
    }

    @Test
    @DisplayName("steps out of order or not starting at the first commit are invalid")
    void invalidOrder() {
        assertEquals(ReplayLog.INVALID, ReplayLog.coveredCount(COMMITS, List.of(step("B"))));
        assertEquals(ReplayLog.INVALID, ReplayLog.coveredCount(COMMITS, List.of(step("A"), step("C"))));
        assertEquals(ReplayLog.INVALID, ReplayLog.coveredCount(COMMITS, List.of(checkpoint("C"), step("C"))));
    }

    @Test
    @DisplayName("a checkpoint on an unknown commit or too many steps are invalid")
    void invalidCoverage() {
        assertEquals(ReplayLog.INVALID, ReplayLog.coveredCount(COMMITS, List.of(checkpoint("Z"))));
        assertEquals(ReplayLog.INVALID, ReplayLog.coveredCount(COMMITS,
                List.of(checkpoint("D"), step("E"))));
    }
}
