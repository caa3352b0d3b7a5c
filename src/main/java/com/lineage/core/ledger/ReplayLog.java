package com.lineage.core.ledger;

import java.util.List;

/**
 * Validates a segment's recorded steps against its commit list.
 * <p>
 * A valid replay log is a prefix of the segment's commits. The first step may instead be a
 * {@link CompletedStep#CHECKPOINT_TAG checkpoint} at index {@code k}, standing for commits
 * {@code 0..k}; the steps after it must then follow on from {@code k + 1}.
 */
public final class ReplayLog {

    public static final int INVALID = -1;

    private ReplayLog() {}

    /**
     * @return how many of {@code commitIds} the steps cover, or {@link #INVALID}
     */
    public static int coveredCount(List<String> commitIds, List<CompletedStep> steps) {
        if (steps.isEmpty()) {
            return 0;
        }
        CompletedStep first = steps.get(0);
        int offset;
        if (CompletedStep.CHECKPOINT_TAG.equals(first.processorTag())) {
            offset = commitIds.indexOf(first.originalId());
            if (offset < 0) {
                return INVALID;
            }
        } else if (commitIds.get(0).equals(first.originalId())) {
            offset = 0;
        } else {
            return INVALID;
        }

        int covered = offset + steps.size();
        if (covered > commitIds.size()) {
            return INVALID;
        }
        for (int i = 1; i < steps.size(); i++) {
            if (!commitIds.get(offset + i).equals(steps.get(i).originalId())) {
                return INVALID;
            }
        }
        return covered;
    }
}
