package com.lineage.core.engine;

import com.lineage.core.process.StepKind;
import com.lineage.core.segment.SegmentKind;

import java.util.Map;

/**
 * Size, progress and cost/time estimates for a run, computed before any work starts.
 */
public record SetupStats(
        int totalCommits,
        Map<SegmentKind, Integer> segmentsByKind,
        Map<SegmentKind, Integer> commitsByKind,
        int totalSteps,
        int completedSteps,
        int remainingSteps,
        int mergePoints,
        Map<StepKind, Integer> remainingByStepKind,
        double costLow,
        double costHigh,
        double costSoFar,
        int criticalPath,
        int concurrency,
        long wallClockLowSeconds,
        long wallClockHighSeconds
) {

    public int segmentCount() {
        return segmentsByKind.values().stream().mapToInt(Integer::intValue).sum();
    }
}
