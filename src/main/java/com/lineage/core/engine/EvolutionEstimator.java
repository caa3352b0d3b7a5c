package com.lineage.core.engine;

import com.lineage.core.graph.CommitGraph;
import com.lineage.core.ledger.EvolutionState;
import com.lineage.core.ledger.ReplayLog;
import com.lineage.core.ledger.SegmentProgress;
import com.lineage.core.ledger.SegmentStatus;
import com.lineage.core.process.StepKind;
import com.lineage.core.segment.Segment;
import com.lineage.core.segment.SegmentKind;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Estimates the work left in a run. The critical path is the longest chain of remaining
 * steps through the segment dependencies; segments arrive in dependency order, so a single
 * forward pass suffices.
 */
public class EvolutionEstimator {

    static final long STEP_SECONDS_LOW = 45;
    static final long STEP_SECONDS_HIGH = 90;

    private static final Map<StepKind, double[]> COST_PER_STEP = Map.of(
            StepKind.INITIAL, new double[] {0.01, 0.05},
            StepKind.EVOLVE, new double[] {0.005, 0.03},
            StepKind.MERGE, new double[] {0.02, 0.10});

    public SetupStats estimate(CommitGraph graph, List<Segment> segments, EvolutionState state, int concurrency) {
        var segmentsByKind = new EnumMap<SegmentKind, Integer>(SegmentKind.class);
        var commitsByKind = new EnumMap<SegmentKind, Integer>(SegmentKind.class);
        var remainingByStepKind = new EnumMap<StepKind, Integer>(StepKind.class);
        for (StepKind kind : StepKind.values()) {
            remainingByStepKind.put(kind, 0);
        }
        var longest = new HashMap<String, Integer>();

        int totalSteps = 0;
        int completed = 0;
        int mergePoints = 0;
        int criticalPath = 0;
        for (Segment segment : segments) {
            segmentsByKind.merge(segment.kind(), 1, Integer::sum);
            commitsByKind.merge(segment.kind(), segment.size(), Integer::sum);
            totalSteps += segment.size();

            int covered = coveredSteps(segment, state.getSegmentProgress().get(segment.id()));
            completed += covered;
            for (int i = 0; i < segment.size(); i++) {
                boolean merge = i == 0 && segment.isTrunk() && graph.node(segment.firstCommit()).isMerge();
                if (merge) {
                    mergePoints++;
                }
                if (i >= covered) {
                    StepKind kind = merge ? StepKind.MERGE
                            : graph.node(segment.commitIds().get(i)).isRoot() ? StepKind.INITIAL : StepKind.EVOLVE;
                    remainingByStepKind.merge(kind, 1, Integer::sum);
                }
            }

            int before = 0;
            for (String dep : segment.dependsOn()) {
                before = Math.max(before, longest.getOrDefault(dep, 0));
            }
            int path = before + segment.size() - covered;
            longest.put(segment.id(), path);
            criticalPath = Math.max(criticalPath, path);
        }

        int remaining = totalSteps - completed;
        double costLow = 0.0;
        double costHigh = 0.0;
        for (var entry : remainingByStepKind.entrySet()) {
            double[] range = COST_PER_STEP.get(entry.getKey());
            costLow += range[0] * entry.getValue();
            costHigh += range[1] * entry.getValue();
        }
        long sequentialFloor = (remaining + concurrency - 1) / concurrency;
        long wallSteps = Math.max(criticalPath, sequentialFloor);

        return new SetupStats(graph.size(), segmentsByKind, commitsByKind, totalSteps, completed, remaining,
                mergePoints, remainingByStepKind, costLow, costHigh, state.getTotalCost(), criticalPath,
                concurrency, wallSteps * STEP_SECONDS_LOW, wallSteps * STEP_SECONDS_HIGH);
    }

    private static int coveredSteps(Segment segment, SegmentProgress progress) {
        if (progress == null) {
            return 0;
        }
        if (progress.getStatus() == SegmentStatus.COMPLETE) {
            return segment.size();
        }
        int covered = ReplayLog.coveredCount(segment.commitIds(), progress.getCompletedSteps());
        return Math.max(covered, 0);
    }

    public static String formatSummary(SetupStats stats) {
        var sb = new StringBuilder();
        sb.append(String.format("Total commits:   %d%n", stats.totalCommits()));
        sb.append(String.format("Segments:        %d (trunk %d, branch %d, dead-end %d)%n",
                stats.segmentCount(),
                stats.segmentsByKind().getOrDefault(SegmentKind.TRUNK, 0),
                stats.segmentsByKind().getOrDefault(SegmentKind.BRANCH, 0),
                stats.segmentsByKind().getOrDefault(SegmentKind.DEAD_END, 0)));
        sb.append(String.format("Merge points:    %d%n", stats.mergePoints()));
        sb.append(String.format("Steps:           %d total, %d completed%n", stats.totalSteps(), stats.completedSteps()));
        sb.append(String.format("Remaining:       %d (initial %d, evolve %d, merge %d)%n",
                stats.remainingSteps(),
                stats.remainingByStepKind().getOrDefault(StepKind.INITIAL, 0),
                stats.remainingByStepKind().getOrDefault(StepKind.EVOLVE, 0),
                stats.remainingByStepKind().getOrDefault(StepKind.MERGE, 0)));
        sb.append(String.format("Cost estimate:   $%.2f - $%.2f (spent so far $%.2f)%n",
                stats.costLow(), stats.costHigh(), stats.costSoFar()));
        sb.append(String.format("Critical path:   %d steps at concurrency %d%n",
                stats.criticalPath(), stats.concurrency()));
        sb.append(String.format("Time estimate:   %s - %s%n",
                formatDuration(stats.wallClockLowSeconds()), formatDuration(stats.wallClockHighSeconds())));
        return sb.toString();
    }

    static String formatDuration(long seconds) {
        long hours = seconds / 3600;
        long minutes = (seconds % 3600) / 60;
        if (hours > 0) {
            return hours + "h " + minutes + "m";
        }
        if (minutes > 0) {
            return minutes + "m";
        }
        return seconds + "s";
    }
}
