package com.lineage.core.scheduler;

import com.lineage.core.segment.Segment;

import java.util.Map;

/**
 * Executes one segment once all of its dependencies have completed.
 */
@FunctionalInterface
public interface SegmentExecutor {

    /**
     * @param segment           the segment to run
     * @param dependencyResults results produced in this run by the segment's dependencies, keyed by
     *                          segment id; dependencies completed in an earlier run are absent
     */
    SegmentResult execute(Segment segment, Map<String, SegmentResult> dependencyResults);
}
