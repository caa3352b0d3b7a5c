package com.lineage.core.scheduler;

/**
 * Final output of one segment, handed to the segments that depend on it.
 *
 * @param segmentId     the segment that produced it
 * @param tipOriginalId last original commit of the segment
 * @param tipSyntheticId synthetic commit downstream work chains onto
 * @param artifact      artifact after the segment's last commit
 * @param changeLog     accumulated change log after the segment's last commit
 */
public record SegmentResult(
        String segmentId,
        String tipOriginalId,
        String tipSyntheticId,
        String artifact,
        String changeLog
) {}
