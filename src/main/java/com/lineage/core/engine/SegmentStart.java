package com.lineage.core.engine;

/**
 * Where a segment execution picks up: the next commit index to process and the
 * state the step before it left behind.
 *
 * @param nextIndex         index into the segment's commits of the first commit still to process
 * @param parentSyntheticId synthetic commit the next step chains onto, or {@code null} for a root
 * @param artifact          artifact input to the next step
 * @param changeLog         change-log input to the next step
 * @param window            window as of the commit before {@code nextIndex}
 */
record SegmentStart(
        int nextIndex,
        String parentSyntheticId,
        String artifact,
        String changeLog,
        CommitWindow window
) {}
