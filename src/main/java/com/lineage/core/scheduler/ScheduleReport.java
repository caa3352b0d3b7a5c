package com.lineage.core.scheduler;

import java.util.Map;
import java.util.Set;

/**
 * Outcome of {@link DependencyScheduler#run}.
 *
 * @param status     overall outcome
 * @param completed  segments complete at the end of the run, including those completed earlier
 * @param failures   segments that failed in this run, with the failure message
 * @param unfinished segments neither complete nor failed, including any stopped by shutdown
 */
public record ScheduleReport(
        Status status,
        Set<String> completed,
        Map<String, String> failures,
        Set<String> unfinished
) {

    public enum Status {
        COMPLETED,
        SHUTDOWN,
        FAILED
    }
}
