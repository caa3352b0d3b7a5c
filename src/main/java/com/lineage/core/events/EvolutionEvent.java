package com.lineage.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted while an evolution run progresses, consumed by the CLI for progress output.
 *
 * @param eventType event type (e.g. "segment.started", "step.completed", "merge.completed")
 * @param runId     the run this event belongs to
 * @param segmentId the segment this event relates to (nullable for run-level events)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record EvolutionEvent(
    String eventType,
    String runId,
    String segmentId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static EvolutionEvent of(String eventType, String runId, String segmentId, Map<String, Object> payload) {
        return new EvolutionEvent(eventType, runId, segmentId, payload, Instant.now());
    }
}
