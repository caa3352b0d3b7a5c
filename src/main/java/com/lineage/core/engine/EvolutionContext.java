package com.lineage.core.engine;

import com.lineage.config.EvolutionConfig;
import com.lineage.core.events.EventBus;
import com.lineage.core.events.EvolutionEvent;
import com.lineage.core.git.GitHistoryReader;
import com.lineage.core.git.ShadowRefs;
import com.lineage.core.git.SourceSnapshotReader;
import com.lineage.core.git.SyntheticCommitWriter;
import com.lineage.core.graph.CommitGraph;
import com.lineage.core.ledger.StateLedger;
import com.lineage.core.metrics.EvolutionMetrics;
import com.lineage.core.process.MergeReconciler;
import com.lineage.core.process.ReconciliationPolicy;
import com.lineage.core.process.SourceReconciler;
import com.lineage.core.process.StepProcessor;
import com.lineage.core.scheduler.ShutdownSignal;
import com.lineage.core.segment.Segment;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything a segment execution needs for one run. Built once per run by
 * {@link EvolutionEngine#run}; shared read-only by all segment executions.
 */
record EvolutionContext(
        String runId,
        EvolutionConfig config,
        CommitGraph graph,
        Map<String, Segment> segmentsById,
        Map<String, String> segmentOfCommit,
        StateLedger ledger,
        GitHistoryReader reader,
        SyntheticCommitWriter writer,
        ShadowRefs refs,
        SourceSnapshotReader sources,
        StepContextAssembler assembler,
        StepProcessor stepProcessor,
        MergeReconciler mergeReconciler,
        SourceReconciler sourceReconciler,
        ReconciliationPolicy policy,
        EventBus eventBus,
        EvolutionMetrics metrics,
        ShutdownSignal signal
) {

    static Map<String, String> indexCommits(List<Segment> segments) {
        var owner = new HashMap<String, String>();
        for (Segment segment : segments) {
            for (String id : segment.commitIds()) {
                owner.put(id, segment.id());
            }
        }
        return owner;
    }

    Map<String, String> artifactFiles(String artifact, String changeLog) {
        return Map.of(config.artifactPath(), artifact, config.logPath(), changeLog);
    }

    void publish(String eventType, String segmentId, Map<String, Object> payload) {
        eventBus.publish(EvolutionEvent.of(eventType, runId, segmentId, payload));
    }
}
