package com.lineage.core.engine;

import com.lineage.core.ledger.ReplayLog;
import com.lineage.core.ledger.SegmentProgress;
import com.lineage.core.ledger.SegmentStatus;
import com.lineage.core.scheduler.SegmentResult;
import com.lineage.core.segment.Segment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;

/**
 * Finds the state left behind by an already processed commit that a segment builds on:
 * a fork point, or a parent of a merge.
 * <p>
 * Results handed over by the scheduler win, then the ledger's recorded progress for a
 * segment completed in an earlier run, then the files of the commit's synthetic counterpart.
 */
class PredecessorResolver {

    private static final Logger log = LoggerFactory.getLogger(PredecessorResolver.class);

    private final EvolutionContext context;

    PredecessorResolver(EvolutionContext context) {
        this.context = context;
    }

    Optional<SegmentResult> resolve(String commitId, Map<String, SegmentResult> dependencyResults) {
        String owner = context.segmentOfCommit().get(commitId);
        if (owner != null) {
            SegmentResult fromRun = dependencyResults.get(owner);
            if (fromRun != null && fromRun.tipOriginalId().equals(commitId)) {
                return Optional.of(fromRun);
            }
            Optional<SegmentResult> fromProgress = fromCompletedProgress(owner, commitId);
            if (fromProgress.isPresent()) {
                return fromProgress;
            }
        }

        Optional<String> tip = context.ledger().chainTipFor(commitId);
        if (tip.isEmpty()) {
            return Optional.empty();
        }
        log.debug("Reading state for {} from synthetic commit {}", commitId, tip.get());
        String artifact = context.reader().readFile(tip.get(), context.config().artifactPath()).orElse("");
        String changeLog = context.reader().readFile(tip.get(), context.config().logPath()).orElse("");
        return Optional.of(new SegmentResult(owner, commitId, tip.get(), artifact, changeLog));
    }

    private Optional<SegmentResult> fromCompletedProgress(String segmentId, String commitId) {
        Segment segment = context.segmentsById().get(segmentId);
        Optional<SegmentProgress> progress = context.ledger().progress(segmentId);
        if (segment == null || progress.isEmpty() || progress.get().getStatus() != SegmentStatus.COMPLETE) {
            return Optional.empty();
        }
        int covered = ReplayLog.coveredCount(segment.commitIds(), progress.get().getCompletedSteps());
        if (covered != segment.size() || !segment.lastCommit().equals(commitId)) {
            return Optional.empty();
        }
        SegmentProgress p = progress.get();
        return Optional.of(new SegmentResult(segmentId, commitId, p.getTipSyntheticId(),
                p.getCurrentArtifact(), p.getCurrentLog()));
    }
}
