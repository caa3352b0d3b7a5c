package com.lineage.core.resume;

import com.lineage.core.git.CommitMetadata;
import com.lineage.core.git.GitHistoryReader;
import com.lineage.core.graph.Ancestry;
import com.lineage.core.graph.CommitGraph;
import com.lineage.core.graph.Trunk;
import com.lineage.core.ledger.CompletedStep;
import com.lineage.core.ledger.ConsistencyException;
import com.lineage.core.ledger.EvolutionState;
import com.lineage.core.ledger.SegmentProgress;
import com.lineage.core.ledger.SegmentStatus;
import com.lineage.core.segment.Segment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Builds ledger state from a {@link ShadowAnchor}: every commit that is an ancestor of the
 * anchor's original commit counts as processed.
 */
public class ResumeSeeder {

    private static final Logger log = LoggerFactory.getLogger(ResumeSeeder.class);

    static final String RECOVERED_TAG = "recovered";

    private final GitHistoryReader reader;
    private final String artifactPath;
    private final String logPath;

    public ResumeSeeder(GitHistoryReader reader, String artifactPath, String logPath) {
        this.reader = reader;
        this.artifactPath = artifactPath;
        this.logPath = logPath;
    }

    /**
     * @throws ConsistencyException if the anchor is not in the target's history, or a commit
     *                              that must have been processed has no synthetic counterpart
     */
    public EvolutionState seed(CommitGraph graph, Trunk trunk, List<Segment> segments, ShadowAnchor anchor) {
        String anchorOriginal = anchor.anchorOriginalId();
        if (!graph.contains(anchorOriginal) || !Ancestry.ancestorsOf(graph, trunk.tip()).contains(anchorOriginal)) {
            throw new ConsistencyException("Shadow branch commit " + CommitMetadata.shortId(anchor.anchorSyntheticId())
                    + " was derived from " + anchorOriginal + ", which is not in the current history of the target. "
                    + "Restore the missing commits, rebase the shadow branch to drop the orphaned commits, "
                    + "or delete the shadow branch to start over.",
                    List.of(anchorOriginal));
        }

        Set<String> processed = Ancestry.ancestorsOf(graph, anchorOriginal);
        Instant now = Instant.now();

        var state = new EvolutionState();
        state.setRootCommit(trunk.root());
        state.setSegments(segments);
        state.setOriginalToSyntheticId(anchor.originalToSynthetic());
        state.setShadowHeadId(anchor.headId());

        int totalSteps = 0;
        int trunkSteps = 0;
        int complete = 0;
        for (Segment segment : segments) {
            int covered = 0;
            while (covered < segment.size() && processed.contains(segment.commitIds().get(covered))) {
                covered++;
            }

            var progress = SegmentProgress.pending();
            if (covered > 0) {
                String lastCovered = segment.commitIds().get(covered - 1);
                var steps = new ArrayList<CompletedStep>();
                if (covered == segment.size()) {
                    steps.add(new CompletedStep(lastCovered, requireSynthetic(anchor, lastCovered, segment),
                            CompletedStep.CHECKPOINT_TAG, 0.0, now));
                    progress.setStatus(SegmentStatus.COMPLETE);
                    complete++;
                } else {
                    for (String id : segment.commitIds().subList(0, covered)) {
                        steps.add(new CompletedStep(id, requireSynthetic(anchor, id, segment),
                                RECOVERED_TAG, 0.0, now));
                    }
                    progress.setStatus(SegmentStatus.IN_PROGRESS);
                }
                String tip = anchor.tipFor(lastCovered);
                progress.setCompletedSteps(steps);
                progress.setTipSyntheticId(tip);
                progress.setCurrentArtifact(reader.readFile(tip, artifactPath).orElse(""));
                progress.setCurrentLog(reader.readFile(tip, logPath).orElse(""));

                totalSteps += covered;
                if (segment.isTrunk()) {
                    trunkSteps += covered;
                }
            }
            state.getSegmentProgress().put(segment.id(), progress);
        }

        state.setTotalSteps(totalSteps);
        state.setTrunkSteps(trunkSteps);
        state.setLastReconciliationStep(totalSteps);
        state.setLastReconciliationTrunkStep(trunkSteps);
        log.info("Seeded state from shadow history: {} of {} segments complete, {} steps recovered",
                complete, segments.size(), totalSteps);
        return state;
    }

    private static String requireSynthetic(ShadowAnchor anchor, String originalId, Segment segment) {
        String synthetic = anchor.originalToSynthetic().get(originalId);
        if (synthetic == null) {
            throw new ConsistencyException("Shadow history has no synthetic commit for " + originalId
                    + " in segment " + segment.id() + ", although it precedes the resume anchor. "
                    + "The shadow branch may have been edited by hand; rebase it to a consistent state "
                    + "or delete it to start over.",
                    List.of(originalId));
        }
        return synthetic;
    }
}
