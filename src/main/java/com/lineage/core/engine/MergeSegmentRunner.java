package com.lineage.core.engine;

import com.lineage.core.git.CommitMetadata;
import com.lineage.core.graph.Ancestry;
import com.lineage.core.graph.CommitNode;
import com.lineage.core.ledger.CompletedMerge;
import com.lineage.core.ledger.CompletedStep;
import com.lineage.core.process.MergeRequest;
import com.lineage.core.process.MergeResult;
import com.lineage.core.scheduler.SegmentResult;
import com.lineage.core.segment.Segment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Processes the merge commit that opens a trunk segment.
 * <p>
 * The trunk-side result is reconciled with each branch-side result in parent order, and a
 * single synthetic merge commit is written whose parents are all predecessor tips.
 */
class MergeSegmentRunner {

    private static final Logger log = LoggerFactory.getLogger(MergeSegmentRunner.class);

    private final EvolutionContext context;
    private final PredecessorResolver predecessors;

    MergeSegmentRunner(EvolutionContext context, PredecessorResolver predecessors) {
        this.context = context;
        this.predecessors = predecessors;
    }

    /**
     * @return the state after the merge commit, or empty if the trunk side or every branch side
     *         is unavailable, in which case the merge is processed as a regular commit
     */
    Optional<SegmentStart> merge(Segment segment, Map<String, SegmentResult> dependencyResults) {
        String mergeId = segment.firstCommit();
        CommitNode node = context.graph().node(mergeId);

        Optional<SegmentResult> trunkSide = predecessors.resolve(node.parentIds().get(0), dependencyResults);
        var branchSides = new ArrayList<SegmentResult>();
        for (String parentId : node.parentIds().subList(1, node.parentIds().size())) {
            Optional<SegmentResult> side = predecessors.resolve(parentId, dependencyResults);
            if (side.isPresent()) {
                branchSides.add(side.get());
            } else {
                log.warn("Merge {} parent {} has no processed state; leaving it out of the merge",
                        CommitMetadata.shortId(mergeId), CommitMetadata.shortId(parentId));
            }
        }
        if (trunkSide.isEmpty() || branchSides.isEmpty()) {
            log.warn("Merge {} is missing its {} predecessor; processing it as a regular commit",
                    CommitMetadata.shortId(mergeId), trunkSide.isEmpty() ? "trunk" : "branch");
            return Optional.empty();
        }

        context.signal().assertContinue();
        long start = System.currentTimeMillis();
        String changes = context.assembler().changesOf(mergeId);
        SegmentResult trunk = trunkSide.get();
        String artifact = trunk.artifact();
        String changeLog = trunk.changeLog();
        String summary = node.summary();
        double cost = 0.0;
        var parents = new ArrayList<String>();
        parents.add(trunk.tipSyntheticId());
        var branchSegmentIds = new ArrayList<String>();

        for (SegmentResult branch : branchSides) {
            log.info("Reconciling {} into {} at merge {}", branch.segmentId(), segment.id(),
                    CommitMetadata.shortId(mergeId));
            MergeResult result = context.mergeReconciler().reconcile(new MergeRequest(
                    artifact, changeLog, branch.artifact(), branch.changeLog(),
                    mergeId, node.summary(), changes, trunk.segmentId(), branch.segmentId()));
            artifact = result.unifiedArtifact();
            changeLog = ChangeLog.merge(changeLog, branch.changeLog(), mergeId, result.unifiedLogEntry());
            summary = result.commitSummary();
            cost += result.cost();
            parents.add(branch.tipSyntheticId());
            branchSegmentIds.add(branch.segmentId());
        }

        String message = CommitMetadata.mergeMessage(summary, mergeId, node.summary(),
                trunk.segmentId(), branchSegmentIds, CompletedStep.MERGE_TAG);
        String syntheticId = context.writer().write(mergeId, parents,
                context.artifactFiles(artifact, changeLog), message);

        Instant now = Instant.now();
        context.ledger().recordStep(segment.id(),
                new CompletedStep(mergeId, syntheticId, CompletedStep.MERGE_TAG, cost, now), artifact, changeLog);
        context.ledger().recordMerge(new CompletedMerge(mergeId, syntheticId, trunk.segmentId(),
                List.copyOf(branchSegmentIds), cost, now));
        context.ledger().save();

        long elapsed = System.currentTimeMillis() - start;
        if (context.metrics() != null) {
            context.metrics().recordMerge(branchSegmentIds.size());
            context.metrics().recordStep(CompletedStep.MERGE_TAG, elapsed, cost);
        }
        context.publish("merge.completed", segment.id(), Map.of(
                "mergeId", mergeId,
                "syntheticId", syntheticId,
                "branches", List.copyOf(branchSegmentIds)));
        log.info("Merged {} into {} as {}", branchSegmentIds, segment.id(), CommitMetadata.shortId(syntheticId));

        var window = CommitWindow.empty(context.config().windowSize(), context.config().processDepth())
                .seed(Ancestry.firstParentChain(context.graph(), mergeId, context.config().windowSize()));
        return Optional.of(new SegmentStart(1, syntheticId, artifact, changeLog, window));
    }
}
