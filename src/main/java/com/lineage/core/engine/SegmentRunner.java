package com.lineage.core.engine;

import com.lineage.core.git.CommitMetadata;
import com.lineage.core.git.SourceSnapshotReader.SourceSnapshot;
import com.lineage.core.graph.Ancestry;
import com.lineage.core.graph.CommitNode;
import com.lineage.core.ledger.CompletedReconciliation;
import com.lineage.core.ledger.CompletedStep;
import com.lineage.core.ledger.ReplayLog;
import com.lineage.core.ledger.SegmentProgress;
import com.lineage.core.ledger.SegmentStatus;
import com.lineage.core.logging.MdcContext;
import com.lineage.core.process.ReconciliationContext;
import com.lineage.core.process.SourceReconciliationRequest;
import com.lineage.core.process.SourceReconciliationResult;
import com.lineage.core.process.StepResult;
import com.lineage.core.scheduler.GracefulShutdownException;
import com.lineage.core.scheduler.SegmentExecutor;
import com.lineage.core.scheduler.SegmentResult;
import com.lineage.core.segment.Segment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Executes one segment: resumes after its recorded steps, or starts from its fork point or
 * merge, then processes the remaining commits in order. Every commit is checkpointed to the
 * ledger before the next one starts.
 */
class SegmentRunner implements SegmentExecutor {

    private static final Logger log = LoggerFactory.getLogger(SegmentRunner.class);

    private final EvolutionContext context;
    private final PredecessorResolver predecessors;
    private final MergeSegmentRunner mergeRunner;

    SegmentRunner(EvolutionContext context) {
        this.context = context;
        this.predecessors = new PredecessorResolver(context);
        this.mergeRunner = new MergeSegmentRunner(context, predecessors);
    }

    @Override
    public SegmentResult execute(Segment segment, Map<String, SegmentResult> dependencyResults) {
        MdcContext.setSegment(context.runId(), segment.id());
        try {
            log.info("Starting {} segment {} ({} commits)", segment.kind().label(), segment.id(), segment.size());
            context.publish("segment.started", segment.id(), Map.of(
                    "kind", segment.kind().label(),
                    "commits", segment.size()));
            SegmentResult result = process(segment, dependencyResults);
            complete(segment, result);
            return result;
        } catch (GracefulShutdownException e) {
            throw e;
        } catch (RuntimeException e) {
            fail(segment, e);
            throw e;
        } finally {
            MdcContext.clear();
        }
    }

    private SegmentResult process(Segment segment, Map<String, SegmentResult> dependencyResults) {
        SegmentStart start = resumePoint(segment)
                .or(() -> isMergeSegment(segment) ? mergeRunner.merge(segment, dependencyResults) : Optional.empty())
                .orElseGet(() -> initialStart(segment, dependencyResults));

        String parent = start.parentSyntheticId();
        String artifact = start.artifact();
        String changeLog = start.changeLog();
        CommitWindow window = start.window();

        for (int i = start.nextIndex(); i < segment.size(); i++) {
            context.signal().assertContinue();
            String commitId = segment.commitIds().get(i);
            MdcContext.setCommit(commitId);
            try {
                window = window.advance(commitId);
                long begin = System.currentTimeMillis();
                var stepContext = context.assembler().assemble(window, commitId, artifact, changeLog);
                StepResult result = context.stepProcessor().process(stepContext.request());

                String summary = context.graph().summaryOf(commitId);
                String newLog = ChangeLog.appendStep(changeLog, commitId, summary, result.logEntry());
                String message = CommitMetadata.stepMessage(result.commitSummary(), commitId, summary,
                        window.commitIds(), result.processorTag());
                String syntheticId = context.writer().write(commitId,
                        parent == null ? List.of() : List.of(parent),
                        context.artifactFiles(result.newArtifact(), newLog), message);

                context.ledger().recordStep(segment.id(), new CompletedStep(commitId, syntheticId,
                        result.processorTag(), result.cost(), Instant.now()), result.newArtifact(), newLog);
                context.ledger().addDiffTokens(stepContext.diffTokens());
                context.ledger().save();

                long elapsed = System.currentTimeMillis() - begin;
                if (context.metrics() != null) {
                    context.metrics().recordStep(result.processorTag(), elapsed, result.cost());
                }
                context.publish("step.completed", segment.id(), Map.of(
                        "commitId", commitId,
                        "syntheticId", syntheticId,
                        "index", i + 1,
                        "of", segment.size()));
                log.debug("Processed {} -> {} in {} ms", CommitMetadata.shortId(commitId),
                        CommitMetadata.shortId(syntheticId), elapsed);

                parent = syntheticId;
                artifact = result.newArtifact();
                changeLog = newLog;
                if (!segment.isTrunk() && context.config().parallelBranches()) {
                    context.refs().advanceSegmentRef(segment.id(), syntheticId);
                }

                Optional<Reconciled> reconciled = reconcileIfDue(segment, commitId, parent, artifact, changeLog);
                if (reconciled.isPresent()) {
                    parent = reconciled.get().syntheticId();
                    artifact = reconciled.get().artifact();
                    changeLog = reconciled.get().changeLog();
                }
            } finally {
                MdcContext.clearCommit();
            }
        }
        return new SegmentResult(segment.id(), segment.lastCommit(), parent, artifact, changeLog);
    }

    private boolean isMergeSegment(Segment segment) {
        return segment.isTrunk() && context.graph().node(segment.firstCommit()).isMerge();
    }

    /**
     * Picks up after the recorded steps, if there are any and they still replay against the
     * segment's commits. Steps that do not replay are discarded.
     */
    private Optional<SegmentStart> resumePoint(Segment segment) {
        Optional<SegmentProgress> progress = context.ledger().progress(segment.id());
        if (progress.isEmpty() || progress.get().getCompletedSteps().isEmpty()) {
            return Optional.empty();
        }
        int covered = ReplayLog.coveredCount(segment.commitIds(), progress.get().getCompletedSteps());
        if (covered == ReplayLog.INVALID) {
            log.warn("Recorded steps for {} do not replay against its commits; redoing it", segment.id());
            context.ledger().resetSegmentProgress(segment.id());
            context.ledger().save();
            return Optional.empty();
        }
        SegmentProgress p = progress.get();
        String lastCovered = segment.commitIds().get(covered - 1);
        log.info("Resuming {} after {} of {} commits", segment.id(), covered, segment.size());
        return Optional.of(new SegmentStart(covered, p.getTipSyntheticId(), nullToEmpty(p.getCurrentArtifact()),
                nullToEmpty(p.getCurrentLog()), windowEndingAt(lastCovered, context.config().windowSize() - 1)));
    }

    /**
     * Starting state for a segment with no recorded steps: empty for a root, otherwise the
     * state left by the commit it continues from.
     */
    private SegmentStart initialStart(Segment segment, Map<String, SegmentResult> dependencyResults) {
        CommitNode first = context.graph().node(segment.firstCommit());
        String predecessor = segment.isTrunk() ? first.firstParent().orElse(null) : segment.forkFrom();
        if (predecessor == null) {
            return new SegmentStart(0, null, "", "", emptyWindow());
        }
        SegmentResult before = predecessors.resolve(predecessor, dependencyResults)
                .orElseThrow(() -> new IllegalStateException("Segment " + segment.id() + " continues from "
                        + predecessor + ", which has no synthetic commit yet"));
        return new SegmentStart(0, before.tipSyntheticId(), before.artifact(), before.changeLog(),
                windowEndingAt(predecessor, context.config().windowSize() - 1));
    }

    private record Reconciled(String syntheticId, String artifact, String changeLog) {}

    private Optional<Reconciled> reconcileIfDue(Segment segment, String commitId, String parent,
                                                  String artifact, String changeLog) {
        ReconciliationContext counters = context.ledger().reconciliationContext(segment.kind());
        if (!context.policy().shouldReconcile(counters)) {
            return Optional.empty();
        }
        context.signal().assertContinue();
        try {
            log.info("Reconciling artifact against the source of {}", CommitMetadata.shortId(commitId));
            SourceSnapshot snapshot = context.sources().read(commitId);
            SourceReconciliationResult result = context.sourceReconciler().reconcile(
                    new SourceReconciliationRequest(artifact, commitId, snapshot.text(), snapshot.skipped()));
            String newLog = ChangeLog.appendReconciliation(changeLog, commitId, result.logEntry());
            String syntheticId = context.writer().write(commitId, List.of(parent),
                    context.artifactFiles(result.updatedArtifact(), newLog),
                    CommitMetadata.reconciliationMessage(result.commitSummary(), commitId));

            context.ledger().recordReconciliation(new CompletedReconciliation(segment.id(), commitId, syntheticId,
                    counters.totalSteps(), result.cost(), Instant.now()), result.updatedArtifact(), newLog);
            context.ledger().save();
            if (context.metrics() != null) {
                context.metrics().recordReconciliation("applied");
                context.metrics().recordCost(result.cost());
            }
            context.publish("reconciliation.completed", segment.id(), Map.of(
                    "afterCommitId", commitId,
                    "syntheticId", syntheticId));
            if (!segment.isTrunk() && context.config().parallelBranches()) {
                context.refs().advanceSegmentRef(segment.id(), syntheticId);
            }
            return Optional.of(new Reconciled(syntheticId, result.updatedArtifact(), newLog));
        } catch (GracefulShutdownException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("Reconciliation after {} failed, continuing with the unreconciled artifact: {}",
                    CommitMetadata.shortId(commitId), e.getMessage());
            if (context.metrics() != null) {
                context.metrics().recordReconciliation("failed");
            }
            return Optional.empty();
        }
    }

    private void complete(Segment segment, SegmentResult result) {
        context.ledger().updateSegmentStatus(segment.id(), SegmentStatus.COMPLETE);
        if (segment.isTrunk()) {
            context.refs().advanceShadowBranch(result.tipSyntheticId());
            context.ledger().updateShadowHead(result.tipSyntheticId());
        } else if (context.config().parallelBranches()) {
            context.refs().advanceSegmentRef(segment.id(), result.tipSyntheticId());
        }
        context.ledger().save();
        if (context.metrics() != null) {
            context.metrics().recordSegmentResult(segment.kind().label(), "complete");
        }
        context.publish("segment.completed", segment.id(), Map.of("tip", result.tipSyntheticId()));
        log.info("Completed segment {} at {}", segment.id(), CommitMetadata.shortId(result.tipSyntheticId()));
    }

    private void fail(Segment segment, RuntimeException e) {
        context.ledger().updateSegmentStatus(segment.id(), SegmentStatus.FAILED);
        context.ledger().save();
        if (context.metrics() != null) {
            context.metrics().recordSegmentResult(segment.kind().label(), "failed");
        }
        context.publish("segment.failed", segment.id(), Map.of(
                "error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName()));
    }

    private CommitWindow windowEndingAt(String commitId, int count) {
        return emptyWindow().seed(Ancestry.firstParentChain(context.graph(), commitId, count));
    }

    private CommitWindow emptyWindow() {
        return CommitWindow.empty(context.config().windowSize(), context.config().processDepth());
    }

    private static String nullToEmpty(String text) {
        return text == null ? "" : text;
    }
}
