package com.lineage.core.ledger;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;
import com.lineage.core.graph.CommitGraph;
import com.lineage.core.process.ReconciliationContext;
import com.lineage.core.segment.Segment;
import com.lineage.core.segment.SegmentKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Durable record of evolution progress.
 * <p>
 * All mutators are synchronized; the scheduler guarantees that only the execution
 * owning a segment mutates that segment's progress. The whole snapshot is rewritten
 * on every {@link #save()}, via a temporary file moved over the target.
 */
public class StateLedger {

    private static final Logger log = LoggerFactory.getLogger(StateLedger.class);

    private final Path stateFile;
    private final ObjectMapper mapper;
    private EvolutionState state = new EvolutionState();
    private final Map<String, Segment> segmentsById = new HashMap<>();

    public StateLedger(Path stateFile, ObjectMapper mapper) {
        this.stateFile = Objects.requireNonNull(stateFile, "stateFile");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public static ObjectMapper defaultMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .registerModule(new ParameterNamesModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public Path getStateFile() {
        return stateFile;
    }

    // --- lifecycle ---

    public synchronized void init(String rootCommit, List<Segment> segments) {
        var fresh = new EvolutionState();
        fresh.setRootCommit(rootCommit);
        fresh.setSegments(segments);
        for (Segment segment : segments) {
            fresh.getSegmentProgress().put(segment.id(), SegmentProgress.pending());
        }
        adopt(fresh);
    }

    /**
     * Replaces the in-memory state, for example with one seeded from shadow history.
     */
    public synchronized void adopt(EvolutionState newState) {
        this.state = newState;
        segmentsById.clear();
        for (Segment segment : newState.getSegments()) {
            segmentsById.put(segment.id(), segment);
        }
    }

    /**
     * Reads the snapshot file. A file that cannot be parsed, or that carries an unknown
     * version, is reported as {@code CORRUPT} and leaves the in-memory state untouched.
     */
    public synchronized LedgerLoadResult load() {
        if (!Files.exists(stateFile)) {
            return LedgerLoadResult.absent();
        }
        try {
            EvolutionState loaded = mapper.readValue(stateFile.toFile(), EvolutionState.class);
            if (loaded.getVersion() != EvolutionState.CURRENT_VERSION) {
                return corrupt("unsupported version " + loaded.getVersion());
            }
            adopt(loaded);
            log.info("Loaded state file {} ({} steps recorded)", stateFile, loaded.getTotalSteps());
            return LedgerLoadResult.loaded(loaded);
        } catch (IOException e) {
            return corrupt(e.getMessage());
        }
    }

    private LedgerLoadResult corrupt(String detail) {
        log.warn("State file {} exists but is unreadable ({}); ignoring it", stateFile, detail);
        return LedgerLoadResult.corrupt(detail);
    }

    public synchronized void save() {
        try {
            Path parent = stateFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path temp = stateFile.resolveSibling(stateFile.getFileName() + ".tmp");
            mapper.writeValue(temp.toFile(), state);
            try {
                Files.move(temp, stateFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, stateFile, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to save state file " + stateFile, e);
        }
    }

    // --- validation ---

    /**
     * Checks that the snapshot still describes the given graph: the root commit and the last
     * recorded commit of every segment must be present.
     *
     * @throws ConsistencyException listing every missing commit
     */
    public synchronized void validate(CommitGraph graph) {
        var missing = new ArrayList<String>();
        if (state.getRootCommit() != null && !graph.contains(state.getRootCommit())) {
            missing.add(state.getRootCommit());
        }
        for (SegmentProgress progress : state.getSegmentProgress().values()) {
            List<CompletedStep> steps = progress.getCompletedSteps();
            if (!steps.isEmpty()) {
                String last = steps.get(steps.size() - 1).originalId();
                if (!graph.contains(last) && !missing.contains(last)) {
                    missing.add(last);
                }
            }
        }
        if (!missing.isEmpty()) {
            throw new ConsistencyException("State file " + stateFile
                    + " references commits not in the current commit graph: " + missing
                    + ". The source history was rewritten after the state was saved. "
                    + "Restore the missing commits, or delete the state file and the shadow branch to start over.",
                    missing);
        }
    }

    /**
     * Aligns stored progress with a fresh decomposition: new segments start pending, completed
     * segments that gained commits reopen, failed segments become retryable, and segments whose
     * steps no longer replay against their commits are reset.
     */
    public synchronized void reconcileSegments(List<Segment> fresh) {
        var freshIds = new HashSet<String>();
        for (Segment segment : fresh) {
            freshIds.add(segment.id());
        }
        for (String id : new ArrayList<>(state.getSegmentProgress().keySet())) {
            if (!freshIds.contains(id)) {
                int discarded = reverseProgress(id);
                state.getSegmentProgress().remove(id);
                log.info("Dropping progress for segment {} which no longer exists ({} step(s) discarded)",
                        id, discarded);
            }
        }

        state.setSegments(fresh);
        segmentsById.clear();
        for (Segment segment : fresh) {
            segmentsById.put(segment.id(), segment);
        }

        for (Segment segment : fresh) {
            SegmentProgress progress = state.getSegmentProgress().get(segment.id());
            if (progress == null) {
                state.getSegmentProgress().put(segment.id(), SegmentProgress.pending());
                continue;
            }
            int covered = ReplayLog.coveredCount(segment.commitIds(), progress.getCompletedSteps());
            if (covered == ReplayLog.INVALID) {
                log.warn("Recorded steps for {} no longer match its commits; it will be reprocessed", segment.id());
                resetSegmentProgress(segment.id());
            } else if (progress.getStatus() == SegmentStatus.COMPLETE && covered < segment.size()) {
                log.info("Segment {} gained {} commit(s); reopening", segment.id(), segment.size() - covered);
                progress.setStatus(SegmentStatus.IN_PROGRESS);
            } else if (progress.getStatus() == SegmentStatus.FAILED) {
                progress.setStatus(covered > 0 ? SegmentStatus.IN_PROGRESS : SegmentStatus.PENDING);
            }
        }
    }

    // --- mutation ---

    public synchronized void recordStep(String segmentId, CompletedStep step, String artifact, String changeLog) {
        SegmentProgress progress = requireProgress(segmentId);
        progress.getCompletedSteps().add(step);
        progress.setCurrentArtifact(artifact);
        progress.setCurrentLog(changeLog);
        progress.setTipSyntheticId(step.syntheticId());
        if (progress.getStatus() == SegmentStatus.PENDING) {
            progress.setStatus(SegmentStatus.IN_PROGRESS);
        }
        state.getOriginalToSyntheticId().put(step.originalId(), step.syntheticId());
        state.setTotalCost(state.getTotalCost() + step.cost());
        state.setTotalSteps(state.getTotalSteps() + 1);
        if (isTrunk(segmentId)) {
            state.setTrunkSteps(state.getTrunkSteps() + 1);
        }
    }

    public synchronized void recordMerge(CompletedMerge merge) {
        state.getCompletedMerges().add(merge);
    }

    public synchronized void recordReconciliation(CompletedReconciliation reconciliation,
                                                  String artifact, String changeLog) {
        SegmentProgress progress = requireProgress(reconciliation.segmentId());
        progress.setCurrentArtifact(artifact);
        progress.setCurrentLog(changeLog);
        progress.setTipSyntheticId(reconciliation.syntheticId());
        state.getCompletedReconciliations().add(reconciliation);
        state.setTotalCost(state.getTotalCost() + reconciliation.cost());
        state.setLastReconciliationStep(state.getTotalSteps());
        state.setLastReconciliationTrunkStep(state.getTrunkSteps());
        state.setLastReconciliationSyntheticId(reconciliation.syntheticId());
        state.setCumulativeDiffTokens(0);
    }

    public synchronized void addDiffTokens(long tokens) {
        state.setCumulativeDiffTokens(state.getCumulativeDiffTokens() + tokens);
    }

    public synchronized void updateSegmentStatus(String segmentId, SegmentStatus status) {
        requireProgress(segmentId).setStatus(status);
    }

    public synchronized void updateShadowHead(String syntheticId) {
        state.setShadowHeadId(syntheticId);
    }

    /**
     * Reverses everything a segment has recorded: counters, id mappings, merges and
     * reconciliations. The segment returns to pending.
     */
    public synchronized void resetSegmentProgress(String segmentId) {
        int discarded = reverseProgress(segmentId);
        state.getSegmentProgress().put(segmentId, SegmentProgress.pending());
        log.info("Reset progress for segment {} ({} step(s) discarded)", segmentId, discarded);
    }

    /**
     * Takes a segment's recorded work back out of the global counters and mappings.
     * Must run while {@code segmentsById} still knows the segment.
     *
     * @return the number of steps discarded
     */
    private int reverseProgress(String segmentId) {
        SegmentProgress progress = requireProgress(segmentId);
        Segment segment = segmentsById.get(segmentId);
        boolean trunk = isTrunk(segmentId);
        var stepIds = new HashSet<String>();

        for (CompletedStep step : progress.getCompletedSteps()) {
            int represented = 1;
            if (CompletedStep.CHECKPOINT_TAG.equals(step.processorTag()) && segment != null) {
                represented = Math.max(1, segment.commitIds().indexOf(step.originalId()) + 1);
            }
            state.setTotalCost(state.getTotalCost() - step.cost());
            state.setTotalSteps(Math.max(0, state.getTotalSteps() - represented));
            if (trunk) {
                state.setTrunkSteps(Math.max(0, state.getTrunkSteps() - represented));
            }
            state.getOriginalToSyntheticId().remove(step.originalId(), step.syntheticId());
            stepIds.add(step.originalId());
        }
        state.getCompletedMerges().removeIf(merge -> stepIds.contains(merge.mergeId()));
        state.getCompletedReconciliations().removeIf(reconciliation -> {
            boolean owned = reconciliation.segmentId().equals(segmentId);
            if (owned) {
                state.setTotalCost(state.getTotalCost() - reconciliation.cost());
            }
            return owned;
        });
        state.setTotalCost(Math.max(0, state.getTotalCost()));
        return stepIds.size();
    }

    // --- queries ---

    public synchronized Optional<SegmentProgress> progress(String segmentId) {
        SegmentProgress progress = state.getSegmentProgress().get(segmentId);
        return progress == null ? Optional.empty() : Optional.of(progress.copy());
    }

    public synchronized Set<String> segmentsWithStatus(SegmentStatus status) {
        var ids = new HashSet<String>();
        state.getSegmentProgress().forEach((id, progress) -> {
            if (progress.getStatus() == status) {
                ids.add(id);
            }
        });
        return ids;
    }

    public synchronized Optional<String> syntheticIdFor(String originalId) {
        return Optional.ofNullable(state.getOriginalToSyntheticId().get(originalId));
    }

    /**
     * The synthetic commit that work following {@code originalId} chains onto: the latest
     * reconciliation written after it, otherwise its own synthetic commit.
     */
    public synchronized Optional<String> chainTipFor(String originalId) {
        List<CompletedReconciliation> reconciliations = state.getCompletedReconciliations();
        for (int i = reconciliations.size() - 1; i >= 0; i--) {
            if (reconciliations.get(i).afterOriginalId().equals(originalId)) {
                return Optional.of(reconciliations.get(i).syntheticId());
            }
        }
        return syntheticIdFor(originalId);
    }

    public synchronized ReconciliationContext reconciliationContext(SegmentKind kind) {
        return new ReconciliationContext(kind, state.getTotalSteps(), state.getTrunkSteps(),
                state.getLastReconciliationStep(), state.getLastReconciliationTrunkStep(),
                state.getCumulativeDiffTokens());
    }

    /**
     * Deep copy of the current state.
     */
    public synchronized EvolutionState snapshot() {
        try {
            return mapper.readValue(mapper.writeValueAsBytes(state), EvolutionState.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to copy ledger state", e);
        }
    }

    private SegmentProgress requireProgress(String segmentId) {
        SegmentProgress progress = state.getSegmentProgress().get(segmentId);
        if (progress == null) {
            throw new IllegalArgumentException("Unknown segment " + segmentId);
        }
        return progress;
    }

    private boolean isTrunk(String segmentId) {
        Segment segment = segmentsById.get(segmentId);
        return segment != null && segment.isTrunk();
    }
}
