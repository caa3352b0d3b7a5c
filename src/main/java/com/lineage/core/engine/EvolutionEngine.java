package com.lineage.core.engine;

import com.lineage.config.EvolutionConfig;
import com.lineage.core.events.EventBus;
import com.lineage.core.events.EvolutionEvent;
import com.lineage.core.git.GitCommandRunner;
import com.lineage.core.git.GitHistoryReader;
import com.lineage.core.git.ShadowRefs;
import com.lineage.core.git.SourceSnapshotReader;
import com.lineage.core.git.SyntheticCommitWriter;
import com.lineage.core.graph.CommitGraph;
import com.lineage.core.graph.Trunk;
import com.lineage.core.graph.TrunkMarker;
import com.lineage.core.ledger.EvolutionState;
import com.lineage.core.ledger.LedgerLoadResult;
import com.lineage.core.ledger.SegmentStatus;
import com.lineage.core.ledger.StateLedger;
import com.lineage.core.logging.MdcContext;
import com.lineage.core.metrics.EvolutionMetrics;
import com.lineage.core.process.MergeReconciler;
import com.lineage.core.process.ReconciliationPolicies;
import com.lineage.core.process.SourceReconciler;
import com.lineage.core.process.StepProcessor;
import com.lineage.core.resume.ResumeSeeder;
import com.lineage.core.resume.ShadowAnchor;
import com.lineage.core.resume.ShadowHistoryResolver;
import com.lineage.core.scheduler.DependencyScheduler;
import com.lineage.core.scheduler.ScheduleReport;
import com.lineage.core.scheduler.ShutdownSignal;
import com.lineage.core.segment.Segment;
import com.lineage.core.segment.SegmentDecomposer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Entry point for an evolution run.
 * <p>
 * {@link #setup} reads the history, decomposes it, decides how to resume and estimates the
 * work; it has no side effects in a dry run. {@link #run} executes the remaining segments
 * through the {@link DependencyScheduler}.
 */
@Service
public class EvolutionEngine {

    private static final Logger log = LoggerFactory.getLogger(EvolutionEngine.class);

    static final String AUTHOR_NAME = "Lineage";
    static final String AUTHOR_EMAIL = "lineage@localhost";

    private final StepProcessor stepProcessor;
    private final MergeReconciler mergeReconciler;
    private final SourceReconciler sourceReconciler;
    private final EventBus eventBus;
    private final EvolutionMetrics metrics;
    private final SegmentDecomposer decomposer = new SegmentDecomposer();
    private final EvolutionEstimator estimator = new EvolutionEstimator();

    public EvolutionEngine(StepProcessor stepProcessor, MergeReconciler mergeReconciler,
                           SourceReconciler sourceReconciler, EventBus eventBus, EvolutionMetrics metrics) {
        this.stepProcessor = stepProcessor;
        this.mergeReconciler = mergeReconciler;
        this.sourceReconciler = sourceReconciler;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    /**
     * @param dryRun when true nothing is written: no state file, refs or objects
     * @throws IllegalStateException if the target cannot be resolved or has no usable history
     * @throws com.lineage.core.ledger.ConsistencyException if saved progress refers to commits the
     *         target's history no longer contains
     */
    public SetupResult setup(EvolutionConfig config, boolean dryRun) {
        var git = new GitCommandRunner(config.repoPath());
        var reader = new GitHistoryReader(git);

        String tipId = reader.resolveCommit(config.targetRef())
                .orElseThrow(() -> new IllegalStateException("Cannot resolve target reference '"
                        + config.targetRef() + "' in " + config.repoPath()));
        CommitGraph graph = reader.readGraph(config.targetRef(),
                config.includeUnmergedBranches() ? config.shadowBranch() : null);
        if (graph.isEmpty()) {
            throw new IllegalStateException("Target reference '" + config.targetRef() + "' has no history");
        }
        Trunk trunk = TrunkMarker.mark(graph, tipId);
        List<Segment> segments = decomposer.decompose(graph, trunk);
        if (segments.isEmpty()) {
            throw new IllegalStateException("History of '" + config.targetRef() + "' produced no segments");
        }

        var ledger = new StateLedger(config.stateFile(), StateLedger.defaultMapper());
        ResumeInfo resume = resolveResume(config, reader, ledger, graph, trunk, segments);
        ledger.reconcileSegments(segments);

        EvolutionState snapshot = ledger.snapshot();
        SetupStats stats = estimator.estimate(graph, segments, snapshot, config.effectiveConcurrency());
        if (!dryRun) {
            ledger.save();
        }
        log.info("Setup complete: {} segments, {} of {} steps done, resume mode {}{}",
                segments.size(), stats.completedSteps(), stats.totalSteps(), resume.mode(),
                dryRun ? " (dry run)" : "");
        return new SetupResult(config, git, graph, trunk, segments, ledger, resume, stats, dryRun);
    }

    private ResumeInfo resolveResume(EvolutionConfig config, GitHistoryReader reader, StateLedger ledger,
                                     CommitGraph graph, Trunk trunk, List<Segment> segments) {
        var warnings = new ArrayList<String>();
        LedgerLoadResult loaded = ledger.load();
        switch (loaded.status()) {
            case LOADED -> {
                ledger.validate(graph);
                log.info("Resuming from state file {}", config.stateFile());
                return new ResumeInfo(ResumeInfo.Mode.LEDGER, warnings, 0, null);
            }
            case CORRUPT -> warnings.add("State file " + config.stateFile() + " is unreadable ("
                    + loaded.detail() + "); falling back to the shadow branch");
            case ABSENT -> log.debug("No state file at {}", config.stateFile());
        }

        Optional<ShadowAnchor> anchor = new ShadowHistoryResolver(reader).resolve(config.shadowBranch());
        if (anchor.isEmpty()) {
            ledger.init(trunk.root(), segments);
            log.info("Starting fresh: no state file and no shadow branch {}", config.shadowBranch());
            return new ResumeInfo(ResumeInfo.Mode.FRESH, warnings, 0, null);
        }

        EvolutionState seeded = new ResumeSeeder(reader, config.artifactPath(), config.logPath())
                .seed(graph, trunk, segments, anchor.get());
        ledger.adopt(seeded);
        log.info("Resuming from shadow branch {} at original {}", config.shadowBranch(),
                anchor.get().anchorOriginalId());
        return new ResumeInfo(ResumeInfo.Mode.SHADOW_HISTORY, warnings, anchor.get().commitsBeyondAnchor(),
                anchor.get().anchorOriginalId());
    }

    /**
     * Executes every segment not yet complete. Returns once all are complete, a shutdown has
     * been honoured, or no further segment can make progress.
     */
    public ScheduleReport run(SetupResult setup, ShutdownSignal signal) {
        if (setup.dryRun()) {
            throw new IllegalStateException("A dry-run setup cannot be run");
        }
        EvolutionConfig config = setup.config();
        String runId = "run-" + UUID.randomUUID().toString().substring(0, 8);
        MdcContext.setRun(runId);
        try {
            EvolutionContext context = buildContext(runId, setup, signal);
            var scheduler = new DependencyScheduler(config.effectiveConcurrency(), metrics);
            var alreadyComplete = setup.ledger().segmentsWithStatus(SegmentStatus.COMPLETE);

            eventBus.publish(EvolutionEvent.of("evolution.started", runId, null, Map.of(
                    "segments", setup.segments().size(),
                    "remainingSteps", setup.stats().remainingSteps())));
            ScheduleReport report = scheduler.run(setup.segments(), alreadyComplete,
                    new SegmentRunner(context), signal);
            setup.ledger().save();

            EvolutionState state = setup.ledger().snapshot();
            eventBus.publish(EvolutionEvent.of("evolution.finished", runId, null, Map.of(
                    "status", report.status().name(),
                    "totalSteps", state.getTotalSteps(),
                    "totalCost", state.getTotalCost())));
            log.info("Run {} finished with status {} ({} steps recorded, ${} spent)", runId, report.status(),
                    state.getTotalSteps(), String.format("%.4f", state.getTotalCost()));
            return report;
        } finally {
            MdcContext.clear();
        }
    }

    private EvolutionContext buildContext(String runId, SetupResult setup, ShutdownSignal signal) {
        EvolutionConfig config = setup.config();
        var reader = new GitHistoryReader(setup.git());
        var segmentsById = new HashMap<String, Segment>();
        for (Segment segment : setup.segments()) {
            segmentsById.put(segment.id(), segment);
        }
        return new EvolutionContext(
                runId,
                config,
                setup.graph(),
                Map.copyOf(segmentsById),
                Map.copyOf(EvolutionContext.indexCommits(setup.segments())),
                setup.ledger(),
                reader,
                new SyntheticCommitWriter(setup.git(), AUTHOR_NAME, AUTHOR_EMAIL),
                new ShadowRefs(setup.git(), config.shadowBranch(), config.segmentRefPrefix()),
                new SourceSnapshotReader(reader, config.diffIgnorePatterns(), config.maxSourceTokens()),
                new StepContextAssembler(reader, setup.graph(), config.diffIgnorePatterns(), config.diffMaxTokens()),
                stepProcessor,
                mergeReconciler,
                sourceReconciler,
                ReconciliationPolicies.create(config.reconciliationStrategy(), config.reconciliationInterval(),
                        config.reconciliationTokenThreshold()),
                eventBus,
                metrics,
                signal);
    }
}
