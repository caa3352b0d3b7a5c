package com.lineage.cli;

import com.lineage.config.EvolutionConfig;
import com.lineage.config.LineageProperties;
import com.lineage.core.engine.EvolutionEngine;
import com.lineage.core.engine.EvolutionEstimator;
import com.lineage.core.engine.ResumeInfo;
import com.lineage.core.engine.SetupResult;
import com.lineage.core.events.EventBus;
import com.lineage.core.ledger.SegmentStatus;
import com.lineage.core.scheduler.ScheduleReport;
import com.lineage.core.scheduler.ShutdownSignal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * CLI command: lineage evolve [options]
 * <p>
 * Derives the specification from the target reference's history, resuming any earlier
 * progress. The first interrupt requests a graceful shutdown; in-flight commits are
 * allowed to checkpoint before the process exits.
 */
@Command(name = "evolve", mixinStandardHelpOptions = true,
        description = "Derive or continue the specification history")
@Component
public class EvolveCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(EvolveCommand.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_INTERRUPTED = 130;

    private static final long SHUTDOWN_GRACE_SECONDS = 120;

    @Option(names = "--repo", description = "Repository to process")
    private String repo;

    @Option(names = "--target-ref", description = "Reference whose first-parent chain is the trunk")
    private String targetRef;

    @Option(names = "--shadow-branch", description = "Branch that receives the shadow history")
    private String shadowBranch;

    @Option(names = "--state-file", description = "State file path, relative to the repository")
    private String stateFile;

    @Option(names = "--max-concurrency", description = "Segments processed at once")
    private Integer maxConcurrency;

    @Option(names = "--window-size", description = "Commits in the sliding context window")
    private Integer windowSize;

    @Option(names = "--process-depth", description = "Window commits sent with full diffs")
    private Integer processDepth;

    @Option(names = "--reconciliation",
            description = "Reconciliation strategy: none, n-commits, n-trunk-commits, token-count")
    private String reconciliation;

    @Option(names = "--reconciliation-interval", description = "Steps between reconciliations")
    private Integer reconciliationInterval;

    @Option(names = "--setup-only", description = "Show the plan and estimates without writing anything")
    private boolean setupOnly;

    @Option(names = "--unmerged-branches", negatable = true,
            description = "Also process local branches never merged into the target")
    private Boolean unmergedBranches;

    @Option(names = "--parallel-branches", negatable = true,
            description = "Run independent segments concurrently; when off, segments run one at a time")
    private Boolean parallelBranches;

    private final EvolutionEngine engine;
    private final LineageProperties properties;
    private final EventBus eventBus;

    public EvolveCommand(EvolutionEngine engine, LineageProperties properties, EventBus eventBus) {
        this.engine = engine;
        this.properties = properties;
        this.eventBus = eventBus;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        EvolutionConfig config;
        SetupResult setup;
        try {
            config = applyOverrides().toConfig();
            ConsoleOutput.info("Reading history of " + config.targetRef() + " in " + config.repoPath());
            setup = engine.setup(config, setupOnly);
        } catch (Exception e) {
            ConsoleOutput.error("Setup failed: " + rootCauseMessage(e));
            return EXIT_FAILED;
        }

        printSetup(setup);
        if (setupOnly) {
            ConsoleOutput.info("Setup only; nothing was written.");
            return EXIT_OK;
        }
        if (setup.ledger().segmentsWithStatus(SegmentStatus.COMPLETE).size() == setup.segments().size()) {
            ConsoleOutput.success("Everything is up to date.");
            return EXIT_OK;
        }

        var signal = new ShutdownSignal();
        var finished = new CountDownLatch(1);
        Thread hook = new Thread(() -> {
            signal.request();
            log.info("Interrupt received; waiting for in-flight commits to checkpoint");
            try {
                finished.await(SHUTDOWN_GRACE_SECONDS, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "lineage-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);
        EventBus.Subscription subscription = eventBus.subscribeAll(ConsoleOutput::event);

        try {
            ScheduleReport report = engine.run(setup, signal);
            return report(report, config);
        } catch (Exception e) {
            ConsoleOutput.error("Evolution failed: " + rootCauseMessage(e));
            return EXIT_FAILED;
        } finally {
            subscription.unsubscribe();
            finished.countDown();
            try {
                Runtime.getRuntime().removeShutdownHook(hook);
            } catch (IllegalStateException e) {
                log.debug("JVM already shutting down; shutdown hook stays registered");
            }
        }
    }

    private LineageProperties applyOverrides() {
        if (repo != null) {
            properties.setRepoPath(repo);
        }
        if (targetRef != null) {
            properties.setTargetRef(targetRef);
        }
        if (shadowBranch != null) {
            properties.setShadowBranch(shadowBranch);
        }
        if (stateFile != null) {
            properties.setStateFile(stateFile);
        }
        if (maxConcurrency != null) {
            properties.setMaxConcurrency(maxConcurrency);
        }
        if (windowSize != null) {
            properties.setWindowSize(windowSize);
        }
        if (processDepth != null) {
            properties.setProcessDepth(processDepth);
        }
        if (reconciliation != null) {
            properties.getReconciliation().setStrategy(reconciliation);
        }
        if (reconciliationInterval != null) {
            properties.getReconciliation().setInterval(reconciliationInterval);
        }
        if (unmergedBranches != null) {
            properties.setIncludeUnmergedBranches(unmergedBranches);
        }
        if (parallelBranches != null) {
            properties.setParallelBranches(parallelBranches);
        }
        return properties;
    }

    private static void printSetup(SetupResult setup) {
        ResumeInfo resume = setup.resume();
        for (String warning : resume.warnings()) {
            ConsoleOutput.warn(warning);
        }
        switch (resume.mode()) {
            case FRESH -> ConsoleOutput.info("Starting a fresh evolution.");
            case LEDGER -> ConsoleOutput.info("Resuming from state file " + setup.config().stateFile());
            case SHADOW_HISTORY -> ConsoleOutput.info("Resuming from shadow branch "
                    + setup.config().shadowBranch() + " at original " + resume.anchorOriginalId()
                    + (resume.commitsBeyondAnchor() > 0
                    ? " (" + resume.commitsBeyondAnchor() + " untagged commit(s) above it)" : ""));
        }
        System.out.println();
        ConsoleOutput.block(EvolutionEstimator.formatSummary(setup.stats()));
    }

    private static int report(ScheduleReport report, EvolutionConfig config) {
        System.out.println();
        return switch (report.status()) {
            case COMPLETED -> {
                ConsoleOutput.success("Evolution complete. Shadow history is on " + config.shadowBranch() + ".");
                yield EXIT_OK;
            }
            case SHUTDOWN -> {
                ConsoleOutput.info("Stopped on request. Run evolve again to resume ("
                        + report.unfinished().size() + " segment(s) unfinished).");
                yield EXIT_INTERRUPTED;
            }
            case FAILED -> {
                ConsoleOutput.error("Evolution halted: segments " + report.failures().keySet()
                        + " failed. Resume to retry.");
                report.failures().forEach((id, error) -> ConsoleOutput.error("  " + id + ": " + error));
                yield EXIT_FAILED;
            }
        };
    }

    static String rootCauseMessage(Throwable t) {
        Throwable cause = t;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
