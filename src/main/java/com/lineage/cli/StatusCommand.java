package com.lineage.cli;

import com.lineage.config.LineageProperties;
import com.lineage.core.ledger.EvolutionState;
import com.lineage.core.ledger.LedgerLoadResult;
import com.lineage.core.ledger.SegmentProgress;
import com.lineage.core.ledger.SegmentStatus;
import com.lineage.core.ledger.StateLedger;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Map;
import java.util.TreeSet;
import java.util.concurrent.Callable;

/**
 * CLI command: lineage status
 * <p>
 * Reads the state file and displays progress. Does not touch the repository.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Show evolution progress")
@Component
public class StatusCommand implements Callable<Integer> {

    @Option(names = "--repo", description = "Repository the state file belongs to")
    private String repo;

    @Option(names = "--state-file", description = "State file path, relative to the repository")
    private String stateFile;

    private final LineageProperties properties;

    public StatusCommand(LineageProperties properties) {
        this.properties = properties;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        Path repoPath = Path.of(repo != null ? repo : properties.getRepoPath()).toAbsolutePath().normalize();
        Path file = Path.of(stateFile != null ? stateFile : properties.getStateFile());
        if (!file.isAbsolute()) {
            file = repoPath.resolve(file);
        }

        LedgerLoadResult result = new StateLedger(file, StateLedger.defaultMapper()).load();
        switch (result.status()) {
            case ABSENT -> {
                ConsoleOutput.info("No state file at " + file + ". Nothing has been processed yet,"
                        + " or progress lives only on the shadow branch.");
                return 0;
            }
            case CORRUPT -> {
                ConsoleOutput.error("State file " + file + " is unreadable: " + result.detail());
                ConsoleOutput.info("The next evolve run will resume from the shadow branch.");
                return 1;
            }
            case LOADED -> printState(file, result.state());
        }
        return 0;
    }

    static Map<SegmentStatus, Integer> countByStatus(EvolutionState state) {
        var counts = new EnumMap<SegmentStatus, Integer>(SegmentStatus.class);
        for (SegmentStatus status : SegmentStatus.values()) {
            counts.put(status, 0);
        }
        for (SegmentProgress progress : state.getSegmentProgress().values()) {
            counts.merge(progress.getStatus(), 1, Integer::sum);
        }
        return counts;
    }

    private static void printState(Path file, EvolutionState state) {
        ConsoleOutput.info("State file: " + file);
        System.out.println("Root commit:  " + state.getRootCommit());
        System.out.println("Shadow head:  " + (state.getShadowHeadId() != null ? state.getShadowHeadId() : "(none)"));
        System.out.println("Total steps:  " + state.getTotalSteps()
                + " (trunk " + state.getTrunkSteps() + ")");
        System.out.println("Total cost:   " + String.format("$%.4f", state.getTotalCost()));
        System.out.println("Merges:       " + state.getCompletedMerges().size());
        System.out.println("Reconciled:   " + state.getCompletedReconciliations().size() + " time(s)");
        System.out.println();

        Map<SegmentStatus, Integer> counts = countByStatus(state);
        System.out.printf("Segments:     %d complete, %d in progress, %d pending, %d failed%n",
                counts.get(SegmentStatus.COMPLETE), counts.get(SegmentStatus.IN_PROGRESS),
                counts.get(SegmentStatus.PENDING), counts.get(SegmentStatus.FAILED));

        var failed = new TreeSet<String>();
        state.getSegmentProgress().forEach((id, progress) -> {
            if (progress.getStatus() == SegmentStatus.FAILED) {
                failed.add(id);
            }
        });
        if (!failed.isEmpty()) {
            ConsoleOutput.error("Failed segments: " + String.join(", ", failed) + ". Run evolve to retry.");
        } else if (counts.get(SegmentStatus.COMPLETE) == state.getSegmentProgress().size()) {
            ConsoleOutput.success("All segments complete.");
        }
    }
}
