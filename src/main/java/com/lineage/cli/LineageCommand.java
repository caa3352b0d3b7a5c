package com.lineage.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Lineage.
 * Routes to subcommands: evolve, status.
 */
@Command(
        name = "lineage",
        mixinStandardHelpOptions = true,
        version = "Lineage 0.1.0",
        description = "Derives a specification from a repository's history, one commit at a time",
        subcommands = {
                EvolveCommand.class,
                StatusCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class LineageCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        new CommandLine(this).usage(System.out);
    }
}
