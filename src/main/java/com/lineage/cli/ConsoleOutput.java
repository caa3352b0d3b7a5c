package com.lineage.cli;

import com.lineage.core.events.EvolutionEvent;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Lineage CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) LINEAGE v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [LINEAGE]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void block(String text) {
        for (String line : text.split("\n")) {
            System.out.println("  " + line);
        }
    }

    public static void event(EvolutionEvent event) {
        String prefix = switch (event.eventType()) {
            case "evolution.started", "evolution.finished" -> "@|bold,fg(cyan) [RUN]|@";
            case "segment.started" -> "@|fg(blue) [SEGMENT]|@";
            case "segment.completed" -> "@|fg(green) [SEGMENT]|@";
            case "segment.failed" -> "@|fg(red),bold [SEGMENT]|@";
            case "step.completed" -> "@|fg(white) [STEP]|@";
            case "merge.completed" -> "@|fg(magenta) [MERGE]|@";
            case "reconciliation.completed" -> "@|fg(yellow) [RECONCILE]|@";
            default -> "@|fg(white) [" + event.eventType() + "]|@";
        };
        String subject = event.segmentId() != null ? event.segmentId() + " " : "";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                prefix + " " + subject + describe(event)));
    }

    private static String describe(EvolutionEvent event) {
        var p = event.payload();
        return switch (event.eventType()) {
            case "segment.started" -> p.get("kind") + ", " + p.get("commits") + " commits";
            case "segment.completed" -> "complete at " + shortId(p.get("tip"));
            case "segment.failed" -> "failed: " + p.get("error");
            case "step.completed" -> p.get("index") + "/" + p.get("of") + " " + shortId(p.get("commitId"))
                    + " -> " + shortId(p.get("syntheticId"));
            case "merge.completed" -> "merged " + p.get("branches") + " at " + shortId(p.get("mergeId"));
            case "reconciliation.completed" -> "reconciled after " + shortId(p.get("afterCommitId"));
            default -> String.valueOf(p);
        };
    }

    private static String shortId(Object id) {
        String text = String.valueOf(id);
        return text.length() > 8 ? text.substring(0, 8) : text;
    }
}
