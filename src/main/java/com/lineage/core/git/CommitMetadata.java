package com.lineage.core.git;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Formats and parses the metadata lines embedded in synthetic commit messages.
 * <p>
 * Message layout (version 1):
 * <pre>
 * lineage: &lt;summary&gt;
 *
 * Original: &lt;40-hex id&gt; "&lt;original summary&gt;"
 * Window: &lt;id8&gt;..&lt;id8&gt;
 * Merge: &lt;trunk segment&gt; + &lt;branch segment&gt;
 * Processor: &lt;tag&gt;
 * </pre>
 * Only the {@code Original:} line is machine-read. The first such line in a
 * message wins. Reconciliation commits deliberately carry no {@code Original:}
 * line so that resume anchoring skips over them.
 */
public final class CommitMetadata {

    public static final String SUBJECT_PREFIX = "lineage: ";
    public static final String ORIGINAL_PREFIX = "Original: ";

    static final Pattern ORIGINAL_LINE = Pattern.compile("^Original:\\s+([a-f0-9]{64}|[a-f0-9]{40})(?![a-f0-9])", Pattern.MULTILINE);

    private CommitMetadata() {}

    public static String formatOriginalLine(String originalId, String originalSummary) {
        return ORIGINAL_PREFIX + originalId + " \"" + singleLine(originalSummary) + "\"";
    }

    public static Optional<String> parseOriginalId(String message) {
        if (message == null) {
            return Optional.empty();
        }
        Matcher matcher = ORIGINAL_LINE.matcher(message);
        return matcher.find() ? Optional.of(matcher.group(1)) : Optional.empty();
    }

    public static String stepMessage(String summary, String originalId, String originalSummary,
                                     List<String> window, String processorTag) {
        var lines = new ArrayList<String>();
        lines.add(SUBJECT_PREFIX + singleLine(summary));
        lines.add("");
        lines.add(formatOriginalLine(originalId, originalSummary));
        lines.add("Window: " + windowRange(window));
        lines.add("Processor: " + processorTag);
        return String.join("\n", lines) + "\n";
    }

    public static String mergeMessage(String summary, String originalId, String originalSummary,
                                      String trunkSegmentId, List<String> branchSegmentIds, String processorTag) {
        var lines = new ArrayList<String>();
        lines.add(SUBJECT_PREFIX + singleLine(summary));
        lines.add("");
        lines.add(formatOriginalLine(originalId, originalSummary));
        lines.add("Merge: " + trunkSegmentId + " + " + String.join(" + ", branchSegmentIds));
        lines.add("Processor: " + processorTag);
        return String.join("\n", lines) + "\n";
    }

    public static String reconciliationMessage(String summary, String afterOriginalId) {
        return SUBJECT_PREFIX + singleLine(summary) + "\n\n"
                + "Reconciled-After: " + afterOriginalId + "\n";
    }

    static String windowRange(List<String> window) {
        if (window == null || window.isEmpty()) {
            return "..";
        }
        return shortId(window.get(0)) + ".." + shortId(window.get(window.size() - 1));
    }

    public static String shortId(String id) {
        return id.length() > 8 ? id.substring(0, 8) : id;
    }

    private static String singleLine(String text) {
        if (text == null || text.isBlank()) {
            return "(no summary)";
        }
        int newline = text.indexOf('\n');
        return (newline >= 0 ? text.substring(0, newline) : text).strip();
    }
}
