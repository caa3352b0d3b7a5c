package com.lineage.core.engine;

import com.lineage.core.git.CommitMetadata;

/**
 * Formatting of the accumulated change log written next to the artifact.
 */
final class ChangeLog {

    private ChangeLog() {}

    static String appendStep(String log, String commitId, String summary, String entry) {
        return append(log, "## " + CommitMetadata.shortId(commitId) + " - " + summary, entry);
    }

    static String appendReconciliation(String log, String commitId, String entry) {
        return append(log, "## " + CommitMetadata.shortId(commitId) + " (reconciliation)", entry);
    }

    /**
     * Joins a trunk log and a branch log that share history up to the fork point, then adds
     * the merge entry. Only the part of the branch log after the shared prefix is appended.
     */
    static String merge(String trunkLog, String branchLog, String mergeId, String entry) {
        int common = 0;
        int limit = Math.min(trunkLog.length(), branchLog.length());
        while (common < limit && trunkLog.charAt(common) == branchLog.charAt(common)) {
            common++;
        }
        int cut = common == branchLog.length() ? common : branchLog.lastIndexOf('\n', common - 1) + 1;
        String branchSuffix = branchLog.substring(cut);
        String joined = trunkLog;
        if (!branchSuffix.isEmpty() && !joined.isEmpty() && !branchSuffix.startsWith("\n")) {
            joined += joined.endsWith("\n\n") ? "" : joined.endsWith("\n") ? "\n" : "\n\n";
        }
        joined += branchSuffix;
        return append(joined, "## " + CommitMetadata.shortId(mergeId) + " (merge)", entry);
    }

    private static String append(String log, String heading, String entry) {
        var sb = new StringBuilder(log == null ? "" : log);
        if (sb.length() > 0 && sb.charAt(sb.length() - 1) != '\n') {
            sb.append('\n');
        }
        if (sb.length() > 0) {
            sb.append('\n');
        }
        sb.append(heading).append("\n\n").append(entry == null ? "" : entry.strip()).append('\n');
        return sb.toString();
    }
}
