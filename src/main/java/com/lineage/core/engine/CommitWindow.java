package com.lineage.core.engine;

import java.util.ArrayList;
import java.util.List;

/**
 * The most recent commits seen by a segment, oldest first. The trailing
 * {@code processDepth} commits are sent with full diffs; the rest only as context.
 */
public record CommitWindow(int windowSize, int processDepth, List<String> commitIds) {

    public CommitWindow {
        if (windowSize < 1) {
            throw new IllegalArgumentException("windowSize must be at least 1");
        }
        if (processDepth < 1 || processDepth > windowSize) {
            throw new IllegalArgumentException("processDepth must be between 1 and windowSize");
        }
        commitIds = List.copyOf(commitIds);
    }

    public static CommitWindow empty(int windowSize, int processDepth) {
        return new CommitWindow(windowSize, processDepth, List.of());
    }

    public CommitWindow advance(String commitId) {
        var ids = new ArrayList<>(commitIds);
        ids.add(commitId);
        return new CommitWindow(windowSize, processDepth, lastN(ids, windowSize));
    }

    public CommitWindow seed(List<String> ids) {
        return new CommitWindow(windowSize, processDepth, lastN(ids, windowSize));
    }

    public List<String> fullDiffIds() {
        int n = Math.min(processDepth, commitIds.size());
        return commitIds.subList(commitIds.size() - n, commitIds.size());
    }

    public List<String> contextIds() {
        int n = Math.min(processDepth, commitIds.size());
        return commitIds.subList(0, commitIds.size() - n);
    }

    private static List<String> lastN(List<String> ids, int n) {
        return ids.size() <= n ? ids : ids.subList(ids.size() - n, ids.size());
    }
}
