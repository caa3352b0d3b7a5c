package com.lineage.config;

import com.lineage.core.git.ShadowRefs;
import com.lineage.core.process.ReconciliationPolicies;

import java.nio.file.Path;
import java.util.List;

/**
 * Immutable settings for one evolution run, derived from {@link LineageProperties}
 * plus any command-line overrides.
 */
public record EvolutionConfig(
        Path repoPath,
        String targetRef,
        boolean includeUnmergedBranches,
        String shadowBranch,
        String segmentRefPrefix,
        Path stateFile,
        int windowSize,
        int processDepth,
        int maxConcurrency,
        boolean parallelBranches,
        String artifactPath,
        String logPath,
        List<String> diffIgnorePatterns,
        long diffMaxTokens,
        String reconciliationStrategy,
        int reconciliationInterval,
        long reconciliationTokenThreshold,
        long maxSourceTokens
) {

    public EvolutionConfig {
        if (repoPath == null) {
            throw new IllegalArgumentException("repoPath is required");
        }
        if (targetRef == null || targetRef.isBlank()) {
            throw new IllegalArgumentException("targetRef is required");
        }
        ShadowRefs.validateBranchName(shadowBranch);
        if (windowSize < 1) {
            throw new IllegalArgumentException("window-size must be at least 1, got " + windowSize);
        }
        if (processDepth < 1 || processDepth > windowSize) {
            throw new IllegalArgumentException("process-depth must be between 1 and window-size ("
                    + windowSize + "), got " + processDepth);
        }
        if (maxConcurrency < 1) {
            throw new IllegalArgumentException("max-concurrency must be at least 1, got " + maxConcurrency);
        }
        if (artifactPath == null || artifactPath.isBlank() || logPath == null || logPath.isBlank()) {
            throw new IllegalArgumentException("artifact path and log path are required");
        }
        if (artifactPath.equals(logPath)) {
            throw new IllegalArgumentException("artifact path and log path must differ");
        }
        if (!ReconciliationPolicies.STRATEGIES.contains(reconciliationStrategy)) {
            throw new IllegalArgumentException("Unknown reconciliation strategy '" + reconciliationStrategy
                    + "'; expected one of " + ReconciliationPolicies.STRATEGIES);
        }
        diffIgnorePatterns = diffIgnorePatterns == null ? List.of() : List.copyOf(diffIgnorePatterns);
        if (stateFile == null) {
            throw new IllegalArgumentException("stateFile is required");
        }
        if (!stateFile.isAbsolute()) {
            stateFile = repoPath.resolve(stateFile);
        }
    }

    /**
     * Segments that may run at once. With parallel branches off, segments run one at a time
     * in dependency order regardless of {@link #maxConcurrency()}.
     */
    public int effectiveConcurrency() {
        return parallelBranches ? maxConcurrency : 1;
    }
}
