package com.lineage.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Settings bound from {@code lineage.*}. Command-line options override individual values
 * before {@link #toConfig()} freezes them for a run.
 */
@Component
@ConfigurationProperties(prefix = "lineage")
public class LineageProperties {

    private String repoPath = ".";
    private String targetRef = "HEAD";
    private boolean includeUnmergedBranches = true;
    private String shadowBranch = "lineage/evolution";
    private String segmentRefPrefix = "refs/lineage/segments/";
    private String stateFile = ".lineage-state.json";
    private int windowSize = 5;
    private int processDepth = 1;
    private int maxConcurrency = 4;
    private boolean parallelBranches = true;
    private Artifact artifact = new Artifact();
    private Diff diff = new Diff();
    private Reconciliation reconciliation = new Reconciliation();

    public EvolutionConfig toConfig() {
        Path repo = Path.of(repoPath).toAbsolutePath().normalize();
        return new EvolutionConfig(
                repo,
                targetRef,
                includeUnmergedBranches,
                shadowBranch,
                segmentRefPrefix,
                Path.of(stateFile),
                windowSize,
                processDepth,
                maxConcurrency,
                parallelBranches,
                artifact.getPath(),
                artifact.getLogPath(),
                diff.getIgnorePatterns(),
                diff.getMaxTokens(),
                reconciliation.getStrategy(),
                reconciliation.getInterval(),
                reconciliation.getTokenThreshold(),
                reconciliation.getMaxSourceTokens());
    }

    public String getRepoPath() { return repoPath; }
    public void setRepoPath(String repoPath) { this.repoPath = repoPath; }

    public String getTargetRef() { return targetRef; }
    public void setTargetRef(String targetRef) { this.targetRef = targetRef; }

    public boolean isIncludeUnmergedBranches() { return includeUnmergedBranches; }
    public void setIncludeUnmergedBranches(boolean includeUnmergedBranches) {
        this.includeUnmergedBranches = includeUnmergedBranches;
    }

    public String getShadowBranch() { return shadowBranch; }
    public void setShadowBranch(String shadowBranch) { this.shadowBranch = shadowBranch; }

    public String getSegmentRefPrefix() { return segmentRefPrefix; }
    public void setSegmentRefPrefix(String segmentRefPrefix) { this.segmentRefPrefix = segmentRefPrefix; }

    public String getStateFile() { return stateFile; }
    public void setStateFile(String stateFile) { this.stateFile = stateFile; }

    public int getWindowSize() { return windowSize; }
    public void setWindowSize(int windowSize) { this.windowSize = windowSize; }

    public int getProcessDepth() { return processDepth; }
    public void setProcessDepth(int processDepth) { this.processDepth = processDepth; }

    public int getMaxConcurrency() { return maxConcurrency; }
    public void setMaxConcurrency(int maxConcurrency) { this.maxConcurrency = maxConcurrency; }

    public boolean isParallelBranches() { return parallelBranches; }
    public void setParallelBranches(boolean parallelBranches) { this.parallelBranches = parallelBranches; }

    public Artifact getArtifact() { return artifact; }
    public void setArtifact(Artifact artifact) { this.artifact = artifact; }

    public Diff getDiff() { return diff; }
    public void setDiff(Diff diff) { this.diff = diff; }

    public Reconciliation getReconciliation() { return reconciliation; }
    public void setReconciliation(Reconciliation reconciliation) { this.reconciliation = reconciliation; }

    public static class Artifact {
        private String path = "specification.md";
        private String logPath = "specification-changelog.md";

        public String getPath() { return path; }
        public void setPath(String path) { this.path = path; }

        public String getLogPath() { return logPath; }
        public void setLogPath(String logPath) { this.logPath = logPath; }
    }

    public static class Diff {
        private List<String> ignorePatterns = new ArrayList<>(List.of("*-lock.*", "*.min.*", "*.generated.*"));
        private long maxTokens = 60_000;

        public List<String> getIgnorePatterns() { return ignorePatterns; }
        public void setIgnorePatterns(List<String> ignorePatterns) { this.ignorePatterns = ignorePatterns; }

        public long getMaxTokens() { return maxTokens; }
        public void setMaxTokens(long maxTokens) { this.maxTokens = maxTokens; }
    }

    public static class Reconciliation {
        private String strategy = "n-trunk-commits";
        private int interval = 50;
        private long tokenThreshold = 500_000;
        private long maxSourceTokens = 120_000;

        public String getStrategy() { return strategy; }
        public void setStrategy(String strategy) { this.strategy = strategy; }

        public int getInterval() { return interval; }
        public void setInterval(int interval) { this.interval = interval; }

        public long getTokenThreshold() { return tokenThreshold; }
        public void setTokenThreshold(long tokenThreshold) { this.tokenThreshold = tokenThreshold; }

        public long getMaxSourceTokens() { return maxSourceTokens; }
        public void setMaxSourceTokens(long maxSourceTokens) { this.maxSourceTokens = maxSourceTokens; }
    }
}
