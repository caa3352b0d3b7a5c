package com.lineage.core.ledger;

import com.lineage.core.segment.Segment;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Full ledger snapshot, persisted as JSON by {@link StateLedger}.
 */
public class EvolutionState {

    public static final int CURRENT_VERSION = 1;

    private int version = CURRENT_VERSION;
    private String rootCommit;
    private List<Segment> segments = new ArrayList<>();
    private Map<String, SegmentProgress> segmentProgress = new LinkedHashMap<>();
    private Map<String, String> originalToSyntheticId = new LinkedHashMap<>();
    private List<CompletedMerge> completedMerges = new ArrayList<>();
    private List<CompletedReconciliation> completedReconciliations = new ArrayList<>();
    private String shadowHeadId;
    private double totalCost;
    private int totalSteps;
    private int trunkSteps;
    private int lastReconciliationStep;
    private int lastReconciliationTrunkStep;
    private String lastReconciliationSyntheticId;
    private long cumulativeDiffTokens;

    public int getVersion() { return version; }
    public void setVersion(int version) { this.version = version; }

    public String getRootCommit() { return rootCommit; }
    public void setRootCommit(String rootCommit) { this.rootCommit = rootCommit; }

    public List<Segment> getSegments() { return segments; }
    public void setSegments(List<Segment> segments) { this.segments = new ArrayList<>(segments); }

    public Map<String, SegmentProgress> getSegmentProgress() { return segmentProgress; }
    public void setSegmentProgress(Map<String, SegmentProgress> segmentProgress) {
        this.segmentProgress = new LinkedHashMap<>(segmentProgress);
    }

    public Map<String, String> getOriginalToSyntheticId() { return originalToSyntheticId; }
    public void setOriginalToSyntheticId(Map<String, String> originalToSyntheticId) {
        this.originalToSyntheticId = new LinkedHashMap<>(originalToSyntheticId);
    }

    public List<CompletedMerge> getCompletedMerges() { return completedMerges; }
    public void setCompletedMerges(List<CompletedMerge> completedMerges) {
        this.completedMerges = new ArrayList<>(completedMerges);
    }

    public List<CompletedReconciliation> getCompletedReconciliations() { return completedReconciliations; }
    public void setCompletedReconciliations(List<CompletedReconciliation> completedReconciliations) {
        this.completedReconciliations = new ArrayList<>(completedReconciliations);
    }

    public String getShadowHeadId() { return shadowHeadId; }
    public void setShadowHeadId(String shadowHeadId) { this.shadowHeadId = shadowHeadId; }

    public double getTotalCost() { return totalCost; }
    public void setTotalCost(double totalCost) { this.totalCost = totalCost; }

    public int getTotalSteps() { return totalSteps; }
    public void setTotalSteps(int totalSteps) { this.totalSteps = totalSteps; }

    public int getTrunkSteps() { return trunkSteps; }
    public void setTrunkSteps(int trunkSteps) { this.trunkSteps = trunkSteps; }

    public int getLastReconciliationStep() { return lastReconciliationStep; }
    public void setLastReconciliationStep(int lastReconciliationStep) { this.lastReconciliationStep = lastReconciliationStep; }

    public int getLastReconciliationTrunkStep() { return lastReconciliationTrunkStep; }
    public void setLastReconciliationTrunkStep(int lastReconciliationTrunkStep) {
        this.lastReconciliationTrunkStep = lastReconciliationTrunkStep;
    }

    public String getLastReconciliationSyntheticId() { return lastReconciliationSyntheticId; }
    public void setLastReconciliationSyntheticId(String lastReconciliationSyntheticId) {
        this.lastReconciliationSyntheticId = lastReconciliationSyntheticId;
    }

    public long getCumulativeDiffTokens() { return cumulativeDiffTokens; }
    public void setCumulativeDiffTokens(long cumulativeDiffTokens) { this.cumulativeDiffTokens = cumulativeDiffTokens; }
}
