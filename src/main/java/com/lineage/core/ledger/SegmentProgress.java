package com.lineage.core.ledger;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable progress of one segment, owned by the {@link StateLedger}.
 * <p>
 * {@code currentArtifact} and {@code currentLog} are the outputs of the last completed step;
 * {@code tipSyntheticId} is the synthetic commit the next step chains onto, which is the last
 * step's commit or a reconciliation commit written after it.
 */
public class SegmentProgress {

    private SegmentStatus status = SegmentStatus.PENDING;
    private List<CompletedStep> completedSteps = new ArrayList<>();
    private String currentArtifact = "";
    private String currentLog = "";
    private String tipSyntheticId;

    public SegmentProgress() {}

    public static SegmentProgress pending() {
        return new SegmentProgress();
    }

    public SegmentProgress copy() {
        var copy = new SegmentProgress();
        copy.status = status;
        copy.completedSteps = new ArrayList<>(completedSteps);
        copy.currentArtifact = currentArtifact;
        copy.currentLog = currentLog;
        copy.tipSyntheticId = tipSyntheticId;
        return copy;
    }

    public SegmentStatus getStatus() { return status; }
    public void setStatus(SegmentStatus status) { this.status = status; }

    public List<CompletedStep> getCompletedSteps() { return completedSteps; }
    public void setCompletedSteps(List<CompletedStep> completedSteps) {
        this.completedSteps = completedSteps == null ? new ArrayList<>() : new ArrayList<>(completedSteps);
    }

    public String getCurrentArtifact() { return currentArtifact; }
    public void setCurrentArtifact(String currentArtifact) { this.currentArtifact = currentArtifact; }

    public String getCurrentLog() { return currentLog; }
    public void setCurrentLog(String currentLog) { this.currentLog = currentLog; }

    public String getTipSyntheticId() { return tipSyntheticId; }
    public void setTipSyntheticId(String tipSyntheticId) { this.tipSyntheticId = tipSyntheticId; }
}
