package com.lineage.core.process;

/**
 * Input to a {@link MergeReconciler}: the two upstream artifacts meeting at a merge commit.
 */
public record MergeRequest(
        String trunkArtifact,
        String trunkLog,
        String branchArtifact,
        String branchLog,
        String mergeCommitId,
        String mergeSummary,
        String changes,
        String trunkSegmentId,
        String branchSegmentId
) {}
