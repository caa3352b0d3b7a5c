package com.lineage.core.process;

/**
 * Input to a {@link StepProcessor} for one commit.
 *
 * @param kind           INITIAL for a root commit, EVOLVE otherwise
 * @param priorArtifact  artifact as of the previous step (empty for the first step)
 * @param priorLog       accumulated change log as of the previous step
 * @param commitId       the commit being processed
 * @param commitSummary  its subject line
 * @param contextCommits recent commits in the window, one {@code ### id8 - summary} line each
 * @param changes        full diffs of the window's trailing commits
 */
public record StepRequest(
        StepKind kind,
        String priorArtifact,
        String priorLog,
        String commitId,
        String commitSummary,
        String contextCommits,
        String changes
) {}
