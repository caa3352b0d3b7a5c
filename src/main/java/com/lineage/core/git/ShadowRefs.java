package com.lineage.core.git;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.regex.Pattern;

/**
 * Maintains the shadow-history branch pointer and the per-segment auxiliary refs.
 */
public class ShadowRefs {

    private static final Logger log = LoggerFactory.getLogger(ShadowRefs.class);

    private static final Pattern BRANCH_NAME = Pattern.compile("^[a-zA-Z0-9._/-]+$");

    private final GitCommandRunner git;
    private final String shadowBranch;
    private final String segmentRefPrefix;

    public ShadowRefs(GitCommandRunner git, String shadowBranch, String segmentRefPrefix) {
        validateBranchName(shadowBranch);
        this.git = git;
        this.shadowBranch = shadowBranch;
        this.segmentRefPrefix = segmentRefPrefix.endsWith("/") ? segmentRefPrefix : segmentRefPrefix + "/";
    }

    public static void validateBranchName(String branch) {
        if (branch == null || !BRANCH_NAME.matcher(branch).matches()
                || branch.startsWith("/") || branch.endsWith("/") || branch.contains("..")) {
            throw new IllegalArgumentException("Invalid shadow branch name: '" + branch + "'");
        }
    }

    public String shadowBranchRef() {
        return "refs/heads/" + shadowBranch;
    }

    public String segmentRef(String segmentId) {
        return segmentRefPrefix + segmentId;
    }

    public void advanceShadowBranch(String syntheticId) {
        git.output("update-ref", shadowBranchRef(), syntheticId);
        log.info("Shadow branch {} -> {}", shadowBranch, CommitMetadata.shortId(syntheticId));
    }

    public void advanceSegmentRef(String segmentId, String syntheticId) {
        git.output("update-ref", segmentRef(segmentId), syntheticId);
        log.debug("Segment ref {} -> {}", segmentRef(segmentId), CommitMetadata.shortId(syntheticId));
    }
}
