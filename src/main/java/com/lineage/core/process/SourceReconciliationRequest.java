package com.lineage.core.process;

import java.util.List;

/**
 * Input to a {@link SourceReconciler}.
 *
 * @param currentArtifact artifact after the most recent step
 * @param commitId        the commit whose source tree is the reference
 * @param sources         tracked text files rendered as {@code --- path ---} blocks
 * @param skippedFiles    files left out of {@code sources}; not to be treated as removed
 */
public record SourceReconciliationRequest(
        String currentArtifact,
        String commitId,
        String sources,
        List<String> skippedFiles
) {}
