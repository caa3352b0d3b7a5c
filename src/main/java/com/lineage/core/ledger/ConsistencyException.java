package com.lineage.core.ledger;

import java.util.List;

/**
 * Thrown when persisted progress or shadow history refers to commits that are
 * no longer part of the source history. Resuming blindly would desynchronize
 * the shadow history, so this is always fatal.
 */
public class ConsistencyException extends RuntimeException {

    private final List<String> missingCommits;

    public ConsistencyException(String message, List<String> missingCommits) {
        super(message);
        this.missingCommits = List.copyOf(missingCommits);
    }

    public List<String> getMissingCommits() {
        return missingCommits;
    }
}
