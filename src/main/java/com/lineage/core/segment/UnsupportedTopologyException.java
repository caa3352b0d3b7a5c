package com.lineage.core.segment;

/**
 * Thrown when history branches in a shape the decomposer does not handle,
 * such as a branch that itself forks into several continuations.
 */
public class UnsupportedTopologyException extends RuntimeException {

    public UnsupportedTopologyException(String message) {
        super(message);
    }
}
