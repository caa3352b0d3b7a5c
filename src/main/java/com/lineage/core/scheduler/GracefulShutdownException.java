package com.lineage.core.scheduler;

/**
 * Unwinds a segment execution after a requested shutdown. Not a failure: the ledger is
 * checkpointed after every commit, so the run can be resumed.
 */
public class GracefulShutdownException extends RuntimeException {

    public GracefulShutdownException() {
        super("Graceful shutdown requested");
    }
}
