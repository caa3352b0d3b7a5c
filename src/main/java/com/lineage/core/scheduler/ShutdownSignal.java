package com.lineage.core.scheduler;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative shutdown flag shared between the CLI's interrupt handling and segment executions.
 */
public class ShutdownSignal {

    private final AtomicBoolean requested = new AtomicBoolean();

    public void request() {
        requested.set(true);
    }

    public boolean isRequested() {
        return requested.get();
    }

    /**
     * Called between commits; never inside a commit write.
     *
     * @throws GracefulShutdownException once shutdown has been requested
     */
    public void assertContinue() {
        if (requested.get()) {
            throw new GracefulShutdownException();
        }
    }
}
