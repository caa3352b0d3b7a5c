package com.lineage.core.scheduler;

import java.util.Set;

/**
 * Thrown when segments remain but none can start and none is running, without a failed
 * segment to explain it.
 */
public class SchedulerDeadlockException extends RuntimeException {

    public SchedulerDeadlockException(Set<String> blocked) {
        super("Deadlock: no segments ready and none in progress; blocked segments " + blocked);
    }
}
