package com.lineage.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Lineage-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setRun(String runId) {
        MDC.put("runId", runId);
    }

    public static void setSegment(String runId, String segmentId) {
        MDC.put("runId", runId);
        MDC.put("segmentId", segmentId);
    }

    public static void setCommit(String commitId) {
        MDC.put("commitId", commitId.length() > 8 ? commitId.substring(0, 8) : commitId);
    }

    public static void clearCommit() {
        MDC.remove("commitId");
    }

    public static void clear() {
        MDC.remove("runId");
        MDC.remove("segmentId");
        MDC.remove("commitId");
    }
}
