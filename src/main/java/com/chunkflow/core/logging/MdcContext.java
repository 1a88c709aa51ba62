package com.chunkflow.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Chunkflow-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setJob(String jobId, int attempt) {
        MDC.put("jobId", jobId);
        MDC.put("attempt", String.valueOf(attempt));
    }

    public static void setBatch(int batchIndex) {
        MDC.put("batchIndex", String.valueOf(batchIndex));
    }

    public static void setChunk(int chunkIndex) {
        MDC.put("chunkIndex", String.valueOf(chunkIndex));
    }

    public static void clearBatch() {
        MDC.remove("batchIndex");
    }

    public static void clear() {
        MDC.remove("jobId");
        MDC.remove("attempt");
        MDC.remove("batchIndex");
        MDC.remove("chunkIndex");
    }
}
