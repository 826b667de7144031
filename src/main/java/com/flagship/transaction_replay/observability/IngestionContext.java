package com.flagship.transaction_replay.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * MDC context for ingestion workers.
 *
 * Every log line written by a worker carries the run id and the stream it is
 * reading, so interleaved output from concurrent workers can be told apart.
 */
public final class IngestionContext {

    public static final String RUN_ID_MDC_KEY = "runId";
    public static final String STREAM_MDC_KEY = "stream";

    private IngestionContext() {
        // Utility class
    }

    /**
     * Generates a new run id.
     * Uses a shorter format for readability in logs.
     */
    public static String generateRunId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    public static void enter(String runId, String stream) {
        MDC.put(RUN_ID_MDC_KEY, runId);
        MDC.put(STREAM_MDC_KEY, stream);
    }

    /**
     * Clears the worker context. Pool threads are reused, so this must run after every stream.
     */
    public static void clear() {
        MDC.remove(RUN_ID_MDC_KEY);
        MDC.remove(STREAM_MDC_KEY);
    }
}
