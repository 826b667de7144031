package com.flagship.transaction_replay.ingestion;

/**
 * What a worker does when a row cannot be decoded into a transaction record.
 */
public enum MalformedRowPolicy {
    /**
     * Abandon the rest of the stream. Records already applied stay applied.
     */
    ABORT,

    /**
     * Log the row and carry on with the next one.
     */
    SKIP
}
