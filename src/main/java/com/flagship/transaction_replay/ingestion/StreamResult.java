package com.flagship.transaction_replay.ingestion;

import lombok.Value;

/**
 * Outcome of one ingestion worker.
 */
@Value
public class StreamResult {
    String source;
    Status status;
    long recordsApplied;
    long rowsSkipped;
    String failureReason;

    public enum Status {
        /** Every row was read. Some may have been skipped under the SKIP policy. */
        COMPLETED,
        /** The stream could not be opened. Nothing was applied. */
        UNREADABLE,
        /** A malformed row stopped the worker. Earlier records stay applied. */
        MALFORMED,
        /** The stream broke mid-way or the worker hit an unexpected error. */
        FAILED
    }

    public static StreamResult completed(String source, long recordsApplied, long rowsSkipped) {
        return new StreamResult(source, Status.COMPLETED, recordsApplied, rowsSkipped, null);
    }

    public static StreamResult unreadable(String source, String reason) {
        return new StreamResult(source, Status.UNREADABLE, 0, 0, reason);
    }

    public static StreamResult malformed(String source, long recordsApplied, long rowsSkipped, String reason) {
        return new StreamResult(source, Status.MALFORMED, recordsApplied, rowsSkipped, reason);
    }

    public static StreamResult failed(String source, long recordsApplied, long rowsSkipped, String reason) {
        return new StreamResult(source, Status.FAILED, recordsApplied, rowsSkipped, reason);
    }

    public boolean isSuccessful() {
        return status == Status.COMPLETED;
    }
}
