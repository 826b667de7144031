package com.flagship.transaction_replay.ingestion;

import lombok.Getter;

/**
 * Thrown when an input row cannot be decoded into a transaction record.
 */
@Getter
public class MalformedRecordException extends RuntimeException {

    private final String source;
    private final long row;

    public MalformedRecordException(String source, long row, String message) {
        super(String.format("%s row %d: %s", source, row, message));
        this.source = source;
        this.row = row;
    }

    public MalformedRecordException(String source, long row, String message, Throwable cause) {
        super(String.format("%s row %d: %s", source, row, message), cause);
        this.source = source;
        this.row = row;
    }
}
