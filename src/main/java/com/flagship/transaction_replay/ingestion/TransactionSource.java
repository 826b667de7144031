package com.flagship.transaction_replay.ingestion;

import com.flagship.transaction_replay.transaction.TransactionRecord;

import java.io.Closeable;
import java.io.IOException;
import java.util.Optional;

/**
 * A finite, non-restartable sequence of records read from one input stream.
 *
 * Records are decoded lazily, one per call to {@link #next()}.
 */
public interface TransactionSource extends Closeable {

    /**
     * Name of the stream, used in logs and reports.
     */
    String getName();

    /**
     * Reads the next record.
     *
     * @return the record, or empty once the stream is exhausted
     * @throws MalformedRecordException if the next row cannot be decoded; the
     *         source stays usable and a further call moves on to the following row
     * @throws IOException if the underlying stream cannot be read
     */
    Optional<TransactionRecord> next() throws IOException;
}
