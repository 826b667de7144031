package com.flagship.transaction_replay.export;

import com.flagship.transaction_replay.ledger.AccountSnapshot;

import java.io.IOException;
import java.io.OutputStream;
import java.util.List;

/**
 * Serializes the final account snapshot.
 */
public interface AccountWriter {

    /**
     * Writes every account to {@code out} and flushes it. The stream is left open.
     *
     * @throws IOException if the output cannot be written
     */
    void write(List<AccountSnapshot> accounts, OutputStream out) throws IOException;
}
