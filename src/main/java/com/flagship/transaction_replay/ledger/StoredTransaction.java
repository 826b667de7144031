package com.flagship.transaction_replay.ledger;

import com.flagship.transaction_replay.transaction.TransactionRecord;
import lombok.Getter;
import lombok.ToString;

/**
 * A Deposit or Withdrawal kept in the ledger's transaction history.
 *
 * The dispute flag starts false and is only flipped by the transaction
 * processor while it holds the history lock.
 */
@Getter
@ToString
public class StoredTransaction {

    private final TransactionRecord record;
    private boolean disputed;

    StoredTransaction(TransactionRecord record) {
        this(record, false);
    }

    private StoredTransaction(TransactionRecord record, boolean disputed) {
        this.record = record;
        this.disputed = disputed;
    }

    public Amount getAmount() {
        return record.getAmount();
    }

    public int getClientId() {
        return record.getClientId();
    }

    public void markDisputed() {
        this.disputed = true;
    }

    public void clearDisputed() {
        this.disputed = false;
    }

    StoredTransaction copy() {
        return new StoredTransaction(record, disputed);
    }
}
