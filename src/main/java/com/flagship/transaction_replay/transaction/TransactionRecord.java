package com.flagship.transaction_replay.transaction;

import com.flagship.transaction_replay.ledger.Amount;
import lombok.Value;

import java.util.Objects;

/**
 * One parsed input row.
 *
 * Immutable once built. The amount only matters for Deposit and Withdrawal;
 * meta-operations carry {@link Amount#ZERO} unless the row had a value.
 *
 * Key invariant: clientId fits an unsigned 16-bit and txId an unsigned 32-bit value.
 */
@Value
public class TransactionRecord {

    public static final int MAX_CLIENT_ID = 0xFFFF;
    public static final long MAX_TX_ID = 0xFFFF_FFFFL;

    TransactionType type;
    int clientId;
    long txId;
    Amount amount;

    private TransactionRecord(TransactionType type, int clientId, long txId, Amount amount) {
        this.type = Objects.requireNonNull(type, "type");
        if (clientId < 0 || clientId > MAX_CLIENT_ID) {
            throw new IllegalArgumentException("Client id out of range: " + clientId);
        }
        if (txId < 0 || txId > MAX_TX_ID) {
            throw new IllegalArgumentException("Transaction id out of range: " + txId);
        }
        this.clientId = clientId;
        this.txId = txId;
        this.amount = amount != null ? amount : Amount.ZERO;
    }

    public static TransactionRecord of(TransactionType type, int clientId, long txId, Amount amount) {
        return new TransactionRecord(type, clientId, txId, amount);
    }

    public static TransactionRecord deposit(int clientId, long txId, Amount amount) {
        return new TransactionRecord(TransactionType.DEPOSIT, clientId, txId, amount);
    }

    public static TransactionRecord withdrawal(int clientId, long txId, Amount amount) {
        return new TransactionRecord(TransactionType.WITHDRAWAL, clientId, txId, amount);
    }

    public static TransactionRecord dispute(int clientId, long txId) {
        return new TransactionRecord(TransactionType.DISPUTE, clientId, txId, Amount.ZERO);
    }

    public static TransactionRecord resolve(int clientId, long txId) {
        return new TransactionRecord(TransactionType.RESOLVE, clientId, txId, Amount.ZERO);
    }

    public static TransactionRecord chargeback(int clientId, long txId) {
        return new TransactionRecord(TransactionType.CHARGEBACK, clientId, txId, Amount.ZERO);
    }
}
