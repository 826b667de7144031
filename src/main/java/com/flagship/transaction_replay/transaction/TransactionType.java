package com.flagship.transaction_replay.transaction;

import java.util.Map;
import java.util.Optional;

/**
 * Kind of a transaction record.
 *
 * Deposit and Withdrawal move money and are kept in the transaction history.
 * Dispute, Resolve and Chargeback are meta-operations: they carry no amount of
 * their own and act on a stored Deposit or Withdrawal referenced by tx id.
 */
public enum TransactionType {
    DEPOSIT("deposit"),
    WITHDRAWAL("withdrawal"),
    DISPUTE("dispute"),
    RESOLVE("resolve"),
    CHARGEBACK("chargeback");

    // Input codes are case-sensitive
    private static final Map<String, TransactionType> BY_CODE = Map.of(
            DEPOSIT.code, DEPOSIT,
            WITHDRAWAL.code, WITHDRAWAL,
            DISPUTE.code, DISPUTE,
            RESOLVE.code, RESOLVE,
            CHARGEBACK.code, CHARGEBACK
    );

    private final String code;

    TransactionType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * Whether records of this type are stored in the transaction history.
     */
    public boolean isStored() {
        return this == DEPOSIT || this == WITHDRAWAL;
    }

    public static Optional<TransactionType> fromCode(String code) {
        return Optional.ofNullable(code).map(BY_CODE::get);
    }
}
