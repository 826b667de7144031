package com.flagship.transaction_replay.transaction;

/**
 * What applying a single record did to the ledger.
 *
 * Everything except {@link #APPLIED} is a silent no-op. None of them is an
 * error, they only feed logging and metrics.
 */
public enum ApplyOutcome {
    APPLIED,
    ACCOUNT_LOCKED,
    INSUFFICIENT_FUNDS,
    UNKNOWN_TRANSACTION,
    NOT_DISPUTED,
    AMOUNT_OVERFLOW
}
