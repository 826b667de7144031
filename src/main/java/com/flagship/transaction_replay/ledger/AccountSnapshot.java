package com.flagship.transaction_replay.ledger;

import lombok.Value;

/**
 * Export-only view of an account.
 *
 * Taken once ingestion is done. The total is derived here and is never fed
 * back into processing.
 */
@Value
public class AccountSnapshot {
    int clientId;
    Amount available;
    Amount held;
    Amount total;
    boolean locked;
}
