package com.flagship.transaction_replay.transaction;

import com.flagship.transaction_replay.ledger.Account;
import com.flagship.transaction_replay.ledger.Ledger;
import com.flagship.transaction_replay.ledger.StoredTransaction;
import com.flagship.transaction_replay.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Applies transaction records to a {@link Ledger}.
 *
 * Processing flow for one record:
 * 1. Take exclusive access to the client's account (created if absent)
 * 2. Drop the record if the account is locked
 * 3. Dispatch on the record type
 * 4. Store Deposits and Withdrawals in the history under their tx id
 *
 * Meta-operations look up the referenced transaction while the account lock is
 * held, so the lookup, the balance change and the flag change happen as one step.
 *
 * Nothing here throws for bad references. An unknown tx id, a resolve without a
 * live dispute or a withdrawal without funds are all silent no-ops.
 *
 * A record whose balance change would overflow the scaled amount is dropped on
 * its own: balances stay as they were and the record is not stored.
 *
 * Known quirks kept on purpose:
 * - a dispute is applied to the account that issued it, even when the referenced
 *   transaction belongs to another client
 * - a chargeback does not clear the dispute flag of the stored transaction
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TransactionProcessor {

    private final LedgerMetrics metrics;

    /**
     * Applies one record to the ledger.
     *
     * @param record the parsed record
     * @param ledger the shared ledger of the current run
     */
    public void process(TransactionRecord record, Ledger ledger) {
        ApplyOutcome outcome = ledger.withAccount(record.getClientId(), account -> apply(record, account, ledger));

        if (outcome != ApplyOutcome.APPLIED) {
            log.debug("Record {} for client {} tx {} was a no-op: {}",
                    record.getType(), record.getClientId(), record.getTxId(), outcome);
        }
        metrics.recordApplied(record.getType(), outcome);
    }

    private ApplyOutcome apply(TransactionRecord record, Account account, Ledger ledger) {
        if (account.isLocked()) {
            return ApplyOutcome.ACCOUNT_LOCKED;
        }

        ApplyOutcome outcome;
        try {
            outcome = switch (record.getType()) {
                case DEPOSIT -> deposit(record, account);
                case WITHDRAWAL -> withdraw(record, account);
                case DISPUTE -> ledger.withStoredTransaction(record.getTxId(), stored -> dispute(stored, account));
                case RESOLVE -> ledger.withStoredTransaction(record.getTxId(), stored -> resolve(stored, account));
                case CHARGEBACK -> ledger.withStoredTransaction(record.getTxId(), stored -> chargeback(stored, account));
            };
        } catch (ArithmeticException e) {
            log.warn("Dropping {} for client {} tx {}: balance would overflow",
                    record.getType(), record.getClientId(), record.getTxId());
            return ApplyOutcome.AMOUNT_OVERFLOW;
        }

        if (record.getType().isStored()) {
            ledger.storeTransaction(record);
        }
        return outcome;
    }

    private ApplyOutcome deposit(TransactionRecord record, Account account) {
        account.credit(record.getAmount());
        return ApplyOutcome.APPLIED;
    }

    private ApplyOutcome withdraw(TransactionRecord record, Account account) {
        if (!account.hasAvailable(record.getAmount())) {
            return ApplyOutcome.INSUFFICIENT_FUNDS;
        }
        account.debit(record.getAmount());
        return ApplyOutcome.APPLIED;
    }

    private ApplyOutcome dispute(Optional<StoredTransaction> stored, Account account) {
        if (stored.isEmpty()) {
            return ApplyOutcome.UNKNOWN_TRANSACTION;
        }
        StoredTransaction disputed = stored.get();
        if (disputed.getClientId() != account.getClientId()) {
            log.warn("Client {} disputes tx {} owned by client {}",
                    account.getClientId(), disputed.getRecord().getTxId(), disputed.getClientId());
        }
        account.hold(disputed.getAmount());
        disputed.markDisputed();
        return ApplyOutcome.APPLIED;
    }

    private ApplyOutcome resolve(Optional<StoredTransaction> stored, Account account) {
        if (stored.isEmpty()) {
            return ApplyOutcome.UNKNOWN_TRANSACTION;
        }
        StoredTransaction disputed = stored.get();
        if (!disputed.isDisputed()) {
            return ApplyOutcome.NOT_DISPUTED;
        }
        account.release(disputed.getAmount());
        disputed.clearDisputed();
        return ApplyOutcome.APPLIED;
    }

    private ApplyOutcome chargeback(Optional<StoredTransaction> stored, Account account) {
        if (stored.isEmpty()) {
            return ApplyOutcome.UNKNOWN_TRANSACTION;
        }
        StoredTransaction disputed = stored.get();
        if (!disputed.isDisputed()) {
            return ApplyOutcome.NOT_DISPUTED;
        }
        account.chargeback(disputed.getAmount());
        return ApplyOutcome.APPLIED;
    }
}
