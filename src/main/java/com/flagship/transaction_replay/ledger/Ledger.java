package com.flagship.transaction_replay.ledger;

import com.flagship.transaction_replay.transaction.TransactionRecord;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Shared store of client accounts and transaction history for one replay run.
 *
 * The underlying maps are never exposed. Callers get exclusive access through
 * the {@code with*} operations only:
 * - each account has its own lock, so workers on different clients never block each other
 * - the transaction history is guarded by a single lock
 *
 * Lock order is always account first, history second. A meta-operation that
 * needs both must acquire them in that order, which {@code withAccount} followed
 * by a nested {@code withStoredTransaction} does.
 *
 * One instance is created per run and handed to every ingestion worker.
 */
@Slf4j
public class Ledger {

    private final ConcurrentHashMap<Integer, AccountSlot> accounts = new ConcurrentHashMap<>();

    private final ReentrantLock historyLock = new ReentrantLock();
    private final Map<Long, StoredTransaction> history = new HashMap<>();

    /**
     * Runs {@code action} with exclusive access to the client's account, creating
     * the account on first reference.
     *
     * @param clientId client identifier
     * @param action mutation to apply, may return a result
     * @return whatever {@code action} returned
     */
    public <T> T withAccount(int clientId, Function<Account, T> action) {
        AccountSlot slot = accounts.computeIfAbsent(clientId, AccountSlot::new);
        slot.lock.lock();
        try {
            return action.apply(slot.account);
        } finally {
            slot.lock.unlock();
        }
    }

    /**
     * Runs {@code action} with exclusive access to the stored transaction at {@code txId}.
     * The action receives an empty Optional when nothing is stored there.
     */
    public <T> T withStoredTransaction(long txId, Function<Optional<StoredTransaction>, T> action) {
        historyLock.lock();
        try {
            return action.apply(Optional.ofNullable(history.get(txId)));
        } finally {
            historyLock.unlock();
        }
    }

    /**
     * Returns a detached copy of the stored transaction, if any.
     */
    public Optional<StoredTransaction> getStoredTransaction(long txId) {
        return withStoredTransaction(txId, stored -> stored.map(StoredTransaction::copy));
    }

    /**
     * Stores a Deposit or Withdrawal under its tx id with the dispute flag cleared.
     * An existing entry with the same id is overwritten.
     */
    public void storeTransaction(TransactionRecord record) {
        if (!record.getType().isStored()) {
            throw new IllegalArgumentException("Only deposits and withdrawals are stored, got " + record.getType());
        }
        historyLock.lock();
        try {
            StoredTransaction previous = history.put(record.getTxId(), new StoredTransaction(record));
            if (previous != null) {
                log.debug("Transaction {} overwritten in history", record.getTxId());
            }
        } finally {
            historyLock.unlock();
        }
    }

    /**
     * Takes the export view of every account, ordered by client id.
     * Each account is read under its own lock.
     */
    public List<AccountSnapshot> snapshotAccounts() {
        List<AccountSnapshot> snapshots = new ArrayList<>(accounts.size());
        for (AccountSlot slot : accounts.values()) {
            slot.lock.lock();
            try {
                snapshots.add(slot.account.snapshot());
            } finally {
                slot.lock.unlock();
            }
        }
        snapshots.sort(Comparator.comparingInt(AccountSnapshot::getClientId));
        return snapshots;
    }

    public int accountCount() {
        return accounts.size();
    }

    public int transactionCount() {
        historyLock.lock();
        try {
            return history.size();
        } finally {
            historyLock.unlock();
        }
    }

    private static final class AccountSlot {
        private final ReentrantLock lock = new ReentrantLock();
        private final Account account;

        private AccountSlot(int clientId) {
            this.account = new Account(clientId);
        }
    }
}
