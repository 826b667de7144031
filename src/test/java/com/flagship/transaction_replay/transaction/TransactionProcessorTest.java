package com.flagship.transaction_replay.transaction;

import com.flagship.transaction_replay.ledger.Account;
import com.flagship.transaction_replay.ledger.AccountSnapshot;
import com.flagship.transaction_replay.ledger.Amount;
import com.flagship.transaction_replay.ledger.Ledger;
import com.flagship.transaction_replay.ledger.StoredTransaction;
import com.flagship.transaction_replay.observability.LedgerMetrics;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the transaction state machine.
 *
 * These tests verify that:
 * - Deposits and withdrawals move available funds, withdrawals only with enough funds
 * - Dispute, resolve and chargeback follow the hold/release/lock lifecycle
 * - Every inapplicable instruction is a silent no-op
 * - Locked accounts ignore everything
 * - Concurrent disputes and resolves on one tx id keep held and available consistent
 */
class TransactionProcessorTest {

    private SimpleMeterRegistry registry;
    private TransactionProcessor processor;
    private Ledger ledger;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        processor = new TransactionProcessor(new LedgerMetrics(registry));
        ledger = new Ledger();
    }

    private void apply(TransactionRecord... records) {
        for (TransactionRecord record : records) {
            processor.process(record, ledger);
        }
    }

    private AccountSnapshot account(int clientId) {
        return ledger.snapshotAccounts().stream()
                .filter(snapshot -> snapshot.getClientId() == clientId)
                .findFirst()
                .orElseThrow(() -> new AssertionError("No account for client " + clientId));
    }

    private double recordCount(TransactionType type, ApplyOutcome outcome) {
        Counter counter = registry.find("ledger.records")
                .tag("type", type.getCode())
                .tag("outcome", outcome.name().toLowerCase())
                .counter();
        return counter != null ? counter.count() : 0.0;
    }

    private static Amount amount(String text) {
        return Amount.fromDecimalString(text);
    }

    private static void assertBalances(AccountSnapshot account, String available, String held, boolean locked) {
        assertEquals(available, account.getAvailable().toDecimalString(), "available");
        assertEquals(held, account.getHeld().toDecimalString(), "held");
        assertEquals(locked, account.isLocked(), "locked");
    }

    private boolean isDisputed(long txId) {
        return ledger.getStoredTransaction(txId).map(StoredTransaction::isDisputed).orElseThrow();
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    @Test
    @DisplayName("Deposit credits available and is stored")
    void testDeposit() {
        printTestHeader("Deposit credits available and is stored");

        apply(TransactionRecord.deposit(1, 1, amount("5")));

        AccountSnapshot account = account(1);
        assertEquals(1, account.getClientId());
        assertBalances(account, "5.0000", "0.0000", false);
        assertEquals(1, ledger.transactionCount());
    }

    @Test
    @DisplayName("Withdrawal of the full available balance succeeds")
    void testWithdrawal() {
        printTestHeader("Withdrawal of the full available balance succeeds");

        apply(
                TransactionRecord.deposit(1, 1, amount("5")),
                TransactionRecord.withdrawal(1, 2, amount("5"))
        );

        assertBalances(account(1), "0.0000", "0.0000", false);
        assertEquals(2, ledger.transactionCount());
    }

    @Test
    @DisplayName("Withdrawal beyond available is a no-op but is still stored")
    void testWithdrawalInsufficientFunds() {
        printTestHeader("Withdrawal beyond available is a no-op but is still stored");

        apply(
                TransactionRecord.deposit(1, 1, amount("3")),
                TransactionRecord.withdrawal(1, 2, amount("5"))
        );

        assertBalances(account(1), "3.0000", "0.0000", false);
        assertEquals(2, ledger.transactionCount());
        assertEquals(1.0, recordCount(TransactionType.WITHDRAWAL, ApplyOutcome.INSUFFICIENT_FUNDS));
    }

    @Test
    @DisplayName("Deposits and withdrawals replay in order on a single stream")
    void testDepositWithdrawalSequence() {
        printTestHeader("Deposits and withdrawals replay in order on a single stream");

        apply(
                TransactionRecord.deposit(1, 1, amount("1.0")),
                TransactionRecord.deposit(2, 2, amount("2.0")),
                TransactionRecord.deposit(1, 3, amount("2.0")),
                TransactionRecord.withdrawal(1, 4, amount("1.5")),
                TransactionRecord.withdrawal(2, 5, amount("3.0"))
        );

        assertBalances(account(1), "1.5000", "0.0000", false);
        assertBalances(account(2), "2.0000", "0.0000", false);
    }

    @Test
    @DisplayName("Withdrawal during a dispute only sees available funds")
    void testWithdrawalMidDispute() {
        printTestHeader("Withdrawal during a dispute only sees available funds");

        apply(
                TransactionRecord.deposit(1, 1, amount("3.0")),
                TransactionRecord.dispute(1, 1),
                TransactionRecord.withdrawal(1, 2, amount("3.0"))
        );

        assertBalances(account(1), "0.0000", "3.0000", false);
        assertTrue(isDisputed(1));
        assertEquals(2, ledger.transactionCount());
    }

    @Test
    @DisplayName("Dispute then resolve restores balances and clears the flag")
    void testDisputeResolved() {
        printTestHeader("Dispute then resolve restores balances and clears the flag");

        apply(
                TransactionRecord.deposit(1, 1, amount("3")),
                TransactionRecord.dispute(1, 1),
                TransactionRecord.withdrawal(1, 2, amount("3")),
                TransactionRecord.resolve(1, 1),
                TransactionRecord.withdrawal(1, 3, amount("3"))
        );

        assertBalances(account(1), "0.0000", "0.0000", false);
        assertFalse(isDisputed(1));
        assertEquals(3, ledger.transactionCount());
    }

    @Test
    @DisplayName("A second resolve on the same tx is a no-op")
    void testDoubleResolve() {
        printTestHeader("A second resolve on the same tx is a no-op");

        apply(
                TransactionRecord.deposit(1, 1, amount("3")),
                TransactionRecord.dispute(1, 1),
                TransactionRecord.resolve(1, 1),
                TransactionRecord.resolve(1, 1)
        );

        assertBalances(account(1), "3.0000", "0.0000", false);
        assertEquals(1.0, recordCount(TransactionType.RESOLVE, ApplyOutcome.NOT_DISPUTED));
    }

    @Test
    @DisplayName("Resolve referencing another tx id leaves the dispute in place")
    void testResolveWrongTxId() {
        printTestHeader("Resolve referencing another tx id leaves the dispute in place");

        apply(
                TransactionRecord.deposit(1, 1, amount("3")),
                TransactionRecord.dispute(1, 1),
                TransactionRecord.resolve(1, 34)
        );

        assertBalances(account(1), "0.0000", "3.0000", false);
        assertTrue(isDisputed(1));
        assertEquals(1, ledger.transactionCount());
    }

    @Test
    @DisplayName("Dispute of an unknown tx changes nothing and raises nothing")
    void testDisputeUnknownTx() {
        printTestHeader("Dispute of an unknown tx changes nothing and raises nothing");

        apply(TransactionRecord.deposit(1, 1, amount("2")));

        assertDoesNotThrow(() -> apply(TransactionRecord.dispute(1, 99)));

        assertBalances(account(1), "2.0000", "0.0000", false);
        assertEquals(1.0, recordCount(TransactionType.DISPUTE, ApplyOutcome.UNKNOWN_TRANSACTION));
    }

    @Test
    @DisplayName("Resolve or chargeback without a dispute is a no-op")
    void testResolveAndChargebackWithoutDispute() {
        printTestHeader("Resolve or chargeback without a dispute is a no-op");

        apply(
                TransactionRecord.deposit(1, 1, amount("2")),
                TransactionRecord.resolve(1, 1),
                TransactionRecord.chargeback(1, 1)
        );

        assertBalances(account(1), "2.0000", "0.0000", false);
    }

    @Test
    @DisplayName("Meta-operation on a new client still creates the account")
    void testMetaOperationCreatesAccount() {
        printTestHeader("Meta-operation on a new client still creates the account");

        apply(TransactionRecord.resolve(9, 1));

        assertBalances(account(9), "0.0000", "0.0000", false);
        assertEquals(0, ledger.transactionCount());
    }

    @Test
    @DisplayName("Dispute then chargeback removes held funds and locks the account")
    void testChargebackLocks() {
        printTestHeader("Dispute then chargeback removes held funds and locks the account");

        apply(
                TransactionRecord.deposit(1, 1, amount("5.0")),
                TransactionRecord.dispute(1, 1),
                TransactionRecord.chargeback(1, 1),
                TransactionRecord.deposit(1, 2, amount("1.0"))
        );

        assertBalances(account(1), "0.0000", "0.0000", true);
        assertEquals("0.0000", account(1).getTotal().toDecimalString());
        // The chargeback keeps the stored transaction flagged as disputed
        assertTrue(isDisputed(1));
        // The deposit on the locked account was dropped before being stored
        assertEquals(1, ledger.transactionCount());
        assertEquals(1.0, recordCount(TransactionType.DEPOSIT, ApplyOutcome.ACCOUNT_LOCKED));
    }

    @Test
    @DisplayName("Locked account ignores every kind of record")
    void testLockedAccountIgnoresEverything() {
        printTestHeader("Locked account ignores every kind of record");

        apply(
                TransactionRecord.deposit(1, 1, amount("5")),
                TransactionRecord.deposit(1, 2, amount("4")),
                TransactionRecord.dispute(1, 1),
                TransactionRecord.chargeback(1, 1)
        );
        AccountSnapshot before = account(1);

        apply(
                TransactionRecord.deposit(1, 3, amount("1")),
                TransactionRecord.withdrawal(1, 4, amount("1")),
                TransactionRecord.dispute(1, 2),
                TransactionRecord.resolve(1, 1),
                TransactionRecord.chargeback(1, 1)
        );

        assertEquals(before, account(1));
        assertBalances(account(1), "4.0000", "0.0000", true);
        assertFalse(isDisputed(2));
    }

    @Test
    @DisplayName("Dispute of an already withdrawn deposit drives available negative")
    void testDisputeCanGoNegative() {
        printTestHeader("Dispute of an already withdrawn deposit drives available negative");

        apply(
                TransactionRecord.deposit(1, 1, amount("5")),
                TransactionRecord.withdrawal(1, 2, amount("5")),
                TransactionRecord.dispute(1, 1)
        );

        AccountSnapshot account = account(1);
        assertBalances(account, "-5.0000", "5.0000", false);
        assertEquals("0.0000", account.getTotal().toDecimalString());
    }

    @Test
    @DisplayName("Disputing a withdrawal holds its amount like any other transaction")
    void testDisputeWithdrawal() {
        printTestHeader("Disputing a withdrawal holds its amount like any other transaction");

        apply(
                TransactionRecord.deposit(1, 1, amount("5")),
                TransactionRecord.withdrawal(1, 2, amount("2")),
                TransactionRecord.dispute(1, 2)
        );

        assertBalances(account(1), "1.0000", "2.0000", false);
    }

    @Test
    @DisplayName("Repeated dispute holds the amount again")
    void testRepeatedDispute() {
        printTestHeader("Repeated dispute holds the amount again");

        apply(
                TransactionRecord.deposit(1, 1, amount("5")),
                TransactionRecord.dispute(1, 1),
                TransactionRecord.dispute(1, 1)
        );

        assertBalances(account(1), "-5.0000", "10.0000", false);
    }

    @Test
    @DisplayName("Dispute is applied to the issuing client, not the owner of the tx")
    void testDisputeOfAnotherClientsTransaction() {
        printTestHeader("Dispute is applied to the issuing client, not the owner of the tx");

        // Likely a defect: nothing checks that the tx belongs to the disputing client
        apply(
                TransactionRecord.deposit(1, 1, amount("5")),
                TransactionRecord.deposit(2, 2, amount("1")),
                TransactionRecord.dispute(2, 1)
        );

        assertBalances(account(1), "5.0000", "0.0000", false);
        assertBalances(account(2), "-4.0000", "5.0000", false);
        assertTrue(isDisputed(1));
    }

    @Test
    @DisplayName("Reused tx id overwrites the stored transaction")
    void testReusedTxIdOverwrites() {
        printTestHeader("Reused tx id overwrites the stored transaction");

        apply(
                TransactionRecord.deposit(1, 1, amount("5")),
                TransactionRecord.deposit(1, 1, amount("2")),
                TransactionRecord.dispute(1, 1)
        );

        assertBalances(account(1), "5.0000", "2.0000", false);
        assertEquals(1, ledger.transactionCount());
    }

    @Test
    @DisplayName("Concurrent dispute/resolve cycles on one tx keep balances consistent")
    void testConcurrentDisputeResolve() throws Exception {
        printTestHeader("Concurrent dispute/resolve cycles on one tx keep balances consistent");

        apply(TransactionRecord.deposit(1, 1, amount("10")));

        int threads = 4;
        int cycles = 500;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);

        for (int i = 0; i < threads; i++) {
            int clientId = 1 + (i % 2);
            executor.submit(() -> {
                try {
                    start.await();
                    for (int j = 0; j < cycles; j++) {
                        processor.process(TransactionRecord.dispute(clientId, 1), ledger);
                        processor.process(TransactionRecord.resolve(clientId, 1), ledger);
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }

        start.countDown();
        assertTrue(done.await(60, TimeUnit.SECONDS));
        executor.shutdown();

        // Hold and release move funds within one account, so totals never change
        long totalAcrossClients = ledger.snapshotAccounts().stream()
                .mapToLong(snapshot -> snapshot.getTotal().getScaledValue())
                .sum();
        assertEquals(amount("10").getScaledValue(), totalAcrossClients);

        // Every dispute applies; a resolve applies only while the flag is set
        long disputesApplied = (long) recordCount(TransactionType.DISPUTE, ApplyOutcome.APPLIED);
        long resolvesApplied = (long) recordCount(TransactionType.RESOLVE, ApplyOutcome.APPLIED);
        assertEquals((long) threads * cycles, disputesApplied);

        long heldAcrossClients = ledger.snapshotAccounts().stream()
                .mapToLong(snapshot -> snapshot.getHeld().getScaledValue())
                .sum();
        assertEquals(amount("10").getScaledValue() * (disputesApplied - resolvesApplied), heldAcrossClients);
    }

    @Test
    @DisplayName("Overflowing deposit is dropped without costing later records")
    void testOverflowingDepositDropped() {
        printTestHeader("Overflowing deposit is dropped without costing later records");

        apply(
                TransactionRecord.deposit(1, 1, amount("900000000000000")),
                TransactionRecord.deposit(1, 2, amount("900000000000000")),
                TransactionRecord.deposit(2, 3, amount("1.0")),
                TransactionRecord.dispute(1, 2)
        );

        assertBalances(account(1), "900000000000000.0000", "0.0000", false);
        assertBalances(account(2), "1.0000", "0.0000", false);
        assertTrue(ledger.getStoredTransaction(2).isEmpty());
        assertEquals(1.0, recordCount(TransactionType.DEPOSIT, ApplyOutcome.AMOUNT_OVERFLOW));
        assertEquals(1.0, recordCount(TransactionType.DISPUTE, ApplyOutcome.UNKNOWN_TRANSACTION));
    }

    @Test
    @DisplayName("Overflowing hold leaves both balances untouched")
    void testOverflowingHoldIsAtomic() {
        printTestHeader("Overflowing hold leaves both balances untouched");

        ledger.withAccount(1, account -> {
            account.credit(Amount.ofScaled(Long.MIN_VALUE + 10));
            return null;
        });
        ledger.storeTransaction(TransactionRecord.deposit(2, 7, Amount.ofScaled(100)));

        processor.process(TransactionRecord.dispute(1, 7), ledger);

        AccountSnapshot snapshot = ledger.withAccount(1, Account::snapshot);
        assertEquals(Long.MIN_VALUE + 10, snapshot.getAvailable().getScaledValue());
        assertEquals(0L, snapshot.getHeld().getScaledValue());
        assertFalse(ledger.getStoredTransaction(7).orElseThrow().isDisputed());
    }
}
