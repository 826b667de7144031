package com.flagship.transaction_replay.ledger;

import lombok.Getter;
import lombok.ToString;

/**
 * Balance state of a single client.
 *
 * Accounts are created lazily by the {@link Ledger} the first time a client is
 * referenced and are only mutated while the ledger grants exclusive access.
 * The total is not tracked here, it is derived in {@link AccountSnapshot}.
 *
 * Balances may go negative, e.g. when a deposit that was already withdrawn
 * is disputed. That is accepted ledger behaviour. A mutation that would
 * overflow throws {@link ArithmeticException} and leaves the balances untouched.
 */
@Getter
@ToString
public class Account {

    private final int clientId;
    private Amount available = Amount.ZERO;
    private Amount held = Amount.ZERO;
    private boolean locked;

    public Account(int clientId) {
        this.clientId = clientId;
    }

    public boolean hasAvailable(Amount amount) {
        return available.isGreaterThanOrEqualTo(amount);
    }

    public void credit(Amount amount) {
        available = available.add(amount);
    }

    public void debit(Amount amount) {
        available = available.subtract(amount);
    }

    /**
     * Moves funds from available to held. Both sides change or neither does.
     */
    public void hold(Amount amount) {
        Amount newAvailable = available.subtract(amount);
        Amount newHeld = held.add(amount);
        available = newAvailable;
        held = newHeld;
    }

    /**
     * Moves funds from held back to available. Both sides change or neither does.
     */
    public void release(Amount amount) {
        Amount newHeld = held.subtract(amount);
        Amount newAvailable = available.add(amount);
        held = newHeld;
        available = newAvailable;
    }

    /**
     * Removes held funds for good and freezes the account.
     */
    public void chargeback(Amount amount) {
        held = held.subtract(amount);
        locked = true;
    }

    public AccountSnapshot snapshot() {
        return new AccountSnapshot(clientId, available, held, available.add(held), locked);
    }
}
