package com.flagship.payments_engine.ledger;

import lombok.Getter;

import java.math.BigDecimal;

/**
 * Per-client balance state.
 *
 * Key invariants:
 * - total == available + held (total is derived, never stored)
 * - available >= 0 and held >= 0 after every accepted operation
 * - once locked, no operation changes the account again
 *
 * Not thread-safe. An account is only touched by the worker owning its client.
 */
@Getter
public class Account {

    private final int clientId;
    private BigDecimal available = Amounts.ZERO;
    private BigDecimal held = Amounts.ZERO;
    private boolean locked;

    public Account(int clientId) {
        this.clientId = clientId;
    }

    public BigDecimal getTotal() {
        return available.add(held);
    }

    public void deposit(BigDecimal amount) {
        requireUnlocked();
        BigDecimal newAvailable = Amounts.add(available, amount);
        Amounts.checked(newAvailable.add(held));
        available = newAvailable;
    }

    public void withdraw(BigDecimal amount) {
        requireUnlocked();
        requireAvailable(amount);
        available = Amounts.subtract(available, amount);
    }

    /**
     * Moves funds from available to held for a dispute.
     */
    public void hold(BigDecimal amount) {
        requireUnlocked();
        requireAvailable(amount);
        available = Amounts.subtract(available, amount);
        held = Amounts.add(held, amount);
    }

    /**
     * Moves held funds back to available when a dispute is resolved.
     */
    public void release(BigDecimal amount) {
        requireUnlocked();
        requireHeld(amount);
        held = Amounts.subtract(held, amount);
        available = Amounts.add(available, amount);
    }

    /**
     * Removes held funds for good and locks the account.
     */
    public void chargeback(BigDecimal amount) {
        requireUnlocked();
        requireHeld(amount);
        held = Amounts.subtract(held, amount);
        locked = true;
    }

    public void requireUnlocked() {
        if (locked) {
            throw new TransactionRejectedException(ApplyError.ACCOUNT_LOCKED,
                "Account " + clientId + " is locked");
        }
    }

    public void requireAvailable(BigDecimal amount) {
        if (amount.compareTo(available) > 0) {
            throw new TransactionRejectedException(ApplyError.INSUFFICIENT_FUNDS,
                String.format("Account %d has %s available, %s requested",
                    clientId, available.toPlainString(), amount.toPlainString()));
        }
    }

    // Held funds always cover an open dispute; a shortfall means a broken invariant.
    private void requireHeld(BigDecimal amount) {
        if (amount.compareTo(held) > 0) {
            throw new IllegalStateException(
                String.format("Account %d holds %s, cannot release %s",
                    clientId, held.toPlainString(), amount.toPlainString()));
        }
    }

    public AccountSnapshot snapshot() {
        return new AccountSnapshot(clientId, available, held, getTotal(), locked);
    }
}
