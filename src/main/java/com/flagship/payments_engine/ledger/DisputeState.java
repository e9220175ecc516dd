package com.flagship.payments_engine.ledger;

/**
 * Dispute lifecycle of a history entry.
 *
 * CLEAN -> DISPUTED (dispute)
 * DISPUTED -> CLEAN (resolve)
 * DISPUTED -> CHARGED_BACK (chargeback)
 */
public enum DisputeState {
    /**
     * No open dispute. Initial state of every entry.
     * Can be disputed (again, after a resolve).
     */
    CLEAN,

    /**
     * Funds of the entry are held.
     * Can be resolved or charged back.
     */
    DISPUTED,

    /**
     * The entry was reversed and the account locked.
     * Terminal state.
     */
    CHARGED_BACK;

    public boolean canTransitionTo(DisputeState target) {
        return switch (this) {
            case CLEAN -> target == DISPUTED;
            case DISPUTED -> target == CLEAN || target == CHARGED_BACK;
            case CHARGED_BACK -> false;
        };
    }
}
