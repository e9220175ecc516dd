package com.flagship.payments_engine.ledger;

/**
 * Reasons a record is rejected. None of them is fatal to the run.
 */
public enum ApplyError {
    DUPLICATE_TRANSACTION,
    ACCOUNT_LOCKED,
    INSUFFICIENT_FUNDS,
    UNKNOWN_TRANSACTION,
    /** Dispute action against an entry not in the expected lifecycle state. */
    INVALID_STATE,
    /** Raised by parsers only; never reaches the engine. */
    MALFORMED_RECORD
}
