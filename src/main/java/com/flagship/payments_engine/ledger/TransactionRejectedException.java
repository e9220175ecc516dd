package com.flagship.payments_engine.ledger;

import lombok.Getter;

/**
 * Thrown by ledger state transitions when a record cannot be applied.
 * Caught by {@link LedgerEngine#apply} and turned into a rejected {@link ApplyResult}.
 */
@Getter
public class TransactionRejectedException extends RuntimeException {

    private final ApplyError error;

    public TransactionRejectedException(ApplyError error, String message) {
        super(message);
        this.error = error;
    }
}
