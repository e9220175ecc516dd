package com.flagship.payments_engine.ledger;

/**
 * Raised when fixed-precision arithmetic leaves the representable range.
 *
 * This is a fatal condition for the run, not a per-record rejection.
 */
public class LedgerOverflowException extends ArithmeticException {

    public LedgerOverflowException(String message) {
        super(message);
    }
}
