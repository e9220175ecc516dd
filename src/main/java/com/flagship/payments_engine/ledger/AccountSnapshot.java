package com.flagship.payments_engine.ledger;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Immutable view of an account, as reported once the input is exhausted.
 */
@Value
public class AccountSnapshot {
    int clientId;
    BigDecimal available;
    BigDecimal held;
    BigDecimal total;
    boolean locked;
}
