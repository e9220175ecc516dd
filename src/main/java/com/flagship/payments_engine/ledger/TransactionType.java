package com.flagship.payments_engine.ledger;

import java.util.Locale;

/**
 * Kind of an incoming transaction record.
 *
 * Deposits and withdrawals carry an amount and open a new history entry.
 * Disputes, resolves and chargebacks reference an existing entry by id.
 */
public enum TransactionType {
    DEPOSIT,
    WITHDRAWAL,
    DISPUTE,
    RESOLVE,
    CHARGEBACK;

    /**
     * Whether records of this type carry their own amount.
     */
    public boolean carriesAmount() {
        return this == DEPOSIT || this == WITHDRAWAL;
    }

    /**
     * Lower-case code as it appears in input files ({@code deposit}, {@code chargeback}, ...).
     */
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Resolves a type from its input code, ignoring case.
     *
     * @throws IllegalArgumentException if the code is unknown
     */
    public static TransactionType fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("Transaction type is required");
        }
        for (TransactionType type : values()) {
            if (type.code().equalsIgnoreCase(code.trim())) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown transaction type: " + code);
    }
}
