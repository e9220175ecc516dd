package com.flagship.payments_engine.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * One parsed input record, the unit of work of the ledger engine.
 *
 * Invariants checked at construction:
 * - client ids fit an unsigned 16-bit range, transaction ids an unsigned 32-bit range
 * - deposits and withdrawals carry a non-negative amount, normalised to four decimals
 * - dispute, resolve and chargeback records carry no amount
 */
@Value
public class TransactionRecord {

    public static final int MAX_CLIENT_ID = 0xFFFF;
    public static final long MAX_TX_ID = 0xFFFF_FFFFL;

    TransactionType type;
    int clientId;
    long txId;
    BigDecimal amount;

    private TransactionRecord(TransactionType type, int clientId, long txId, BigDecimal amount) {
        this.type = Objects.requireNonNull(type, "type");
        if (clientId < 0 || clientId > MAX_CLIENT_ID) {
            throw new IllegalArgumentException("Client id out of range: " + clientId);
        }
        if (txId < 0 || txId > MAX_TX_ID) {
            throw new IllegalArgumentException("Transaction id out of range: " + txId);
        }
        this.clientId = clientId;
        this.txId = txId;

        if (type.carriesAmount()) {
            if (amount == null) {
                throw new IllegalArgumentException("Amount is required for " + type.code());
            }
            if (amount.signum() < 0) {
                throw new IllegalArgumentException("Amount must not be negative: " + amount.toPlainString());
            }
            this.amount = Amounts.normalize(amount);
        } else {
            this.amount = null;
        }
    }

    public static TransactionRecord of(TransactionType type, int clientId, long txId, BigDecimal amount) {
        return new TransactionRecord(type, clientId, txId, amount);
    }

    public static TransactionRecord deposit(int clientId, long txId, BigDecimal amount) {
        return new TransactionRecord(TransactionType.DEPOSIT, clientId, txId, amount);
    }

    public static TransactionRecord withdrawal(int clientId, long txId, BigDecimal amount) {
        return new TransactionRecord(TransactionType.WITHDRAWAL, clientId, txId, amount);
    }

    public static TransactionRecord dispute(int clientId, long txId) {
        return new TransactionRecord(TransactionType.DISPUTE, clientId, txId, null);
    }

    public static TransactionRecord resolve(int clientId, long txId) {
        return new TransactionRecord(TransactionType.RESOLVE, clientId, txId, null);
    }

    public static TransactionRecord chargeback(int clientId, long txId) {
        return new TransactionRecord(TransactionType.CHARGEBACK, clientId, txId, null);
    }
}
