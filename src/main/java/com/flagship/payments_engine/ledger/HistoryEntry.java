package com.flagship.payments_engine.ledger;

import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;

/**
 * Durable record of an accepted deposit or withdrawal.
 *
 * Amount, owner and type never change. Only the dispute state moves, and only
 * along the transitions allowed by {@link DisputeState}. An entry is mutated
 * exclusively by the worker that owns its client.
 */
@Getter
@ToString
public class HistoryEntry {

    private final long txId;
    private final int clientId;
    private final BigDecimal amount;
    private final TransactionType type;
    private DisputeState disputeState;

    private HistoryEntry(long txId, int clientId, BigDecimal amount, TransactionType type) {
        this.txId = txId;
        this.clientId = clientId;
        this.amount = amount;
        this.type = type;
        this.disputeState = DisputeState.CLEAN;
    }

    /**
     * Creates a CLEAN entry for an accepted deposit or withdrawal.
     */
    public static HistoryEntry of(TransactionRecord record) {
        if (!record.getType().carriesAmount()) {
            throw new IllegalArgumentException(
                "Only deposits and withdrawals are recorded, got " + record.getType().code());
        }
        return new HistoryEntry(record.getTxId(), record.getClientId(), record.getAmount(), record.getType());
    }

    /**
     * Verifies the entry is in the state an action expects.
     *
     * @throws TransactionRejectedException with {@link ApplyError#INVALID_STATE} otherwise
     */
    public void requireState(DisputeState expected, TransactionType action) {
        if (disputeState != expected) {
            throw new TransactionRejectedException(ApplyError.INVALID_STATE,
                String.format("Cannot %s transaction %d in %s state. Only %s transactions qualify.",
                    action.code(), txId, disputeState, expected));
        }
    }

    void transitionTo(DisputeState target) {
        if (!disputeState.canTransitionTo(target)) {
            throw new IllegalStateException(
                String.format("Illegal dispute transition %s -> %s for transaction %d", disputeState, target, txId));
        }
        this.disputeState = target;
    }
}
