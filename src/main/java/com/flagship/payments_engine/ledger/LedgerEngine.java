package com.flagship.payments_engine.ledger;

import com.flagship.payments_engine.observability.LedgerMetrics;
import com.flagship.payments_engine.observability.RecordContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Applies transaction records to the account store and the transaction history.
 *
 * This service enforces the ledger invariants:
 * 1. total == available + held for every account
 * 2. available and held never go negative
 * 3. transaction ids of deposits and withdrawals are unique
 * 4. a locked account never changes again
 * 5. resolve and chargeback only apply to a currently disputed entry
 *
 * A rejected record leaves no trace in account or history state. Rejections
 * are logged and counted, never propagated. Only fatal conditions such as
 * {@link LedgerOverflowException} escape {@link #apply}.
 *
 * Callers must not apply two records of the same client concurrently.
 */
@Service
@Slf4j
public class LedgerEngine {

    private final AccountStore accounts;
    private final TransactionHistory history;
    private final LedgerMetrics metrics;
    private final RejectionLogLevel rejectionLogLevel;

    public LedgerEngine(AccountStore accounts,
                        TransactionHistory history,
                        LedgerMetrics metrics,
                        @Value("${engine.rejections.log-level:warn}") RejectionLogLevel rejectionLogLevel) {
        this.accounts = accounts;
        this.history = history;
        this.metrics = metrics;
        this.rejectionLogLevel = rejectionLogLevel;
    }

    /**
     * Applies one record.
     *
     * @param record the record to apply
     * @return accepted, or rejected with the reason
     * @throws LedgerOverflowException if balances leave the representable range
     */
    public ApplyResult apply(TransactionRecord record) {
        try (RecordContext ignored = RecordContext.open(record)) {
            return metrics.timeApply(() -> applyInContext(record));
        }
    }

    /**
     * Final state of every account seen, ascending by client id.
     */
    public List<AccountSnapshot> snapshot() {
        return accounts.snapshot();
    }

    private ApplyResult applyInContext(TransactionRecord record) {
        try {
            switch (record.getType()) {
                case DEPOSIT -> deposit(record);
                case WITHDRAWAL -> withdraw(record);
                case DISPUTE -> dispute(record);
                case RESOLVE -> resolve(record);
                case CHARGEBACK -> chargeback(record);
            }
        } catch (TransactionRejectedException e) {
            reportRejection(record, e);
            return ApplyResult.rejected(e.getError(), e.getMessage());
        }

        metrics.recordApplied(record.getType());
        log.debug("Applied {} {} for client {}", record.getType().code(), record.getTxId(), record.getClientId());
        return ApplyResult.accepted();
    }

    private void deposit(TransactionRecord record) {
        requireNewTransaction(record);
        Account account = accounts.getOrCreate(record.getClientId());
        account.requireUnlocked();
        recordEntry(record);
        account.deposit(record.getAmount());
    }

    private void withdraw(TransactionRecord record) {
        requireNewTransaction(record);
        // Checked against a blank account for unseen clients; the account is only opened once accepted.
        Account current = accounts.find(record.getClientId())
            .orElseGet(() -> new Account(record.getClientId()));
        current.requireUnlocked();
        current.requireAvailable(record.getAmount());
        recordEntry(record);
        accounts.getOrCreate(record.getClientId()).withdraw(record.getAmount());
    }

    private void dispute(TransactionRecord record) {
        HistoryEntry entry = findEntry(record);
        entry.requireState(DisputeState.CLEAN, record.getType());
        Account account = accountOf(entry);
        account.hold(entry.getAmount());
        entry.transitionTo(DisputeState.DISPUTED);
    }

    private void resolve(TransactionRecord record) {
        HistoryEntry entry = findEntry(record);
        entry.requireState(DisputeState.DISPUTED, record.getType());
        Account account = accountOf(entry);
        account.release(entry.getAmount());
        entry.transitionTo(DisputeState.CLEAN);
    }

    private void chargeback(TransactionRecord record) {
        HistoryEntry entry = findEntry(record);
        entry.requireState(DisputeState.DISPUTED, record.getType());
        Account account = accountOf(entry);
        account.chargeback(entry.getAmount());
        entry.transitionTo(DisputeState.CHARGED_BACK);
        metrics.incrementAccountsLocked();
        log.info("Account {} locked by chargeback of transaction {}", account.getClientId(), entry.getTxId());
    }

    private void requireNewTransaction(TransactionRecord record) {
        if (history.contains(record.getTxId())) {
            throw duplicate(record);
        }
    }

    // Last check before any mutation; closes the race with another shard recording the same id.
    private void recordEntry(TransactionRecord record) {
        if (!history.record(HistoryEntry.of(record))) {
            throw duplicate(record);
        }
    }

    private HistoryEntry findEntry(TransactionRecord record) {
        return history.find(record.getTxId(), record.getClientId())
            .orElseThrow(() -> new TransactionRejectedException(ApplyError.UNKNOWN_TRANSACTION,
                String.format("No transaction %d recorded for client %d", record.getTxId(), record.getClientId())));
    }

    private Account accountOf(HistoryEntry entry) {
        return accounts.find(entry.getClientId())
            .orElseThrow(() -> new IllegalStateException(
                "History entry " + entry.getTxId() + " has no account for client " + entry.getClientId()));
    }

    private TransactionRejectedException duplicate(TransactionRecord record) {
        return new TransactionRejectedException(ApplyError.DUPLICATE_TRANSACTION,
            "Transaction " + record.getTxId() + " was already recorded");
    }

    private void reportRejection(TransactionRecord record, TransactionRejectedException e) {
        metrics.recordRejected(record.getType(), e.getError());
        switch (rejectionLogLevel) {
            case WARN -> log.warn("Rejected {}: {} ({})", record.getType().code(), e.getMessage(), e.getError());
            case DEBUG -> log.debug("Rejected {}: {} ({})", record.getType().code(), e.getMessage(), e.getError());
            case OFF -> {
                // counted only
            }
        }
    }
}
