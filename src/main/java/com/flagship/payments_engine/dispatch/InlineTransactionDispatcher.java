package com.flagship.payments_engine.dispatch;

import com.flagship.payments_engine.ledger.LedgerEngine;
import com.flagship.payments_engine.ledger.TransactionRecord;
import lombok.extern.slf4j.Slf4j;

/**
 * Applies each record on the submitting thread, one at a time.
 *
 * The whole dispatcher is a single critical section, so records are applied
 * in submission order even when several threads submit.
 */
@Slf4j
public class InlineTransactionDispatcher implements TransactionDispatcher {

    private final LedgerEngine engine;
    private boolean completed;
    private RuntimeException failure;

    public InlineTransactionDispatcher(LedgerEngine engine) {
        this.engine = engine;
    }

    @Override
    public synchronized void submit(TransactionRecord record) {
        if (failure != null) {
            throw new DispatchFailedException("Dispatcher stopped after a fatal error", failure);
        }
        if (completed) {
            throw new IllegalStateException("Dispatcher already completed");
        }
        try {
            engine.apply(record);
        } catch (RuntimeException e) {
            failure = e;
            log.error("Fatal error applying transaction {} of client {}", record.getTxId(), record.getClientId(), e);
            throw new DispatchFailedException("Failed to apply transaction " + record.getTxId(), e);
        }
    }

    @Override
    public synchronized void awaitCompletion() {
        completed = true;
        if (failure != null) {
            throw new DispatchFailedException("Dispatcher stopped after a fatal error", failure);
        }
    }

    @Override
    public long backlog() {
        return 0;
    }

    @Override
    public synchronized boolean isFailed() {
        return failure != null;
    }
}
