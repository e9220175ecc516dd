package com.flagship.payments_engine.dispatch;

import com.flagship.payments_engine.ledger.TransactionRecord;

/**
 * Feeds records into the ledger engine.
 *
 * Implementations guarantee that two records of the same client are never
 * applied concurrently and are applied in submission order.
 */
public interface TransactionDispatcher {

    /**
     * Hands a record over for application. May block while the dispatcher is saturated.
     *
     * @throws DispatchFailedException if a fatal error already stopped the dispatcher
     * @throws IllegalStateException if the dispatcher was already completed
     */
    void submit(TransactionRecord record);

    /**
     * Waits until every submitted record has been applied, then stops accepting records.
     *
     * @throws DispatchFailedException if applying a record failed fatally
     */
    void awaitCompletion();

    /**
     * Records submitted but not yet applied.
     */
    long backlog();

    /**
     * Whether a fatal error stopped the dispatcher.
     */
    boolean isFailed();
}
