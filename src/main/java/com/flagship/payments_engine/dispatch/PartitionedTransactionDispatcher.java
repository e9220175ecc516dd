package com.flagship.payments_engine.dispatch;

import com.flagship.payments_engine.ledger.LedgerEngine;
import com.flagship.payments_engine.ledger.TransactionRecord;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Applies records on a fixed set of shard workers, partitioned by client id.
 *
 * Each shard is a single worker thread draining a bounded queue. All records
 * of a client land on the same shard, so they are applied sequentially and in
 * submission order, while different clients proceed in parallel.
 *
 * When a shard queue is full, {@link #submit} blocks until the worker catches
 * up instead of dropping or reordering records.
 *
 * Transaction ids are unique across clients, so deposits and withdrawals that
 * share an id are ordered across shards too: a record waits until every
 * earlier record claiming the same id has been applied. The first one in
 * submission order therefore wins, exactly as with inline application.
 *
 * A fatal error on any shard stops the whole dispatcher: records still queued
 * are skipped and the error is rethrown from {@link #awaitCompletion()}.
 */
@Slf4j
public class PartitionedTransactionDispatcher implements TransactionDispatcher, AutoCloseable {

    private static final long AWAIT_PROGRESS_SECONDS = 30;

    private final LedgerEngine engine;
    private final ThreadPoolExecutor[] shards;
    private final AtomicLong pending = new AtomicLong();
    private final AtomicReference<Throwable> failure = new AtomicReference<>();
    private final Map<Long, CompletableFuture<Void>> txIdClaims = new ConcurrentHashMap<>();
    private final Object submitLock = new Object();
    private volatile boolean completed;

    public PartitionedTransactionDispatcher(LedgerEngine engine, int shardCount, int queueCapacity) {
        if (shardCount <= 0) {
            throw new IllegalArgumentException("Shard count must be positive: " + shardCount);
        }
        if (queueCapacity <= 0) {
            throw new IllegalArgumentException("Queue capacity must be positive: " + queueCapacity);
        }
        this.engine = engine;
        this.shards = new ThreadPoolExecutor[shardCount];
        for (int shardId = 0; shardId < shardCount; shardId++) {
            String threadName = "ledger-shard-" + shardId;
            shards[shardId] = new ThreadPoolExecutor(
                1, 1,
                0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(queueCapacity),
                runnable -> new Thread(runnable, threadName),
                PartitionedTransactionDispatcher::blockUntilQueued
            );
        }

        log.info("Initialized partitioned dispatcher: {} shards, {} queued records per shard", shardCount, queueCapacity);
    }

    @Override
    public void submit(TransactionRecord record) {
        rethrowIfFailed();
        if (completed) {
            throw new IllegalStateException("Dispatcher already completed");
        }

        int shardId = shardOf(record.getClientId());
        // Claim and enqueue together, so claim order matches queue order on every shard.
        synchronized (submitLock) {
            CompletableFuture<Void> claim = record.getType().carriesAmount() ? new CompletableFuture<>() : null;
            CompletableFuture<Void> earlierClaim = claim != null ? txIdClaims.put(record.getTxId(), claim) : null;

            pending.incrementAndGet();
            try {
                shards[shardId].execute(() -> applyOnShard(record, earlierClaim, claim));
            } catch (RejectedExecutionException e) {
                pending.decrementAndGet();
                if (claim != null) {
                    passOn(earlierClaim, claim, record.getTxId());
                }
                throw new IllegalStateException("Shard " + shardId + " rejected transaction " + record.getTxId(), e);
            }
        }
    }

    @Override
    public void awaitCompletion() {
        completed = true;
        for (ThreadPoolExecutor shard : shards) {
            shard.shutdown();
        }
        try {
            for (int shardId = 0; shardId < shards.length; shardId++) {
                while (!shards[shardId].awaitTermination(AWAIT_PROGRESS_SECONDS, TimeUnit.SECONDS)) {
                    log.info("Waiting for shard {} to drain, {} records pending", shardId, pending.get());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for shards to drain", e);
        }
        rethrowIfFailed();
        log.debug("All shards drained");
    }

    @Override
    public long backlog() {
        return pending.get();
    }

    @Override
    public boolean isFailed() {
        return failure.get() != null;
    }

    /**
     * Stops the shard workers without waiting for queued records.
     */
    @Override
    public void close() {
        completed = true;
        for (ThreadPoolExecutor shard : shards) {
            shard.shutdownNow();
        }
    }

    int shardOf(int clientId) {
        return Math.floorMod(clientId, shards.length);
    }

    int shardCount() {
        return shards.length;
    }

    int claimedTxIds() {
        return txIdClaims.size();
    }

    private void applyOnShard(TransactionRecord record,
                              CompletableFuture<Void> earlierClaim,
                              CompletableFuture<Void> claim) {
        try {
            awaitEarlierClaim(earlierClaim, record);
            if (failure.get() == null) {
                engine.apply(record);
            }
        } catch (Throwable e) {
            if (failure.compareAndSet(null, e)) {
                log.error("Fatal error applying transaction {} of client {}, stopping dispatcher",
                        record.getTxId(), record.getClientId(), e);
            }
        } finally {
            if (claim != null) {
                release(claim, record.getTxId());
            }
            pending.decrementAndGet();
        }
    }

    private void awaitEarlierClaim(CompletableFuture<Void> earlierClaim, TransactionRecord record) {
        if (earlierClaim == null) {
            return;
        }
        try {
            earlierClaim.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(
                "Interrupted while waiting for an earlier use of transaction " + record.getTxId(), e);
        } catch (ExecutionException e) {
            throw new IllegalStateException(
                "Earlier use of transaction " + record.getTxId() + " failed", e.getCause());
        }
    }

    private void release(CompletableFuture<Void> claim, long txId) {
        claim.complete(null);
        txIdClaims.remove(txId, claim);
    }

    // A claim whose record never ran must still not overtake the claim before it.
    private void passOn(CompletableFuture<Void> earlierClaim, CompletableFuture<Void> claim, long txId) {
        if (earlierClaim == null) {
            release(claim, txId);
        } else {
            earlierClaim.whenComplete((ignored, error) -> release(claim, txId));
        }
    }

    private void rethrowIfFailed() {
        Throwable cause = failure.get();
        if (cause != null) {
            throw new DispatchFailedException("Dispatcher stopped after a fatal error", cause);
        }
    }

    // Applies back-pressure: the submitting thread waits for room in the shard queue.
    private static void blockUntilQueued(Runnable task, ThreadPoolExecutor executor) {
        if (executor.isShutdown()) {
            throw new RejectedExecutionException("Shard is shut down");
        }
        try {
            executor.getQueue().put(task);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RejectedExecutionException("Interrupted while waiting for shard capacity", e);
        }
    }
}
