package com.flagship.payments_engine.dispatch;

import com.flagship.payments_engine.ledger.AccountSnapshot;
import com.flagship.payments_engine.ledger.AccountStore;
import com.flagship.payments_engine.ledger.LedgerEngine;
import com.flagship.payments_engine.ledger.LedgerOverflowException;
import com.flagship.payments_engine.ledger.RejectionLogLevel;
import com.flagship.payments_engine.ledger.TransactionHistory;
import com.flagship.payments_engine.ledger.TransactionRecord;
import com.flagship.payments_engine.observability.LedgerMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Partitioned dispatcher tests.
 *
 * These tests verify that:
 * - Per-client order is preserved across shards
 * - The final state matches applying the same records inline
 * - A fatal error stops the dispatcher and surfaces from awaitCompletion
 * - A transaction id reused across clients goes to the first record submitted
 */
class PartitionedTransactionDispatcherTest {

    private PartitionedTransactionDispatcher dispatcher;

    @AfterEach
    void tearDown() {
        if (dispatcher != null) {
            dispatcher.close();
        }
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private static LedgerEngine newEngine() {
        return new LedgerEngine(new AccountStore(), new TransactionHistory(),
            new LedgerMetrics(new SimpleMeterRegistry()), RejectionLogLevel.OFF);
    }

    /**
     * Per client: ten deposits of 1, a withdrawal of 3, a dispute and resolve
     * on the first deposit, then a dispute and chargeback on the second.
     * Any reordering changes the outcome.
     */
    private static List<TransactionRecord> workload(int clients) {
        List<TransactionRecord> records = new ArrayList<>();
        long tx = 1;
        for (int round = 0; round < 10; round++) {
            for (int client = 0; client < clients; client++) {
                records.add(TransactionRecord.deposit(client, tx++, BigDecimal.ONE));
            }
        }
        for (int client = 0; client < clients; client++) {
            long firstDeposit = 1 + client;
            long secondDeposit = 1 + clients + client;
            records.add(TransactionRecord.withdrawal(client, tx++, new BigDecimal("3")));
            records.add(TransactionRecord.dispute(client, firstDeposit));
            records.add(TransactionRecord.resolve(client, firstDeposit));
            records.add(TransactionRecord.dispute(client, secondDeposit));
            records.add(TransactionRecord.chargeback(client, secondDeposit));
            records.add(TransactionRecord.deposit(client, tx++, new BigDecimal("100")));
        }
        return records;
    }

    @Test
    @DisplayName("Final state matches inline application of the same records")
    void matchesInline() {
        List<TransactionRecord> records = workload(50);

        LedgerEngine inlineEngine = newEngine();
        InlineTransactionDispatcher inline = new InlineTransactionDispatcher(inlineEngine);
        records.forEach(inline::submit);
        inline.awaitCompletion();

        LedgerEngine partitionedEngine = newEngine();
        dispatcher = new PartitionedTransactionDispatcher(partitionedEngine, 4, 8);
        records.forEach(dispatcher::submit);
        dispatcher.awaitCompletion();

        List<AccountSnapshot> expected = inlineEngine.snapshot();
        assertEquals(50, expected.size());
        assertEquals(expected, partitionedEngine.snapshot());
        assertEquals(0, dispatcher.backlog());
    }

    private static List<AccountSnapshot> applyInline(List<TransactionRecord> records) {
        LedgerEngine engine = newEngine();
        InlineTransactionDispatcher inline = new InlineTransactionDispatcher(engine);
        records.forEach(inline::submit);
        inline.awaitCompletion();
        return engine.snapshot();
    }

    private static Optional<AccountSnapshot> account(List<AccountSnapshot> accounts, int clientId) {
        return accounts.stream().filter(a -> a.getClientId() == clientId).findFirst();
    }

    @Test
    @DisplayName("A transaction id reused by another client is rejected on every run")
    void crossClientDuplicateFollowsSubmissionOrder() {
        printTestHeader("A transaction id reused by another client is rejected on every run");

        // Given: client 2 (shard 0) has a long backlog, client 1 (shard 1) has none
        List<TransactionRecord> records = new ArrayList<>();
        for (long tx = 1_000; tx < 21_000; tx++) {
            records.add(TransactionRecord.deposit(2, tx, BigDecimal.ONE));
        }
        records.add(TransactionRecord.deposit(2, 1, BigDecimal.TEN));
        records.add(TransactionRecord.deposit(1, 1, new BigDecimal("5")));

        for (int run = 0; run < 5; run++) {
            // When
            LedgerEngine engine = newEngine();
            dispatcher = new PartitionedTransactionDispatcher(engine, 2, 16);
            records.forEach(dispatcher::submit);
            dispatcher.awaitCompletion();

            // Then
            List<AccountSnapshot> accounts = engine.snapshot();
            printOutput("Run " + run, accounts);
            assertTrue(account(accounts, 1).isEmpty(), "Later deposit reusing tx 1 must be rejected");
            assertEquals(new BigDecimal("20010.0000"), account(accounts, 2).orElseThrow().getTotal());
            assertEquals(0, dispatcher.claimedTxIds());
            dispatcher.close();
        }
        printSuccess("First submitted use of the id won on every run");
    }

    @Test
    @DisplayName("A reused transaction id goes to the later client when the first use was rejected")
    void rejectedFirstUseFreesTheId() {
        List<TransactionRecord> records = new ArrayList<>();
        for (long tx = 1_000; tx < 11_000; tx++) {
            records.add(TransactionRecord.deposit(2, tx, BigDecimal.ONE));
        }
        records.add(TransactionRecord.withdrawal(2, 1, new BigDecimal("50000")));
        records.add(TransactionRecord.deposit(1, 1, new BigDecimal("5")));
        records.add(TransactionRecord.withdrawal(3, 1, BigDecimal.ONE));
        records.add(TransactionRecord.dispute(1, 1));

        List<AccountSnapshot> expected = applyInline(records);

        LedgerEngine engine = newEngine();
        dispatcher = new PartitionedTransactionDispatcher(engine, 4, 16);
        records.forEach(dispatcher::submit);
        dispatcher.awaitCompletion();

        assertEquals(expected, engine.snapshot());
        assertEquals(new BigDecimal("5.0000"), account(expected, 1).orElseThrow().getHeld());
        assertTrue(account(expected, 3).isEmpty());
    }

    @Test
    @DisplayName("Records of one client are applied in submission order")
    void perClientOrder() {
        LedgerEngine engine = newEngine();
        dispatcher = new PartitionedTransactionDispatcher(engine, 3, 2);

        for (int client = 0; client < 6; client++) {
            dispatcher.submit(TransactionRecord.deposit(client, client * 10L + 1, new BigDecimal("5")));
            dispatcher.submit(TransactionRecord.withdrawal(client, client * 10L + 2, new BigDecimal("5")));
            dispatcher.submit(TransactionRecord.dispute(client, client * 10L + 1));
        }
        dispatcher.awaitCompletion();

        // Withdrawal after the deposit empties the account, so the dispute is refused.
        for (AccountSnapshot account : engine.snapshot()) {
            assertEquals(0, account.getAvailable().signum(), "client " + account.getClientId());
            assertEquals(0, account.getHeld().signum(), "client " + account.getClientId());
        }
    }

    @Test
    @DisplayName("Clients map to a stable shard")
    void shardOf() {
        dispatcher = new PartitionedTransactionDispatcher(newEngine(), 4, 1);

        assertEquals(4, dispatcher.shardCount());
        assertEquals(0, dispatcher.shardOf(0));
        assertEquals(3, dispatcher.shardOf(7));
        assertEquals(dispatcher.shardOf(65535), dispatcher.shardOf(65535));
    }

    @Test
    @DisplayName("A fatal error stops the dispatcher and is rethrown on completion")
    void fatalError() {
        BigDecimal max = BigDecimal.valueOf(Long.MAX_VALUE, 4);
        dispatcher = new PartitionedTransactionDispatcher(newEngine(), 2, 4);

        dispatcher.submit(TransactionRecord.deposit(1, 1, max));
        dispatcher.submit(TransactionRecord.deposit(1, 2, BigDecimal.ONE));

        DispatchFailedException e = assertThrows(DispatchFailedException.class, dispatcher::awaitCompletion);
        assertInstanceOf(LedgerOverflowException.class, e.getCause());
        assertTrue(dispatcher.isFailed());
        assertThrows(DispatchFailedException.class,
            () -> dispatcher.submit(TransactionRecord.deposit(2, 3, BigDecimal.ONE)));
    }

    @Test
    @DisplayName("An Error on a shard worker fails the run instead of losing the record")
    void errorOnShard() {
        LedgerEngine engine = mock(LedgerEngine.class);
        AssertionError broken = new AssertionError("engine broken");
        when(engine.apply(any())).thenThrow(broken);
        dispatcher = new PartitionedTransactionDispatcher(engine, 2, 4);

        dispatcher.submit(TransactionRecord.deposit(1, 1, BigDecimal.ONE));

        DispatchFailedException e = assertThrows(DispatchFailedException.class, dispatcher::awaitCompletion);
        assertSame(broken, e.getCause());
        assertTrue(dispatcher.isFailed());
        assertEquals(0, dispatcher.backlog());
    }

    @Test
    @DisplayName("Submitting after completion is refused")
    void submitAfterCompletion() {
        dispatcher = new PartitionedTransactionDispatcher(newEngine(), 1, 1);
        dispatcher.awaitCompletion();

        assertThrows(IllegalStateException.class,
            () -> dispatcher.submit(TransactionRecord.deposit(1, 1, BigDecimal.ONE)));
    }

    @Test
    @DisplayName("Shard count and queue capacity must be positive")
    void invalidSizing() {
        LedgerEngine engine = newEngine();

        assertThrows(IllegalArgumentException.class, () -> new PartitionedTransactionDispatcher(engine, 0, 1));
        assertThrows(IllegalArgumentException.class, () -> new PartitionedTransactionDispatcher(engine, 1, 0));
    }
}
