package com.flagship.payments_engine.consumer;

import com.flagship.payments_engine.config.JacksonConfig;
import com.flagship.payments_engine.dispatch.TransactionDispatcher;
import com.flagship.payments_engine.ingest.TransactionRecordParser;
import com.flagship.payments_engine.ledger.LedgerEngine;
import com.flagship.payments_engine.ledger.TransactionRecord;
import com.flagship.payments_engine.observability.LedgerMetrics;
import com.flagship.payments_engine.report.CsvReportWriter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.kafka.support.Acknowledgment;

import java.io.IOException;
import java.math.BigDecimal;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Kafka consumer tests.
 *
 * These tests verify that:
 * - Valid JSON records are parsed and handed to the dispatcher
 * - Malformed messages are counted, acknowledged and never dispatched
 * - A record the dispatcher refuses is left unacknowledged
 */
class TransactionRecordConsumerTest {

    private static final String TOPIC = "transactions";

    private TransactionDispatcher dispatcher;
    private LedgerEngine engine;
    private Acknowledgment ack;
    private SimpleMeterRegistry registry;
    private TransactionRecordConsumer consumer;

    @BeforeEach
    void setUp() {
        dispatcher = mock(TransactionDispatcher.class);
        engine = mock(LedgerEngine.class);
        ack = mock(Acknowledgment.class);
        registry = new SimpleMeterRegistry();
        consumer = new TransactionRecordConsumer(
            new TransactionRecordParser(),
            dispatcher,
            engine,
            new CsvReportWriter(),
            new LedgerMetrics(registry),
            new JacksonConfig().objectMapper()
        );
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private ConsumerRecord<String, String> message(long offset, String value) {
        return new ConsumerRecord<>(TOPIC, 0, offset, "1", value);
    }

    private double malformedCount() {
        return registry.counter("ledger.records.malformed", "source", "kafka").count();
    }

    @Test
    @DisplayName("Deposit message is dispatched and acknowledged")
    void depositDispatched() {
        printTestHeader("Deposit message is dispatched and acknowledged");

        // Given
        String json = "{\"type\": \"deposit\", \"client\": 1, \"tx\": 7, \"amount\": 1.5, \"extra\": true}";

        // When
        consumer.consume(message(0, json), ack);

        // Then
        verify(dispatcher).submit(TransactionRecord.deposit(1, 7, new BigDecimal("1.5")));
        verify(ack).acknowledge();
        assertEquals(1, consumer.consumedCount());
        printSuccess("Record submitted to the dispatcher");
    }

    @Test
    @DisplayName("String-typed fields are accepted")
    void stringFields() {
        consumer.consume(message(0, "{\"type\": \"DISPUTE\", \"client\": \"2\", \"tx\": \"9\"}"), ack);

        verify(dispatcher).submit(TransactionRecord.dispute(2, 9));
        verify(ack).acknowledge();
    }

    @Test
    @DisplayName("Malformed messages are acknowledged but never dispatched")
    void malformedSkipped() {
        printTestHeader("Malformed messages are acknowledged but never dispatched");

        consumer.consume(message(0, "not json"), ack);
        consumer.consume(message(1, "[1, 2, 3]"), ack);
        consumer.consume(message(2, null), ack);
        consumer.consume(message(3, "{\"type\": \"deposit\", \"client\": 1, \"tx\": 1}"), ack);
        consumer.consume(message(4, "{\"type\": \"refund\", \"client\": 1, \"tx\": 1, \"amount\": 1}"), ack);

        verifyNoInteractions(dispatcher);
        verify(ack, times(5)).acknowledge();
        assertEquals(5.0, malformedCount());
        assertEquals(0, consumer.consumedCount());
        printSuccess("All malformed messages counted and skipped");
    }

    @Test
    @DisplayName("Amount with a huge exponent is skipped without stalling the listener")
    void hugeExponentSkipped() {
        assertTimeoutPreemptively(Duration.ofSeconds(5), () ->
            consumer.consume(message(0, "{\"type\": \"deposit\", \"client\": 1, \"tx\": 1, \"amount\": 1E+200000000}"), ack));

        verifyNoInteractions(dispatcher);
        verify(ack).acknowledge();
        assertEquals(1.0, malformedCount());
    }

    @Test
    @DisplayName("Record refused by the dispatcher is not acknowledged")
    void refusedNotAcknowledged() {
        doThrow(new IllegalStateException("Dispatcher already completed")).when(dispatcher).submit(any());

        assertThrows(IllegalStateException.class,
            () -> consumer.consume(message(0, "{\"type\": \"deposit\", \"client\": 1, \"tx\": 1, \"amount\": 1}"), ack));

        verify(ack, never()).acknowledge();
    }

    @Test
    @DisplayName("Shutdown drains the dispatcher only when records were consumed")
    void reportOnShutdown() throws IOException {
        consumer.writeReport();
        verify(dispatcher, never()).awaitCompletion();

        consumer.consume(message(0, "{\"type\": \"deposit\", \"client\": 1, \"tx\": 1, \"amount\": 1}"), ack);
        consumer.writeReport();

        verify(dispatcher).awaitCompletion();
        verify(engine).snapshot();
    }
}
