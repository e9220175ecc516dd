package com.flagship.payments_engine.consumer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.payments_engine.dispatch.TransactionDispatcher;
import com.flagship.payments_engine.ingest.MalformedRecordException;
import com.flagship.payments_engine.ingest.TransactionRecordParser;
import com.flagship.payments_engine.ledger.LedgerEngine;
import com.flagship.payments_engine.ledger.TransactionRecord;
import com.flagship.payments_engine.observability.LedgerMetrics;
import com.flagship.payments_engine.report.CsvReportWriter;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Kafka consumer for transaction records.
 *
 * This consumer:
 * 1. Receives JSON records from the transactions topic
 * 2. Parses them into transaction records
 * 3. Submits them to the dispatcher
 * 4. Manually acknowledges each message once it has been handed over
 *
 * Expected payload:
 * <pre>
 * {"type": "deposit", "client": 1, "tx": 1, "amount": 1.5}
 * </pre>
 * Messages must be keyed by client id so that one client's records share a
 * partition and arrive in order. Unparseable messages are counted, logged
 * and acknowledged so they are not redelivered.
 *
 * On shutdown the dispatcher is drained and the account report is written to stdout.
 */
@Component
@ConditionalOnProperty(name = "consumer.enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class TransactionRecordConsumer {

    private static final String METRICS_SOURCE = "kafka";

    private final TransactionRecordParser parser;
    private final TransactionDispatcher dispatcher;
    private final LedgerEngine engine;
    private final CsvReportWriter reportWriter;
    private final LedgerMetrics metrics;
    private final ObjectMapper objectMapper;

    private final AtomicLong consumed = new AtomicLong();

    @KafkaListener(
        topics = "${kafka.topic.transactions:transactions}",
        groupId = "${spring.kafka.consumer.group-id:payments-engine}"
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment ack) {
        log.debug("Received message: topic={}, partition={}, offset={}, key={}",
                record.topic(), record.partition(), record.offset(), record.key());

        String source = "partition " + record.partition() + " offset " + record.offset();
        Optional<TransactionRecord> parsed = parse(source, record.value());

        // Not acknowledged if the dispatcher refuses the record; it will be redelivered.
        parsed.ifPresent(dispatcher::submit);
        ack.acknowledge();

        if (parsed.isPresent()) {
            consumed.incrementAndGet();
        }
    }

    /**
     * Drains the dispatcher and writes the report for everything consumed.
     */
    @PreDestroy
    public void writeReport() throws IOException {
        if (consumed.get() == 0) {
            log.info("No transaction records consumed, skipping report");
            return;
        }
        dispatcher.awaitCompletion();
        reportWriter.write(engine.snapshot(), System.out);
        System.out.flush();
        log.info("Wrote report for {} consumed records", consumed.get());
    }

    long consumedCount() {
        return consumed.get();
    }

    private Optional<TransactionRecord> parse(String source, String json) {
        try {
            if (json == null) {
                throw new MalformedRecordException(source, "Empty message");
            }
            JsonNode node = objectMapper.readTree(json);
            if (node == null || !node.isObject()) {
                throw new MalformedRecordException(source, "Expected a JSON object");
            }
            return Optional.of(parser.parse(source,
                    text(node, "type"), text(node, "client"), text(node, "tx"), text(node, "amount")));
        } catch (JsonProcessingException e) {
            reportMalformed(source, "Invalid JSON: " + e.getOriginalMessage());
        } catch (MalformedRecordException e) {
            reportMalformed(source, e.getMessage());
        }
        return Optional.empty();
    }

    private String text(JsonNode node, String field) {
        return node.hasNonNull(field) ? node.get(field).asText() : null;
    }

    private void reportMalformed(String source, String reason) {
        metrics.recordMalformed(METRICS_SOURCE);
        log.warn("Skipping malformed message at {}: {}", source, reason);
    }
}
