package com.flagship.payments_engine.config;

import com.flagship.payments_engine.dispatch.InlineTransactionDispatcher;
import com.flagship.payments_engine.dispatch.PartitionedTransactionDispatcher;
import com.flagship.payments_engine.dispatch.TransactionDispatcher;
import com.flagship.payments_engine.ledger.LedgerEngine;
import com.flagship.payments_engine.observability.LedgerMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Dispatcher configuration.
 *
 * Configures:
 * - engine.dispatch.mode: partitioned (default) or inline
 * - engine.dispatch.shards: shard workers, defaults to the available processors
 * - engine.dispatch.queue-capacity: bounded queue size per shard
 */
@Configuration
@Slf4j
public class DispatcherConfig {

    @Value("${engine.dispatch.mode:partitioned}")
    private String mode;

    @Value("${engine.dispatch.shards:0}")
    private int shards;

    @Value("${engine.dispatch.queue-capacity:1024}")
    private int queueCapacity;

    @Bean
    public TransactionDispatcher transactionDispatcher(LedgerEngine engine, LedgerMetrics metrics) {
        TransactionDispatcher dispatcher = switch (mode.trim().toLowerCase()) {
            case "inline" -> new InlineTransactionDispatcher(engine);
            case "partitioned" -> new PartitionedTransactionDispatcher(engine, resolveShards(), queueCapacity);
            default -> throw new IllegalArgumentException(
                "Unknown engine.dispatch.mode '" + mode + "', expected 'partitioned' or 'inline'");
        };
        metrics.registerBacklogGauge(dispatcher::backlog);
        log.info("Using {} dispatcher", dispatcher.getClass().getSimpleName());
        return dispatcher;
    }

    private int resolveShards() {
        return shards > 0 ? shards : Runtime.getRuntime().availableProcessors();
    }
}
