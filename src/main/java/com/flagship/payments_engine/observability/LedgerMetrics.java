package com.flagship.payments_engine.observability;

import com.flagship.payments_engine.ledger.ApplyError;
import com.flagship.payments_engine.ledger.TransactionType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Centralized metrics for the ledger engine.
 *
 * Metrics exposed:
 * - ledger.records.applied: accepted records, tagged by type
 * - ledger.records.rejected: rejected records, tagged by type and reason
 * - ledger.records.malformed: input rows dropped before reaching the engine, tagged by source
 * - ledger.accounts.locked: accounts locked by a chargeback
 * - ledger.apply.duration: time spent applying one record
 * - ledger.dispatch.backlog: records submitted but not yet applied
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;

    private final Counter accountsLocked;
    private final Timer applyTimer;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.accountsLocked = Counter.builder("ledger.accounts.locked")
                .description("Number of accounts locked by a chargeback")
                .register(registry);

        this.applyTimer = Timer.builder("ledger.apply.duration")
                .description("Time taken to apply one record")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    // ==================== Counter Methods ====================

    public void recordApplied(TransactionType type) {
        registry.counter("ledger.records.applied", "type", type.code()).increment();
    }

    public void recordRejected(TransactionType type, ApplyError reason) {
        registry.counter("ledger.records.rejected",
                "type", type.code(),
                "reason", reason.name()
        ).increment();
    }

    public void recordMalformed(String source) {
        registry.counter("ledger.records.malformed", "source", sanitizeTag(source)).increment();
    }

    public void incrementAccountsLocked() {
        accountsLocked.increment();
    }

    // ==================== Timer Methods ====================

    public <T> T timeApply(Supplier<T> operation) {
        return applyTimer.record(operation);
    }

    // ==================== Gauge Methods ====================

    public void registerBacklogGauge(Supplier<Number> supplier) {
        Gauge.builder("ledger.dispatch.backlog", supplier)
                .description("Records submitted but not yet applied")
                .strongReference(true)
                .register(registry);
    }

    // ==================== Helper Methods ====================

    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
