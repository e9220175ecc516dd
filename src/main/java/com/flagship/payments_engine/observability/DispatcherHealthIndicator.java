package com.flagship.payments_engine.observability;

import com.flagship.payments_engine.dispatch.TransactionDispatcher;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the transaction dispatcher.
 *
 * Down once a fatal error stopped the dispatcher. Reports WARNING when too
 * many records are waiting to be applied.
 */
@Component("dispatcherHealth")
public class DispatcherHealthIndicator implements HealthIndicator {

    static final long BACKLOG_WARNING_THRESHOLD = 10_000;

    private final TransactionDispatcher dispatcher;

    public DispatcherHealthIndicator(TransactionDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @Override
    public Health health() {
        long backlog = dispatcher.backlog();

        if (dispatcher.isFailed()) {
            return Health.down()
                    .withDetail("error", "Dispatcher stopped after a fatal error")
                    .withDetail("backlog", backlog)
                    .build();
        }

        Health.Builder builder = backlog < BACKLOG_WARNING_THRESHOLD
                ? Health.up()
                : Health.status("WARNING");

        return builder
                .withDetail("backlog", backlog)
                .withDetail("warningThreshold", BACKLOG_WARNING_THRESHOLD)
                .build();
    }
}
