package com.flagship.payments_engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * Payments engine: applies a stream of client transactions to per-client
 * accounts and reports the final balances.
 *
 * Runs once over a CSV file by default. With {@code consumer.enabled=true}
 * and no file argument it keeps running and consumes records from Kafka.
 */
@SpringBootApplication
public class PaymentsEngineApplication {

    public static void main(String[] args) {
        ConfigurableApplicationContext context = SpringApplication.run(PaymentsEngineApplication.class, args);
        boolean consumerEnabled = context.getEnvironment().getProperty("consumer.enabled", Boolean.class, false);
        // A file run is one-shot even with the consumer enabled.
        if (!consumerEnabled || context.getEnvironment().getProperty("nonOptionArgs") != null) {
            System.exit(SpringApplication.exit(context));
        }
    }
}
