package com.flagship.payments_engine.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Kafka configuration, active only when the record consumer is enabled.
 *
 * Configures:
 * - Kafka topic for incoming transaction records
 */
@Configuration
@ConditionalOnProperty(name = "consumer.enabled", havingValue = "true")
public class KafkaConfig {

    @Value("${kafka.topic.transactions:transactions}")
    private String transactionsTopic;

    @Value("${kafka.topic.partitions:3}")
    private int partitions;

    /**
     * Creates the transactions topic if it doesn't exist.
     * Producers key messages by client id, so one client always maps to one partition.
     */
    @Bean
    public NewTopic transactionsTopic() {
        return TopicBuilder.name(transactionsTopic)
                .partitions(partitions)
                .replicas(1)
                .build();
    }
}
