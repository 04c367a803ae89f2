package com.flagship.value_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Kafka topics used by the ledger.
 *
 * - purchases: settled purchases consumed to earn points
 * - ledger audit: audit events shipped from the outbox
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.purchases:purchases-settled}")
    private String purchasesTopic;

    @Value("${kafka.topic.ledger-audit:ledger-audit}")
    private String ledgerAuditTopic;

    /**
     * Keyed by payment id; 3 partitions for parallel consumption.
     */
    @Bean
    public NewTopic purchasesTopic() {
        return TopicBuilder.name(purchasesTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }

    /**
     * Keyed by aggregate id so events for one account stay ordered.
     */
    @Bean
    public NewTopic ledgerAuditTopic() {
        return TopicBuilder.name(ledgerAuditTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }
}
