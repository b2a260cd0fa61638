package com.tally.ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Declares the ledger event topic when event publication is enabled.
 */
@Configuration
@ConditionalOnProperty(prefix = "accounting.events", name = "enabled", havingValue = "true")
public class KafkaTopicConfig {

    @Bean
    public NewTopic ledgerEventsTopic(AccountingProperties properties) {
        return TopicBuilder.name(properties.getEvents().getTopic())
            .partitions(3)
            .replicas(1)
            .build();
    }
}
