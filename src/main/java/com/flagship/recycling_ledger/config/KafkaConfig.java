package com.flagship.recycling_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Kafka topic for ledger events (deposits recorded, totals rebuilt).
 *
 * Events are keyed by user id, so partitioning keeps each user's events in order.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.deposits:deposits}")
    private String depositsTopic;

    @Bean
    public NewTopic depositsTopic() {
        return TopicBuilder.name(depositsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }
}
