package com.flagship.token_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Topics the outbox publisher writes to, created if missing.
 */
@Configuration
public class KafkaConfig {

    @Value("${ledger.kafka.topics.tokens:token-ledger.tokens}")
    private String tokensTopic;

    @Value("${ledger.kafka.topics.settlements:token-ledger.settlements}")
    private String settlementsTopic;

    @Value("${ledger.kafka.partitions:3}")
    private int partitions;

    @Bean
    public NewTopic tokensTopic() {
        return TopicBuilder.name(tokensTopic)
                .partitions(partitions)
                .replicas(1)
                .build();
    }

    @Bean
    public NewTopic settlementsTopic() {
        return TopicBuilder.name(settlementsTopic)
                .partitions(partitions)
                .replicas(1)
                .build();
    }
}
