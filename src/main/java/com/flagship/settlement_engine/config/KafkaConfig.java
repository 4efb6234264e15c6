package com.flagship.settlement_engine.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Notification topics, one per engine plus one for ledger funding.
 * Only declared when the outbox publisher runs.
 */
@Configuration
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
public class KafkaConfig {

    private static final int PARTITIONS = 3;

    @Value("${kafka.topic.escrow:settlement.escrow}")
    private String escrowTopic;

    @Value("${kafka.topic.voting:settlement.voting}")
    private String votingTopic;

    @Value("${kafka.topic.marketplace:settlement.marketplace}")
    private String marketplaceTopic;

    @Value("${kafka.topic.ledger:settlement.ledger}")
    private String ledgerTopic;

    @Bean
    public NewTopic escrowTopic() {
        return topic(escrowTopic);
    }

    @Bean
    public NewTopic votingTopic() {
        return topic(votingTopic);
    }

    @Bean
    public NewTopic marketplaceTopic() {
        return topic(marketplaceTopic);
    }

    @Bean
    public NewTopic ledgerTopic() {
        return topic(ledgerTopic);
    }

    private NewTopic topic(String name) {
        return TopicBuilder.name(name)
                .partitions(PARTITIONS)
                .replicas(1)
                .build();
    }
}
