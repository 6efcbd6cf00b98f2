package com.flagship.escrow_engine.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Lifecycle topics. Sale transitions and dispute events go to separate topics,
 * both keyed by transaction id.
 */
@Configuration
@ConditionalOnProperty(name = "kafka.topics.auto-create", havingValue = "true", matchIfMissing = true)
public class KafkaConfig {

    @Value("${kafka.topic.transactions:escrow.transactions}")
    private String transactionsTopic;

    @Value("${kafka.topic.disputes:escrow.disputes}")
    private String disputesTopic;

    @Value("${kafka.topic.partitions:3}")
    private int partitions;

    @Bean
    public NewTopic transactionsTopic() {
        return TopicBuilder.name(transactionsTopic)
                .partitions(partitions)
                .replicas(1)
                .build();
    }

    @Bean
    public NewTopic disputesTopic() {
        return TopicBuilder.name(disputesTopic)
                .partitions(partitions)
                .replicas(1)
                .build();
    }
}
