package com.flagship.otp_rental.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Declares the topic that rental lifecycle events are published to.
 * Only registered when the outbox publisher runs.
 */
@Configuration
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
public class KafkaConfig {

    @Value("${kafka.topic.rentals:rentals}")
    private String rentalsTopic;

    @Value("${kafka.topic.partitions:3}")
    private int partitions;

    /**
     * Events are keyed by session id, so every event of one rental lands
     * on the same partition in order.
     */
    @Bean
    public NewTopic rentalsTopic() {
        return TopicBuilder.name(rentalsTopic)
                .partitions(partitions)
                .replicas(1)
                .build();
    }
}
