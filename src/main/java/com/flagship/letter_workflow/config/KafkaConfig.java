package com.flagship.letter_workflow.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Kafka topic for letter and subscription notifications.
 *
 * Only declared when the outbox publisher runs, so that tests and
 * deployments without a broker do not try to reach one at startup.
 */
@Configuration
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
public class KafkaConfig {

    @Value("${kafka.topic.letters:letter-notifications}")
    private String lettersTopic;

    /**
     * Keyed by aggregate id, so three partitions keep per-letter ordering.
     */
    @Bean
    public NewTopic lettersTopic() {
        return TopicBuilder.name(lettersTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }
}
