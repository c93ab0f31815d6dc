package com.demo.app;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Ensure demo topics exist (useful when the broker disables auto topic creation).
 * Applied through the KafkaAdmin of evbus-kafka-starter, so only in durable mode.
 */
@Configuration
@ConditionalOnProperty(prefix = "evbus", name = "mode", havingValue = "durable")
public class DemoTopicsConfiguration {

    @Bean
    public NewTopic ordersTopic() {
        return TopicBuilder.name(DemoTopics.ORDERS)
                .partitions(3)
                .replicas(1)
                .build();
    }

    @Bean
    public NewTopic ordersDlqTopic() {
        return TopicBuilder.name(DemoTopics.ORDERS_DLQ)
                .partitions(1)
                .replicas(1)
                .build();
    }
}
