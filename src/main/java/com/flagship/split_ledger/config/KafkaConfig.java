package com.flagship.split_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Declares the mirror-events topic. Disabled with {@code kafka.topic.auto-create=false}
 * where topics are provisioned externally.
 */
@Configuration
@ConditionalOnProperty(name = "kafka.topic.auto-create", havingValue = "true", matchIfMissing = true)
public class KafkaConfig {

    @Value("${kafka.topic.mirror-events:mirror-events}")
    private String mirrorEventsTopic;

    @Value("${kafka.topic.partitions:3}")
    private int partitions;

    @Bean
    public NewTopic mirrorEventsTopic() {
        return TopicBuilder.name(mirrorEventsTopic)
                .partitions(partitions)
                .replicas(1)
                .build();
    }
}
