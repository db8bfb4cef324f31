package com.flagship.vn_accounting.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.accounting-events:accounting-events}")
    private String accountingEventsTopic;

    /**
     * Keyed by aggregate id, so events of one voucher stay on one partition.
     */
    @Bean
    @ConditionalOnProperty(name = "kafka.topic.create", havingValue = "true", matchIfMissing = true)
    public NewTopic accountingEventsTopic() {
        return TopicBuilder.name(accountingEventsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }
}
