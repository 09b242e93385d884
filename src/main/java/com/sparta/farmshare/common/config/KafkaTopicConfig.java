package com.sparta.farmshare.common.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Kafka 토픽 정의
 */
@Configuration
public class KafkaTopicConfig {

    public static final String PAYOUT_EVENTS = "payout-events";
    public static final String NEWSLETTER_DISPATCH = "newsletter-dispatch";

    @Bean
    public NewTopic payoutEventsTopic() {
        return TopicBuilder.name(PAYOUT_EVENTS)
                .partitions(3)
                .replicas(1)
                .build();
    }

    @Bean
    public NewTopic newsletterDispatchTopic() {
        return TopicBuilder.name(NEWSLETTER_DISPATCH)
                .partitions(3)
                .replicas(1)
                .build();
    }
}
