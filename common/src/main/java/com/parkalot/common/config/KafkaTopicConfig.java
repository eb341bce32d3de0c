package com.parkalot.common.config;

import com.parkalot.common.event.Topics;
import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.common.config.TopicConfig;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.kafka.config.TopicBuilder;
import org.springframework.kafka.core.KafkaAdmin;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Declares the booking and payment topics when a Kafka broker is configured.
 * Booking topics are keyed by space id, payment topics by payment id.
 */
@AutoConfiguration
@ConditionalOnClass(KafkaAdmin.class)
@ConditionalOnProperty(name = "spring.kafka.bootstrap-servers")
public class KafkaTopicConfig {

    static final Duration BOOKING_RETENTION = Duration.ofDays(7);
    static final Duration PAYMENT_RETENTION = Duration.ofDays(30);

    @Bean
    public KafkaAdmin.NewTopics parkalotTopics(
            @Value("${parkalot.kafka.replication-factor:1}") short replicationFactor) {
        return new KafkaAdmin.NewTopics(topics(replicationFactor).toArray(new NewTopic[0]));
    }

    static List<NewTopic> topics(short replicationFactor) {
        List<NewTopic> topics = new ArrayList<>();
        for (String name : Topics.BOOKING_TOPICS) {
            topics.add(topic(name, Topics.PARTITIONS_BOOKING, replicationFactor, BOOKING_RETENTION));
        }
        for (String name : Topics.PAYMENT_TOPICS) {
            topics.add(topic(name, Topics.PARTITIONS_PAYMENT, replicationFactor, PAYMENT_RETENTION));
        }
        return topics;
    }

    static NewTopic topic(String name, int partitions, short replicationFactor, Duration retention) {
        return TopicBuilder.name(name)
                .partitions(partitions)
                .replicas(replicationFactor)
                .config(TopicConfig.RETENTION_MS_CONFIG, String.valueOf(retention.toMillis()))
                .build();
    }
}
