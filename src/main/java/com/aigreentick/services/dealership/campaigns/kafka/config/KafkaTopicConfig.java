package com.aigreentick.services.dealership.campaigns.kafka.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

import lombok.extern.slf4j.Slf4j;

@Configuration
@Slf4j
public class KafkaTopicConfig {

    @Value("${kafka.topics.delivery-receipts.name}")
    private String deliveryReceiptsTopicName;

    @Value("${kafka.topics.delivery-receipts.partitions:10}")
    private int deliveryReceiptsPartitions;

    @Value("${kafka.topics.delivery-receipts.replicas:1}")
    private int deliveryReceiptsReplicas;

    @Value("${kafka.topics.lead-events.name}")
    private String leadEventsTopicName;

    @Value("${kafka.topics.lead-events.partitions:3}")
    private int leadEventsPartitions;

    @Value("${kafka.topics.lead-events.replicas:1}")
    private int leadEventsReplicas;

    /**
     * Provider receipts and inbound SMS, keyed by provider message id.
     */
    @Bean
    public NewTopic deliveryReceiptsTopic() {
        NewTopic topic = TopicBuilder.name(deliveryReceiptsTopicName)
                .partitions(deliveryReceiptsPartitions)
                .replicas(deliveryReceiptsReplicas)
                .config("retention.ms", "604800000") // 7 days
                .config("compression.type", "snappy")
                .config("min.insync.replicas", "1")
                .build();

        log.info("Delivery receipts topic: name={} partitions={} replicas={}",
                deliveryReceiptsTopicName, deliveryReceiptsPartitions, deliveryReceiptsReplicas);
        return topic;
    }

    /**
     * Lead assignment events for operations tooling, keyed by lead.
     */
    @Bean
    public NewTopic leadEventsTopic() {
        NewTopic topic = TopicBuilder.name(leadEventsTopicName)
                .partitions(leadEventsPartitions)
                .replicas(leadEventsReplicas)
                .config("retention.ms", "2592000000") // 30 days
                .config("compression.type", "snappy")
                .build();

        log.info("Lead events topic: name={} partitions={} replicas={}",
                leadEventsTopicName, leadEventsPartitions, leadEventsReplicas);
        return topic;
    }
}
