package com.aigreentick.services.dealership.campaigns.kafka.producer;

import java.util.concurrent.CompletableFuture;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import com.aigreentick.services.dealership.campaigns.kafka.event.DeliveryReceiptEvent;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Component
@RequiredArgsConstructor
public class DeliveryReceiptProducer {

    private final KafkaTemplate<String, Object> kafkaTemplate;

    @Value("${kafka.topics.delivery-receipts.name}")
    private String topicName;

    /**
     * Publishes a receipt keyed by provider message id, so every callback of one message
     * lands on the same partition in arrival order.
     */
    public CompletableFuture<SendResult<String, Object>> publish(DeliveryReceiptEvent event) {
        CompletableFuture<SendResult<String, Object>> future = kafkaTemplate.send(topicName, event.partitionKey(), event);

        future.whenComplete((result, ex) -> {
            if (ex != null) {
                log.error("Failed to publish delivery receipt. type={} eventId={} messageId={}",
                        event.getType(), event.getEventId(), event.getMessageId(), ex);
            } else {
                log.debug("Delivery receipt published. type={} eventId={} partition={} offset={}",
                        event.getType(),
                        event.getEventId(),
                        result.getRecordMetadata().partition(),
                        result.getRecordMetadata().offset());
            }
        });

        return future;
    }
}
