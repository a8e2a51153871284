package com.aigreentick.services.dealership.leads.kafka.producer;

import java.util.concurrent.CompletableFuture;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import com.aigreentick.services.dealership.leads.kafka.event.LeadLifecycleEvent;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Component
@RequiredArgsConstructor
public class LeadEventProducer {

    private final KafkaTemplate<String, Object> kafkaTemplate;

    @Value("${kafka.topics.lead-events.name}")
    private String topicName;

    /**
     * Publishes a lead lifecycle event. Publishing is fire-and-forget; a failed send is
     * logged and does not undo the state change it reports.
     */
    public CompletableFuture<SendResult<String, Object>> publish(LeadLifecycleEvent event) {
        CompletableFuture<SendResult<String, Object>> future = kafkaTemplate.send(topicName, event.leadKey(), event);

        future.whenComplete((result, ex) -> {
            if (ex != null) {
                log.error("Failed to publish lead event. type={} eventId={} customerId={} inquiryId={}",
                        event.getType(), event.getEventId(), event.getCustomerId(), event.getInquiryId(), ex);
            } else {
                log.debug("Lead event published. type={} eventId={} partition={} offset={}",
                        event.getType(),
                        event.getEventId(),
                        result.getRecordMetadata().partition(),
                        result.getRecordMetadata().offset());
            }
        });

        return future;
    }
}
