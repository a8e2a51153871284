package com.aigreentick.services.dealership.campaigns.kafka.consumer;

import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.kafka.support.KafkaHeaders;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.stereotype.Component;

import com.aigreentick.services.dealership.campaigns.dto.EmailBouncePayload;
import com.aigreentick.services.dealership.campaigns.dto.EmailDeliveryPayload;
import com.aigreentick.services.dealership.campaigns.dto.SmsStatusPayload;
import com.aigreentick.services.dealership.campaigns.kafka.event.DeliveryReceiptEvent;
import com.aigreentick.services.dealership.campaigns.service.impl.SmsKeywordService;
import com.aigreentick.services.dealership.queue.dto.JobOptions;
import com.aigreentick.services.dealership.queue.enums.JobType;
import com.aigreentick.services.dealership.queue.service.QueueRuntime;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Turns provider receipts into receipt jobs. The consumer thread only enqueues; the
 * status change itself runs on the queue with its retry policy.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DeliveryReceiptConsumer {

    private final QueueRuntime queueRuntime;
    private final SmsKeywordService smsKeywordService;

    @KafkaListener(
        topics = "${kafka.topics.delivery-receipts.name}",
        groupId = "${spring.kafka.consumer.group-id}",
        containerFactory = "deliveryReceiptListenerFactory"
    )
    public void consumeReceipt(
            @Payload DeliveryReceiptEvent event,
            @Header(KafkaHeaders.RECEIVED_PARTITION) int partition,
            @Header(KafkaHeaders.OFFSET) long offset,
            Acknowledgment acknowledgment) {

        log.debug("Received delivery receipt: type={} messageId={} partition={} offset={}",
                event.getType(), event.getMessageId(), partition, offset);

        try {
            dispatch(event);
        } catch (Exception e) {
            // the receipt is dropped; the send row stays as the last known status
            log.error("Failed to handle delivery receipt. type={} messageId={} partition={} offset={}",
                    event.getType(), event.getMessageId(), partition, offset, e);
        }
        acknowledgment.acknowledge();
    }

    void dispatch(DeliveryReceiptEvent event) {
        if (event.getType() == null) {
            log.warn("Delivery receipt without type ignored. eventId={}", event.getEventId());
            return;
        }
        switch (event.getType()) {
            case EMAIL_DELIVERED -> queueRuntime.enqueue(JobType.PROCESS_EMAIL_DELIVERY,
                    EmailDeliveryPayload.builder()
                            .messageId(event.getMessageId())
                            .email(event.getRecipient())
                            .build(),
                    receiptOptions(event, "delivered"));
            case EMAIL_BOUNCED -> queueRuntime.enqueue(JobType.PROCESS_EMAIL_BOUNCE,
                    EmailBouncePayload.builder()
                            .messageId(event.getMessageId())
                            .email(event.getRecipient())
                            .campaignId(event.getCampaignId())
                            .bounceType(event.getBounceType())
                            .build(),
                    receiptOptions(event, "bounced"));
            case SMS_STATUS -> queueRuntime.enqueue(JobType.PROCESS_SMS_STATUS,
                    SmsStatusPayload.builder()
                            .messageId(event.getMessageId())
                            .phoneNumber(event.getRecipient())
                            .campaignId(event.getCampaignId())
                            .status(event.getStatus())
                            .errorMessage(event.getErrorMessage())
                            .build(),
                    receiptOptions(event, String.valueOf(event.getStatus())));
            case SMS_INBOUND -> smsKeywordService.handleInbound(event.getRecipient(), event.getBody());
        }
    }

    private static JobOptions receiptOptions(DeliveryReceiptEvent event, String status) {
        return JobOptions.builder()
                .priority(5)
                .dedupeKey("receipt:" + event.getMessageId() + ":" + status)
                .build();
    }
}
