package com.aigreentick.services.dealership.campaigns.kafka.consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.support.Acknowledgment;

import com.aigreentick.services.dealership.campaigns.dto.EmailBouncePayload;
import com.aigreentick.services.dealership.campaigns.dto.SmsStatusPayload;
import com.aigreentick.services.dealership.campaigns.enums.BounceType;
import com.aigreentick.services.dealership.campaigns.enums.DeliveryStatus;
import com.aigreentick.services.dealership.campaigns.kafka.event.DeliveryReceiptEvent;
import com.aigreentick.services.dealership.campaigns.service.impl.SmsKeywordService;
import com.aigreentick.services.dealership.queue.InMemoryQueueRuntime;
import com.aigreentick.services.dealership.queue.InMemoryQueueRuntime.RecordedJob;
import com.aigreentick.services.dealership.queue.enums.JobType;

@ExtendWith(MockitoExtension.class)
class DeliveryReceiptConsumerTest {

    @Mock
    private SmsKeywordService smsKeywordService;
    @Mock
    private Acknowledgment acknowledgment;

    private InMemoryQueueRuntime queueRuntime;
    private DeliveryReceiptConsumer consumer;

    @BeforeEach
    void setUp() {
        queueRuntime = new InMemoryQueueRuntime();
        consumer = new DeliveryReceiptConsumer(queueRuntime, smsKeywordService);
    }

    @Test
    @DisplayName("A bounce receipt becomes a bounce processing job")
    void bounceReceipt() {
        consumer.consumeReceipt(
                DeliveryReceiptEvent.emailBounced("re_123", "arben@example.com", BounceType.PERMANENT, 1L),
                0, 10L, acknowledgment);

        RecordedJob job = queueRuntime.jobsOfType(JobType.PROCESS_EMAIL_BOUNCE).get(0);
        EmailBouncePayload payload = job.payloadAs(EmailBouncePayload.class);
        assertThat(payload.getMessageId()).isEqualTo("re_123");
        assertThat(payload.getBounceType()).isEqualTo(BounceType.PERMANENT);
        assertThat(job.options().getDedupeKey()).isEqualTo("receipt:re_123:bounced");
        verify(acknowledgment).acknowledge();
    }

    @Test
    @DisplayName("A repeated SMS status callback is queued once")
    void smsStatusDeduplicated() {
        DeliveryReceiptEvent event = DeliveryReceiptEvent.smsStatus("SM1", "+38349123456",
                DeliveryStatus.DELIVERED, null, 1L);

        consumer.consumeReceipt(event, 0, 11L, acknowledgment);
        consumer.consumeReceipt(event, 0, 12L, acknowledgment);

        assertThat(queueRuntime.jobsOfType(JobType.PROCESS_SMS_STATUS)).singleElement()
                .satisfies(job -> assertThat(job.payloadAs(SmsStatusPayload.class).getStatus())
                        .isEqualTo(DeliveryStatus.DELIVERED));
    }

    @Test
    @DisplayName("Inbound SMS goes to keyword handling")
    void inboundSms() {
        consumer.consumeReceipt(DeliveryReceiptEvent.smsInbound("+38349123456", "STOP", 1L), 0, 13L, acknowledgment);

        verify(smsKeywordService).handleInbound("+38349123456", "STOP");
        assertThat(queueRuntime.jobs()).isEmpty();
    }

    @Test
    @DisplayName("A receipt that fails to process is still acknowledged")
    void failureStillAcknowledged() {
        doThrow(new IllegalStateException("database unavailable"))
                .when(smsKeywordService).handleInbound("+38349123456", "START");

        consumer.consumeReceipt(DeliveryReceiptEvent.smsInbound("+38349123456", "START", 1L), 0, 14L, acknowledgment);

        verify(acknowledgment).acknowledge();
    }

    @Test
    @DisplayName("Receipts without a type are ignored")
    void untypedReceipt() {
        consumer.consumeReceipt(DeliveryReceiptEvent.builder().messageId("x").build(), 0, 15L, acknowledgment);

        assertThat(queueRuntime.jobs()).isEmpty();
        verifyNoInteractions(smsKeywordService);
        verify(acknowledgment).acknowledge();
    }
}
