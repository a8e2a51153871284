package com.aigreentick.services.dealership.campaigns.service.impl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.aigreentick.services.dealership.campaigns.client.dto.EmailMessage;
import com.aigreentick.services.dealership.campaigns.client.dto.EmailSendResult;
import com.aigreentick.services.dealership.campaigns.client.service.EmailTransport;
import com.aigreentick.services.dealership.campaigns.dto.SendResult;
import com.aigreentick.services.dealership.campaigns.dto.SendSingleEmailPayload;
import com.aigreentick.services.dealership.campaigns.enums.Channel;
import com.aigreentick.services.dealership.campaigns.enums.DeliveryStatus;
import com.aigreentick.services.dealership.campaigns.repository.CampaignRepository;
import com.aigreentick.services.dealership.campaigns.repository.DeliveryLogRepository;
import com.aigreentick.services.dealership.campaigns.service.impl.DeliveryLogger.Entry;
import com.aigreentick.services.dealership.common.exception.NonRetryableJobException;
import com.aigreentick.services.dealership.common.exception.ProviderException;
import com.aigreentick.services.dealership.config.DealershipProperties;

@ExtendWith(MockitoExtension.class)
class EmailSendWorkerTest {

    @Mock
    private EmailTransport emailTransport;

    @Mock
    private OptOutGate optOutGate;

    @Mock
    private DeliveryLogger deliveryLogger;

    @Mock
    private DeliveryLogRepository deliveryLogRepository;

    @Mock
    private CampaignRepository campaignRepository;

    @Captor
    private ArgumentCaptor<EmailMessage> messageCaptor;

    @Captor
    private ArgumentCaptor<Entry> entryCaptor;

    private EmailSendWorker worker;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-05-10T09:00:00Z"), ZoneOffset.UTC);
        worker = new EmailSendWorker(emailTransport, optOutGate, new PersonalizationEngine(new DealershipProperties(), clock),
                deliveryLogger, deliveryLogRepository, campaignRepository, clock);
    }

    private static SendSingleEmailPayload campaignEmail() {
        return SendSingleEmailPayload.builder()
                .to("arben@example.com")
                .subject("News for {{firstName}}")
                .content("Hello {{firstName}}")
                .customerId(11L)
                .campaignId(3L)
                .personalizationData(Map.of("firstName", "Arben"))
                .priority(2)
                .dedupeKey("key-1")
                .build();
    }

    @Test
    @DisplayName("An opted-out recipient gets a SKIPPED row and the provider is never called")
    void optedOutIsSkipped() {
        // given
        when(optOutGate.isOptedOut(Channel.EMAIL, "arben@example.com")).thenReturn(true);

        // when
        SendResult result = worker.send(campaignEmail());

        // then
        assertThat(result.status()).isEqualTo(DeliveryStatus.SKIPPED);
        verify(deliveryLogger).skipped(entryCaptor.capture(), eq("Recipient opted out"));
        assertThat(entryCaptor.getValue().campaignId()).isEqualTo(3L);
        verifyNoInteractions(emailTransport);
    }

    @Test
    @DisplayName("A successful send is personalized, carries the idempotency key and logs a SENT row")
    void sendsAndLogs() {
        // given
        when(emailTransport.send(any())).thenReturn(new EmailSendResult("re_123"));

        // when
        SendResult result = worker.send(campaignEmail());

        // then
        assertThat(result.status()).isEqualTo(DeliveryStatus.SENT);
        assertThat(result.messageId()).isEqualTo("re_123");
        verify(emailTransport).send(messageCaptor.capture());
        assertThat(messageCaptor.getValue().subject()).isEqualTo("News for Arben");
        assertThat(messageCaptor.getValue().text()).isEqualTo("Hello Arben");
        assertThat(messageCaptor.getValue().idempotencyKey()).isEqualTo("key-1");
        verify(deliveryLogger).sent(any(), eq("re_123"), isNull(), isNull());
    }

    @Test
    @DisplayName("Internal notifications skip the opt-out check")
    void notificationsSkipOptOut() {
        when(emailTransport.send(any())).thenReturn(new EmailSendResult("re_9"));

        worker.send(SendSingleEmailPayload.builder().to("rep@autoani.com").subject("New lead").content("Call now").build());

        verifyNoInteractions(optOutGate);
    }

    @Test
    @DisplayName("A message already sent under the same dedupe key is not sent again")
    void alreadySentIsNotRepeated() {
        when(deliveryLogRepository.existsByDedupeKeyAndStatus("key-1", DeliveryStatus.SENT)).thenReturn(true);

        SendResult result = worker.send(campaignEmail());

        assertThat(result.status()).isEqualTo(DeliveryStatus.SKIPPED);
        verifyNoInteractions(emailTransport);
    }

    @Test
    @DisplayName("Transient provider failures log FAILED and are rethrown for retry")
    void transientFailureIsRetried() {
        // given
        ProviderException failure = ProviderException.fromStatus("resend", 503, "unavailable");
        when(emailTransport.send(any())).thenThrow(failure);

        // when / then
        assertThatThrownBy(() -> worker.send(campaignEmail())).isSameAs(failure);
        verify(deliveryLogger).failed(any(), anyString());
        verify(campaignRepository, never()).incrementFailed(any(), any());
    }

    @Test
    @DisplayName("Permanent provider failures are not retried and count as failed")
    void permanentFailureIsFinal() {
        // given
        when(emailTransport.send(any())).thenThrow(ProviderException.fromStatus("resend", 422, "invalid address"));

        // when / then
        assertThatThrownBy(() -> worker.send(campaignEmail())).isInstanceOf(NonRetryableJobException.class);
        verify(deliveryLogger).failed(any(), anyString());
        verify(campaignRepository).incrementFailed(eq(3L), any());
    }
}
