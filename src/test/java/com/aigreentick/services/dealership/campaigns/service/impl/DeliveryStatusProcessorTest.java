package com.aigreentick.services.dealership.campaigns.service.impl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.aigreentick.services.dealership.campaigns.dto.EmailBouncePayload;
import com.aigreentick.services.dealership.campaigns.dto.SmsStatusPayload;
import com.aigreentick.services.dealership.campaigns.enums.BounceType;
import com.aigreentick.services.dealership.campaigns.enums.Channel;
import com.aigreentick.services.dealership.campaigns.enums.DeliveryStatus;
import com.aigreentick.services.dealership.campaigns.model.DeliveryLog;
import com.aigreentick.services.dealership.campaigns.repository.CampaignRepository;
import com.aigreentick.services.dealership.campaigns.repository.DeliveryLogRepository;
import com.aigreentick.services.dealership.leads.repository.CustomerRepository;

@ExtendWith(MockitoExtension.class)
class DeliveryStatusProcessorTest {

    @Mock
    private DeliveryLogRepository deliveryLogRepository;

    @Mock
    private DeliveryLogger deliveryLogger;

    @Mock
    private CampaignRepository campaignRepository;

    @Mock
    private CustomerRepository customerRepository;

    private DeliveryStatusProcessor processor;

    @BeforeEach
    void setUp() {
        processor = new DeliveryStatusProcessor(deliveryLogRepository, deliveryLogger, campaignRepository,
                customerRepository, Clock.fixed(Instant.parse("2024-05-10T09:00:00Z"), ZoneOffset.UTC));
    }

    private static DeliveryLog sentRow(Long campaignId) {
        return DeliveryLog.builder()
                .channel(Channel.SMS)
                .campaignId(campaignId)
                .customerId(21L)
                .recipient("+38349123456")
                .status(DeliveryStatus.SENT)
                .providerMessageId("SM1")
                .build();
    }

    @Test
    @DisplayName("A permanent bounce counts against the campaign and marks the address bounced")
    void permanentBounce() {
        // given
        when(deliveryLogRepository.findFirstByProviderMessageIdAndStatusOrderByIdAsc("re_1", DeliveryStatus.SENT))
                .thenReturn(Optional.of(sentRow(8L)));

        // when
        boolean applied = processor.processEmailBounce(EmailBouncePayload.builder()
                .messageId("re_1").email("gone@example.com").bounceType(BounceType.PERMANENT).build());

        // then
        assertThat(applied).isTrue();
        verify(deliveryLogger).status(eq(Channel.EMAIL), eq(8L), eq(21L), eq("gone@example.com"),
                eq(DeliveryStatus.BOUNCED), eq("re_1"), anyString());
        verify(campaignRepository).incrementBounced(eq(8L), any());
        verify(customerRepository).markEmailBounced(eq("gone@example.com"), any());
    }

    @Test
    @DisplayName("A transient bounce leaves the customer address usable")
    void transientBounce() {
        processor.processEmailBounce(EmailBouncePayload.builder()
                .messageId("re_2").email("full@example.com").campaignId(8L).bounceType(BounceType.TRANSIENT).build());

        verify(campaignRepository).incrementBounced(eq(8L), any());
        verifyNoInteractions(customerRepository);
    }

    @Test
    @DisplayName("A repeated bounce callback is ignored")
    void repeatedBounceIgnored() {
        when(deliveryLogRepository.existsByProviderMessageIdAndStatus("re_1", DeliveryStatus.BOUNCED)).thenReturn(true);

        boolean applied = processor.processEmailBounce(EmailBouncePayload.builder()
                .messageId("re_1").email("gone@example.com").bounceType(BounceType.PERMANENT).build());

        assertThat(applied).isFalse();
        verifyNoInteractions(deliveryLogger, campaignRepository, customerRepository);
    }

    @Test
    @DisplayName("A delivered SMS resolves its campaign from the SENT row")
    void smsDelivered() {
        // given
        when(deliveryLogRepository.findFirstByProviderMessageIdAndStatusOrderByIdAsc("SM1", DeliveryStatus.SENT))
                .thenReturn(Optional.of(sentRow(5L)));

        // when
        boolean applied = processor.processSmsStatus(SmsStatusPayload.builder()
                .messageId("SM1").status(DeliveryStatus.DELIVERED).build());

        // then
        assertThat(applied).isTrue();
        verify(campaignRepository).incrementDelivered(eq(5L), any());
        verify(campaignRepository, never()).incrementFailed(any(), any());
    }

    @Test
    @DisplayName("An undelivered SMS counts as failed")
    void smsUndelivered() {
        processor.processSmsStatus(SmsStatusPayload.builder()
                .messageId("SM2").phoneNumber("+38349123456").campaignId(5L)
                .status(DeliveryStatus.UNDELIVERED).errorMessage("30003").build());

        verify(deliveryLogger).status(Channel.SMS, 5L, null, "+38349123456", DeliveryStatus.UNDELIVERED, "SM2", "30003");
        verify(campaignRepository).incrementFailed(eq(5L), any());
    }

    @Test
    @DisplayName("Intermediate SMS states are not recorded")
    void intermediateStatusIgnored() {
        boolean applied = processor.processSmsStatus(SmsStatusPayload.builder()
                .messageId("SM3").status(DeliveryStatus.SENT).build());

        assertThat(applied).isFalse();
        verifyNoInteractions(deliveryLogger, campaignRepository);
    }
}
