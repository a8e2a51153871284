package com.aigreentick.services.dealership.campaigns.service.impl;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;

import org.springframework.stereotype.Component;

import com.aigreentick.services.dealership.campaigns.enums.Channel;
import com.aigreentick.services.dealership.campaigns.enums.DeliveryStatus;
import com.aigreentick.services.dealership.campaigns.model.DeliveryLog;
import com.aigreentick.services.dealership.campaigns.repository.DeliveryLogRepository;

import lombok.RequiredArgsConstructor;

/**
 * Appends delivery log rows. One row per send attempt and per provider status callback.
 */
@Component
@RequiredArgsConstructor
public class DeliveryLogger {

    private static final int MAX_ERROR_LENGTH = 1000;

    private final DeliveryLogRepository deliveryLogRepository;
    private final Clock clock;

    /**
     * Message details of one delivery row; provider fields stay null until the provider answered.
     */
    public record Entry(
            Channel channel,
            Long campaignId,
            Long customerId,
            String recipient,
            String subject,
            String content,
            String dedupeKey) {
    }

    public DeliveryLog skipped(Entry entry, String reason) {
        return insert(entry, DeliveryStatus.SKIPPED, null, null, null, reason);
    }

    public DeliveryLog sent(Entry entry, String providerMessageId, BigDecimal cost, Integer segments) {
        return insert(entry, DeliveryStatus.SENT, providerMessageId, cost, segments, null);
    }

    public DeliveryLog failed(Entry entry, String errorMessage) {
        return insert(entry, DeliveryStatus.FAILED, null, null, null, errorMessage);
    }

    /**
     * Status row written for a provider callback on an earlier send.
     */
    public DeliveryLog status(Channel channel, Long campaignId, Long customerId, String recipient,
            DeliveryStatus status, String providerMessageId, String errorMessage) {
        Entry entry = new Entry(channel, campaignId, customerId, recipient, null, null, null);
        return insert(entry, status, providerMessageId, null, null, errorMessage);
    }

    private DeliveryLog insert(Entry entry, DeliveryStatus status, String providerMessageId,
            BigDecimal cost, Integer segments, String errorMessage) {
        return deliveryLogRepository.save(DeliveryLog.builder()
                .channel(entry.channel())
                .campaignId(entry.campaignId())
                .customerId(entry.customerId())
                .recipient(entry.recipient())
                .subject(entry.subject())
                .content(entry.content())
                .status(status)
                .providerMessageId(providerMessageId)
                .cost(cost)
                .segments(segments)
                .errorMessage(truncate(errorMessage))
                .dedupeKey(entry.dedupeKey())
                .createdAt(LocalDateTime.now(clock))
                .build());
    }

    private static String truncate(String message) {
        if (message == null || message.length() <= MAX_ERROR_LENGTH) {
            return message;
        }
        return message.substring(0, MAX_ERROR_LENGTH);
    }
}
