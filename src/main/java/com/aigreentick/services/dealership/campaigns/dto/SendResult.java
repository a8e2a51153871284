package com.aigreentick.services.dealership.campaigns.dto;

import java.math.BigDecimal;

import com.aigreentick.services.dealership.campaigns.enums.DeliveryStatus;

/**
 * Result of one individual send. A SKIPPED result never reached the provider.
 */
public record SendResult(
        DeliveryStatus status,
        String messageId,
        BigDecimal cost,
        Integer segments,
        String reason) {

    public static SendResult sent(String messageId, BigDecimal cost, Integer segments) {
        return new SendResult(DeliveryStatus.SENT, messageId, cost, segments, null);
    }

    public static SendResult skipped(String reason) {
        return new SendResult(DeliveryStatus.SKIPPED, null, null, null, reason);
    }
}
