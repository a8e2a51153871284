package com.aigreentick.services.dealership.campaigns.client.dto;

import java.util.List;

/**
 * Rendered SMS handed to the transport. {@code to} is already normalized.
 */
public record SmsMessage(
        String to,
        String body,
        List<String> mediaUrls,
        String senderName,
        String idempotencyKey) {
}
