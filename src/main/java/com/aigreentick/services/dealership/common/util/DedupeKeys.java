package com.aigreentick.services.dealership.common.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Stable keys used to recognise a repeated provider send of the same campaign message.
 * The same key is stored on the queue job, the delivery log row and sent to the provider
 * as its idempotency key.
 */
public final class DedupeKeys {

    private DedupeKeys() {
    }

    public static String campaignSend(String channel, Long campaignId, String recipient, int batchStart) {
        String raw = channel + "|" + campaignId + "|" + recipient.trim().toLowerCase(Locale.ROOT) + "|" + batchStart;
        return sha256(raw);
    }

    public static String leadAssignment(Long customerId, Long inquiryId) {
        return "assign:" + customerId + ":" + inquiryId;
    }

    static String sha256(String raw) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(raw.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
