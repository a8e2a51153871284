package com.aigreentick.services.dealership.campaigns.enums;

import java.util.Locale;

public enum DeliveryStatus {
    SENT,
    DELIVERED,
    BOUNCED,
    UNDELIVERED,
    FAILED,
    SKIPPED;

    /**
     * Maps an SMS provider status callback value. Intermediate states count as SENT.
     */
    public static DeliveryStatus fromProviderValue(String value) {
        if (value == null) {
            return SENT;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "delivered", "read" -> DELIVERED;
            case "undelivered" -> UNDELIVERED;
            case "failed", "canceled" -> FAILED;
            default -> SENT;
        };
    }
}
