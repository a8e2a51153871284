package com.aigreentick.services.dealership.campaigns.enums;

import java.util.Locale;

public enum BounceType {

    /** Address does not exist; the customer stops receiving email. */
    PERMANENT,
    TRANSIENT,
    COMPLAINT;

    public static BounceType fromProviderValue(String value) {
        if (value == null) {
            return TRANSIENT;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "permanent", "hard", "hard_bounce", "bounce" -> PERMANENT;
            case "complaint", "spam", "spamreport" -> COMPLAINT;
            default -> TRANSIENT;
        };
    }
}
