package com.aigreentick.services.dealership.leads.enums;

import java.util.EnumSet;
import java.util.Set;

public enum InquiryStatus {

    NEW,
    IN_PROGRESS,
    RESPONDED,
    CLOSED;

    public Set<InquiryStatus> allowedNext() {
        return switch (this) {
            case NEW -> EnumSet.of(IN_PROGRESS, CLOSED);
            case IN_PROGRESS -> EnumSet.of(RESPONDED, CLOSED);
            case RESPONDED -> EnumSet.of(CLOSED);
            case CLOSED -> EnumSet.noneOf(InquiryStatus.class);
        };
    }

    public boolean canTransitionTo(InquiryStatus next) {
        return allowedNext().contains(next);
    }

    public boolean isResponded() {
        return this == RESPONDED || this == CLOSED;
    }
}
