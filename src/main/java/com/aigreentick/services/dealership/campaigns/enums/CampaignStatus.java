package com.aigreentick.services.dealership.campaigns.enums;

import java.util.EnumSet;
import java.util.Set;

public enum CampaignStatus {

    SCHEDULED,
    SENDING,
    SENT,
    FAILED;

    public Set<CampaignStatus> allowedNext() {
        return switch (this) {
            case SCHEDULED -> EnumSet.of(SENDING, SENT, FAILED);
            case SENDING -> EnumSet.of(SENT, FAILED);
            case SENT, FAILED -> EnumSet.noneOf(CampaignStatus.class);
        };
    }

    public boolean canTransitionTo(CampaignStatus next) {
        return allowedNext().contains(next);
    }

    /** A batch may only be expanded while the campaign is in one of these. */
    public boolean isSendable() {
        return this == SCHEDULED || this == SENDING;
    }
}
