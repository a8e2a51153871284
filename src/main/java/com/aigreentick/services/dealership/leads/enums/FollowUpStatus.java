package com.aigreentick.services.dealership.leads.enums;

import java.util.EnumSet;
import java.util.Set;

public enum FollowUpStatus {

    PENDING,
    COMPLETED,
    CANCELLED;

    public Set<FollowUpStatus> allowedNext() {
        return this == PENDING ? EnumSet.of(COMPLETED, CANCELLED) : EnumSet.noneOf(FollowUpStatus.class);
    }

    public boolean canTransitionTo(FollowUpStatus next) {
        return allowedNext().contains(next);
    }
}
