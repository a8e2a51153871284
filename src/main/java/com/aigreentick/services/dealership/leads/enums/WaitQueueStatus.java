package com.aigreentick.services.dealership.leads.enums;

import java.util.EnumSet;
import java.util.Set;

public enum WaitQueueStatus {

    WAITING,
    ASSIGNED,
    EXPIRED;

    public Set<WaitQueueStatus> allowedNext() {
        return switch (this) {
            case WAITING -> EnumSet.of(ASSIGNED, EXPIRED);
            case ASSIGNED, EXPIRED -> EnumSet.noneOf(WaitQueueStatus.class);
        };
    }

    public boolean canTransitionTo(WaitQueueStatus next) {
        return allowedNext().contains(next);
    }
}
