package com.aigreentick.services.dealership.leads.enums;

import java.util.EnumSet;
import java.util.Set;

public enum AssignmentStatus {

    ACTIVE,
    CONTACTED,
    FOLLOW_UP,
    CLOSED,
    EXPIRED;

    /** Statuses that count as "lead already assigned". */
    public static final Set<AssignmentStatus> OPEN = EnumSet.of(ACTIVE, CONTACTED, FOLLOW_UP);

    public Set<AssignmentStatus> allowedNext() {
        return switch (this) {
            case ACTIVE -> EnumSet.of(CONTACTED, FOLLOW_UP, CLOSED, EXPIRED);
            case CONTACTED -> EnumSet.of(FOLLOW_UP, CLOSED, EXPIRED);
            case FOLLOW_UP -> EnumSet.of(CONTACTED, CLOSED, EXPIRED);
            case CLOSED, EXPIRED -> EnumSet.noneOf(AssignmentStatus.class);
        };
    }

    public boolean canTransitionTo(AssignmentStatus next) {
        return allowedNext().contains(next);
    }

    public boolean isOpen() {
        return OPEN.contains(this);
    }
}
