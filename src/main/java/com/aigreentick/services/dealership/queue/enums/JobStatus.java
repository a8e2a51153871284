package com.aigreentick.services.dealership.queue.enums;

import java.util.EnumSet;
import java.util.Set;

public enum JobStatus {

    WAITING,
    ACTIVE,
    COMPLETED,
    FAILED;

    public Set<JobStatus> allowedNext() {
        return switch (this) {
            case WAITING -> EnumSet.of(ACTIVE);
            // back to WAITING on retry or stalled-job recovery
            case ACTIVE -> EnumSet.of(COMPLETED, FAILED, WAITING);
            case COMPLETED, FAILED -> EnumSet.noneOf(JobStatus.class);
        };
    }

    public boolean canTransitionTo(JobStatus next) {
        return allowedNext().contains(next);
    }

    public boolean isTerminal() {
        return allowedNext().isEmpty();
    }
}
