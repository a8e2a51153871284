package com.aigreentick.services.dealership.queue.enums;

public enum JobOutcome {
    COMPLETED,
    RETRY_SCHEDULED,
    FAILED
}
