package com.aigreentick.services.dealership.queue.dto;

import java.time.LocalDateTime;

import com.aigreentick.services.dealership.queue.enums.JobType;

/**
 * Handle returned by the queue runtime. {@code deduplicated} is true when an existing
 * job with the same dedupe key was returned instead of creating a new one.
 */
public record EnqueuedJob(
        Long jobId,
        JobType type,
        int priority,
        LocalDateTime availableAt,
        boolean deduplicated) {
}
