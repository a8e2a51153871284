package com.aigreentick.services.dealership.queue.dto;

import java.time.Duration;

import com.aigreentick.services.dealership.queue.enums.DedupePolicy;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

@Getter
@Builder(toBuilder = true)
@ToString
public class JobOptions {

    public static final int DEFAULT_PRIORITY = 10;

    // lower value runs first
    @Builder.Default
    private final int priority = DEFAULT_PRIORITY;

    @Builder.Default
    private final Duration delay = Duration.ZERO;

    // null falls back to the job type default
    private final Integer maxAttempts;

    private final String dedupeKey;

    @Builder.Default
    private final DedupePolicy dedupePolicy = DedupePolicy.IN_FLIGHT;

    public static JobOptions defaults() {
        return JobOptions.builder().build();
    }

    public static JobOptions withPriority(int priority) {
        return JobOptions.builder().priority(priority).build();
    }

    public static JobOptions delayed(int priority, Duration delay) {
        return JobOptions.builder().priority(priority).delay(delay).build();
    }
}
