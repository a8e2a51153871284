package com.aigreentick.services.dealership.queue.service;

import java.time.Duration;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import com.aigreentick.services.dealership.queue.enums.JobType;

/**
 * Exponential backoff with a cap: base * 2^(attempt - 1), never above {@code queue.backoff-cap}.
 */
@Component
public class BackoffPolicy {

    private final Duration cap;

    public BackoffPolicy(@Value("${queue.backoff-cap:5m}") Duration cap) {
        this.cap = cap;
    }

    public Duration delayFor(JobType type, int attemptsMade) {
        Duration base = type.getBackoffBase();
        if (base.isZero() || attemptsMade < 1) {
            return base;
        }
        // 2^20 already exceeds any sensible cap
        int exponent = Math.min(attemptsMade - 1, 20);
        Duration delay = base.multipliedBy(1L << exponent);
        return delay.compareTo(cap) > 0 ? cap : delay;
    }
}
