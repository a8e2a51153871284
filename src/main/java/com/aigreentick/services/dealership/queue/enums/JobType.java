package com.aigreentick.services.dealership.queue.enums;

import java.time.Duration;

/**
 * Job types accepted by the queue runtime. Each type carries its worker concurrency,
 * the default number of attempts and the base delay of its exponential backoff.
 * Campaign orchestration types run one at a time and are never retried.
 */
public enum JobType {

    SEND_SINGLE_EMAIL("send_single_email", 5, 5, Duration.ofSeconds(5)),
    SEND_EMAIL_CAMPAIGN("send_email_campaign", 1, 1, Duration.ZERO),
    PROCESS_EMAIL_BOUNCE("process_email_bounce", 10, 3, Duration.ofSeconds(2)),
    PROCESS_EMAIL_DELIVERY("process_email_delivery", 10, 3, Duration.ofSeconds(2)),
    SEND_SINGLE_SMS("send_single_sms", 3, 3, Duration.ofSeconds(3)),
    SEND_SMS_CAMPAIGN("send_sms_campaign", 1, 1, Duration.ZERO),
    PROCESS_SMS_STATUS("process_sms_status", 10, 3, Duration.ofSeconds(2)),
    CALCULATE_LEAD_SCORE("calculate_lead_score", 3, 2, Duration.ofSeconds(5)),
    ASSIGN_LEAD("assign_lead", 2, 2, Duration.ofSeconds(5)),
    UPDATE_LEAD_SCORE("update_lead_score", 5, 2, Duration.ofSeconds(5)),
    FOLLOW_UP_REMINDER("follow_up_reminder", 3, 2, Duration.ofSeconds(5));

    private final String code;
    private final int defaultConcurrency;
    private final int defaultMaxAttempts;
    private final Duration backoffBase;

    JobType(String code, int defaultConcurrency, int defaultMaxAttempts, Duration backoffBase) {
        this.code = code;
        this.defaultConcurrency = defaultConcurrency;
        this.defaultMaxAttempts = defaultMaxAttempts;
        this.backoffBase = backoffBase;
    }

    public String getCode() {
        return code;
    }

    public int getDefaultConcurrency() {
        return defaultConcurrency;
    }

    public int getDefaultMaxAttempts() {
        return defaultMaxAttempts;
    }

    public Duration getBackoffBase() {
        return backoffBase;
    }

    public static JobType fromCode(String code) {
        for (JobType t : values()) {
            if (t.code.equalsIgnoreCase(code)) return t;
        }
        throw new IllegalArgumentException("Unknown JobType code: " + code);
    }
}
