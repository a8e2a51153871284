package com.aigreentick.services.dealership.leads.enums;

import java.time.Duration;

/**
 * Lead urgency. Carries the scoring multiplier and the response window that
 * drives the assignment due date and the first follow-up reminder.
 */
public enum Urgency {

    URGENT(1.5, Duration.ofMinutes(15)),
    HIGH(1.3, Duration.ofHours(1)),
    MEDIUM(1.1, Duration.ofHours(4)),
    LOW(1.0, Duration.ofHours(24));

    private final double scoreMultiplier;
    private final Duration responseWindow;

    Urgency(double scoreMultiplier, Duration responseWindow) {
        this.scoreMultiplier = scoreMultiplier;
        this.responseWindow = responseWindow;
    }

    public double getScoreMultiplier() {
        return scoreMultiplier;
    }

    public Duration getResponseWindow() {
        return responseWindow;
    }
}
