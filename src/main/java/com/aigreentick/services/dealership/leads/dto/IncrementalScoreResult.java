package com.aigreentick.services.dealership.leads.dto;

import com.aigreentick.services.dealership.leads.enums.QualificationLevel;

/**
 * Result of an engagement-driven score update. {@code fullRecalculationQueued} is set
 * when the customer had no score yet.
 */
public record IncrementalScoreResult(
        Long customerId,
        Long leadScoreId,
        double previousScore,
        double newScore,
        QualificationLevel previousLevel,
        QualificationLevel newLevel,
        boolean fullRecalculationQueued
) {

    public static IncrementalScoreResult fullRecalculationQueued(Long customerId) {
        return new IncrementalScoreResult(customerId, null, 0, 0, null, null, true);
    }

    public boolean becameQualified() {
        return newLevel == QualificationLevel.QUALIFIED && previousLevel != QualificationLevel.QUALIFIED;
    }
}
