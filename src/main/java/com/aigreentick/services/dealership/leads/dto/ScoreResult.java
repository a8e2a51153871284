package com.aigreentick.services.dealership.leads.dto;

import java.util.List;
import java.util.Map;

import com.aigreentick.services.dealership.leads.enums.ConversionGrade;
import com.aigreentick.services.dealership.leads.enums.QualificationLevel;

/**
 * Output of a scoring pass. {@code factors} holds each factor's weighted contribution.
 */
public record ScoreResult(
        double totalScore,
        double maxPossibleScore,
        double scorePercentage,
        QualificationLevel qualificationLevel,
        ConversionGrade conversionGrade,
        double conversionProbability,
        Map<String, Double> factors,
        List<String> recommendations,
        List<String> nextActions
) {
}
