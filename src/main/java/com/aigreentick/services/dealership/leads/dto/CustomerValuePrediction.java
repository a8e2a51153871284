package com.aigreentick.services.dealership.leads.dto;

import java.util.Map;

public record CustomerValuePrediction(
        Long customerId,
        long predictedValue,
        double confidence,
        String timeframe,
        double marketAdjustment,
        Map<String, Double> factors
) {
}
