package com.aigreentick.services.dealership.leads.service.impl;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.stereotype.Component;

import com.aigreentick.services.dealership.leads.model.Inquiry;
import com.aigreentick.services.dealership.leads.model.Vehicle;

/**
 * Weighted score of a standalone inquiry (contact fields only, no customer history).
 */
@Component
public class InquiryScoringModel {

    public static final double INQUIRY_TYPE_WEIGHT = 0.30;
    public static final double COMPLETENESS_WEIGHT = 0.20;
    public static final double RESPONSE_TIME_WEIGHT = 0.25;
    public static final double VEHICLE_APPEAL_WEIGHT = 0.15;
    public static final double TIMING_WEIGHT = 0.10;

    static final int DEFAULT_TYPE_SCORE = 40;
    static final double NEUTRAL_APPEAL = 50;

    /**
     * Raw factor scores on 0..100.
     *
     * @param vehicle           linked vehicle, may be null
     * @param averageSimilarPrice average price of comparable available stock, may be null
     */
    public Map<String, Double> rawFactors(Inquiry inquiry, Vehicle vehicle, Double averageSimilarPrice, LocalDateTime now) {
        Map<String, Double> raw = new LinkedHashMap<>();
        raw.put("inquiryType", inquiryTypeScore(inquiry));
        raw.put("contactCompleteness", completenessScore(inquiry));
        raw.put("responseTime", responseTimeScore(inquiry, now));
        raw.put("vehicleAppeal", vehicleAppealScore(vehicle, averageSimilarPrice, now));
        raw.put("timing", timingScore(inquiry, now));
        return raw;
    }

    public Map<String, Double> weigh(Map<String, Double> raw) {
        Map<String, Double> weighted = new LinkedHashMap<>();
        weighted.put("inquiryType", raw.get("inquiryType") * INQUIRY_TYPE_WEIGHT);
        weighted.put("contactCompleteness", raw.get("contactCompleteness") * COMPLETENESS_WEIGHT);
        weighted.put("responseTime", raw.get("responseTime") * RESPONSE_TIME_WEIGHT);
        weighted.put("vehicleAppeal", raw.get("vehicleAppeal") * VEHICLE_APPEAL_WEIGHT);
        weighted.put("timing", raw.get("timing") * TIMING_WEIGHT);
        return weighted;
    }

    static double inquiryTypeScore(Inquiry inquiry) {
        return inquiry.getType() == null ? DEFAULT_TYPE_SCORE : inquiry.getType().getIntentScore();
    }

    static double completenessScore(Inquiry inquiry) {
        double score = 0;
        if (hasText(inquiry.getEmail())) score += 30;
        if (hasText(inquiry.getPhone())) score += 40;
        if (inquiry.getMessage() != null && inquiry.getMessage().trim().length() > 20) score += 20;
        if (hasText(inquiry.getName()) && inquiry.getName().trim().split("\\s+").length >= 2) score += 10;
        return score;
    }

    /**
     * Measured up to the response when there is one, otherwise up to now.
     */
    static double responseTimeScore(Inquiry inquiry, LocalDateTime now) {
        LocalDateTime end = inquiry.getStatus() != null && inquiry.getStatus().isResponded() && inquiry.getRespondedAt() != null
                ? inquiry.getRespondedAt()
                : now;
        double hours = Duration.between(inquiry.getCreatedAt(), end).toSeconds() / 3600.0;

        if (hours < 1) return 100;
        if (hours < 24) return 80;
        if (hours < 72) return 60;
        return 30;
    }

    static double vehicleAppealScore(Vehicle vehicle, Double averageSimilarPrice, LocalDateTime now) {
        if (vehicle == null) {
            return NEUTRAL_APPEAL;
        }
        double score = 50;

        if (vehicle.getFuelType() != null && vehicle.getFuelType().isAlternative()) {
            score += 15;
        }
        if (vehicle.getMileage() != null && vehicle.getMileage() < 50_000) {
            score += 10;
        }
        if (vehicle.getYear() >= now.getYear() - 3) {
            score += 15;
        }
        if (vehicle.getPrice() != null && averageSimilarPrice != null && averageSimilarPrice > 0) {
            double ratio = vehicle.getPrice().doubleValue() / averageSimilarPrice;
            if (ratio < 0.9) {
                score += 10; // priced below market
            } else if (ratio > 1.1) {
                score -= 10;
            }
        }
        score += Math.min(20, vehicle.getViewCount() / 10.0);
        score += Math.min(15, vehicle.getInquiryCount() * 5.0);

        return clamp(score);
    }

    static double timingScore(Inquiry inquiry, LocalDateTime now) {
        LocalDateTime submitted = inquiry.getCreatedAt();
        double score = 50;

        int hour = submitted.getHour();
        if (hour >= 9 && hour <= 17) {
            score += 20;
        } else if (hour >= 8 && hour <= 19) {
            score += 10;
        }

        DayOfWeek day = submitted.getDayOfWeek();
        if (day != DayOfWeek.SATURDAY && day != DayOfWeek.SUNDAY) {
            score += 15;
        } else if (day == DayOfWeek.SATURDAY) {
            score += 5;
        }

        if (Duration.between(submitted, now).toHours() < 24) {
            score += 15; // fresh lead
        }
        return clamp(score);
    }

    private static double clamp(double score) {
        return Math.max(0, Math.min(100, score));
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
