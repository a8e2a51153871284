package com.aigreentick.services.dealership.leads.service.impl;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.Period;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import com.aigreentick.services.dealership.leads.model.Customer;
import com.aigreentick.services.dealership.leads.model.CustomerTouchpoint;
import com.aigreentick.services.dealership.leads.model.Purchase;

/**
 * Weighted score of a known customer. Every factor is normalized to 0..100 before weighting,
 * so the weighted total is on a 0..100 scale as well.
 */
@Component
public class CustomerScoringModel {

    public static final double PURCHASE_HISTORY_WEIGHT = 0.40;
    public static final double ENGAGEMENT_WEIGHT = 0.25;
    public static final double DEMOGRAPHICS_WEIGHT = 0.20;
    public static final double LIFECYCLE_WEIGHT = 0.15;

    public static final double MAX_SCORE = 100.0;

    // purchase value per month that maps to 1 point
    private final double purchaseValueScale;

    public CustomerScoringModel(@Value("${scoring.purchase-value-scale:500}") double purchaseValueScale) {
        this.purchaseValueScale = purchaseValueScale;
    }

    public Map<String, Double> rawFactors(
            Customer customer,
            List<Purchase> purchases,
            List<CustomerTouchpoint> recentTouchpoints,
            LocalDateTime now) {

        Map<String, Double> raw = new LinkedHashMap<>();
        raw.put("purchaseHistory", purchaseHistoryScore(purchases));
        raw.put("engagement", engagementScore(recentTouchpoints));
        raw.put("demographics", demographicsScore(customer, now));
        raw.put("lifecycle", lifecycleScore(customer, now));
        return raw;
    }

    /**
     * @return factor name to weighted contribution
     */
    public Map<String, Double> weigh(Map<String, Double> raw) {
        Map<String, Double> weighted = new LinkedHashMap<>();
        weighted.put("purchaseHistory", raw.get("purchaseHistory") * PURCHASE_HISTORY_WEIGHT);
        weighted.put("engagement", raw.get("engagement") * ENGAGEMENT_WEIGHT);
        weighted.put("demographics", raw.get("demographics") * DEMOGRAPHICS_WEIGHT);
        weighted.put("lifecycle", raw.get("lifecycle") * LIFECYCLE_WEIGHT);
        return weighted;
    }

    double purchaseHistoryScore(List<Purchase> purchases) {
        if (purchases == null || purchases.isEmpty()) {
            return 0;
        }
        BigDecimal total = purchases.stream()
                .map(Purchase::getAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        double averageValue = total.doubleValue() / purchases.size();
        double monthlyValue = averageValue * purchaseFrequency(purchases);
        return Math.min(MAX_SCORE, monthlyValue / purchaseValueScale);
    }

    /**
     * Purchases per 30-day window between the first and the last purchase.
     * Expects purchases in chronological order.
     */
    static double purchaseFrequency(List<Purchase> purchases) {
        if (purchases.size() < 2) {
            return 1;
        }
        LocalDateTime first = purchases.get(0).getPurchasedAt();
        LocalDateTime last = purchases.get(purchases.size() - 1).getPurchasedAt();
        double daysBetween = Math.ceil(ChronoUnit.HOURS.between(first, last) / 24.0);
        if (daysBetween <= 0) {
            return 1;
        }
        return purchases.size() / (daysBetween / 30.0);
    }

    static double engagementScore(List<CustomerTouchpoint> recentTouchpoints) {
        if (recentTouchpoints == null) {
            return 0;
        }
        int points = recentTouchpoints.stream()
                .mapToInt(t -> t.getType() == null ? 1 : t.getType().getEngagementPoints())
                .sum();
        return Math.min(MAX_SCORE, points);
    }

    static double demographicsScore(Customer customer, LocalDateTime now) {
        double score = 50;

        if (customer.getDateOfBirth() != null) {
            int age = Period.between(customer.getDateOfBirth(), now.toLocalDate()).getYears();
            if (age >= 25 && age <= 55) {
                score += 20; // prime buying age
            } else if (age >= 18 && age <= 65) {
                score += 10;
            }
        }
        if (hasText(customer.getPhone())) score += 5;
        if (hasText(customer.getAddress())) score += 5;
        if (customer.isEmailVerified()) score += 10;
        if (customer.isMarketingOptIn()) score += 10;

        return Math.min(MAX_SCORE, score);
    }

    static double lifecycleScore(Customer customer, LocalDateTime now) {
        LocalDateTime createdAt = customer.getCreatedAt() != null ? customer.getCreatedAt() : now;
        long days = ChronoUnit.DAYS.between(createdAt, now);

        if (days <= 30) return 80;
        if (days <= 90) return 70;
        if (days <= 180) return 60;
        if (days <= 365) return 50;
        return 40;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
