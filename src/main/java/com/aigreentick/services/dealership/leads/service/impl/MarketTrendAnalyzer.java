package com.aigreentick.services.dealership.leads.service.impl;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import org.springframework.stereotype.Service;

import com.aigreentick.services.dealership.leads.repository.PurchaseRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Market multiplier from month-over-month dealership revenue, compared over two
 * rolling 30-day windows.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MarketTrendAnalyzer {

    private static final int WINDOW_DAYS = 30;

    private final PurchaseRepository purchaseRepository;

    public double currentAdjustment(LocalDateTime now) {
        LocalDateTime currentStart = now.minusDays(WINDOW_DAYS);
        LocalDateTime previousStart = currentStart.minusDays(WINDOW_DAYS);

        BigDecimal current = purchaseRepository.sumRevenueBetween(currentStart, now);
        BigDecimal previous = purchaseRepository.sumRevenueBetween(previousStart, currentStart);

        double adjustment = adjustmentFor(current, previous);
        log.debug("Market trend adjustment={} currentRevenue={} previousRevenue={}", adjustment, current, previous);
        return adjustment;
    }

    static double adjustmentFor(BigDecimal current, BigDecimal previous) {
        if (previous == null || previous.signum() == 0) {
            return 1.0;
        }
        double currentValue = current == null ? 0 : current.doubleValue();
        double growth = (currentValue - previous.doubleValue()) / previous.doubleValue();

        if (growth > 0.10) return 1.2;
        if (growth > 0.05) return 1.1;
        if (growth < -0.10) return 0.8;
        if (growth < -0.05) return 0.9;
        return 1.0;
    }
}
