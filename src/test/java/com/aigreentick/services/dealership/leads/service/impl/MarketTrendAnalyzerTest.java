package com.aigreentick.services.dealership.leads.service.impl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.aigreentick.services.dealership.leads.repository.PurchaseRepository;

@ExtendWith(MockitoExtension.class)
class MarketTrendAnalyzerTest {

    @Mock
    private PurchaseRepository purchaseRepository;

    @InjectMocks
    private MarketTrendAnalyzer analyzer;

    @Test
    @DisplayName("Growth maps to a stepped multiplier")
    void adjustmentSteps() {
        assertThat(MarketTrendAnalyzer.adjustmentFor(amount("120"), amount("100"))).isEqualTo(1.2);
        assertThat(MarketTrendAnalyzer.adjustmentFor(amount("108"), amount("100"))).isEqualTo(1.1);
        assertThat(MarketTrendAnalyzer.adjustmentFor(amount("102"), amount("100"))).isEqualTo(1.0);
        assertThat(MarketTrendAnalyzer.adjustmentFor(amount("93"), amount("100"))).isEqualTo(0.9);
        assertThat(MarketTrendAnalyzer.adjustmentFor(amount("80"), amount("100"))).isEqualTo(0.8);
    }

    @Test
    @DisplayName("No revenue in the previous window means no adjustment")
    void noPreviousRevenue() {
        assertThat(MarketTrendAnalyzer.adjustmentFor(amount("5000"), null)).isEqualTo(1.0);
        assertThat(MarketTrendAnalyzer.adjustmentFor(amount("5000"), BigDecimal.ZERO)).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Compares the last 30 days with the 30 days before")
    void comparesRollingWindows() {
        LocalDateTime now = LocalDateTime.of(2024, 5, 14, 10, 0);
        when(purchaseRepository.sumRevenueBetween(now.minusDays(30), now)).thenReturn(amount("66000"));
        when(purchaseRepository.sumRevenueBetween(now.minusDays(60), now.minusDays(30))).thenReturn(amount("50000"));

        assertThat(analyzer.currentAdjustment(now)).isEqualTo(1.2);
    }

    private static BigDecimal amount(String value) {
        return new BigDecimal(value);
    }
}
