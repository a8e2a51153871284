package com.aigreentick.services.dealership.leads.service.impl;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.aigreentick.services.dealership.leads.enums.InquiryType;
import com.aigreentick.services.dealership.leads.enums.TouchpointType;
import com.aigreentick.services.dealership.leads.model.CustomerTouchpoint;
import com.aigreentick.services.dealership.leads.model.Inquiry;

/**
 * Raising any single factor while the others stay put never lowers the total.
 */
class ScoringMonotonicityTest {

    private static final LocalDateTime CREATED = LocalDateTime.of(2024, 5, 14, 10, 0);

    private final CustomerScoringModel customerModel = new CustomerScoringModel(500);
    private final InquiryScoringModel inquiryModel = new InquiryScoringModel();

    @ParameterizedTest(name = "customer factor {0}")
    @ValueSource(strings = {"purchaseHistory", "engagement", "demographics", "lifecycle"})
    @DisplayName("Customer total grows with each factor")
    void customerTotalGrowsWithFactor(String factor) {
        List<Double> totals = new ArrayList<>();
        for (double value = 0; value <= 100; value += 10) {
            Map<String, Double> raw = baseline("purchaseHistory", "engagement", "demographics", "lifecycle");
            raw.put(factor, value);
            totals.add(sum(customerModel.weigh(raw)));
        }

        assertStrictlyIncreasing(totals);
    }

    @ParameterizedTest(name = "inquiry factor {0}")
    @ValueSource(strings = {"inquiryType", "contactCompleteness", "responseTime", "vehicleAppeal", "timing"})
    @DisplayName("Inquiry total grows with each factor")
    void inquiryTotalGrowsWithFactor(String factor) {
        List<Double> totals = new ArrayList<>();
        for (double value = 0; value <= 100; value += 10) {
            Map<String, Double> raw = baseline("inquiryType", "contactCompleteness", "responseTime",
                    "vehicleAppeal", "timing");
            raw.put(factor, value);
            totals.add(sum(inquiryModel.weigh(raw)));
        }

        assertStrictlyIncreasing(totals);
    }

    @Test
    @DisplayName("Adding touchpoints never lowers the engagement factor")
    void engagementNeverDropsWithMoreTouchpoints() {
        List<CustomerTouchpoint> touchpoints = new ArrayList<>();
        TouchpointType[] types = TouchpointType.values();
        double previous = CustomerScoringModel.engagementScore(touchpoints);

        for (int i = 0; i < 40; i++) {
            touchpoints.add(CustomerTouchpoint.builder()
                    .customerId(1L)
                    .type(types[i % types.length])
                    .occurredAt(CREATED.minusDays(1))
                    .build());
            double current = CustomerScoringModel.engagementScore(touchpoints);

            assertThat(current).isGreaterThanOrEqualTo(previous);
            previous = current;
        }
    }

    @Test
    @DisplayName("A faster response never scores lower than a slower one")
    void fasterResponseNeverScoresLower() {
        Inquiry inquiry = Inquiry.builder().type(InquiryType.GENERAL).createdAt(CREATED).build();
        double previous = Double.MAX_VALUE;

        // every 15 minutes over five days
        for (int minutes = 0; minutes <= 5 * 24 * 60; minutes += 15) {
            double current = InquiryScoringModel.responseTimeScore(inquiry, CREATED.plusMinutes(minutes));

            assertThat(current).isLessThanOrEqualTo(previous);
            previous = current;
        }
    }

    private static Map<String, Double> baseline(String... factors) {
        Map<String, Double> raw = new LinkedHashMap<>();
        for (String factor : factors) {
            raw.put(factor, 50.0);
        }
        return raw;
    }

    private static double sum(Map<String, Double> weighted) {
        return weighted.values().stream().mapToDouble(Double::doubleValue).sum();
    }

    private static void assertStrictlyIncreasing(List<Double> totals) {
        for (int i = 1; i < totals.size(); i++) {
            assertThat(totals.get(i)).isGreaterThan(totals.get(i - 1));
        }
    }
}
