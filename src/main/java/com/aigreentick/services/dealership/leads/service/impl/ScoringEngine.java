package com.aigreentick.services.dealership.leads.service.impl;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import com.aigreentick.services.dealership.common.exception.ResourceNotFoundException;
import com.aigreentick.services.dealership.leads.dto.CustomerValuePrediction;
import com.aigreentick.services.dealership.leads.dto.ScoreResult;
import com.aigreentick.services.dealership.leads.enums.ConversionGrade;
import com.aigreentick.services.dealership.leads.enums.QualificationLevel;
import com.aigreentick.services.dealership.leads.enums.VehicleStatus;
import com.aigreentick.services.dealership.leads.model.Customer;
import com.aigreentick.services.dealership.leads.model.CustomerTouchpoint;
import com.aigreentick.services.dealership.leads.model.Inquiry;
import com.aigreentick.services.dealership.leads.model.Purchase;
import com.aigreentick.services.dealership.leads.model.Vehicle;
import com.aigreentick.services.dealership.leads.repository.CustomerRepository;
import com.aigreentick.services.dealership.leads.repository.CustomerTouchpointRepository;
import com.aigreentick.services.dealership.leads.repository.InquiryRepository;
import com.aigreentick.services.dealership.leads.repository.PurchaseRepository;
import com.aigreentick.services.dealership.leads.repository.VehicleRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Computes lead scores. Loads the data a model needs, runs it and derives the
 * qualification level, grade and guidance. Nothing is persisted here.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScoringEngine {

    private static final int SIMILAR_YEAR_SPAN = 2;

    private final CustomerRepository customerRepository;
    private final PurchaseRepository purchaseRepository;
    private final CustomerTouchpointRepository touchpointRepository;
    private final InquiryRepository inquiryRepository;
    private final VehicleRepository vehicleRepository;
    private final CustomerScoringModel customerScoringModel;
    private final InquiryScoringModel inquiryScoringModel;
    private final MarketTrendAnalyzer marketTrendAnalyzer;
    private final Clock clock;

    @Value("${scoring.engagement-window:10}")
    private int engagementWindow;

    public ScoreResult scoreCustomer(Customer customer) {
        LocalDateTime now = LocalDateTime.now(clock);
        Map<String, Double> raw = customerRawFactors(customer, now);
        Map<String, Double> weighted = customerScoringModel.weigh(raw);

        double total = sum(weighted);
        long inquiries = inquiryRepository.countByCustomerId(customer.getId());

        ScoreResult result = assemble(total, CustomerScoringModel.MAX_SCORE, weighted,
                LeadRecommendations.forCustomer(raw, (int) inquiries));

        log.info("Customer scored. customerId={} total={} level={}",
                customer.getId(), result.totalScore(), result.qualificationLevel());
        return result;
    }

    public ScoreResult scoreInquiry(Inquiry inquiry) {
        LocalDateTime now = LocalDateTime.now(clock);

        Vehicle vehicle = inquiry.getVehicleId() == null
                ? null
                : vehicleRepository.findById(inquiry.getVehicleId()).orElse(null);
        Double averageSimilarPrice = vehicle == null ? null : vehicleRepository.averagePriceOfSimilar(
                vehicle.getMake(),
                vehicle.getModel(),
                vehicle.getYear() - SIMILAR_YEAR_SPAN,
                vehicle.getYear() + SIMILAR_YEAR_SPAN,
                VehicleStatus.AVAILABLE);

        Map<String, Double> raw = inquiryScoringModel.rawFactors(inquiry, vehicle, averageSimilarPrice, now);
        Map<String, Double> weighted = inquiryScoringModel.weigh(raw);

        double total = sum(weighted);
        double pct = percentage(total, 100.0);

        ScoreResult result = assemble(total, 100.0, weighted,
                LeadRecommendations.forInquiry(inquiry.getType(), raw, pct));

        log.info("Inquiry scored. inquiryId={} type={} total={} level={}",
                inquiry.getId(), inquiry.getType(), result.totalScore(), result.qualificationLevel());
        return result;
    }

    /**
     * Lifetime-value estimate: the customer score scaled by the current market trend.
     */
    public CustomerValuePrediction predictLifetimeValue(Long customerId) {
        Customer customer = customerRepository.findById(customerId)
                .orElseThrow(() -> new ResourceNotFoundException("Customer", customerId));
        LocalDateTime now = LocalDateTime.now(clock);

        List<Purchase> purchases = purchaseRepository.findByCustomerIdOrderByPurchasedAtAsc(customerId);
        List<CustomerTouchpoint> touchpoints = recentTouchpoints(customerId);

        Map<String, Double> raw = customerScoringModel.rawFactors(customer, purchases, touchpoints, now);
        double baseScore = sum(customerScoringModel.weigh(raw));
        double marketAdjustment = marketTrendAnalyzer.currentAdjustment(now);

        double confidence = 0.5;
        if (purchases.size() > 1) confidence += 0.2;
        if (touchpoints.size() > 5) confidence += 0.2;
        if (customer.getDateOfBirth() != null) confidence += 0.1;

        return new CustomerValuePrediction(
                customerId,
                Math.round(baseScore * marketAdjustment),
                Math.min(0.95, confidence),
                "24 months",
                marketAdjustment,
                raw);
    }

    private Map<String, Double> customerRawFactors(Customer customer, LocalDateTime now) {
        List<Purchase> purchases = purchaseRepository.findByCustomerIdOrderByPurchasedAtAsc(customer.getId());
        return customerScoringModel.rawFactors(customer, purchases, recentTouchpoints(customer.getId()), now);
    }

    private List<CustomerTouchpoint> recentTouchpoints(Long customerId) {
        return touchpointRepository.findByCustomerIdOrderByOccurredAtDesc(customerId, PageRequest.of(0, engagementWindow));
    }

    static ScoreResult assemble(double total, double max, Map<String, Double> weighted, List<String> recommendations) {
        // level derived from the stored, rounded percentage so the row is self-consistent
        double pct = round(percentage(total, max));
        double probability = Math.max(0, Math.min(1, pct / 100.0));
        QualificationLevel level = QualificationLevel.fromPercentage(pct);

        Map<String, Double> factors = new LinkedHashMap<>();
        weighted.forEach((name, value) -> factors.put(name, round(value)));

        return new ScoreResult(
                round(total),
                max,
                pct,
                level,
                ConversionGrade.fromProbability(probability),
                probability,
                factors,
                List.copyOf(recommendations),
                LeadRecommendations.nextActions(level));
    }

    static double percentage(double total, double max) {
        return max <= 0 ? 0 : Math.min(100.0, total / max * 100.0);
    }

    private static double sum(Map<String, Double> values) {
        return values.values().stream().mapToDouble(Double::doubleValue).sum();
    }

    private static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
