package com.aigreentick.services.dealership.leads.service.impl;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.aigreentick.services.dealership.common.exception.InvalidJobPayloadException;
import com.aigreentick.services.dealership.common.exception.ResourceNotFoundException;
import com.aigreentick.services.dealership.common.util.DedupeKeys;
import com.aigreentick.services.dealership.common.util.PhoneNumbers;
import com.aigreentick.services.dealership.leads.dto.AssignLeadPayload;
import com.aigreentick.services.dealership.leads.dto.CalculateLeadScorePayload;
import com.aigreentick.services.dealership.leads.dto.IncrementalScoreResult;
import com.aigreentick.services.dealership.leads.dto.ScoreResult;
import com.aigreentick.services.dealership.leads.dto.ScoringBatchResult;
import com.aigreentick.services.dealership.leads.dto.UpdateLeadScorePayload;
import com.aigreentick.services.dealership.leads.enums.ConversionGrade;
import com.aigreentick.services.dealership.leads.enums.QualificationLevel;
import com.aigreentick.services.dealership.leads.enums.Urgency;
import com.aigreentick.services.dealership.leads.model.Customer;
import com.aigreentick.services.dealership.leads.model.Inquiry;
import com.aigreentick.services.dealership.leads.model.LeadScore;
import com.aigreentick.services.dealership.leads.model.Vehicle;
import com.aigreentick.services.dealership.leads.repository.CustomerRepository;
import com.aigreentick.services.dealership.leads.repository.InquiryRepository;
import com.aigreentick.services.dealership.leads.repository.LeadScoreRepository;
import com.aigreentick.services.dealership.leads.repository.VehicleRepository;
import com.aigreentick.services.dealership.queue.dto.JobOptions;
import com.aigreentick.services.dealership.queue.enums.DedupePolicy;
import com.aigreentick.services.dealership.queue.enums.JobType;
import com.aigreentick.services.dealership.queue.service.QueueRuntime;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Persists scoring results as new LeadScore rows and queues the assignment of
 * leads that came out QUALIFIED or HOT.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LeadScoringService {

    static final int QUALIFIED_ASSIGNMENT_PRIORITY = 1;
    static final int HOT_ASSIGNMENT_PRIORITY = 2;

    private final ScoringEngine scoringEngine;
    private final LeadScoreRepository leadScoreRepository;
    private final CustomerRepository customerRepository;
    private final InquiryRepository inquiryRepository;
    private final VehicleRepository vehicleRepository;
    private final QueueRuntime queueRuntime;
    private final Clock clock;

    @Value("${scoring.hot-assignment-delay:5m}")
    private Duration hotAssignmentDelay;

    @Value("${scoring.batch-cooldown:1h}")
    private Duration batchCooldown;

    @Transactional
    public LeadScore scoreCustomer(Long customerId, String reason) {
        Customer customer = customerRepository.findById(customerId)
                .orElseThrow(() -> new InvalidJobPayloadException("Customer not found: " + customerId));

        ScoreResult result = scoringEngine.scoreCustomer(customer);
        LeadScore saved = persist(customer.getId(), null, result, false, reason);

        enqueueAssignmentIfQualified(saved, criteriaFor(customer, null, null));
        return saved;
    }

    /**
     * Scores an inquiry. One linked to a known customer is scored with the customer's
     * full history; a standalone inquiry with its contact fields only.
     */
    @Transactional
    public LeadScore scoreInquiry(Long inquiryId, String reason) {
        Inquiry inquiry = inquiryRepository.findById(inquiryId)
                .orElseThrow(() -> new InvalidJobPayloadException("Inquiry not found: " + inquiryId));
        Customer customer = inquiry.getCustomerId() == null
                ? null
                : customerRepository.findById(inquiry.getCustomerId()).orElse(null);
        Vehicle vehicle = inquiry.getVehicleId() == null
                ? null
                : vehicleRepository.findById(inquiry.getVehicleId()).orElse(null);

        ScoreResult result = customer != null
                ? scoringEngine.scoreCustomer(customer)
                : scoringEngine.scoreInquiry(inquiry);
        LeadScore saved = persist(customer != null ? customer.getId() : null, inquiry.getId(), result, false, reason);

        enqueueAssignmentIfQualified(saved, criteriaFor(customer, inquiry, vehicle));
        return saved;
    }

    /**
     * Scores a list of customers. A failing customer is logged and skipped.
     */
    public ScoringBatchResult scoreBatch(List<Long> customerIds, boolean forceRecalculation, String reason) {
        LocalDateTime cooldownStart = LocalDateTime.now(clock).minus(batchCooldown);
        int processed = 0;
        List<Long> failed = new ArrayList<>();

        for (Long customerId : customerIds) {
            try {
                if (!forceRecalculation && scoredSince(customerId, cooldownStart)) {
                    log.debug("Skipping recently scored customer. customerId={}", customerId);
                    continue;
                }
                scoreCustomer(customerId, reason);
                processed++;
            } catch (Exception e) {
                log.error("Batch scoring failed for customerId={}", customerId, e);
                failed.add(customerId);
            }
        }

        log.info("Batch scoring finished. requested={} processed={} failed={}",
                customerIds.size(), processed, failed.size());
        return new ScoringBatchResult(processed, failed.size(), failed);
    }

    /**
     * Adds engagement points to the latest score. A customer without any score gets a
     * full calculation queued instead.
     *
     * @return empty when no customer matches the identifiers
     */
    @Transactional
    public Optional<IncrementalScoreResult> applyEngagement(UpdateLeadScorePayload payload) {
        Optional<Customer> match = resolveCustomer(payload);
        if (match.isEmpty()) {
            log.info("No customer for engagement event. action={} email={} phone={}",
                    payload.getAction(), payload.getEmail(), payload.getPhone());
            return Optional.empty();
        }
        Customer customer = match.get();

        Optional<LeadScore> latest = leadScoreRepository.findFirstByCustomerIdOrderByCalculatedAtDescIdDesc(customer.getId());
        if (latest.isEmpty()) {
            queueRuntime.enqueue(JobType.CALCULATE_LEAD_SCORE,
                    CalculateLeadScorePayload.builder()
                            .customerId(customer.getId())
                            .reason("initial score after " + payload.getAction())
                            .build(),
                    JobOptions.withPriority(3));
            return Optional.of(IncrementalScoreResult.fullRecalculationQueued(customer.getId()));
        }

        LeadScore previous = latest.get();
        double newTotal = Math.max(0, previous.getTotalScore() + payload.getPoints());
        double pct = Math.round(ScoringEngine.percentage(newTotal, previous.getMaxPossibleScore()) * 100.0) / 100.0;
        QualificationLevel newLevel = QualificationLevel.fromPercentage(pct);

        Map<String, Double> factors = new LinkedHashMap<>();
        if (previous.getFactors() != null) {
            factors.putAll(previous.getFactors());
        }
        factors.merge("engagementEvents", (double) payload.getPoints(), Double::sum);

        LeadScore saved = leadScoreRepository.save(LeadScore.builder()
                .customerId(customer.getId())
                .inquiryId(previous.getInquiryId())
                .totalScore(newTotal)
                .maxPossibleScore(previous.getMaxPossibleScore())
                .scorePercentage(pct)
                .qualificationLevel(newLevel)
                .conversionGrade(ConversionGrade.fromProbability(pct / 100.0))
                .conversionProbability(pct / 100.0)
                .factors(factors)
                .recommendations(previous.getRecommendations())
                .nextActions(LeadRecommendations.nextActions(newLevel))
                .incrementalUpdate(true)
                .updateReason(payload.getAction())
                .calculatedAt(LocalDateTime.now(clock))
                .build());

        IncrementalScoreResult result = new IncrementalScoreResult(
                customer.getId(), saved.getId(),
                previous.getTotalScore(), newTotal,
                previous.getQualificationLevel(), newLevel, false);

        log.info("Lead score updated. customerId={} action={} points={} score={}->{} level={}->{}",
                customer.getId(), payload.getAction(), payload.getPoints(),
                previous.getTotalScore(), newTotal, previous.getQualificationLevel(), newLevel);

        // only the step into QUALIFIED triggers assignment here
        if (result.becameQualified()) {
            enqueueAssignment(saved, criteriaFor(customer, null, null), QUALIFIED_ASSIGNMENT_PRIORITY, Duration.ZERO, Urgency.HIGH);
        }
        return Optional.of(result);
    }

    public List<LeadScore> history(Long customerId) {
        if (!customerRepository.existsById(customerId)) {
            throw new ResourceNotFoundException("Customer", customerId);
        }
        return leadScoreRepository.findByCustomerIdOrderByCalculatedAtAsc(customerId);
    }

    private LeadScore persist(Long customerId, Long inquiryId, ScoreResult result, boolean incremental, String reason) {
        LeadScore saved = leadScoreRepository.save(LeadScore.builder()
                .customerId(customerId)
                .inquiryId(inquiryId)
                .totalScore(result.totalScore())
                .maxPossibleScore(result.maxPossibleScore())
                .scorePercentage(result.scorePercentage())
                .qualificationLevel(result.qualificationLevel())
                .conversionGrade(result.conversionGrade())
                .conversionProbability(result.conversionProbability())
                .factors(result.factors())
                .recommendations(result.recommendations())
                .nextActions(result.nextActions())
                .incrementalUpdate(incremental)
                .updateReason(reason)
                .calculatedAt(LocalDateTime.now(clock))
                .build());

        log.info("Lead score stored. leadScoreId={} customerId={} inquiryId={} percentage={} level={}",
                saved.getId(), customerId, inquiryId, result.scorePercentage(), result.qualificationLevel());
        return saved;
    }

    private void enqueueAssignmentIfQualified(LeadScore score, AssignLeadPayload criteria) {
        if (score.getQualificationLevel() == QualificationLevel.QUALIFIED) {
            enqueueAssignment(score, criteria, QUALIFIED_ASSIGNMENT_PRIORITY, Duration.ZERO, Urgency.HIGH);
        } else if (score.getQualificationLevel() == QualificationLevel.HOT) {
            enqueueAssignment(score, criteria, HOT_ASSIGNMENT_PRIORITY, hotAssignmentDelay, Urgency.MEDIUM);
        }
    }

    private void enqueueAssignment(LeadScore score, AssignLeadPayload criteria, int priority, Duration delay, Urgency urgency) {
        AssignLeadPayload payload = criteria.toBuilder()
                .customerId(score.getCustomerId())
                .inquiryId(score.getInquiryId())
                .leadScore(score.getScorePercentage())
                .urgency(urgency)
                .build();

        queueRuntime.enqueue(JobType.ASSIGN_LEAD, payload, JobOptions.builder()
                .priority(priority)
                .delay(delay)
                .dedupeKey(DedupeKeys.leadAssignment(score.getCustomerId(), score.getInquiryId()))
                .dedupePolicy(DedupePolicy.IN_FLIGHT)
                .build());

        log.info("Assignment queued. customerId={} inquiryId={} level={} priority={} delay={}s",
                score.getCustomerId(), score.getInquiryId(), score.getQualificationLevel(), priority, delay.toSeconds());
    }

    private AssignLeadPayload criteriaFor(Customer customer, Inquiry inquiry, Vehicle vehicle) {
        AssignLeadPayload.AssignLeadPayloadBuilder builder = AssignLeadPayload.builder();
        if (customer != null) {
            builder.location(customer.getCity()).preferredLanguage(customer.getPreferredLanguage());
        }
        if (inquiry != null) {
            builder.source(inquiry.getSource());
            if (inquiry.getPreferredLanguage() != null) {
                builder.preferredLanguage(inquiry.getPreferredLanguage());
            }
        }
        if (vehicle != null) {
            builder.vehicleType(vehicle.getBodyType()).priceRange(vehicle.getPrice());
        }
        return builder.build();
    }

    private Optional<Customer> resolveCustomer(UpdateLeadScorePayload payload) {
        if (payload.getCustomerId() != null) {
            return customerRepository.findById(payload.getCustomerId());
        }
        if (payload.getEmail() != null && !payload.getEmail().isBlank()) {
            Optional<Customer> byEmail = customerRepository.findFirstByEmailIgnoreCase(payload.getEmail().trim());
            if (byEmail.isPresent()) {
                return byEmail;
            }
        }
        if (payload.getPhone() != null && !payload.getPhone().isBlank()) {
            return customerRepository.findFirstByPhone(PhoneNumbers.normalize(payload.getPhone()));
        }
        return Optional.empty();
    }

    private boolean scoredSince(Long customerId, LocalDateTime since) {
        return leadScoreRepository.findFirstByCustomerIdOrderByCalculatedAtDescIdDesc(customerId)
                .map(score -> score.getCalculatedAt().isAfter(since))
                .orElse(false);
    }
}
