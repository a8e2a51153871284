package com.aigreentick.services.dealership.leads.service.impl;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import com.aigreentick.services.dealership.common.util.DedupeKeys;
import com.aigreentick.services.dealership.leads.dto.AssignLeadPayload;
import com.aigreentick.services.dealership.leads.enums.Urgency;
import com.aigreentick.services.dealership.leads.model.WaitQueueEntry;
import com.aigreentick.services.dealership.leads.repository.WaitQueueEntryRepository;
import com.aigreentick.services.dealership.queue.dto.JobOptions;
import com.aigreentick.services.dealership.queue.enums.DedupePolicy;
import com.aigreentick.services.dealership.queue.enums.JobType;
import com.aigreentick.services.dealership.queue.service.QueueRuntime;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Retries waiting leads and expires the ones that waited too long.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WaitQueueService {

    private final WaitQueueEntryRepository waitQueueRepository;
    private final QueueRuntime queueRuntime;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Value("${assignment.wait-queue.enabled:true}")
    private boolean enabled;

    @Value("${assignment.wait-queue.max-attempts:5}")
    private int maxAttempts;

    @Value("${assignment.wait-queue.batch-size:25}")
    private int batchSize;

    @Value("${assignment.wait-queue.expire-after:72h}")
    private Duration expireAfter;

    @Scheduled(fixedDelayString = "${assignment.wait-queue.retry-interval-ms:300000}")
    public void runMaintenance() {
        if (!enabled) {
            return;
        }
        try {
            expireStale();
            retryWaiting();
        } catch (Exception e) {
            log.error("Wait queue maintenance failed", e);
        }
    }

    /**
     * Re-enqueues {@code assign_lead} for waiting entries, most urgent first.
     *
     * @return number of entries retried
     */
    public int retryWaiting() {
        LocalDateTime now = LocalDateTime.now(clock);
        List<WaitQueueEntry> candidates = waitQueueRepository.findRetryCandidates(maxAttempts, PageRequest.of(0, batchSize));

        for (WaitQueueEntry entry : candidates) {
            AssignLeadPayload payload = payloadOf(entry);
            waitQueueRepository.incrementAttempts(entry.getId(), now);
            queueRuntime.enqueue(JobType.ASSIGN_LEAD, payload, JobOptions.builder()
                    .priority(queuePriority(entry.getPriority()))
                    .dedupeKey(DedupeKeys.leadAssignment(entry.getCustomerId(), entry.getInquiryId()))
                    .dedupePolicy(DedupePolicy.IN_FLIGHT)
                    .build());

            log.debug("Waiting lead retried. waitQueueEntryId={} attempt={}", entry.getId(), entry.getAttempts() + 1);
        }

        if (!candidates.isEmpty()) {
            log.info("Wait queue retry queued {} assignments", candidates.size());
        }
        return candidates.size();
    }

    public int expireStale() {
        int expired = waitQueueRepository.expireWaitingBefore(LocalDateTime.now(clock).minus(expireAfter));
        if (expired > 0) {
            log.warn("Expired {} waiting leads older than {}h", expired, expireAfter.toHours());
        }
        return expired;
    }

    AssignLeadPayload payloadOf(WaitQueueEntry entry) {
        AssignLeadPayload fromEntry = AssignLeadPayload.builder()
                .customerId(entry.getCustomerId())
                .inquiryId(entry.getInquiryId())
                .leadScore(entry.getLeadScore())
                .urgency(entry.getPriority())
                .build();
        if (entry.getCriteria() == null) {
            return fromEntry;
        }
        try {
            return objectMapper.readValue(entry.getCriteria(), AssignLeadPayload.class);
        } catch (JsonProcessingException e) {
            log.error("Unreadable criteria on wait queue entry {}, retrying with lead ids only", entry.getId(), e);
            return fromEntry;
        }
    }

    static int queuePriority(Urgency urgency) {
        if (urgency == null) {
            return 2;
        }
        return switch (urgency) {
            case URGENT, HIGH -> 1;
            case MEDIUM -> 2;
            case LOW -> 3;
        };
    }
}
