package com.aigreentick.services.dealership.queue.service.impl;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.aigreentick.services.dealership.common.exception.InvalidJobPayloadException;
import com.aigreentick.services.dealership.queue.dto.EnqueuedJob;
import com.aigreentick.services.dealership.queue.dto.JobOptions;
import com.aigreentick.services.dealership.queue.enums.JobType;
import com.aigreentick.services.dealership.queue.model.QueueJob;
import com.aigreentick.services.dealership.queue.repository.QueueJobRepository;
import com.aigreentick.services.dealership.queue.service.QueueRuntime;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Durable queue runtime backed by the {@code queue_jobs} table.
 * Jobs are picked up by {@link QueueWorkerCoordinator}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JpaQueueRuntime implements QueueRuntime {

    private final QueueJobRepository queueJobRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    @Transactional
    public EnqueuedJob enqueue(JobType type, Object payload, JobOptions options) {
        if (options.getDedupeKey() != null) {
            Optional<QueueJob> existing = queueJobRepository.findFirstByDedupeKeyAndStatusIn(
                    options.getDedupeKey(), options.getDedupePolicy().getBlockingStatuses());
            if (existing.isPresent()) {
                QueueJob job = existing.get();
                log.info("Duplicate job suppressed. type={} dedupeKey={} existingJobId={} status={}",
                        type.getCode(), options.getDedupeKey(), job.getId(), job.getStatus());
                return new EnqueuedJob(job.getId(), job.getType(), job.getPriority(), job.getAvailableAt(), true);
            }
        }

        LocalDateTime availableAt = LocalDateTime.now(clock).plus(options.getDelay());
        int maxAttempts = options.getMaxAttempts() != null
                ? options.getMaxAttempts()
                : type.getDefaultMaxAttempts();

        QueueJob job = QueueJob.builder()
                .type(type)
                .payload(serialize(type, payload))
                .priority(options.getPriority())
                .maxAttempts(maxAttempts)
                .availableAt(availableAt)
                .dedupeKey(options.getDedupeKey())
                .build();

        QueueJob saved = queueJobRepository.save(job);

        log.debug("Job enqueued. jobId={} type={} priority={} availableAt={}",
                saved.getId(), type.getCode(), saved.getPriority(), availableAt);

        return new EnqueuedJob(saved.getId(), type, saved.getPriority(), availableAt, false);
    }

    private String serialize(JobType type, Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new InvalidJobPayloadException("Payload for " + type.getCode() + " is not serializable", e);
        }
    }
}
