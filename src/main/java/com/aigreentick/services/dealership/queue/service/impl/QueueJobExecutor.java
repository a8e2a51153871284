package com.aigreentick.services.dealership.queue.service.impl;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.concurrent.atomic.AtomicLong;

import org.springframework.stereotype.Service;

import com.aigreentick.services.dealership.common.exception.InvalidJobPayloadException;
import com.aigreentick.services.dealership.common.exception.NonRetryableJobException;
import com.aigreentick.services.dealership.queue.enums.JobOutcome;
import com.aigreentick.services.dealership.queue.model.QueueJob;
import com.aigreentick.services.dealership.queue.repository.QueueJobRepository;
import com.aigreentick.services.dealership.queue.service.BackoffPolicy;
import com.aigreentick.services.dealership.queue.service.JobHandler;
import com.aigreentick.services.dealership.queue.service.JobHandlerRegistry;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs one claimed job and records its outcome: completed, rescheduled with backoff,
 * or failed. Handler exceptions never escape to the worker thread.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QueueJobExecutor {

    private static final int MAX_ERROR_LENGTH = 2000;

    private final JobHandlerRegistry handlerRegistry;
    private final QueueJobRepository queueJobRepository;
    private final BackoffPolicy backoffPolicy;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final AtomicLong totalCompleted = new AtomicLong(0);
    private final AtomicLong totalRetried = new AtomicLong(0);
    private final AtomicLong totalFailed = new AtomicLong(0);

    public JobOutcome execute(QueueJob job) {
        long startTime = System.currentTimeMillis();
        JobHandler<?> handler = null;

        try {
            handler = handlerRegistry.find(job.getType())
                    .orElseThrow(() -> new NonRetryableJobException(
                            "No handler registered for job type " + job.getType().getCode()));

            Object result = invoke(handler, job);

            queueJobRepository.markCompleted(job.getId(), now());
            totalCompleted.incrementAndGet();

            log.info("Job completed. jobId={} type={} attempt={}/{} duration={}ms result={}",
                    job.getId(), job.getType().getCode(), job.getAttempts(), job.getMaxAttempts(),
                    System.currentTimeMillis() - startTime, result);
            return JobOutcome.COMPLETED;

        } catch (NonRetryableJobException e) {
            return fail(job, e);

        } catch (Exception e) {
            if (!job.hasAttemptsLeft()) {
                JobOutcome outcome = fail(job, e);
                notifyExhausted(handler, job, e);
                return outcome;
            }
            Duration delay = backoffPolicy.delayFor(job.getType(), job.getAttempts());
            queueJobRepository.scheduleRetry(job.getId(), now().plus(delay), truncate(e), now());
            totalRetried.incrementAndGet();

            log.warn("Job failed, retry scheduled. jobId={} type={} attempt={}/{} retryIn={}ms error={}",
                    job.getId(), job.getType().getCode(), job.getAttempts(), job.getMaxAttempts(),
                    delay.toMillis(), e.getMessage());
            return JobOutcome.RETRY_SCHEDULED;
        }
    }

    private <P> Object invoke(JobHandler<P> handler, QueueJob job) {
        P payload;
        try {
            payload = objectMapper.readValue(job.getPayload(), handler.payloadType());
        } catch (JsonProcessingException e) {
            throw new InvalidJobPayloadException("Malformed payload for " + job.getType().getCode(), e);
        }
        return handler.handle(payload);
    }

    /**
     * Fails an ACTIVE job whose worker stopped reporting and that has no attempts left.
     *
     * @return false when the job already left the ACTIVE state
     */
    public boolean failStalled(QueueJob job) {
        IllegalStateException cause = new IllegalStateException(
                "stalled after attempt " + job.getAttempts() + "/" + job.getMaxAttempts());
        if (queueJobRepository.markFailed(job.getId(), truncate(cause), now()) != 1) {
            return false;
        }
        totalFailed.incrementAndGet();
        log.error("Stalled job failed permanently. jobId={} type={} attempt={}/{}",
                job.getId(), job.getType().getCode(), job.getAttempts(), job.getMaxAttempts());
        handlerRegistry.find(job.getType()).ifPresent(handler -> notifyExhausted(handler, job, cause));
        return true;
    }

    private <P> void notifyExhausted(JobHandler<P> handler, QueueJob job, Exception cause) {
        if (handler == null) {
            return;
        }
        try {
            P payload = objectMapper.readValue(job.getPayload(), handler.payloadType());
            handler.onExhausted(payload, cause);
        } catch (Exception e) {
            log.error("Exhausted-job callback failed. jobId={} type={}", job.getId(), job.getType().getCode(), e);
        }
    }

    private JobOutcome fail(QueueJob job, Exception e) {
        queueJobRepository.markFailed(job.getId(), truncate(e), now());
        totalFailed.incrementAndGet();

        log.error("Job failed permanently. jobId={} type={} attempt={}/{} payload={}",
                job.getId(), job.getType().getCode(), job.getAttempts(), job.getMaxAttempts(),
                job.getPayload(), e);
        return JobOutcome.FAILED;
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }

    private static String truncate(Exception e) {
        String message = e.getClass().getSimpleName() + ": " + e.getMessage();
        return message.length() > MAX_ERROR_LENGTH ? message.substring(0, MAX_ERROR_LENGTH) : message;
    }

    public ExecutorStats getStats() {
        return new ExecutorStats(totalCompleted.get(), totalRetried.get(), totalFailed.get());
    }

    public record ExecutorStats(long completed, long retried, long failed) {
    }
}
