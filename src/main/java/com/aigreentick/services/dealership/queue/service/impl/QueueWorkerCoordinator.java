package com.aigreentick.services.dealership.queue.service.impl;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import com.aigreentick.services.dealership.config.ExecutorConfig.WorkerPool;
import com.aigreentick.services.dealership.queue.enums.JobStatus;
import com.aigreentick.services.dealership.queue.enums.JobType;
import com.aigreentick.services.dealership.queue.model.QueueJob;
import com.aigreentick.services.dealership.queue.repository.QueueJobRepository;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;

/**
 * Polls the job table and hands due jobs to the worker pool of their type.
 * A job is only submitted after a permit of its pool was taken and the
 * compare-and-set claim succeeded, so dequeueing never blocks the poller.
 */
@Slf4j
@Service
public class QueueWorkerCoordinator {

    private final QueueJobRepository queueJobRepository;
    private final QueueJobExecutor queueJobExecutor;
    private final Map<JobType, WorkerPool> workerPools;
    private final Clock clock;

    @Value("${queue.enabled:true}")
    private boolean enabled;

    @Value("${queue.claim-batch-size:20}")
    private int claimBatchSize;

    @Value("${queue.stalled-after:10m}")
    private Duration stalledAfter;

    private final AtomicBoolean shutdownRequested = new AtomicBoolean(false);

    // Metrics
    private final AtomicLong totalDispatched = new AtomicLong(0);
    private final AtomicLong totalClaimConflicts = new AtomicLong(0);

    public QueueWorkerCoordinator(
            QueueJobRepository queueJobRepository,
            QueueJobExecutor queueJobExecutor,
            @Qualifier("queueWorkerPools") Map<JobType, WorkerPool> workerPools,
            Clock clock) {
        this.queueJobRepository = queueJobRepository;
        this.queueJobExecutor = queueJobExecutor;
        this.workerPools = workerPools;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${queue.poll-interval-ms:500}")
    public void poll() {
        if (!enabled || shutdownRequested.get()) {
            return;
        }
        for (WorkerPool pool : workerPools.values()) {
            try {
                dispatchDueJobs(pool);
            } catch (Exception e) {
                log.error("Polling failed for job type {}", pool.type().getCode(), e);
            }
        }
    }

    /**
     * Claims up to the free capacity of the pool and submits the claimed jobs.
     *
     * @return number of jobs submitted
     */
    int dispatchDueJobs(WorkerPool pool) {
        int free = pool.permits().availablePermits();
        if (free == 0) {
            return 0;
        }

        LocalDateTime now = LocalDateTime.now(clock);
        List<QueueJob> due = queueJobRepository.findDueJobs(
                pool.type(), now, PageRequest.of(0, Math.min(free, claimBatchSize)));

        int submitted = 0;
        for (QueueJob job : due) {
            if (!pool.permits().tryAcquire()) {
                break;
            }
            if (queueJobRepository.claim(job.getId(), now) != 1) {
                // another poller got it first
                totalClaimConflicts.incrementAndGet();
                pool.permits().release();
                continue;
            }
            job.markClaimed(now);

            try {
                pool.executor().submit(() -> runClaimed(pool, job));
                submitted++;
                totalDispatched.incrementAndGet();
            } catch (RejectedExecutionException e) {
                pool.permits().release();
                queueJobRepository.scheduleRetry(job.getId(), now, "worker pool rejected job", now);
                log.warn("Worker pool rejected job. jobId={} type={}", job.getId(), pool.type().getCode());
            }
        }

        if (submitted > 0) {
            log.debug("Dispatched {} jobs. type={} inFlight={}/{}",
                    submitted, pool.type().getCode(), pool.inFlight(), pool.concurrency());
        }
        return submitted;
    }

    private void runClaimed(WorkerPool pool, QueueJob job) {
        try {
            queueJobExecutor.execute(job);
        } catch (Exception e) {
            log.error("Unexpected worker failure. jobId={} type={}", job.getId(), pool.type().getCode(), e);
        } finally {
            pool.permits().release();
        }
    }

    @Scheduled(fixedDelayString = "${queue.stalled-check-interval-ms:60000}")
    public void recoverStalledJobs() {
        if (!enabled || shutdownRequested.get()) {
            return;
        }
        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime cutoff = now.minus(stalledAfter);

        int released = queueJobRepository.releaseStalled(cutoff, now);
        if (released > 0) {
            log.warn("Released {} stalled jobs back to the waiting set", released);
        }

        // no attempts left, so these are given up instead of run again
        int failed = 0;
        for (QueueJob job : queueJobRepository.findStalledExhausted(cutoff)) {
            if (queueJobExecutor.failStalled(job)) {
                failed++;
            }
        }
        if (failed > 0) {
            log.warn("Failed {} stalled jobs that had no attempts left", failed);
        }
    }

    public QueueStats getStats() {
        Map<JobType, Long> waiting = new EnumMap<>(JobType.class);
        Map<JobType, Integer> inFlight = new EnumMap<>(JobType.class);
        for (WorkerPool pool : workerPools.values()) {
            waiting.put(pool.type(), queueJobRepository.countByTypeAndStatus(pool.type(), JobStatus.WAITING));
            inFlight.put(pool.type(), pool.inFlight());
        }
        return new QueueStats(totalDispatched.get(), totalClaimConflicts.get(), waiting, inFlight);
    }

    @PreDestroy
    public void shutdown() {
        shutdownRequested.set(true);
        log.info("Queue worker coordinator stopping. dispatched={}", totalDispatched.get());
    }

    public record QueueStats(
            long totalDispatched,
            long claimConflicts,
            Map<JobType, Long> waiting,
            Map<JobType, Integer> inFlight
    ) {
    }
}
