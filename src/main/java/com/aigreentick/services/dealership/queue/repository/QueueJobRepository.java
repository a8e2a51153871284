package com.aigreentick.services.dealership.queue.repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import com.aigreentick.services.dealership.queue.enums.JobStatus;
import com.aigreentick.services.dealership.queue.enums.JobType;
import com.aigreentick.services.dealership.queue.model.QueueJob;

@Repository
public interface QueueJobRepository extends JpaRepository<QueueJob, Long> {

    @Query("""
                SELECT j FROM QueueJob j
                WHERE j.type = :type
                  AND j.status = com.aigreentick.services.dealership.queue.enums.JobStatus.WAITING
                  AND j.availableAt <= :now
                ORDER BY j.priority ASC, j.availableAt ASC, j.id ASC
            """)
    List<QueueJob> findDueJobs(
            @Param("type") JobType type,
            @Param("now") LocalDateTime now,
            Pageable pageable);

    Optional<QueueJob> findFirstByDedupeKeyAndStatusIn(String dedupeKey, Collection<JobStatus> statuses);

    long countByTypeAndStatus(JobType type, JobStatus status);

    /**
     * Compare-and-set claim. Returns 1 only for the worker that won the job.
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
                UPDATE QueueJob j
                SET j.status = com.aigreentick.services.dealership.queue.enums.JobStatus.ACTIVE,
                    j.attempts = j.attempts + 1,
                    j.startedAt = :now,
                    j.updatedAt = :now
                WHERE j.id = :id
                  AND j.status = com.aigreentick.services.dealership.queue.enums.JobStatus.WAITING
            """)
    int claim(@Param("id") Long id, @Param("now") LocalDateTime now);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
                UPDATE QueueJob j
                SET j.status = com.aigreentick.services.dealership.queue.enums.JobStatus.COMPLETED,
                    j.finishedAt = :now,
                    j.updatedAt = :now
                WHERE j.id = :id
                  AND j.status = com.aigreentick.services.dealership.queue.enums.JobStatus.ACTIVE
            """)
    int markCompleted(@Param("id") Long id, @Param("now") LocalDateTime now);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
                UPDATE QueueJob j
                SET j.status = com.aigreentick.services.dealership.queue.enums.JobStatus.FAILED,
                    j.lastError = :error,
                    j.finishedAt = :now,
                    j.updatedAt = :now
                WHERE j.id = :id
                  AND j.status = com.aigreentick.services.dealership.queue.enums.JobStatus.ACTIVE
            """)
    int markFailed(@Param("id") Long id, @Param("error") String error, @Param("now") LocalDateTime now);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
                UPDATE QueueJob j
                SET j.status = com.aigreentick.services.dealership.queue.enums.JobStatus.WAITING,
                    j.availableAt = :availableAt,
                    j.lastError = :error,
                    j.updatedAt = :now
                WHERE j.id = :id
                  AND j.status = com.aigreentick.services.dealership.queue.enums.JobStatus.ACTIVE
            """)
    int scheduleRetry(
            @Param("id") Long id,
            @Param("availableAt") LocalDateTime availableAt,
            @Param("error") String error,
            @Param("now") LocalDateTime now);

    /**
     * Returns jobs whose worker died mid-flight to the waiting set, as long as they
     * have attempts left. The others are picked up by {@link #findStalledExhausted}.
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
                UPDATE QueueJob j
                SET j.status = com.aigreentick.services.dealership.queue.enums.JobStatus.WAITING,
                    j.availableAt = :now,
                    j.lastError = 'stalled',
                    j.updatedAt = :now
                WHERE j.status = com.aigreentick.services.dealership.queue.enums.JobStatus.ACTIVE
                  AND j.startedAt < :cutoff
                  AND j.attempts < j.maxAttempts
            """)
    int releaseStalled(@Param("cutoff") LocalDateTime cutoff, @Param("now") LocalDateTime now);

    @Query("""
                SELECT j FROM QueueJob j
                WHERE j.status = com.aigreentick.services.dealership.queue.enums.JobStatus.ACTIVE
                  AND j.startedAt < :cutoff
                  AND j.attempts >= j.maxAttempts
                ORDER BY j.startedAt ASC
            """)
    List<QueueJob> findStalledExhausted(@Param("cutoff") LocalDateTime cutoff);
}
