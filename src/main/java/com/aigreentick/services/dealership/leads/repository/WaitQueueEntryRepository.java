package com.aigreentick.services.dealership.leads.repository;

import java.time.LocalDateTime;
import java.util.List;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import com.aigreentick.services.dealership.common.exception.IllegalStateTransitionException;
import com.aigreentick.services.dealership.leads.enums.WaitQueueStatus;
import com.aigreentick.services.dealership.leads.model.WaitQueueEntry;

@Repository
public interface WaitQueueEntryRepository extends JpaRepository<WaitQueueEntry, Long> {

    @Query("""
                SELECT w FROM WaitQueueEntry w
                WHERE w.status = com.aigreentick.services.dealership.leads.enums.WaitQueueStatus.WAITING
                  AND ((:customerId IS NOT NULL AND w.customerId = :customerId)
                    OR (:inquiryId IS NOT NULL AND w.inquiryId = :inquiryId))
            """)
    List<WaitQueueEntry> findWaitingForLead(@Param("customerId") Long customerId, @Param("inquiryId") Long inquiryId);

    /**
     * Waiting entries, most urgent first. Urgency is stored by name, so the order is spelled out.
     */
    @Query("""
                SELECT w FROM WaitQueueEntry w
                WHERE w.status = com.aigreentick.services.dealership.leads.enums.WaitQueueStatus.WAITING
                  AND w.attempts < :maxAttempts
                ORDER BY CASE w.priority
                           WHEN com.aigreentick.services.dealership.leads.enums.Urgency.URGENT THEN 0
                           WHEN com.aigreentick.services.dealership.leads.enums.Urgency.HIGH THEN 1
                           WHEN com.aigreentick.services.dealership.leads.enums.Urgency.MEDIUM THEN 2
                           ELSE 3 END,
                         w.createdAt ASC
            """)
    List<WaitQueueEntry> findRetryCandidates(@Param("maxAttempts") int maxAttempts, Pageable pageable);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
                UPDATE WaitQueueEntry w
                SET w.attempts = w.attempts + 1,
                    w.lastAttemptAt = :now
                WHERE w.id = :id
            """)
    int incrementAttempts(@Param("id") Long id, @Param("now") LocalDateTime now);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
                UPDATE WaitQueueEntry w
                SET w.status = :to
                WHERE w.id = :id
                  AND w.status = :from
            """)
    int compareAndSetStatus(@Param("id") Long id, @Param("from") WaitQueueStatus from, @Param("to") WaitQueueStatus to);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
                UPDATE WaitQueueEntry w
                SET w.status = com.aigreentick.services.dealership.leads.enums.WaitQueueStatus.EXPIRED
                WHERE w.status = com.aigreentick.services.dealership.leads.enums.WaitQueueStatus.WAITING
                  AND w.createdAt < :cutoff
            """)
    int expireWaitingBefore(@Param("cutoff") LocalDateTime cutoff);

    default void transition(WaitQueueEntry entry, WaitQueueStatus to) {
        if (!entry.getStatus().canTransitionTo(to)) {
            throw new IllegalStateTransitionException("WaitQueueEntry", entry.getId(), entry.getStatus(), to);
        }
        if (compareAndSetStatus(entry.getId(), entry.getStatus(), to) != 1) {
            throw new IllegalStateTransitionException("WaitQueueEntry", entry.getId(), "status changed concurrently");
        }
    }
}
