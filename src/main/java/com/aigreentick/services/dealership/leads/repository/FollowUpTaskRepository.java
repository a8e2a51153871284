package com.aigreentick.services.dealership.leads.repository;

import java.time.LocalDateTime;
import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import com.aigreentick.services.dealership.leads.enums.FollowUpStatus;
import com.aigreentick.services.dealership.leads.model.FollowUpTask;

@Repository
public interface FollowUpTaskRepository extends JpaRepository<FollowUpTask, Long> {

    List<FollowUpTask> findByAssignmentIdAndStatus(Long assignmentId, FollowUpStatus status);

    /**
     * Closing an assignment ends its reminders.
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
                UPDATE FollowUpTask t
                SET t.status = com.aigreentick.services.dealership.leads.enums.FollowUpStatus.CANCELLED,
                    t.completedAt = :now
                WHERE t.assignmentId = :assignmentId
                  AND t.status = com.aigreentick.services.dealership.leads.enums.FollowUpStatus.PENDING
            """)
    int cancelPending(@Param("assignmentId") Long assignmentId, @Param("now") LocalDateTime now);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
                UPDATE FollowUpTask t
                SET t.status = com.aigreentick.services.dealership.leads.enums.FollowUpStatus.COMPLETED,
                    t.completedAt = :now,
                    t.notes = COALESCE(:notes, t.notes)
                WHERE t.id = :id
                  AND t.status = com.aigreentick.services.dealership.leads.enums.FollowUpStatus.PENDING
            """)
    int complete(@Param("id") Long id, @Param("notes") String notes, @Param("now") LocalDateTime now);
}
