package com.aigreentick.services.dealership.leads.repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import com.aigreentick.services.dealership.common.exception.IllegalStateTransitionException;
import com.aigreentick.services.dealership.leads.enums.AssignmentStatus;
import com.aigreentick.services.dealership.leads.model.LeadAssignment;

@Repository
public interface LeadAssignmentRepository extends JpaRepository<LeadAssignment, Long> {

    @Query("""
                SELECT a FROM LeadAssignment a
                WHERE a.status IN :statuses
                  AND ((:customerId IS NOT NULL AND a.customerId = :customerId)
                    OR (:inquiryId IS NOT NULL AND a.inquiryId = :inquiryId))
                ORDER BY a.assignedAt DESC
            """)
    List<LeadAssignment> findByLeadAndStatusIn(
            @Param("customerId") Long customerId,
            @Param("inquiryId") Long inquiryId,
            @Param("statuses") Collection<AssignmentStatus> statuses);

    default Optional<LeadAssignment> findOpenAssignment(Long customerId, Long inquiryId) {
        return findByLeadAndStatusIn(customerId, inquiryId, AssignmentStatus.OPEN).stream().findFirst();
    }

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
                UPDATE LeadAssignment a
                SET a.status = :to,
                    a.closedAt = :closedAt
                WHERE a.id = :id
                  AND a.status = :from
            """)
    int compareAndSetStatus(
            @Param("id") Long id,
            @Param("from") AssignmentStatus from,
            @Param("to") AssignmentStatus to,
            @Param("closedAt") LocalDateTime closedAt);

    /**
     * Moves an assignment along its transition table. Rejects transitions the table does
     * not allow and transitions that lost a race with another writer.
     */
    default void transition(LeadAssignment assignment, AssignmentStatus to, LocalDateTime now) {
        AssignmentStatus from = assignment.getStatus();
        if (!from.canTransitionTo(to)) {
            throw new IllegalStateTransitionException("LeadAssignment", assignment.getId(), from, to);
        }
        LocalDateTime closedAt = to.isOpen() ? null : now;
        if (compareAndSetStatus(assignment.getId(), from, to, closedAt) != 1) {
            throw new IllegalStateTransitionException("LeadAssignment", assignment.getId(), "status changed concurrently");
        }
    }
}
