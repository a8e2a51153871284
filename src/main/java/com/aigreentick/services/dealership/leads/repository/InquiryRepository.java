package com.aigreentick.services.dealership.leads.repository;

import java.time.LocalDateTime;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import com.aigreentick.services.dealership.common.exception.IllegalStateTransitionException;
import com.aigreentick.services.dealership.leads.enums.InquiryStatus;
import com.aigreentick.services.dealership.leads.model.Inquiry;

@Repository
public interface InquiryRepository extends JpaRepository<Inquiry, Long> {

    long countByCustomerId(Long customerId);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
                UPDATE Inquiry i
                SET i.status = :to,
                    i.respondedAt = COALESCE(:respondedAt, i.respondedAt)
                WHERE i.id = :id
                  AND i.status = :from
            """)
    int compareAndSetStatus(
            @Param("id") Long id,
            @Param("from") InquiryStatus from,
            @Param("to") InquiryStatus to,
            @Param("respondedAt") LocalDateTime respondedAt);

    default void transition(Inquiry inquiry, InquiryStatus to, LocalDateTime now) {
        if (!inquiry.getStatus().canTransitionTo(to)) {
            throw new IllegalStateTransitionException("Inquiry", inquiry.getId(), inquiry.getStatus(), to);
        }
        LocalDateTime respondedAt = to == InquiryStatus.RESPONDED ? now : null;
        if (compareAndSetStatus(inquiry.getId(), inquiry.getStatus(), to, respondedAt) != 1) {
            throw new IllegalStateTransitionException("Inquiry", inquiry.getId(), "status changed concurrently");
        }
    }
}
