package com.aigreentick.services.dealership.leads.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

import com.aigreentick.services.dealership.leads.enums.Urgency;
import com.aigreentick.services.dealership.leads.enums.WaitQueueStatus;

/**
 * Qualified lead that found no representative. Picked up again by the wait queue retry.
 */
@Entity
@Table(
    name = "lead_wait_queue",
    indexes = {
        @Index(name = "idx_wait_queue_status", columnList = "status, priority, created_at")
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class WaitQueueEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "customer_id")
    private Long customerId;

    @Column(name = "inquiry_id")
    private Long inquiryId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private Urgency priority;

    @Column(name = "lead_score")
    private Double leadScore;

    // assign_lead payload kept for the retry
    @Column(columnDefinition = "json")
    private String criteria;

    @Column(length = 500)
    private String reason;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Setter(AccessLevel.NONE)
    @Builder.Default
    private WaitQueueStatus status = WaitQueueStatus.WAITING;

    @Column(nullable = false)
    private int attempts;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "last_attempt_at")
    private LocalDateTime lastAttemptAt;
}
