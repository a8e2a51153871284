package com.aigreentick.services.dealership.leads.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

import com.aigreentick.services.dealership.leads.enums.AssignmentPriority;
import com.aigreentick.services.dealership.leads.enums.AssignmentStatus;
import com.aigreentick.services.dealership.leads.enums.Urgency;

@Entity
@Table(
    name = "lead_assignments",
    indexes = {
        @Index(name = "idx_assignments_customer", columnList = "customer_id, status"),
        @Index(name = "idx_assignments_inquiry", columnList = "inquiry_id, status"),
        @Index(name = "idx_assignments_rep", columnList = "representative_id, status")
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LeadAssignment {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "customer_id")
    private Long customerId;

    @Column(name = "inquiry_id")
    private Long inquiryId;

    @Column(name = "representative_id", nullable = false)
    private Long representativeId;

    // changed only through LeadAssignmentRepository.transition
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Setter(AccessLevel.NONE)
    @Builder.Default
    private AssignmentStatus status = AssignmentStatus.ACTIVE;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private AssignmentPriority priority;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private Urgency urgency;

    @Column(nullable = false)
    private double confidence;

    @Column(name = "assignment_reason", length = 1000)
    private String assignmentReason;

    @Column(name = "lead_score")
    private Double leadScore;

    @Column(name = "assigned_at", nullable = false)
    private LocalDateTime assignedAt;

    @Column(name = "due_at")
    private LocalDateTime dueAt;

    @Column(name = "closed_at")
    private LocalDateTime closedAt;

    @Column(name = "reassignment_reason", length = 500)
    private String reassignmentReason;
}
