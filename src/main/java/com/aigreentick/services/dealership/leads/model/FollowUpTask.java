package com.aigreentick.services.dealership.leads.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

import com.aigreentick.services.dealership.leads.enums.FollowUpStatus;
import com.aigreentick.services.dealership.leads.enums.FollowUpType;

@Entity
@Table(
    name = "follow_up_tasks",
    indexes = {
        @Index(name = "idx_follow_ups_assignment", columnList = "assignment_id, status")
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FollowUpTask {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "assignment_id", nullable = false)
    private Long assignmentId;

    @Column(name = "representative_id", nullable = false)
    private Long representativeId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private FollowUpType type;

    @Column(name = "due_at", nullable = false)
    private LocalDateTime dueAt;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private FollowUpStatus status = FollowUpStatus.PENDING;

    @Column(length = 1000)
    private String notes;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;
}
