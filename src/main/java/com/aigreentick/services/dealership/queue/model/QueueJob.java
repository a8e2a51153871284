package com.aigreentick.services.dealership.queue.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

import com.aigreentick.services.dealership.queue.enums.JobStatus;
import com.aigreentick.services.dealership.queue.enums.JobType;

@Entity
@Table(
    name = "queue_jobs",
    indexes = {
        @Index(name = "idx_queue_jobs_due", columnList = "type, status, available_at, priority"),
        @Index(name = "idx_queue_jobs_dedupe", columnList = "dedupe_key")
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class QueueJob {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 40)
    private JobType type;

    @Column(nullable = false, columnDefinition = "json")
    private String payload;

    // lower value runs first
    @Column(nullable = false)
    private int priority;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private JobStatus status = JobStatus.WAITING;

    @Column(nullable = false)
    @Builder.Default
    private int attempts = 0;

    @Column(name = "max_attempts", nullable = false)
    private int maxAttempts;

    @Column(name = "available_at", nullable = false)
    private LocalDateTime availableAt;

    @Column(name = "started_at")
    private LocalDateTime startedAt;

    @Column(name = "finished_at")
    private LocalDateTime finishedAt;

    @Column(name = "last_error", length = 2000)
    private String lastError;

    @Column(name = "dedupe_key", length = 128)
    private String dedupeKey;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        LocalDateTime now = LocalDateTime.now();
        if (createdAt == null) {
            createdAt = now;
        }
        updatedAt = now;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }

    /**
     * Mirrors the claim update on the detached instance handed to the worker.
     */
    public void markClaimed(LocalDateTime now) {
        this.status = JobStatus.ACTIVE;
        this.startedAt = now;
        this.attempts = this.attempts + 1;
    }

    public boolean hasAttemptsLeft() {
        return attempts < maxAttempts;
    }
}
