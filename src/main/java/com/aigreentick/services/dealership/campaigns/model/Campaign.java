package com.aigreentick.services.dealership.campaigns.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

import com.aigreentick.services.dealership.campaigns.enums.CampaignStatus;
import com.aigreentick.services.dealership.campaigns.enums.Channel;

@Entity
@Table(
    name = "campaigns",
    indexes = {
        @Index(name = "idx_campaigns_status", columnList = "channel, status")
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Campaign {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private Channel channel;

    @Column(nullable = false, length = 255)
    private String name;

    // email only
    @Column(length = 255)
    private String subject;

    @Lob
    @Column(nullable = false)
    private String content;

    @Lob
    @Column(name = "html_content")
    private String htmlContent;

    @Column(name = "sender_name", length = 20)
    private String senderName;

    @Column(name = "segment_id")
    private Long segmentId;

    // custom audience rule; targeting by rule is not supported yet
    @Column(name = "custom_audience", length = 1000)
    private String customAudience;

    // changed only through CampaignRepository.transition
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Setter(AccessLevel.NONE)
    @Builder.Default
    private CampaignStatus status = CampaignStatus.SCHEDULED;

    // counters are written by atomic UPDATE queries only
    @Column(nullable = false)
    private int sent;

    @Column(nullable = false)
    private int delivered;

    @Column(nullable = false)
    private int bounced;

    @Column(nullable = false)
    private int failed;

    @Column(name = "scheduled_at")
    private LocalDateTime scheduledAt;

    @Column(name = "sent_at")
    private LocalDateTime sentAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @PrePersist
    void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
        updatedAt = createdAt;
    }

    @PreUpdate
    void onUpdate() {
        updatedAt = LocalDateTime.now();
    }

    public boolean hasCustomAudience() {
        return customAudience != null && !customAudience.isBlank();
    }
}
