package com.aigreentick.services.dealership.campaigns.model;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.Immutable;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import com.aigreentick.services.dealership.campaigns.enums.Channel;
import com.aigreentick.services.dealership.campaigns.enums.DeliveryStatus;

/**
 * One row per send attempt or provider status callback. Rows are never updated;
 * a later status is a new row.
 */
@Entity
@Immutable
@Table(
    name = "delivery_logs",
    indexes = {
        @Index(name = "idx_delivery_logs_campaign", columnList = "campaign_id, status"),
        @Index(name = "idx_delivery_logs_message", columnList = "provider_message_id, status")
    }
)
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DeliveryLog {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private Channel channel;

    @Column(name = "campaign_id")
    private Long campaignId;

    @Column(name = "customer_id")
    private Long customerId;

    @Column(nullable = false, length = 255)
    private String recipient;

    @Column(length = 255)
    private String subject;

    @Lob
    private String content;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private DeliveryStatus status;

    @Column(name = "provider_message_id", length = 255)
    private String providerMessageId;

    @Column(precision = 10, scale = 4)
    private BigDecimal cost;

    private Integer segments;

    @Column(name = "error_message", length = 1000)
    private String errorMessage;

    @Column(name = "dedupe_key", length = 64)
    private String dedupeKey;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;
}
