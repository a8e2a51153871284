package com.aigreentick.services.dealership.campaigns.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

@Entity
@Table(
    name = "segment_members",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_segment_customer", columnNames = {"segment_id", "customer_id"})
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SegmentMember {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "segment_id", nullable = false)
    private Long segmentId;

    @Column(name = "customer_id", nullable = false)
    private Long customerId;

    @Column(name = "added_at")
    private LocalDateTime addedAt;
}
