package com.aigreentick.services.dealership.leads.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

import com.aigreentick.services.dealership.leads.enums.TouchpointType;

@Entity
@Table(
    name = "customer_touchpoints",
    indexes = {
        @Index(name = "idx_touchpoints_customer", columnList = "customer_id, occurred_at")
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CustomerTouchpoint {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "customer_id", nullable = false)
    private Long customerId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    private TouchpointType type;

    @Column(name = "occurred_at", nullable = false)
    private LocalDateTime occurredAt;
}
