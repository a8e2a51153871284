package com.aigreentick.services.dealership.leads.kafka.event;

import java.util.UUID;

import com.aigreentick.services.dealership.leads.enums.LeadEventType;
import com.aigreentick.services.dealership.leads.enums.Urgency;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Lead lifecycle notification for operations tooling.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LeadLifecycleEvent {
    private String eventId;

    private LeadEventType type;

    private Long customerId;

    private Long inquiryId;

    private Long assignmentId;

    private Long representativeId;

    private Long waitQueueEntryId;

    private Urgency urgency;

    private Double leadScore;

    private boolean escalationRequired;

    private String reason;

    private Long timestamp; // epoch millis

    public static LeadLifecycleEvent of(LeadEventType type, Long customerId, Long inquiryId, long timestamp) {
        return LeadLifecycleEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .type(type)
                .customerId(customerId)
                .inquiryId(inquiryId)
                .timestamp(timestamp)
                .build();
    }

    /**
     * Partition key: every event of one lead lands on the same partition.
     */
    public String leadKey() {
        return customerId != null ? "customer-" + customerId : "inquiry-" + inquiryId;
    }
}
