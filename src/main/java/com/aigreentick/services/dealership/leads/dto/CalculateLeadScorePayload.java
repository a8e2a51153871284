package com.aigreentick.services.dealership.leads.dto;

import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Payload of {@code calculate_lead_score}. Exactly one of customerId, inquiryId or
 * batchCustomerIds is expected.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CalculateLeadScorePayload {
    private Long customerId;
    private Long inquiryId;
    private List<Long> batchCustomerIds;
    private boolean forceRecalculation;
    private String reason;
}
