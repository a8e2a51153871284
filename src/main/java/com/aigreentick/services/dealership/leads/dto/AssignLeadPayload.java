package com.aigreentick.services.dealership.leads.dto;

import java.math.BigDecimal;

import com.aigreentick.services.dealership.leads.enums.Urgency;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Payload of {@code assign_lead}; doubles as the matching criteria.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AssignLeadPayload {
    private Long customerId;
    private Long inquiryId;
    private Double leadScore;
    private String vehicleType;
    private BigDecimal priceRange;
    private String location;
    private Urgency urgency;
    private String source;
    private String preferredLanguage;
}
