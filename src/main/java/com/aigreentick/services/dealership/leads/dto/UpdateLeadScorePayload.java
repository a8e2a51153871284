package com.aigreentick.services.dealership.leads.dto;

import java.util.Map;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Payload of {@code update_lead_score}: an engagement action worth a number of points.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateLeadScorePayload {
    private String email;
    private String phone;
    private Long customerId;
    private String action;
    private int points;
    private Map<String, Object> metadata;
}
