package com.aigreentick.services.dealership.campaigns.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Payload of {@code send_email_campaign} and {@code send_sms_campaign}. Missing batch
 * size and start index fall back to the channel defaults.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CampaignBatchPayload {
    private Long campaignId;
    private Integer batchSize;
    private Integer startIndex;
}
