package com.aigreentick.services.dealership.campaigns.dto;

import java.util.List;
import java.util.Map;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Payload of {@code send_single_sms}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SendSingleSmsPayload {
    private String to;
    private String message;
    private List<String> mediaUrls;
    private Long customerId;
    private Long campaignId;
    private Map<String, String> personalizationData;
    private String senderName;
    private String dedupeKey;
}
