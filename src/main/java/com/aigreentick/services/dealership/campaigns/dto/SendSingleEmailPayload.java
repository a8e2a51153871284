package com.aigreentick.services.dealership.campaigns.dto;

import java.util.Map;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Payload of {@code send_single_email}. Campaign sends carry the campaign id and the
 * dedupe key; internal notifications carry neither.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SendSingleEmailPayload {
    private String to;
    private String subject;
    private String content;
    private String htmlContent;
    private Long customerId;
    private Long campaignId;
    private Map<String, String> personalizationData;
    private Integer priority;
    private String dedupeKey;
}
