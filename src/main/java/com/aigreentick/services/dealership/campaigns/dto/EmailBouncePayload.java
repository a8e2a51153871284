package com.aigreentick.services.dealership.campaigns.dto;

import com.aigreentick.services.dealership.campaigns.enums.BounceType;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EmailBouncePayload {
    private String messageId;
    private String email;
    private Long campaignId;
    private BounceType bounceType;
}
