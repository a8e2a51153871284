package com.aigreentick.services.dealership.campaigns.dto;

import com.aigreentick.services.dealership.campaigns.enums.DeliveryStatus;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SmsStatusPayload {
    private String messageId;
    private String phoneNumber;
    private Long campaignId;
    private DeliveryStatus status;
    private String errorMessage;
}
