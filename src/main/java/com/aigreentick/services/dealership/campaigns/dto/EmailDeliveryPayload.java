package com.aigreentick.services.dealership.campaigns.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Payload of {@code process_email_delivery}: the provider confirmed the email was delivered.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EmailDeliveryPayload {
    private String messageId;
    private String email;
}
