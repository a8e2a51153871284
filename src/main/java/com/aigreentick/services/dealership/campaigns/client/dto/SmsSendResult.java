package com.aigreentick.services.dealership.campaigns.client.dto;

import java.math.BigDecimal;

/**
 * @param cost     provider price of the message, null when not reported yet
 * @param segments number of billed segments
 */
public record SmsSendResult(String messageId, BigDecimal cost, int segments, String status) {
}
