package com.aigreentick.services.dealership.campaigns.client.service;

import com.aigreentick.services.dealership.campaigns.client.dto.SmsMessage;
import com.aigreentick.services.dealership.campaigns.client.dto.SmsSendResult;

/**
 * SMS provider. Real and simulated implementations are selected by Spring profile.
 */
public interface SmsTransport {

    /**
     * @throws com.aigreentick.services.dealership.common.exception.ProviderException when the provider rejects
     *         the message or cannot be reached
     */
    SmsSendResult send(SmsMessage message);
}
