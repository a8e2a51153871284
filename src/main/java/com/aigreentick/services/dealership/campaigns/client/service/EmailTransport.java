package com.aigreentick.services.dealership.campaigns.client.service;

import com.aigreentick.services.dealership.campaigns.client.dto.EmailMessage;
import com.aigreentick.services.dealership.campaigns.client.dto.EmailSendResult;

/**
 * Email provider. Real and simulated implementations are selected by Spring profile.
 */
public interface EmailTransport {

    /**
     * @throws com.aigreentick.services.dealership.common.exception.ProviderException when the provider rejects
     *         the message or cannot be reached
     */
    EmailSendResult send(EmailMessage message);
}
