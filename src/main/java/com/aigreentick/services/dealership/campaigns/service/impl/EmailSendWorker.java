package com.aigreentick.services.dealership.campaigns.service.impl;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Map;

import org.springframework.stereotype.Service;

import com.aigreentick.services.dealership.campaigns.client.dto.EmailMessage;
import com.aigreentick.services.dealership.campaigns.client.dto.EmailSendResult;
import com.aigreentick.services.dealership.campaigns.client.service.EmailTransport;
import com.aigreentick.services.dealership.campaigns.dto.SendResult;
import com.aigreentick.services.dealership.campaigns.dto.SendSingleEmailPayload;
import com.aigreentick.services.dealership.campaigns.enums.Channel;
import com.aigreentick.services.dealership.campaigns.enums.DeliveryStatus;
import com.aigreentick.services.dealership.campaigns.repository.CampaignRepository;
import com.aigreentick.services.dealership.campaigns.repository.DeliveryLogRepository;
import com.aigreentick.services.dealership.campaigns.service.impl.DeliveryLogger.Entry;
import com.aigreentick.services.dealership.common.exception.InvalidJobPayloadException;
import com.aigreentick.services.dealership.common.exception.NonRetryableJobException;
import com.aigreentick.services.dealership.common.exception.ProviderException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Sends one email: campaign and notification mail alike.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EmailSendWorker {

    private final EmailTransport emailTransport;
    private final OptOutGate optOutGate;
    private final PersonalizationEngine personalizationEngine;
    private final DeliveryLogger deliveryLogger;
    private final DeliveryLogRepository deliveryLogRepository;
    private final CampaignRepository campaignRepository;
    private final Clock clock;

    public SendResult send(SendSingleEmailPayload payload) {
        InvalidJobPayloadException.require(payload.getTo() != null && !payload.getTo().isBlank(), "to is required");
        InvalidJobPayloadException.require(payload.getContent() != null, "content is required");

        String to = payload.getTo().trim();
        Map<String, String> data = payload.getPersonalizationData();
        String subject = personalizationEngine.personalize(payload.getSubject(), data);
        String content = personalizationEngine.personalize(payload.getContent(), data);
        String html = personalizationEngine.personalize(payload.getHtmlContent(), data);
        Entry entry = new Entry(Channel.EMAIL, payload.getCampaignId(), payload.getCustomerId(), to, subject, content,
                payload.getDedupeKey());

        if (payload.getCampaignId() != null && optOutGate.isOptedOut(Channel.EMAIL, to)) {
            deliveryLogger.skipped(entry, "Recipient opted out");
            log.info("Email skipped, recipient opted out. campaignId={} to={}", payload.getCampaignId(), to);
            return SendResult.skipped("Recipient opted out");
        }

        if (payload.getDedupeKey() != null
                && deliveryLogRepository.existsByDedupeKeyAndStatus(payload.getDedupeKey(), DeliveryStatus.SENT)) {
            log.info("Email already sent, not repeating. dedupeKey={}", payload.getDedupeKey());
            return SendResult.skipped("Already sent");
        }

        EmailSendResult result;
        try {
            result = emailTransport.send(new EmailMessage(to, subject, content, html, payload.getDedupeKey()));
        } catch (ProviderException e) {
            deliveryLogger.failed(entry, e.getMessage());
            log.error("Email send failed. to={} campaignId={} retryable={}", to, payload.getCampaignId(), e.isRetryable(), e);
            if (e.isRetryable()) {
                throw e;
            }
            // retryable errors are counted by countExhausted once the job gives up
            countFailed(payload.getCampaignId());
            throw new NonRetryableJobException("Email rejected for " + to + ": " + e.getMessage(), e);
        }

        deliveryLogger.sent(entry, result.messageId(), null, null);
        log.info("Email sent. to={} messageId={} campaignId={}", to, result.messageId(), payload.getCampaignId());
        return SendResult.sent(result.messageId(), null, null);
    }

    /**
     * Counts a send whose retries ran out against its campaign.
     */
    public void countExhausted(SendSingleEmailPayload payload, Exception cause) {
        log.warn("Email send gave up. to={} campaignId={} cause={}", payload.getTo(), payload.getCampaignId(),
                cause.getMessage());
        countFailed(payload.getCampaignId());
    }

    private void countFailed(Long campaignId) {
        if (campaignId != null) {
            campaignRepository.incrementFailed(campaignId, LocalDateTime.now(clock));
        }
    }
}
