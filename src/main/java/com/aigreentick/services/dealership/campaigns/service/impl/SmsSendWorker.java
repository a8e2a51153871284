package com.aigreentick.services.dealership.campaigns.service.impl;

import java.time.Clock;
import java.time.LocalDateTime;

import org.springframework.stereotype.Service;

import com.aigreentick.services.dealership.campaigns.client.dto.SmsMessage;
import com.aigreentick.services.dealership.campaigns.client.dto.SmsSendResult;
import com.aigreentick.services.dealership.campaigns.client.service.SmsTransport;
import com.aigreentick.services.dealership.campaigns.dto.SendResult;
import com.aigreentick.services.dealership.campaigns.dto.SendSingleSmsPayload;
import com.aigreentick.services.dealership.campaigns.enums.Channel;
import com.aigreentick.services.dealership.campaigns.enums.DeliveryStatus;
import com.aigreentick.services.dealership.campaigns.repository.CampaignRepository;
import com.aigreentick.services.dealership.campaigns.repository.DeliveryLogRepository;
import com.aigreentick.services.dealership.campaigns.service.impl.DeliveryLogger.Entry;
import com.aigreentick.services.dealership.common.exception.InvalidJobPayloadException;
import com.aigreentick.services.dealership.common.exception.NonRetryableJobException;
import com.aigreentick.services.dealership.common.exception.ProviderException;
import com.aigreentick.services.dealership.common.util.PhoneNumbers;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Service
@RequiredArgsConstructor
public class SmsSendWorker {

    private final SmsTransport smsTransport;
    private final OptOutGate optOutGate;
    private final PersonalizationEngine personalizationEngine;
    private final DeliveryLogger deliveryLogger;
    private final DeliveryLogRepository deliveryLogRepository;
    private final CampaignRepository campaignRepository;
    private final Clock clock;

    public SendResult send(SendSingleSmsPayload payload) {
        InvalidJobPayloadException.require(payload.getMessage() != null && !payload.getMessage().isBlank(),
                "message is required");
        String to = PhoneNumbers.normalize(payload.getTo());
        InvalidJobPayloadException.require(to != null, "to is not a phone number: " + payload.getTo());

        String message = personalizationEngine.personalize(payload.getMessage(), payload.getPersonalizationData());
        Entry entry = new Entry(Channel.SMS, payload.getCampaignId(), payload.getCustomerId(), to, null, message,
                payload.getDedupeKey());

        if (payload.getCampaignId() != null && optOutGate.isOptedOut(Channel.SMS, to)) {
            deliveryLogger.skipped(entry, "Recipient opted out");
            log.info("SMS skipped, recipient opted out. campaignId={} to={}", payload.getCampaignId(), to);
            return SendResult.skipped("Recipient opted out");
        }

        if (payload.getDedupeKey() != null
                && deliveryLogRepository.existsByDedupeKeyAndStatus(payload.getDedupeKey(), DeliveryStatus.SENT)) {
            log.info("SMS already sent, not repeating. dedupeKey={}", payload.getDedupeKey());
            return SendResult.skipped("Already sent");
        }

        SmsSendResult result;
        try {
            result = smsTransport.send(new SmsMessage(to, message, payload.getMediaUrls(), payload.getSenderName(),
                    payload.getDedupeKey()));
        } catch (ProviderException e) {
            deliveryLogger.failed(entry, e.getMessage());
            log.error("SMS send failed. to={} campaignId={} retryable={}", to, payload.getCampaignId(), e.isRetryable(), e);
            if (e.isRetryable()) {
                throw e;
            }
            // retryable errors are counted by countExhausted once the job gives up
            countFailed(payload.getCampaignId());
            throw new NonRetryableJobException("SMS rejected for " + to + ": " + e.getMessage(), e);
        }

        deliveryLogger.sent(entry, result.messageId(), result.cost(), result.segments());
        log.info("SMS sent. to={} messageId={} segments={} campaignId={}",
                to, result.messageId(), result.segments(), payload.getCampaignId());
        return SendResult.sent(result.messageId(), result.cost(), result.segments());
    }

    /**
     * Counts a send whose retries ran out against its campaign.
     */
    public void countExhausted(SendSingleSmsPayload payload, Exception cause) {
        log.warn("SMS send gave up. to={} campaignId={} cause={}", payload.getTo(), payload.getCampaignId(),
                cause.getMessage());
        countFailed(payload.getCampaignId());
    }

    private void countFailed(Long campaignId) {
        if (campaignId != null) {
            campaignRepository.incrementFailed(campaignId, LocalDateTime.now(clock));
        }
    }
}
