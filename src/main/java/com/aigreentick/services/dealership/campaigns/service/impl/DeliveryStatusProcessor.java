package com.aigreentick.services.dealership.campaigns.service.impl;

import java.time.Clock;
import java.time.LocalDateTime;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.aigreentick.services.dealership.campaigns.dto.EmailBouncePayload;
import com.aigreentick.services.dealership.campaigns.dto.SmsStatusPayload;
import com.aigreentick.services.dealership.campaigns.enums.BounceType;
import com.aigreentick.services.dealership.campaigns.enums.Channel;
import com.aigreentick.services.dealership.campaigns.enums.DeliveryStatus;
import com.aigreentick.services.dealership.campaigns.model.DeliveryLog;
import com.aigreentick.services.dealership.campaigns.repository.CampaignRepository;
import com.aigreentick.services.dealership.campaigns.repository.DeliveryLogRepository;
import com.aigreentick.services.dealership.common.exception.InvalidJobPayloadException;
import com.aigreentick.services.dealership.common.util.PhoneNumbers;
import com.aigreentick.services.dealership.leads.repository.CustomerRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Applies provider delivery callbacks. A callback is applied once per provider message id
 * and status; repeats are ignored.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DeliveryStatusProcessor {

    private final DeliveryLogRepository deliveryLogRepository;
    private final DeliveryLogger deliveryLogger;
    private final CampaignRepository campaignRepository;
    private final CustomerRepository customerRepository;
    private final Clock clock;

    /**
     * @return true when the bounce was applied, false for a repeated callback
     */
    @Transactional
    public boolean processEmailBounce(EmailBouncePayload payload) {
        InvalidJobPayloadException.require(payload.getMessageId() != null, "messageId is required");
        InvalidJobPayloadException.require(payload.getEmail() != null, "email is required");

        if (deliveryLogRepository.existsByProviderMessageIdAndStatus(payload.getMessageId(), DeliveryStatus.BOUNCED)) {
            log.debug("Bounce already processed. messageId={}", payload.getMessageId());
            return false;
        }

        BounceType bounceType = payload.getBounceType() == null ? BounceType.TRANSIENT : payload.getBounceType();
        DeliveryLog sentRow = sentRow(payload.getMessageId());
        Long campaignId = payload.getCampaignId() != null ? payload.getCampaignId()
                : sentRow == null ? null : sentRow.getCampaignId();
        Long customerId = sentRow == null ? null : sentRow.getCustomerId();
        LocalDateTime now = LocalDateTime.now(clock);

        deliveryLogger.status(Channel.EMAIL, campaignId, customerId, payload.getEmail(), DeliveryStatus.BOUNCED,
                payload.getMessageId(), "Bounce: " + bounceType);
        if (campaignId != null) {
            campaignRepository.incrementBounced(campaignId, now);
        }
        if (bounceType != BounceType.TRANSIENT) {
            int updated = customerRepository.markEmailBounced(payload.getEmail(), now);
            log.info("Email marked bounced. email={} customers={} bounceType={}", payload.getEmail(), updated, bounceType);
        }

        log.info("Email bounce processed. messageId={} campaignId={} bounceType={}",
                payload.getMessageId(), campaignId, bounceType);
        return true;
    }

    /**
     * @return true when the status was applied, false for a repeated or non-final callback
     */
    @Transactional
    public boolean processSmsStatus(SmsStatusPayload payload) {
        InvalidJobPayloadException.require(payload.getMessageId() != null, "messageId is required");
        InvalidJobPayloadException.require(payload.getStatus() != null, "status is required");

        DeliveryStatus status = payload.getStatus();
        if (status != DeliveryStatus.DELIVERED && status != DeliveryStatus.UNDELIVERED && status != DeliveryStatus.FAILED) {
            log.debug("Non-final SMS status ignored. messageId={} status={}", payload.getMessageId(), status);
            return false;
        }
        if (deliveryLogRepository.existsByProviderMessageIdAndStatus(payload.getMessageId(), status)) {
            log.debug("SMS status already processed. messageId={} status={}", payload.getMessageId(), status);
            return false;
        }

        DeliveryLog sentRow = sentRow(payload.getMessageId());
        Long campaignId = payload.getCampaignId() != null ? payload.getCampaignId()
                : sentRow == null ? null : sentRow.getCampaignId();
        String recipient = payload.getPhoneNumber() != null ? PhoneNumbers.normalize(payload.getPhoneNumber())
                : sentRow == null ? null : sentRow.getRecipient();
        LocalDateTime now = LocalDateTime.now(clock);

        deliveryLogger.status(Channel.SMS, campaignId, sentRow == null ? null : sentRow.getCustomerId(),
                recipient == null ? "unknown" : recipient, status, payload.getMessageId(), payload.getErrorMessage());
        if (campaignId != null) {
            if (status == DeliveryStatus.DELIVERED) {
                campaignRepository.incrementDelivered(campaignId, now);
            } else {
                campaignRepository.incrementFailed(campaignId, now);
            }
        }

        log.info("SMS status processed. messageId={} status={} campaignId={}", payload.getMessageId(), status, campaignId);
        return true;
    }

    /**
     * Email delivered callback. Counted once per message.
     */
    @Transactional
    public boolean processEmailDelivered(String messageId, String email) {
        InvalidJobPayloadException.require(messageId != null, "messageId is required");
        if (deliveryLogRepository.existsByProviderMessageIdAndStatus(messageId, DeliveryStatus.DELIVERED)) {
            return false;
        }
        DeliveryLog sentRow = sentRow(messageId);
        Long campaignId = sentRow == null ? null : sentRow.getCampaignId();
        String recipient = email != null ? email : sentRow == null ? "unknown" : sentRow.getRecipient();

        deliveryLogger.status(Channel.EMAIL, campaignId, sentRow == null ? null : sentRow.getCustomerId(), recipient,
                DeliveryStatus.DELIVERED, messageId, null);
        if (campaignId != null) {
            campaignRepository.incrementDelivered(campaignId, LocalDateTime.now(clock));
        }
        return true;
    }

    private DeliveryLog sentRow(String messageId) {
        return deliveryLogRepository.findFirstByProviderMessageIdAndStatusOrderByIdAsc(messageId, DeliveryStatus.SENT)
                .orElse(null);
    }
}
