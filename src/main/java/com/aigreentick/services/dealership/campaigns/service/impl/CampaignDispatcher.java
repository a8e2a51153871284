package com.aigreentick.services.dealership.campaigns.service.impl;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

import org.springframework.stereotype.Service;

import com.aigreentick.services.dealership.campaigns.dto.CampaignBatchPayload;
import com.aigreentick.services.dealership.campaigns.dto.CampaignBatchResult;
import com.aigreentick.services.dealership.campaigns.dto.CampaignProgress;
import com.aigreentick.services.dealership.campaigns.dto.SendSingleEmailPayload;
import com.aigreentick.services.dealership.campaigns.dto.SendSingleSmsPayload;
import com.aigreentick.services.dealership.campaigns.enums.CampaignStatus;
import com.aigreentick.services.dealership.campaigns.enums.Channel;
import com.aigreentick.services.dealership.campaigns.enums.DeliveryStatus;
import com.aigreentick.services.dealership.campaigns.model.Campaign;
import com.aigreentick.services.dealership.campaigns.repository.CampaignRepository;
import com.aigreentick.services.dealership.campaigns.repository.DeliveryLogRepository;
import com.aigreentick.services.dealership.common.exception.CampaignOrchestrationException;
import com.aigreentick.services.dealership.common.exception.IllegalStateTransitionException;
import com.aigreentick.services.dealership.common.exception.InvalidJobPayloadException;
import com.aigreentick.services.dealership.common.exception.ResourceNotFoundException;
import com.aigreentick.services.dealership.common.util.DedupeKeys;
import com.aigreentick.services.dealership.config.CampaignProperties;
import com.aigreentick.services.dealership.config.CampaignProperties.Throttle;
import com.aigreentick.services.dealership.leads.model.Customer;
import com.aigreentick.services.dealership.queue.dto.EnqueuedJob;
import com.aigreentick.services.dealership.queue.dto.JobOptions;
import com.aigreentick.services.dealership.queue.enums.DedupePolicy;
import com.aigreentick.services.dealership.queue.service.QueueRuntime;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Expands a campaign into individual send jobs, one batch per orchestration job.
 * <p>
 * Each batch queues the sends of its slice of the recipient list, adds them to the
 * {@code sent} counter and queues the next batch after the channel's batch delay. The
 * campaign moves SCHEDULED, SENDING, SENT; any failure while expanding marks it FAILED.
 * Sends already queued are not withdrawn.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CampaignDispatcher {

    private static final int START_PRIORITY = 1;

    private final CampaignRepository campaignRepository;
    private final DeliveryLogRepository deliveryLogRepository;
    private final RecipientResolver recipientResolver;
    private final PersonalizationEngine personalizationEngine;
    private final QueueRuntime queueRuntime;
    private final CampaignProperties properties;
    private final Clock clock;

    public CampaignBatchResult processCampaignBatch(Channel channel, CampaignBatchPayload payload) {
        InvalidJobPayloadException.require(payload.getCampaignId() != null, "campaignId is required");
        Throttle throttle = properties.forChannel(channel);
        int batchSize = payload.getBatchSize() == null ? throttle.getBatchSize() : payload.getBatchSize();
        int startIndex = payload.getStartIndex() == null ? 0 : payload.getStartIndex();
        return processCampaignBatch(channel, payload.getCampaignId(), batchSize, startIndex);
    }

    public CampaignBatchResult processCampaignBatch(Channel channel, Long campaignId, int batchSize, int startIndex) {
        InvalidJobPayloadException.require(batchSize > 0, "batchSize must be positive");
        InvalidJobPayloadException.require(startIndex >= 0, "startIndex must not be negative");

        Campaign campaign = campaignRepository.findById(campaignId)
                .orElseThrow(() -> new InvalidJobPayloadException("Campaign not found: " + campaignId));
        InvalidJobPayloadException.require(campaign.getChannel() == channel,
                "Campaign " + campaignId + " is an " + campaign.getChannel() + " campaign");

        if (!campaign.getStatus().isSendable()) {
            log.warn("Campaign batch ignored, campaign not sendable. campaignId={} status={}",
                    campaignId, campaign.getStatus());
            return CampaignBatchResult.stateConflict(campaignId, campaign.getStatus());
        }

        try {
            return expandBatch(campaign, batchSize, startIndex);
        } catch (RuntimeException e) {
            log.error("Campaign batch failed. campaignId={} start={}", campaignId, startIndex, e);
            markFailed(campaignId);
            throw new CampaignOrchestrationException(campaignId, e);
        }
    }

    private CampaignBatchResult expandBatch(Campaign campaign, int batchSize, int startIndex) {
        Long campaignId = campaign.getId();
        Channel channel = campaign.getChannel();
        Throttle throttle = properties.forChannel(channel);

        List<Customer> recipients = recipientResolver.resolve(campaign);
        int total = recipients.size();

        if (total == 0) {
            campaignRepository.transition(campaign, CampaignStatus.SENT, LocalDateTime.now(clock));
            log.info("Campaign has no recipients, marked sent. campaignId={}", campaignId);
            return new CampaignBatchResult(campaignId, true, CampaignStatus.SENT, 0, startIndex, startIndex, 0, null,
                    "No recipients");
        }

        if (campaign.getStatus() == CampaignStatus.SCHEDULED) {
            campaignRepository.transition(campaign, CampaignStatus.SENDING, LocalDateTime.now(clock));
        }

        int start = Math.min(startIndex, total);
        int end = Math.min(start + batchSize, total);
        int queued = 0;

        for (Customer recipient : recipients.subList(start, end)) {
            if (enqueueSend(campaign, recipient, start, throttle)) {
                queued++;
            }
        }

        if (queued > 0) {
            campaignRepository.incrementSent(campaignId, queued, LocalDateTime.now(clock));
        }
        log.info("Campaign batch queued. campaignId={} channel={} start={} end={} total={} queued={}",
                campaignId, channel, start, end, total, queued);

        Campaign current = campaignRepository.findById(campaignId)
                .orElseThrow(() -> new IllegalStateException("Campaign disappeared: " + campaignId));
        if (current.getStatus() == CampaignStatus.FAILED) {
            log.warn("Campaign cancelled during batch, no further batches. campaignId={}", campaignId);
            return CampaignBatchResult.stopped(campaignId, total, start, end, queued);
        }

        if (end < total) {
            queueBatch(channel, campaignId, batchSize, end, throttle.getBatchDelay(), JobOptions.DEFAULT_PRIORITY);
            return new CampaignBatchResult(campaignId, true, current.getStatus(), total, start, end, queued, end, null);
        }

        campaignRepository.transition(current, CampaignStatus.SENT, LocalDateTime.now(clock));
        log.info("Campaign fully queued, marked sent. campaignId={} recipients={}", campaignId, total);
        return new CampaignBatchResult(campaignId, true, CampaignStatus.SENT, total, start, end, queued, null, null);
    }

    /**
     * @return true when a new send job was stored, false for a deduplicated or unreachable recipient
     */
    private boolean enqueueSend(Campaign campaign, Customer recipient, int batchStart, Throttle throttle) {
        Channel channel = campaign.getChannel();
        String address = RecipientResolver.addressOf(recipient, channel);
        if (address == null || address.isBlank()) {
            log.warn("Recipient without address skipped. campaignId={} customerId={}", campaign.getId(), recipient.getId());
            return false;
        }

        Map<String, String> data = personalizationEngine.recipientData(recipient);
        String dedupeKey = DedupeKeys.campaignSend(channel.name(), campaign.getId(), address, batchStart);

        Object payload = channel == Channel.EMAIL
                ? SendSingleEmailPayload.builder()
                        .to(address)
                        .subject(personalizationEngine.personalize(campaign.getSubject(), data))
                        .content(personalizationEngine.personalize(campaign.getContent(), data))
                        .htmlContent(personalizationEngine.personalize(campaign.getHtmlContent(), data))
                        .customerId(recipient.getId())
                        .campaignId(campaign.getId())
                        .personalizationData(data)
                        .priority(properties.getSendPriority())
                        .dedupeKey(dedupeKey)
                        .build()
                : SendSingleSmsPayload.builder()
                        .to(address)
                        .message(personalizationEngine.personalize(campaign.getContent(), data))
                        .customerId(recipient.getId())
                        .campaignId(campaign.getId())
                        .personalizationData(data)
                        .senderName(campaign.getSenderName())
                        .dedupeKey(dedupeKey)
                        .build();

        EnqueuedJob job = queueRuntime.enqueue(channel.getSendJobType(), payload, JobOptions.builder()
                .priority(properties.getSendPriority())
                .delay(jitter(throttle))
                .dedupeKey(dedupeKey)
                .dedupePolicy(DedupePolicy.ONCE)
                .build());
        return !job.deduplicated();
    }

    static Duration jitter(Throttle throttle) {
        long min = throttle.getJitterMin().toMillis();
        long max = throttle.getJitterMax().toMillis();
        if (max <= min) {
            return Duration.ofMillis(min);
        }
        return Duration.ofMillis(ThreadLocalRandom.current().nextLong(min, max + 1));
    }

    private EnqueuedJob queueBatch(Channel channel, Long campaignId, Integer batchSize, int startIndex,
            Duration delay, int priority) {
        EnqueuedJob job = queueRuntime.enqueue(channel.getBatchJobType(),
                CampaignBatchPayload.builder()
                        .campaignId(campaignId)
                        .batchSize(batchSize)
                        .startIndex(startIndex)
                        .build(),
                JobOptions.builder()
                        .priority(priority)
                        .delay(delay)
                        .dedupeKey("campaign-batch:" + campaignId + ":" + startIndex)
                        .dedupePolicy(DedupePolicy.ONCE)
                        .build());
        log.debug("Campaign batch scheduled. campaignId={} start={} in={}s", campaignId, startIndex, delay.toSeconds());
        return job;
    }

    /**
     * Moves a campaign to FAILED unless it already reached a terminal state.
     */
    public void markFailed(Long campaignId) {
        try {
            campaignRepository.findById(campaignId)
                    .filter(c -> c.getStatus().canTransitionTo(CampaignStatus.FAILED))
                    .ifPresent(c -> campaignRepository.transition(c, CampaignStatus.FAILED, LocalDateTime.now(clock)));
        } catch (RuntimeException e) {
            log.error("Could not mark campaign failed. campaignId={}", campaignId, e);
        }
    }

    /**
     * Queues the first batch. A scheduled time in the future delays it.
     */
    public EnqueuedJob startCampaign(Long campaignId) {
        Campaign campaign = campaignRepository.findById(campaignId)
                .orElseThrow(() -> new ResourceNotFoundException("Campaign", campaignId));
        if (campaign.getStatus() != CampaignStatus.SCHEDULED) {
            throw new IllegalStateTransitionException("Campaign", campaignId, campaign.getStatus(), CampaignStatus.SENDING);
        }

        Duration delay = Duration.ZERO;
        LocalDateTime now = LocalDateTime.now(clock);
        if (campaign.getScheduledAt() != null && campaign.getScheduledAt().isAfter(now)) {
            delay = Duration.between(now, campaign.getScheduledAt());
        }

        EnqueuedJob job = queueBatch(campaign.getChannel(), campaignId, null, 0, delay, START_PRIORITY);
        log.info("Campaign start queued. campaignId={} channel={} jobId={} deduplicated={}",
                campaignId, campaign.getChannel(), job.jobId(), job.deduplicated());
        return job;
    }

    /**
     * Stops scheduling further batches. Sends already queued still run.
     */
    public CampaignProgress cancelCampaign(Long campaignId) {
        Campaign campaign = campaignRepository.findById(campaignId)
                .orElseThrow(() -> new ResourceNotFoundException("Campaign", campaignId));
        campaignRepository.transition(campaign, CampaignStatus.FAILED, LocalDateTime.now(clock));
        log.warn("Campaign cancelled. campaignId={} previousStatus={}", campaignId, campaign.getStatus());
        return progress(campaignId);
    }

    public CampaignProgress progress(Long campaignId) {
        Campaign campaign = campaignRepository.findById(campaignId)
                .orElseThrow(() -> new ResourceNotFoundException("Campaign", campaignId));
        return CampaignProgress.builder()
                .campaignId(campaign.getId())
                .name(campaign.getName())
                .channel(campaign.getChannel())
                .status(campaign.getStatus())
                .sent(campaign.getSent())
                .delivered(campaign.getDelivered())
                .bounced(campaign.getBounced())
                .failed(campaign.getFailed())
                .skipped(deliveryLogRepository.countByCampaignIdAndStatus(campaignId, DeliveryStatus.SKIPPED))
                .sentAt(campaign.getSentAt())
                .build();
    }
}
