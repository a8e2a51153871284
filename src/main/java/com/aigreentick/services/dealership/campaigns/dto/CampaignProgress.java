package com.aigreentick.services.dealership.campaigns.dto;

import java.time.LocalDateTime;

import com.aigreentick.services.dealership.campaigns.enums.CampaignStatus;
import com.aigreentick.services.dealership.campaigns.enums.Channel;

import lombok.Builder;

@Builder
public record CampaignProgress(
        Long campaignId,
        String name,
        Channel channel,
        CampaignStatus status,
        int sent,
        int delivered,
        int bounced,
        int failed,
        long skipped,
        LocalDateTime sentAt) {
}
