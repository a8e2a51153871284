package com.aigreentick.services.dealership.campaigns.dto;

import com.aigreentick.services.dealership.campaigns.enums.CampaignStatus;

/**
 * Outcome of one campaign batch. {@code processed} is false when the campaign was not in a
 * sendable status and nothing was changed.
 *
 * @param nextStartIndex start of the batch queued next, or null when none was queued
 */
public record CampaignBatchResult(
        Long campaignId,
        boolean processed,
        CampaignStatus status,
        int total,
        int startIndex,
        int endIndex,
        int queued,
        Integer nextStartIndex,
        String reason) {

    public static CampaignBatchResult stateConflict(Long campaignId, CampaignStatus status) {
        return new CampaignBatchResult(campaignId, false, status, 0, 0, 0, 0, null,
                "Campaign is not sendable in status " + status);
    }

    public static CampaignBatchResult stopped(Long campaignId, int total, int startIndex, int endIndex, int queued) {
        return new CampaignBatchResult(campaignId, true, CampaignStatus.FAILED, total, startIndex, endIndex, queued, null,
                "Campaign was cancelled during the batch");
    }
}
