package com.aigreentick.services.dealership.common.exception;

/**
 * Raised after a campaign was marked FAILED because batch orchestration broke.
 * Never retried: resuming needs an operator.
 */
public class CampaignOrchestrationException extends NonRetryableJobException {

    private final Long campaignId;

    public CampaignOrchestrationException(Long campaignId, Throwable cause) {
        super("Campaign batch orchestration failed. campaignId=" + campaignId + ": " + cause.getMessage(), cause);
        this.campaignId = campaignId;
    }

    public Long getCampaignId() {
        return campaignId;
    }
}
