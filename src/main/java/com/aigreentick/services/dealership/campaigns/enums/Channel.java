package com.aigreentick.services.dealership.campaigns.enums;

import com.aigreentick.services.dealership.queue.enums.JobType;

/**
 * Delivery channel of a campaign. Each channel has its own orchestration and
 * single-send job types.
 */
public enum Channel {

    EMAIL(JobType.SEND_EMAIL_CAMPAIGN, JobType.SEND_SINGLE_EMAIL),
    SMS(JobType.SEND_SMS_CAMPAIGN, JobType.SEND_SINGLE_SMS);

    private final JobType batchJobType;
    private final JobType sendJobType;

    Channel(JobType batchJobType, JobType sendJobType) {
        this.batchJobType = batchJobType;
        this.sendJobType = sendJobType;
    }

    public JobType getBatchJobType() {
        return batchJobType;
    }

    public JobType getSendJobType() {
        return sendJobType;
    }
}
