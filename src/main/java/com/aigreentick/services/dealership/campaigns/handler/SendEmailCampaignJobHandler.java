package com.aigreentick.services.dealership.campaigns.handler;

import org.springframework.stereotype.Component;

import com.aigreentick.services.dealership.campaigns.dto.CampaignBatchPayload;
import com.aigreentick.services.dealership.campaigns.enums.Channel;
import com.aigreentick.services.dealership.campaigns.service.impl.CampaignDispatcher;
import com.aigreentick.services.dealership.queue.enums.JobType;
import com.aigreentick.services.dealership.queue.service.JobHandler;

import lombok.RequiredArgsConstructor;

@Component
@RequiredArgsConstructor
public class SendEmailCampaignJobHandler implements JobHandler<CampaignBatchPayload> {

    private final CampaignDispatcher campaignDispatcher;

    @Override
    public JobType type() {
        return JobType.SEND_EMAIL_CAMPAIGN;
    }

    @Override
    public Class<CampaignBatchPayload> payloadType() {
        return CampaignBatchPayload.class;
    }

    @Override
    public Object handle(CampaignBatchPayload payload) {
        return campaignDispatcher.processCampaignBatch(Channel.EMAIL, payload);
    }

    @Override
    public void onExhausted(CampaignBatchPayload payload, Exception cause) {
        if (payload.getCampaignId() != null) {
            campaignDispatcher.markFailed(payload.getCampaignId());
        }
    }
}
