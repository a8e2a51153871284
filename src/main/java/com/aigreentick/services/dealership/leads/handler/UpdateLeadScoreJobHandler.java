package com.aigreentick.services.dealership.leads.handler;

import org.springframework.stereotype.Component;

import com.aigreentick.services.dealership.common.exception.InvalidJobPayloadException;
import com.aigreentick.services.dealership.leads.dto.UpdateLeadScorePayload;
import com.aigreentick.services.dealership.leads.service.impl.LeadScoringService;
import com.aigreentick.services.dealership.queue.enums.JobType;
import com.aigreentick.services.dealership.queue.service.JobHandler;

import lombok.RequiredArgsConstructor;

@Component
@RequiredArgsConstructor
public class UpdateLeadScoreJobHandler implements JobHandler<UpdateLeadScorePayload> {

    private final LeadScoringService leadScoringService;

    @Override
    public JobType type() {
        return JobType.UPDATE_LEAD_SCORE;
    }

    @Override
    public Class<UpdateLeadScorePayload> payloadType() {
        return UpdateLeadScorePayload.class;
    }

    @Override
    public Object handle(UpdateLeadScorePayload payload) {
        InvalidJobPayloadException.require(payload.getAction() != null && !payload.getAction().isBlank(),
                "action is required");
        return leadScoringService.applyEngagement(payload).orElse(null);
    }
}
