package com.aigreentick.services.dealership.leads.handler;

import org.springframework.stereotype.Component;

import com.aigreentick.services.dealership.common.exception.InvalidJobPayloadException;
import com.aigreentick.services.dealership.leads.dto.CalculateLeadScorePayload;
import com.aigreentick.services.dealership.leads.service.impl.LeadScoringService;
import com.aigreentick.services.dealership.queue.enums.JobType;
import com.aigreentick.services.dealership.queue.service.JobHandler;

import lombok.RequiredArgsConstructor;

@Component
@RequiredArgsConstructor
public class CalculateLeadScoreJobHandler implements JobHandler<CalculateLeadScorePayload> {

    private final LeadScoringService leadScoringService;

    @Override
    public JobType type() {
        return JobType.CALCULATE_LEAD_SCORE;
    }

    @Override
    public Class<CalculateLeadScorePayload> payloadType() {
        return CalculateLeadScorePayload.class;
    }

    @Override
    public Object handle(CalculateLeadScorePayload payload) {
        if (payload.getBatchCustomerIds() != null && !payload.getBatchCustomerIds().isEmpty()) {
            return leadScoringService.scoreBatch(payload.getBatchCustomerIds(), payload.isForceRecalculation(), payload.getReason());
        }
        if (payload.getInquiryId() != null) {
            return leadScoringService.scoreInquiry(payload.getInquiryId(), payload.getReason()).getId();
        }
        InvalidJobPayloadException.require(payload.getCustomerId() != null,
                "customerId, inquiryId or batchCustomerIds is required");
        return leadScoringService.scoreCustomer(payload.getCustomerId(), payload.getReason()).getId();
    }
}
