package com.aigreentick.services.dealership.leads.handler;

import org.springframework.stereotype.Component;

import com.aigreentick.services.dealership.common.exception.InvalidJobPayloadException;
import com.aigreentick.services.dealership.leads.dto.AssignLeadPayload;
import com.aigreentick.services.dealership.leads.service.impl.LeadAssignmentService;
import com.aigreentick.services.dealership.queue.enums.JobType;
import com.aigreentick.services.dealership.queue.service.JobHandler;

import lombok.RequiredArgsConstructor;

@Component
@RequiredArgsConstructor
public class AssignLeadJobHandler implements JobHandler<AssignLeadPayload> {

    private final LeadAssignmentService leadAssignmentService;

    @Override
    public JobType type() {
        return JobType.ASSIGN_LEAD;
    }

    @Override
    public Class<AssignLeadPayload> payloadType() {
        return AssignLeadPayload.class;
    }

    @Override
    public Object handle(AssignLeadPayload payload) {
        InvalidJobPayloadException.require(payload.getLeadScore() != null, "leadScore is required");
        return leadAssignmentService.assign(payload);
    }
}
