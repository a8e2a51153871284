package com.aigreentick.services.dealership.leads.handler;

import org.springframework.stereotype.Component;

import com.aigreentick.services.dealership.leads.dto.FollowUpReminderPayload;
import com.aigreentick.services.dealership.leads.service.impl.FollowUpScheduler;
import com.aigreentick.services.dealership.queue.enums.JobType;
import com.aigreentick.services.dealership.queue.service.JobHandler;

import lombok.RequiredArgsConstructor;

@Component
@RequiredArgsConstructor
public class FollowUpReminderJobHandler implements JobHandler<FollowUpReminderPayload> {

    private final FollowUpScheduler followUpScheduler;

    @Override
    public JobType type() {
        return JobType.FOLLOW_UP_REMINDER;
    }

    @Override
    public Class<FollowUpReminderPayload> payloadType() {
        return FollowUpReminderPayload.class;
    }

    @Override
    public Object handle(FollowUpReminderPayload payload) {
        return followUpScheduler.processReminder(payload);
    }
}
