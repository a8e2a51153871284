package com.aigreentick.services.dealership.campaigns.handler;

import org.springframework.stereotype.Component;

import com.aigreentick.services.dealership.campaigns.dto.SendSingleEmailPayload;
import com.aigreentick.services.dealership.campaigns.service.impl.EmailSendWorker;
import com.aigreentick.services.dealership.queue.enums.JobType;
import com.aigreentick.services.dealership.queue.service.JobHandler;

import lombok.RequiredArgsConstructor;

@Component
@RequiredArgsConstructor
public class SendSingleEmailJobHandler implements JobHandler<SendSingleEmailPayload> {

    private final EmailSendWorker emailSendWorker;

    @Override
    public JobType type() {
        return JobType.SEND_SINGLE_EMAIL;
    }

    @Override
    public Class<SendSingleEmailPayload> payloadType() {
        return SendSingleEmailPayload.class;
    }

    @Override
    public Object handle(SendSingleEmailPayload payload) {
        return emailSendWorker.send(payload);
    }

    @Override
    public void onExhausted(SendSingleEmailPayload payload, Exception cause) {
        emailSendWorker.countExhausted(payload, cause);
    }
}
