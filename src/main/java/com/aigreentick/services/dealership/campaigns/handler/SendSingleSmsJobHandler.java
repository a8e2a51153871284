package com.aigreentick.services.dealership.campaigns.handler;

import org.springframework.stereotype.Component;

import com.aigreentick.services.dealership.campaigns.dto.SendSingleSmsPayload;
import com.aigreentick.services.dealership.campaigns.service.impl.SmsSendWorker;
import com.aigreentick.services.dealership.queue.enums.JobType;
import com.aigreentick.services.dealership.queue.service.JobHandler;

import lombok.RequiredArgsConstructor;

@Component
@RequiredArgsConstructor
public class SendSingleSmsJobHandler implements JobHandler<SendSingleSmsPayload> {

    private final SmsSendWorker smsSendWorker;

    @Override
    public JobType type() {
        return JobType.SEND_SINGLE_SMS;
    }

    @Override
    public Class<SendSingleSmsPayload> payloadType() {
        return SendSingleSmsPayload.class;
    }

    @Override
    public Object handle(SendSingleSmsPayload payload) {
        return smsSendWorker.send(payload);
    }

    @Override
    public void onExhausted(SendSingleSmsPayload payload, Exception cause) {
        smsSendWorker.countExhausted(payload, cause);
    }
}
