package com.aigreentick.services.dealership.campaigns.handler;

import org.springframework.stereotype.Component;

import com.aigreentick.services.dealership.campaigns.dto.SmsStatusPayload;
import com.aigreentick.services.dealership.campaigns.service.impl.DeliveryStatusProcessor;
import com.aigreentick.services.dealership.queue.enums.JobType;
import com.aigreentick.services.dealership.queue.service.JobHandler;

import lombok.RequiredArgsConstructor;

@Component
@RequiredArgsConstructor
public class ProcessSmsStatusJobHandler implements JobHandler<SmsStatusPayload> {

    private final DeliveryStatusProcessor deliveryStatusProcessor;

    @Override
    public JobType type() {
        return JobType.PROCESS_SMS_STATUS;
    }

    @Override
    public Class<SmsStatusPayload> payloadType() {
        return SmsStatusPayload.class;
    }

    @Override
    public Object handle(SmsStatusPayload payload) {
        return deliveryStatusProcessor.processSmsStatus(payload);
    }
}
