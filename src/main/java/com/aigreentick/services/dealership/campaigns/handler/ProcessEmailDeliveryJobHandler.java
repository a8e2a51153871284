package com.aigreentick.services.dealership.campaigns.handler;

import org.springframework.stereotype.Component;

import com.aigreentick.services.dealership.campaigns.dto.EmailDeliveryPayload;
import com.aigreentick.services.dealership.campaigns.service.impl.DeliveryStatusProcessor;
import com.aigreentick.services.dealership.queue.enums.JobType;
import com.aigreentick.services.dealership.queue.service.JobHandler;

import lombok.RequiredArgsConstructor;

@Component
@RequiredArgsConstructor
public class ProcessEmailDeliveryJobHandler implements JobHandler<EmailDeliveryPayload> {

    private final DeliveryStatusProcessor deliveryStatusProcessor;

    @Override
    public JobType type() {
        return JobType.PROCESS_EMAIL_DELIVERY;
    }

    @Override
    public Class<EmailDeliveryPayload> payloadType() {
        return EmailDeliveryPayload.class;
    }

    @Override
    public Object handle(EmailDeliveryPayload payload) {
        return deliveryStatusProcessor.processEmailDelivered(payload.getMessageId(), payload.getEmail());
    }
}
