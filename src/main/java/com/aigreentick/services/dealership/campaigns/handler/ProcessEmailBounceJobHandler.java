package com.aigreentick.services.dealership.campaigns.handler;

import org.springframework.stereotype.Component;

import com.aigreentick.services.dealership.campaigns.dto.EmailBouncePayload;
import com.aigreentick.services.dealership.campaigns.service.impl.DeliveryStatusProcessor;
import com.aigreentick.services.dealership.queue.enums.JobType;
import com.aigreentick.services.dealership.queue.service.JobHandler;

import lombok.RequiredArgsConstructor;

@Component
@RequiredArgsConstructor
public class ProcessEmailBounceJobHandler implements JobHandler<EmailBouncePayload> {

    private final DeliveryStatusProcessor deliveryStatusProcessor;

    @Override
    public JobType type() {
        return JobType.PROCESS_EMAIL_BOUNCE;
    }

    @Override
    public Class<EmailBouncePayload> payloadType() {
        return EmailBouncePayload.class;
    }

    @Override
    public Object handle(EmailBouncePayload payload) {
        return deliveryStatusProcessor.processEmailBounce(payload);
    }
}
