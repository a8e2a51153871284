package com.aigreentick.services.dealership.campaigns.client.service.impl;

import java.util.Random;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Service;

import com.aigreentick.services.dealership.campaigns.client.dto.EmailMessage;
import com.aigreentick.services.dealership.campaigns.client.dto.EmailSendResult;
import com.aigreentick.services.dealership.campaigns.client.service.EmailTransport;
import com.aigreentick.services.dealership.common.exception.ProviderException;

import lombok.extern.slf4j.Slf4j;

/**
 * Simulated email provider for local runs and load tests. No HTTP calls.
 * Active when profile is 'mock'.
 */
@Slf4j
@Service
@Profile("mock")
public class EmailTransportMockImpl implements EmailTransport {

    private static final Random random = new Random();

    private static final int MIN_DELAY_MS = 50;
    private static final int MAX_DELAY_MS = 200;
    private static final double FAILURE_RATE = 0.05;

    private final AtomicLong totalCalls = new AtomicLong(0);
    private final AtomicLong failedCalls = new AtomicLong(0);

    @Override
    public EmailSendResult send(EmailMessage message) {
        totalCalls.incrementAndGet();
        try {
            Thread.sleep(MIN_DELAY_MS + random.nextInt(MAX_DELAY_MS - MIN_DELAY_MS + 1));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw ProviderException.transientFailure("mock email provider", e);
        }

        if (random.nextDouble() < FAILURE_RATE) {
            failedCalls.incrementAndGet();
            String[] errors = { "Rate limit exceeded", "Invalid recipient address", "Service unavailable" };
            int[] codes = { 429, 422, 503 };
            int index = random.nextInt(errors.length);
            throw ProviderException.fromStatus("mock email provider", codes[index], errors[index]);
        }

        String messageId = "mock-email-" + UUID.randomUUID();
        log.debug("Mock email sent. to={} messageId={} total={} failed={}",
                message.to(), messageId, totalCalls.get(), failedCalls.get());
        return new EmailSendResult(messageId);
    }
}
