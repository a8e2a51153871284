package com.aigreentick.services.dealership.campaigns.client.service.impl;

import java.math.BigDecimal;
import java.util.Random;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Service;

import com.aigreentick.services.dealership.campaigns.client.dto.SmsMessage;
import com.aigreentick.services.dealership.campaigns.client.dto.SmsSendResult;
import com.aigreentick.services.dealership.campaigns.client.service.SmsTransport;
import com.aigreentick.services.dealership.common.exception.ProviderException;

import lombok.extern.slf4j.Slf4j;

/**
 * Simulated SMS provider for local runs and load tests. No HTTP calls.
 * Active when profile is 'mock'.
 */
@Slf4j
@Service
@Profile("mock")
public class SmsTransportMockImpl implements SmsTransport {

    private static final Random random = new Random();

    private static final int MIN_DELAY_MS = 50;
    private static final int MAX_DELAY_MS = 200;
    private static final double FAILURE_RATE = 0.05;
    private static final int SEGMENT_LENGTH = 160;
    private static final BigDecimal PRICE_PER_SEGMENT = new BigDecimal("0.0075");

    private final AtomicLong totalCalls = new AtomicLong(0);
    private final AtomicLong failedCalls = new AtomicLong(0);

    @Override
    public SmsSendResult send(SmsMessage message) {
        totalCalls.incrementAndGet();
        try {
            Thread.sleep(MIN_DELAY_MS + random.nextInt(MAX_DELAY_MS - MIN_DELAY_MS + 1));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw ProviderException.transientFailure("mock SMS provider", e);
        }

        if (random.nextDouble() < FAILURE_RATE) {
            failedCalls.incrementAndGet();
            String[] errors = { "Too many requests", "Invalid 'To' phone number", "Service unavailable" };
            int[] codes = { 429, 400, 503 };
            int index = random.nextInt(errors.length);
            throw ProviderException.fromStatus("mock SMS provider", codes[index], errors[index]);
        }

        int length = message.body() == null ? 0 : message.body().length();
        int segments = Math.max(1, (length + SEGMENT_LENGTH - 1) / SEGMENT_LENGTH);
        String messageId = "SM" + UUID.randomUUID().toString().replace("-", "");

        log.debug("Mock SMS sent. to={} messageId={} segments={} total={} failed={}",
                message.to(), messageId, segments, totalCalls.get(), failedCalls.get());
        return new SmsSendResult(messageId, PRICE_PER_SEGMENT.multiply(BigDecimal.valueOf(segments)), segments, "queued");
    }
}
