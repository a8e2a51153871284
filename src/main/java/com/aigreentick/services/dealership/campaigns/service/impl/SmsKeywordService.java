package com.aigreentick.services.dealership.campaigns.service.impl;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Locale;
import java.util.Set;

import org.springframework.stereotype.Service;

import com.aigreentick.services.dealership.campaigns.dto.SendSingleSmsPayload;
import com.aigreentick.services.dealership.common.util.PhoneNumbers;
import com.aigreentick.services.dealership.config.DealershipProperties;
import com.aigreentick.services.dealership.leads.repository.CustomerRepository;
import com.aigreentick.services.dealership.queue.dto.JobOptions;
import com.aigreentick.services.dealership.queue.enums.JobType;
import com.aigreentick.services.dealership.queue.service.QueueRuntime;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Handles STOP/START replies to marketing SMS. Albanian keywords are accepted too.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SmsKeywordService {

    static final Set<String> OPT_OUT_KEYWORDS = Set.of("STOP", "STOPALL", "UNSUBSCRIBE", "CANCEL", "END", "QUIT",
            "NDALOJ", "HIQE");
    static final Set<String> OPT_IN_KEYWORDS = Set.of("START", "SUBSCRIBE", "YES", "UNSTOP", "FILLOJ", "PO");

    public enum KeywordAction {
        OPT_OUT,
        OPT_IN,
        NONE
    }

    private final CustomerRepository customerRepository;
    private final QueueRuntime queueRuntime;
    private final DealershipProperties dealership;
    private final Clock clock;

    public static KeywordAction classify(String body) {
        if (body == null) {
            return KeywordAction.NONE;
        }
        String keyword = body.trim().toUpperCase(Locale.ROOT);
        if (OPT_OUT_KEYWORDS.contains(keyword)) {
            return KeywordAction.OPT_OUT;
        }
        if (OPT_IN_KEYWORDS.contains(keyword)) {
            return KeywordAction.OPT_IN;
        }
        return KeywordAction.NONE;
    }

    public KeywordAction handleInbound(String from, String body) {
        KeywordAction action = classify(body);
        String phone = PhoneNumbers.normalize(from);
        if (action == KeywordAction.NONE || phone == null) {
            log.debug("Inbound SMS without keyword. from={}", from);
            return KeywordAction.NONE;
        }

        boolean optIn = action == KeywordAction.OPT_IN;
        int updated = customerRepository.updateSmsOptIn(phone, optIn, LocalDateTime.now(clock));
        log.info("SMS consent updated from keyword. phone={} optIn={} customers={}", phone, optIn, updated);

        String confirmation = optIn
                ? "You are subscribed to " + dealership.getName() + " messages again. Reply STOP to unsubscribe."
                : "You have been unsubscribed from " + dealership.getName() + " messages. Reply START to subscribe again.";
        queueRuntime.enqueue(JobType.SEND_SINGLE_SMS,
                SendSingleSmsPayload.builder()
                        .to(phone)
                        .message(confirmation)
                        .build(),
                JobOptions.withPriority(1));
        return action;
    }
}
