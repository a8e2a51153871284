package com.aigreentick.services.dealership.campaigns.service.impl;

import java.util.Optional;

import org.springframework.stereotype.Component;

import com.aigreentick.services.dealership.campaigns.enums.Channel;
import com.aigreentick.services.dealership.common.util.PhoneNumbers;
import com.aigreentick.services.dealership.leads.model.Customer;
import com.aigreentick.services.dealership.leads.repository.CustomerRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Consent check for campaign sends. A recipient no customer matches is not opted out.
 * Lookup failures propagate so the send job is retried rather than sent unchecked.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OptOutGate {

    private final CustomerRepository customerRepository;

    public boolean isOptedOut(Channel channel, String recipient) {
        if (recipient == null || recipient.isBlank()) {
            return false;
        }
        boolean optedOut = switch (channel) {
            case EMAIL -> customerRepository.findFirstByEmailIgnoreCase(recipient.trim())
                    .map(c -> !c.isMarketingOptIn() || c.isEmailBounced())
                    .orElse(false);
            case SMS -> findByPhone(recipient)
                    .map(c -> !c.isSmsOptIn())
                    .orElse(false);
        };
        if (optedOut) {
            log.debug("Recipient opted out. channel={} recipient={}", channel, recipient);
        }
        return optedOut;
    }

    private Optional<Customer> findByPhone(String phone) {
        String normalized = PhoneNumbers.normalize(phone);
        if (normalized == null) {
            return Optional.empty();
        }
        Optional<Customer> match = customerRepository.findFirstByPhone(normalized);
        return match.isPresent() || normalized.equals(phone) ? match : customerRepository.findFirstByPhone(phone);
    }
}
