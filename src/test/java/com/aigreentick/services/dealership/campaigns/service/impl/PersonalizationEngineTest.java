package com.aigreentick.services.dealership.campaigns.service.impl;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.aigreentick.services.dealership.config.DealershipProperties;
import com.aigreentick.services.dealership.leads.model.Customer;

class PersonalizationEngineTest {

    private PersonalizationEngine engine;

    @BeforeEach
    void setUp() {
        engine = new PersonalizationEngine(new DealershipProperties(),
                Clock.fixed(Instant.parse("2025-06-01T08:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Recipient and dealership tokens are replaced, whitespace inside braces is tolerated")
    void replacesKnownTokens() {
        Map<String, String> data = engine.recipientData(Customer.builder()
                .firstName("Arben").lastName("Krasniqi").email("arben@example.com").build());

        String out = engine.personalize("Hi {{ firstName }} {{lastName}}, {{fullName}} - {{dealershipName}} {{currentYear}}", data);

        assertThat(out).isEqualTo("Hi Arben Krasniqi, Arben Krasniqi - AUTO ANI 2025");
    }

    @Test
    @DisplayName("Unknown tokens stay in the text as written")
    void unknownTokensStayLiteral() {
        assertThat(engine.personalize("Offer {{discountCode}} for {{firstName}}", Map.of("firstName", "Ana")))
                .isEqualTo("Offer {{discountCode}} for Ana");
    }

    @Test
    @DisplayName("customerName falls back to Customer and the unsubscribe link encodes the email")
    void defaultsAndUnsubscribeUrl() {
        String out = engine.personalize("{{customerName}} {{unsubscribeUrl}}", Map.of("email", "a+b@example.com"));

        assertThat(out).isEqualTo("Customer https://autoani.com/unsubscribe?email=a%2Bb%40example.com");
    }

    @Test
    @DisplayName("Caller supplied values override derived tokens")
    void callerValuesOverride() {
        assertThat(engine.personalize("{{customerName}}", Map.of("firstName", "Ana", "customerName", "Ms. Berisha")))
                .isEqualTo("Ms. Berisha");
    }

    @Test
    @DisplayName("Text without tokens and null text are returned unchanged")
    void noTokens() {
        assertThat(engine.personalize("Plain text $1", Map.of())).isEqualTo("Plain text $1");
        assertThat(engine.personalize(null, Map.of())).isNull();
    }
}
