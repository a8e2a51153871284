package com.aigreentick.services.dealership.common.util;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class DedupeKeysTest {

    @Test
    @DisplayName("Campaign send keys are stable SHA-256 hex digests")
    void campaignSendKeyIsStable() {
        String key = DedupeKeys.campaignSend("email", 7L, "arben@example.com", 100);

        assertThat(key).hasSize(64).matches("[0-9a-f]+");
        assertThat(DedupeKeys.campaignSend("email", 7L, "arben@example.com", 100)).isEqualTo(key);
    }

    @Test
    @DisplayName("Recipient case and surrounding whitespace do not change the key")
    void recipientIsNormalized() {
        assertThat(DedupeKeys.campaignSend("email", 7L, "  Arben@Example.com ", 0))
                .isEqualTo(DedupeKeys.campaignSend("email", 7L, "arben@example.com", 0));
    }

    @Test
    @DisplayName("Channel, campaign and batch start all feed into the key")
    void keyComponents() {
        String key = DedupeKeys.campaignSend("email", 7L, "arben@example.com", 0);

        assertThat(DedupeKeys.campaignSend("sms", 7L, "arben@example.com", 0)).isNotEqualTo(key);
        assertThat(DedupeKeys.campaignSend("email", 8L, "arben@example.com", 0)).isNotEqualTo(key);
        assertThat(DedupeKeys.campaignSend("email", 7L, "arben@example.com", 100)).isNotEqualTo(key);
    }

    @Test
    void leadAssignmentKey() {
        assertThat(DedupeKeys.leadAssignment(12L, null)).isEqualTo("assign:12:null");
        assertThat(DedupeKeys.leadAssignment(12L, 40L)).isEqualTo("assign:12:40");
    }
}
