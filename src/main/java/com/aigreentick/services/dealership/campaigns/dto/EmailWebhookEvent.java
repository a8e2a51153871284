package com.aigreentick.services.dealership.campaigns.dto;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Email provider webhook body ({@code email.delivered}, {@code email.bounced},
 * {@code email.complained}).
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class EmailWebhookEvent {

    private String type;

    private EventData data;

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EventData {

        @JsonProperty("email_id")
        private String emailId;

        private List<String> to;

        private Bounce bounce;

        public String firstRecipient() {
            return to == null || to.isEmpty() ? null : to.get(0);
        }
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Bounce {
        private String type;
        private String message;
    }
}
