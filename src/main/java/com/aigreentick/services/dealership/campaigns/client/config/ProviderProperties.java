package com.aigreentick.services.dealership.campaigns.client.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Email and SMS provider settings. The call timeout is shared and configured in
 * {@code WebClientConfig}.
 */
@Data
@Component
@ConfigurationProperties(prefix = "providers")
public class ProviderProperties {

    private Email email = new Email();

    private Sms sms = new Sms();

    @Data
    public static class Email {

        private String baseUrl = "https://api.resend.com";

        private String apiKey;

        private String fromAddress = "AUTO ANI <noreply@autoani.com>";

        /** When false, sends fail with a retryable 503 instead of calling the provider. */
        private boolean outgoingEnabled = true;
    }

    @Data
    public static class Sms {

        private String baseUrl = "https://api.twilio.com/2010-04-01";

        private String accountSid;

        private String authToken;

        private String fromNumber;

        private String statusCallbackUrl;

        private boolean outgoingEnabled = true;
    }
}
