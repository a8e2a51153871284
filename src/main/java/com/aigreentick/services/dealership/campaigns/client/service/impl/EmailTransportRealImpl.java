package com.aigreentick.services.dealership.campaigns.client.service.impl;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.context.annotation.Profile;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.UriComponentsBuilder;

import com.aigreentick.services.dealership.campaigns.client.config.ProviderProperties;
import com.aigreentick.services.dealership.campaigns.client.dto.EmailMessage;
import com.aigreentick.services.dealership.campaigns.client.dto.EmailSendResult;
import com.aigreentick.services.dealership.campaigns.client.dto.ResendEmailResponse;
import com.aigreentick.services.dealership.campaigns.client.service.EmailTransport;
import com.aigreentick.services.dealership.common.exception.ProviderException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Sends email through the Resend HTTP API.
 * Active when profile is NOT 'mock'.
 */
@Slf4j
@RequiredArgsConstructor
@Service
@Profile("!mock")
public class EmailTransportRealImpl implements EmailTransport {

    private static final String PROVIDER = "email provider";

    private final WebClient.Builder webClientBuilder;
    private final ProviderProperties properties;

    @Override
    public EmailSendResult send(EmailMessage message) {
        ProviderProperties.Email config = properties.getEmail();
        if (!config.isOutgoingEnabled()) {
            throw new ProviderException("Outgoing email disabled", 503, true);
        }

        URI uri = UriComponentsBuilder
                .fromUriString(config.getBaseUrl())
                .pathSegment("emails")
                .build()
                .toUri();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("from", config.getFromAddress());
        body.put("to", List.of(message.to()));
        body.put("subject", message.subject());
        body.put("text", message.text());
        if (message.html() != null) {
            body.put("html", message.html());
        }

        try {
            ResendEmailResponse response = webClientBuilder.build()
                    .post()
                    .uri(uri)
                    .contentType(MediaType.APPLICATION_JSON)
                    .headers(headers -> {
                        headers.setBearerAuth(config.getApiKey());
                        if (message.idempotencyKey() != null) {
                            headers.set("Idempotency-Key", message.idempotencyKey());
                        }
                    })
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(ResendEmailResponse.class)
                    .block();

            if (response == null || response.getId() == null) {
                throw new ProviderException("Email provider returned no message id", 502, true);
            }
            log.debug("Email accepted by provider. to={} messageId={}", message.to(), response.getId());
            return new EmailSendResult(response.getId());

        } catch (WebClientResponseException ex) {
            log.error("Email provider rejected message. to={} Status={} Response={}",
                    message.to(), ex.getStatusCode().value(), ex.getResponseBodyAsString());
            throw ProviderException.fromStatus(PROVIDER, ex.getStatusCode().value(), ex.getResponseBodyAsString());

        } catch (WebClientRequestException ex) {
            // connect and read timeouts land here
            log.warn("Email provider unreachable. to={} error={}", message.to(), ex.getMessage());
            throw ProviderException.transientFailure(PROVIDER, ex);
        }
    }
}
