package com.aigreentick.services.dealership.campaigns.client.service.impl;

import java.math.BigDecimal;
import java.net.URI;

import org.springframework.context.annotation.Profile;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.UriComponentsBuilder;

import com.aigreentick.services.dealership.campaigns.client.config.ProviderProperties;
import com.aigreentick.services.dealership.campaigns.client.dto.SmsMessage;
import com.aigreentick.services.dealership.campaigns.client.dto.SmsSendResult;
import com.aigreentick.services.dealership.campaigns.client.dto.TwilioMessageResponse;
import com.aigreentick.services.dealership.campaigns.client.service.SmsTransport;
import com.aigreentick.services.dealership.common.exception.ProviderException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Sends SMS through the Twilio Messages REST API.
 * Active when profile is NOT 'mock'.
 */
@Slf4j
@RequiredArgsConstructor
@Service
@Profile("!mock")
public class SmsTransportRealImpl implements SmsTransport {

    private static final String PROVIDER = "SMS provider";

    private final WebClient.Builder webClientBuilder;
    private final ProviderProperties properties;

    @Override
    public SmsSendResult send(SmsMessage message) {
        ProviderProperties.Sms config = properties.getSms();
        if (!config.isOutgoingEnabled()) {
            throw new ProviderException("Outgoing SMS disabled", 503, true);
        }

        URI uri = UriComponentsBuilder
                .fromUriString(config.getBaseUrl())
                .pathSegment("Accounts", config.getAccountSid(), "Messages.json")
                .build()
                .toUri();

        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("To", message.to());
        form.add("From", message.senderName() != null ? message.senderName() : config.getFromNumber());
        form.add("Body", message.body());
        if (message.mediaUrls() != null) {
            message.mediaUrls().forEach(url -> form.add("MediaUrl", url));
        }
        if (config.getStatusCallbackUrl() != null) {
            form.add("StatusCallback", config.getStatusCallbackUrl());
        }

        try {
            TwilioMessageResponse response = webClientBuilder.build()
                    .post()
                    .uri(uri)
                    .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                    .headers(headers -> {
                        headers.setBasicAuth(config.getAccountSid(), config.getAuthToken());
                        if (message.idempotencyKey() != null) {
                            headers.set("I-Twilio-Idempotency-Token", message.idempotencyKey());
                        }
                    })
                    .body(BodyInserters.fromFormData(form))
                    .retrieve()
                    .bodyToMono(TwilioMessageResponse.class)
                    .block();

            if (response == null || response.getSid() == null) {
                throw new ProviderException("SMS provider returned no message id", 502, true);
            }
            log.debug("SMS accepted by provider. to={} messageId={} status={}",
                    message.to(), response.getSid(), response.getStatus());
            return new SmsSendResult(response.getSid(), parsePrice(response.getPrice()),
                    parseSegments(response.getNumSegments()), response.getStatus());

        } catch (WebClientResponseException ex) {
            log.error("SMS provider rejected message. to={} Status={} Response={}",
                    message.to(), ex.getStatusCode().value(), ex.getResponseBodyAsString());
            throw ProviderException.fromStatus(PROVIDER, ex.getStatusCode().value(), ex.getResponseBodyAsString());

        } catch (WebClientRequestException ex) {
            log.warn("SMS provider unreachable. to={} error={}", message.to(), ex.getMessage());
            throw ProviderException.transientFailure(PROVIDER, ex);
        }
    }

    static BigDecimal parsePrice(String price) {
        if (price == null || price.isBlank()) {
            return null;
        }
        try {
            return new BigDecimal(price).abs();
        } catch (NumberFormatException e) {
            log.warn("Unparseable SMS price '{}'", price);
            return null;
        }
    }

    static int parseSegments(String segments) {
        if (segments == null || segments.isBlank()) {
            return 1;
        }
        try {
            return Math.max(1, Integer.parseInt(segments.trim()));
        } catch (NumberFormatException e) {
            log.warn("Unparseable SMS segment count '{}'", segments);
            return 1;
        }
    }
}
