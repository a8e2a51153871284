package com.aigreentick.services.dealership.campaigns.client.dto;

/**
 * Rendered email handed to the transport.
 *
 * @param idempotencyKey forwarded to the provider so a retried send is not delivered twice; may be null
 */
public record EmailMessage(
        String to,
        String subject,
        String text,
        String html,
        String idempotencyKey) {
}
