package com.aigreentick.services.dealership.campaigns.client.dto;

public record EmailSendResult(String messageId) {
}
