package com.aigreentick.services.dealership.leads.dto;

public record FollowUpResult(boolean created, Long followUpTaskId, String reason) {

    public static FollowUpResult skipped(String reason) {
        return new FollowUpResult(false, null, reason);
    }
}
