package com.aigreentick.services.dealership.leads.enums;

public enum LeadEventType {
    ASSIGNED,
    QUEUED_FOR_LATER,
    REASSIGNED,
    ESCALATION_REQUIRED
}
