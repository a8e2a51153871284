package com.aigreentick.services.dealership.leads.enums;

public enum AssignmentPriority {
    HIGH,
    MEDIUM,
    LOW
}
