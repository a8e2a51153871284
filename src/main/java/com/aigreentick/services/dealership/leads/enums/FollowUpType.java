package com.aigreentick.services.dealership.leads.enums;

public enum FollowUpType {
    INITIAL_CONTACT,
    FOLLOW_UP
}
