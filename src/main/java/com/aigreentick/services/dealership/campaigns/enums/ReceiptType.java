package com.aigreentick.services.dealership.campaigns.enums;

/**
 * Kind of provider callback carried on the delivery receipt topic.
 */
public enum ReceiptType {
    EMAIL_DELIVERED,
    EMAIL_BOUNCED,
    SMS_STATUS,
    SMS_INBOUND
}
