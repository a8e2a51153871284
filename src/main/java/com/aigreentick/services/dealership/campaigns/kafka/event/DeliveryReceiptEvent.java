package com.aigreentick.services.dealership.campaigns.kafka.event;

import java.util.UUID;

import com.aigreentick.services.dealership.campaigns.enums.BounceType;
import com.aigreentick.services.dealership.campaigns.enums.DeliveryStatus;
import com.aigreentick.services.dealership.campaigns.enums.ReceiptType;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Provider callback as received by the webhook endpoints, before it is applied.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeliveryReceiptEvent {
    private String eventId;

    private ReceiptType type;

    private String messageId; // provider message id, absent for inbound SMS

    private String recipient; // email address or phone number

    private Long campaignId;

    private BounceType bounceType;

    private DeliveryStatus status;

    private String errorMessage;

    private String body; // inbound SMS text

    private Long timestamp;

    public static DeliveryReceiptEvent emailDelivered(String messageId, String email, long timestamp) {
        return base(ReceiptType.EMAIL_DELIVERED, messageId, email, timestamp).build();
    }

    public static DeliveryReceiptEvent emailBounced(String messageId, String email, BounceType bounceType, long timestamp) {
        return base(ReceiptType.EMAIL_BOUNCED, messageId, email, timestamp).bounceType(bounceType).build();
    }

    public static DeliveryReceiptEvent smsStatus(String messageId, String phone, DeliveryStatus status,
            String errorMessage, long timestamp) {
        return base(ReceiptType.SMS_STATUS, messageId, phone, timestamp)
                .status(status)
                .errorMessage(errorMessage)
                .build();
    }

    public static DeliveryReceiptEvent smsInbound(String from, String body, long timestamp) {
        return base(ReceiptType.SMS_INBOUND, null, from, timestamp).body(body).build();
    }

    private static DeliveryReceiptEventBuilder base(ReceiptType type, String messageId, String recipient, long timestamp) {
        return DeliveryReceiptEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .type(type)
                .messageId(messageId)
                .recipient(recipient)
                .timestamp(timestamp);
    }

    public String partitionKey() {
        return messageId != null ? messageId : recipient;
    }
}
