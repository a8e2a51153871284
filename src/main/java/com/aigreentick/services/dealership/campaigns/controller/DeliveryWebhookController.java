package com.aigreentick.services.dealership.campaigns.controller;

import java.time.Clock;

import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.aigreentick.services.dealership.campaigns.dto.EmailWebhookEvent;
import com.aigreentick.services.dealership.campaigns.enums.BounceType;
import com.aigreentick.services.dealership.campaigns.enums.DeliveryStatus;
import com.aigreentick.services.dealership.campaigns.kafka.event.DeliveryReceiptEvent;
import com.aigreentick.services.dealership.campaigns.kafka.producer.DeliveryReceiptProducer;
import com.aigreentick.services.dealership.common.dto.ResponseMessage;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Provider callbacks. Each callback is published to the delivery receipt topic and
 * acknowledged right away; it is applied asynchronously.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/webhooks")
@RequiredArgsConstructor
public class DeliveryWebhookController {

    private final DeliveryReceiptProducer receiptProducer;
    private final Clock clock;

    @PostMapping("/email")
    public ResponseEntity<ResponseMessage<Void>> emailEvent(@RequestBody EmailWebhookEvent event) {
        EmailWebhookEvent.EventData data = event.getData();
        if (data == null || data.getEmailId() == null || event.getType() == null) {
            return ResponseEntity.badRequest().body(ResponseMessage.error("type and data.email_id are required"));
        }

        DeliveryReceiptEvent receipt = switch (event.getType()) {
            case "email.delivered" -> DeliveryReceiptEvent.emailDelivered(data.getEmailId(), data.firstRecipient(), clock.millis());
            case "email.bounced" -> DeliveryReceiptEvent.emailBounced(data.getEmailId(), data.firstRecipient(),
                    BounceType.fromProviderValue(data.getBounce() == null ? null : data.getBounce().getType()), clock.millis());
            case "email.complained" -> DeliveryReceiptEvent.emailBounced(data.getEmailId(), data.firstRecipient(),
                    BounceType.COMPLAINT, clock.millis());
            default -> null;
        };

        if (receipt == null) {
            log.debug("Email webhook event ignored. type={} emailId={}", event.getType(), data.getEmailId());
            return ResponseEntity.ok(ResponseMessage.success("Ignored", null));
        }
        receiptProducer.publish(receipt);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(ResponseMessage.success("Accepted", null));
    }

    @PostMapping(path = "/sms/status", consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE)
    public ResponseEntity<ResponseMessage<Void>> smsStatus(
            @RequestParam("MessageSid") String messageSid,
            @RequestParam("MessageStatus") String messageStatus,
            @RequestParam(value = "To", required = false) String to,
            @RequestParam(value = "ErrorMessage", required = false) String errorMessage,
            @RequestParam(value = "ErrorCode", required = false) String errorCode) {

        DeliveryStatus status = DeliveryStatus.fromProviderValue(messageStatus);
        String error = errorMessage != null ? errorMessage : errorCode == null ? null : "Error code " + errorCode;
        receiptProducer.publish(DeliveryReceiptEvent.smsStatus(messageSid, to, status, error, clock.millis()));

        log.debug("SMS status callback. messageSid={} status={}", messageSid, messageStatus);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(ResponseMessage.success("Accepted", null));
    }

    @PostMapping(path = "/sms/inbound", consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE)
    public ResponseEntity<ResponseMessage<Void>> smsInbound(
            @RequestParam("From") String from,
            @RequestParam(value = "Body", required = false) String body) {
        receiptProducer.publish(DeliveryReceiptEvent.smsInbound(from, body, clock.millis()));
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(ResponseMessage.success("Accepted", null));
    }
}
