package com.aigreentick.services.dealership.common.exception;

public class InvalidJobPayloadException extends NonRetryableJobException {

    public InvalidJobPayloadException(String message) {
        super(message);
    }

    public InvalidJobPayloadException(String message, Throwable cause) {
        super(message, cause);
    }

    public static void require(boolean condition, String message) {
        if (!condition) {
            throw new InvalidJobPayloadException(message);
        }
    }
}
