package com.aigreentick.services.dealership.common.exception;

/**
 * Job failure the queue must not retry. The job is marked FAILED on the first occurrence.
 */
public class NonRetryableJobException extends RuntimeException {

    public NonRetryableJobException(String message) {
        super(message);
    }

    public NonRetryableJobException(String message, Throwable cause) {
        super(message, cause);
    }
}
