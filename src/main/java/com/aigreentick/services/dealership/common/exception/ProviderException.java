package com.aigreentick.services.dealership.common.exception;

/**
 * Failure reported by an email or SMS provider.
 * Transient failures (timeouts, 5xx, 429) are retryable; recipient errors are not.
 */
public class ProviderException extends RuntimeException {

    private final boolean retryable;
    private final int statusCode;

    public ProviderException(String message, int statusCode, boolean retryable) {
        super(message);
        this.statusCode = statusCode;
        this.retryable = retryable;
    }

    public ProviderException(String message, int statusCode, boolean retryable, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
        this.retryable = retryable;
    }

    public static ProviderException fromStatus(String provider, int statusCode, String body) {
        boolean retryable = statusCode == 429 || statusCode == 408 || statusCode >= 500;
        return new ProviderException(provider + " returned " + statusCode + ": " + body, statusCode, retryable);
    }

    public static ProviderException transientFailure(String provider, Throwable cause) {
        return new ProviderException(provider + " call failed: " + cause.getMessage(), 0, true, cause);
    }

    public boolean isRetryable() {
        return retryable;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
