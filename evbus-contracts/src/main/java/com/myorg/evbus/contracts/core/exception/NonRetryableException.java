package com.myorg.evbus.contracts.core.exception;

/**
 * Thrown by a handler when retrying cannot help; the record goes to the dead-letter topic at once.
 */
public class NonRetryableException extends RuntimeException {

    private final String reason;

    public NonRetryableException(String message) {
        this("NON_RETRYABLE", message);
    }

    public NonRetryableException(String reason, String message) {
        super(message);
        this.reason = (reason == null || reason.isBlank()) ? "NON_RETRYABLE" : reason;
    }

    public NonRetryableException(String reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = (reason == null || reason.isBlank()) ? "NON_RETRYABLE" : reason;
    }

    public String getReason() {
        return reason;
    }
}
