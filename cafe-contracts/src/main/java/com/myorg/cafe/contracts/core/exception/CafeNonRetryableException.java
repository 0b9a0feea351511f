package com.myorg.cafe.contracts.core.exception;

public class CafeNonRetryableException extends RuntimeException {

    private final String reason;

    public CafeNonRetryableException(String message) {
        this("NON_RETRYABLE", message);
    }

    public CafeNonRetryableException(String reason, String message) {
        super(message);
        this.reason = (reason == null || reason.isBlank()) ? "NON_RETRYABLE" : reason;
    }

    public CafeNonRetryableException(String reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = (reason == null || reason.isBlank()) ? "NON_RETRYABLE" : reason;
    }

    public String getReason() {
        return reason;
    }
}
