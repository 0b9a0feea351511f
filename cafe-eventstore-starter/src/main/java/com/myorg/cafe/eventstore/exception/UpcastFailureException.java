package com.myorg.cafe.eventstore.exception;

import com.myorg.cafe.contracts.core.exception.CafeNonRetryableException;

public class UpcastFailureException extends CafeNonRetryableException {
    public UpcastFailureException(String eventType, int revision, String eventId, Throwable cause) {
        super("UPCAST_FAILURE",
                "Cannot upcast eventType=" + eventType + " revision=" + revision + " eventId=" + eventId, cause);
    }

    public UpcastFailureException(String eventType, int revision, String eventId, String message) {
        super("UPCAST_FAILURE",
                "Cannot upcast eventType=" + eventType + " revision=" + revision + " eventId=" + eventId + ": " + message);
    }
}
