package com.myorg.cafe.deadletter;

import com.myorg.cafe.eventing.exception.CafeRetryableException;

public class HandlerTimeoutException extends CafeRetryableException {
    public static final String CODE = "HANDLER_TIMEOUT";

    public HandlerTimeoutException(String processingGroup, String eventId, long timeoutMs) {
        super("Handler in group=" + processingGroup + " exceeded " + timeoutMs + "ms for eventId=" + eventId);
    }
}
