package com.myorg.cafe.eventing.exception;

import com.myorg.cafe.contracts.core.exception.CafeNonRetryableException;

public class UnknownEventTypeException extends CafeNonRetryableException {
    public UnknownEventTypeException(String processingGroup, String eventType, String eventId) {
        super("UNKNOWN_EVENT_TYPE",
                "No handler in group=" + processingGroup + " for eventType=" + eventType + ", eventId=" + eventId);
    }
}
