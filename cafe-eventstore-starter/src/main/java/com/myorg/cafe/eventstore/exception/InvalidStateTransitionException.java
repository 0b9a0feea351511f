package com.myorg.cafe.eventstore.exception;

import com.myorg.cafe.contracts.core.exception.CafeNonRetryableException;
import lombok.Getter;

/**
 * A command was rejected by the aggregate's current state. Nothing was appended.
 */
@Getter
public class InvalidStateTransitionException extends CafeNonRetryableException {
    private final String command;
    private final String currentState;

    public InvalidStateTransitionException(String command, String currentState, String message) {
        super("INVALID_STATE_TRANSITION",
                "Cannot apply " + command + " in state " + currentState + ": " + message);
        this.command = command;
        this.currentState = currentState;
    }
}
