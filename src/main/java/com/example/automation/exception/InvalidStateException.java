package com.example.automation.exception;

import lombok.Getter;

/**
 * Exception for an operation the resource's current state does not allow
 */
@Getter
public class InvalidStateException extends RuntimeException {

    private final String resourceId;
    private final String currentState;
    private final String requestedOperation;

    public InvalidStateException(String resourceId, String currentState, String requestedOperation) {
        super(String.format("Cannot %s %s while it is %s", requestedOperation, resourceId, currentState));
        this.resourceId = resourceId;
        this.currentState = currentState;
        this.requestedOperation = requestedOperation;
    }
}
