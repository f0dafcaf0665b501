package com.assetdesk.allocation.exception;

/**
 * An attempt to leave a terminal state or skip a required intermediate state.
 * Not retryable.
 */
public class InvalidTransitionException extends RuntimeException {

    public InvalidTransitionException(String entityName, Long id, Enum<?> currentStatus, String action) {
        super(entityName + " " + id + " cannot " + action + "; current status is " + currentStatus);
    }

    public InvalidTransitionException(String message) {
        super(message);
    }
}
