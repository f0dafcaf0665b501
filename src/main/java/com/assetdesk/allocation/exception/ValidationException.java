package com.assetdesk.allocation.exception;

/**
 * Malformed or contradictory input. Nothing has been changed; the caller must correct
 * the request before retrying.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }
}
