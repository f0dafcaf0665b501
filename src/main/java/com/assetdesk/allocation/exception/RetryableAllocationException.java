package com.assetdesk.allocation.exception;

/**
 * A resource is momentarily unavailable because of legitimate contention. Retrying
 * against fresh state may succeed; this is a business condition, not a system fault.
 */
public abstract class RetryableAllocationException extends RuntimeException {

    protected RetryableAllocationException(String message) {
        super(message);
    }
}
