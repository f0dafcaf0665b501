package com.assetdesk.allocation.exception;

/**
 * A write would create a second ACTIVE ledger entry where only one is allowed, or would
 * reuse an idempotency key for a different allocation. Fetch fresh state before retrying.
 */
public class ConflictException extends RuntimeException {

    public ConflictException(String message) {
        super(message);
    }
}
