package com.assetdesk.allocation.exception;

public class CapacityExhaustedException extends RetryableAllocationException {

    public CapacityExhaustedException(Long poolId, int totalCount) {
        super("License pool " + poolId + " has no available seats (all " + totalCount + " in use)");
    }
}
