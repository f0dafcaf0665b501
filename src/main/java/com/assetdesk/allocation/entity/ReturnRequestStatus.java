package com.assetdesk.allocation.entity;

public enum ReturnRequestStatus {
    PENDING,
    APPROVED,
    COMPLETED,
    CANCELLED;

    public boolean isCompletable() {
        return this == PENDING || this == APPROVED;
    }
}
