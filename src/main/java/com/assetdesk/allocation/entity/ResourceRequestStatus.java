package com.assetdesk.allocation.entity;

/**
 * Workflow states of a {@link ResourceRequest}.
 *
 * <pre>
 *   PENDING ──approve──▶ APPROVED ──fulfill──▶ FULFILLED
 *      │                    │
 *      ├──reject──▶ REJECTED │
 *      └──cancel──▶ CANCELLED ◀──cancel──┘
 * </pre>
 */
public enum ResourceRequestStatus {
    PENDING,
    APPROVED,
    REJECTED,
    FULFILLED,
    CANCELLED;

    public boolean isCancellable() {
        return this == PENDING || this == APPROVED;
    }
}
