package com.assetdesk.allocation.entity;

/**
 * Lifecycle states of a {@link LicenseAssignment}.
 *
 * <p>{@link #ACTIVE} is the only non-terminal state. Every other value is reached exactly
 * once and never left:
 * <ul>
 *   <li>{@link #RETURNED}: the holder gave the seat back</li>
 *   <li>{@link #REVOKED}: an administrator took the seat away</li>
 *   <li>{@link #EXPIRED}: closed by the expiry sweep</li>
 * </ul>
 */
public enum LicenseAssignmentStatus {
    ACTIVE,
    RETURNED,
    REVOKED,
    EXPIRED;

    public boolean isTerminal() {
        return this != ACTIVE;
    }
}
