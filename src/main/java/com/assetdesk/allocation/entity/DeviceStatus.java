package com.assetdesk.allocation.entity;

/**
 * Lifecycle states of a {@link Device}.
 *
 * <p>Stored as {@code VARCHAR} via {@code EnumType.STRING}.
 *
 * <ul>
 *   <li>{@link #AVAILABLE}: can be assigned</li>
 *   <li>{@link #ASSIGNED}: held by exactly one ACTIVE {@link DeviceAssignment};
 *                       only the allocation engine enters or leaves this state</li>
 *   <li>{@link #MAINTENANCE}: out of circulation; blocks new assignments</li>
 *   <li>{@link #DISPOSED}: terminal</li>
 * </ul>
 */
public enum DeviceStatus {
    AVAILABLE,
    ASSIGNED,
    MAINTENANCE,
    DISPOSED;

    public boolean isTerminal() {
        return this == DISPOSED;
    }

    /** Statuses an administrator may set directly. */
    public boolean isAdministrative() {
        return this != ASSIGNED;
    }
}
