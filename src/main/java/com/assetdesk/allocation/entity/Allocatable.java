package com.assetdesk.allocation.entity;

/**
 * Capability shared by every resource the allocation engine hands out.
 *
 * <p>Both operations mutate only in-memory entity state. Callers must hold the
 * resource's row lock for the duration of the surrounding transaction; the
 * implementations are not thread-safe on their own.
 */
public interface Allocatable {

    Long getId();

    ResourceKind getKind();

    /**
     * Claims one unit of this resource.
     *
     * @return {@code false} when no unit is available; state is left unchanged
     */
    boolean tryClaim();

    /**
     * Gives one previously claimed unit back. Never pushes capacity above its maximum.
     */
    void release();
}
