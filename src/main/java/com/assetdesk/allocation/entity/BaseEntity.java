package com.assetdesk.allocation.entity;

import jakarta.persistence.Column;
import jakarta.persistence.MappedSuperclass;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;

import java.time.Instant;

/**
 * Shared superclass for catalog, ledger and request entities.
 *
 * <p>Keeps the technical audit columns ({@code created_at}, {@code updated_at}) out of
 * the business attributes. Business timestamps such as {@code closed_at} live on the
 * concrete entities because they carry meaning in the API and are never touched by
 * these callbacks.
 *
 * <p>The protected no-arg constructor is required by JPA.
 */
@MappedSuperclass
public abstract class BaseEntity {

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected BaseEntity() {}

    @PrePersist
    protected void onCreate() {
        Instant now = Instant.now();
        createdAt = now;
        updatedAt = now;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }
}
