package com.assetdesk.allocation.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Ledger entry for one seat of a {@link LicensePool} held by an employee.
 *
 * <p>A pool may have up to {@code totalCount} concurrent ACTIVE entries. A single holder may
 * have at most one ACTIVE seat per pool ({@code uq_license_assignments_active_holder}).
 *
 * <p><strong>Effective expiry</strong>: the seat stops being usable on the earlier of the
 * pool's expiry date and this entry's own {@link #endDate}. The expiry monitor and the
 * sweep both use {@link #getEffectiveExpiryDate()}.
 *
 * <p>Status transitions are monotonic: {@code ACTIVE → RETURNED | REVOKED | EXPIRED}.
 */
@Entity
@Table(name = "license_assignments")
@Getter
@Setter
@NoArgsConstructor
@EqualsAndHashCode(of = "id", callSuper = false)
public class LicenseAssignment extends BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "pool_id", nullable = false, updatable = false)
    private LicensePool pool;

    @Column(name = "holder_id", nullable = false, updatable = false)
    private Long holderId;

    @Column(name = "assigned_date", nullable = false, updatable = false)
    private LocalDate assignedDate;

    @Column(name = "start_date", nullable = false)
    private LocalDate startDate;

    /** Optional last day of use. Never after the pool's expiry date. */
    @Column(name = "end_date")
    private LocalDate endDate;

    @Column(name = "purpose", nullable = false, length = 500)
    private String purpose;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private LicenseAssignmentStatus status;

    /** When the entry reached its terminal status. {@code null} while ACTIVE. */
    @Column(name = "closed_at")
    private Instant closedAt;

    @Column(name = "closing_note", columnDefinition = "TEXT")
    private String closingNote;

    @Column(name = "idempotency_key", length = 100, updatable = false)
    private String idempotencyKey;

    @Version
    @Column(name = "version", nullable = false)
    private Integer version;

    public boolean isActive() {
        return status == LicenseAssignmentStatus.ACTIVE;
    }

    public LocalDate getEffectiveExpiryDate() {
        LocalDate poolExpiry = pool.getExpiryDate();
        if (endDate != null && endDate.isBefore(poolExpiry)) {
            return endDate;
        }
        return poolExpiry;
    }
}
