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

import java.time.LocalDate;

/**
 * Ledger entry for one episode of a {@link Device} being held by an employee.
 *
 * <p>Only one {@code ACTIVE} entry per device can exist at any time. Enforced at the
 * database level by the partial unique index {@code uq_device_assignments_active_device}:
 * <pre>
 *   CREATE UNIQUE INDEX uq_device_assignments_active_device
 *       ON device_assignments (device_id) WHERE status = 'ACTIVE';
 * </pre>
 *
 * <p>Entries are append-only. Once {@link DeviceAssignmentStatus#RETURNED} the row is never
 * edited again; a re-assignment of the same device is a new row.
 *
 * <p>{@code @ToString} is omitted to avoid lazy-loading {@code device} during logging.
 */
@Entity
@Table(name = "device_assignments")
@Getter
@Setter
@NoArgsConstructor
@EqualsAndHashCode(of = "id", callSuper = false)
public class DeviceAssignment extends BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "device_id", nullable = false, updatable = false)
    private Device device;

    /** Employee holding the device. Employees live in another system; only the id is kept. */
    @Column(name = "holder_id", nullable = false, updatable = false)
    private Long holderId;

    @Column(name = "assigned_date", nullable = false, updatable = false)
    private LocalDate assignedDate;

    @Column(name = "planned_return_date")
    private LocalDate plannedReturnDate;

    @Column(name = "purpose", nullable = false, length = 500)
    private String purpose;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private DeviceAssignmentStatus status;

    /** Actual return date. {@code null} while ACTIVE. */
    @Column(name = "returned_date")
    private LocalDate returnedDate;

    @Column(name = "closing_note", columnDefinition = "TEXT")
    private String closingNote;

    /** Caller-supplied key that makes a retried assignment return this row instead of a new one. */
    @Column(name = "idempotency_key", length = 100, updatable = false)
    private String idempotencyKey;

    @Version
    @Column(name = "version", nullable = false)
    private Integer version;

    public boolean isActive() {
        return status == DeviceAssignmentStatus.ACTIVE;
    }
}
