package com.assetdesk.allocation.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDate;

/**
 * JPA entity representing a single-unit resource (laptop, desktop, tablet, phone).
 *
 * <p><strong>Status ownership</strong>: {@link DeviceStatus#ASSIGNED} is entered and left
 * only through {@link #tryClaim()} and {@link #release()}, which the allocation engine
 * calls while holding this row's {@code FOR UPDATE} lock. Administrative states
 * (MAINTENANCE, DISPOSED, AVAILABLE) are set by the resource catalog under the same lock.
 *
 * <p><strong>Serial number</strong>: unique across all devices. Enforced at the DB level by
 * {@code uq_devices_serial_number}; the catalog pre-checks it to produce a descriptive
 * validation error.
 *
 * <p><strong>Optimistic locking</strong>: {@link #version} backs up the row lock. A write
 * based on a stale read fails with {@code OptimisticLockingFailureException} instead of
 * overwriting a concurrent status change.
 */
@Entity
@Table(name = "devices")
@Getter
@Setter
@NoArgsConstructor
@EqualsAndHashCode(of = "id", callSuper = false)
public class Device extends BaseEntity implements Allocatable {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "category", nullable = false, length = 20)
    private DeviceCategory category;

    @Column(name = "manufacturer", nullable = false, length = 100)
    private String manufacturer;

    @Column(name = "model", nullable = false, length = 100)
    private String model;

    @Column(name = "serial_number", nullable = false, unique = true, length = 100)
    private String serialNumber;

    @Column(name = "purchase_date", nullable = false)
    private LocalDate purchaseDate;

    /** Drives warranty alerts in the expiry monitor. Never before {@link #purchaseDate}. */
    @Column(name = "warranty_expiry", nullable = false)
    private LocalDate warrantyExpiry;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private DeviceStatus status = DeviceStatus.AVAILABLE;

    @Column(name = "notes", columnDefinition = "TEXT")
    private String notes;

    @Version
    @Column(name = "version", nullable = false)
    private Integer version;

    @Override
    public ResourceKind getKind() {
        return ResourceKind.DEVICE;
    }

    @Override
    public boolean tryClaim() {
        if (status != DeviceStatus.AVAILABLE) {
            return false;
        }
        status = DeviceStatus.ASSIGNED;
        return true;
    }

    /**
     * Only an ASSIGNED device goes back to AVAILABLE. A device moved to MAINTENANCE or
     * DISPOSED while it was out keeps that administrative status.
     */
    @Override
    public void release() {
        if (status == DeviceStatus.ASSIGNED) {
            status = DeviceStatus.AVAILABLE;
        }
    }

    public String getDisplayName() {
        return manufacturer + " " + model + " (" + serialNumber + ")";
    }
}
