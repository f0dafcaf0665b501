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

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * JPA entity representing a pool of license seats for one software product.
 *
 * <p><strong>Capacity invariant</strong>: {@code available = total - count(ACTIVE assignments)}.
 * The counter is mutated only by {@link #tryClaim()}, {@link #release()} and
 * {@link #addSeats(int)}, always while the caller holds this row's {@code FOR UPDATE}
 * lock. The check-and-decrement in {@link #tryClaim()} is therefore a single step with
 * respect to every other transaction touching the same pool. The table-level CHECK
 * constraint {@code ck_license_pools_available} ({@code 0 <= available_count <= total_count})
 * rejects any write that would escape this discipline.
 *
 * <p><strong>Expiry</strong>: a pool is expired on every day on or after
 * {@link #expiryDate}. Expired pools accept no new assignments and the expiry sweep
 * closes their ACTIVE assignments.
 *
 * <p>Pricing fields are stored as plain data; no cost computation happens here.
 */
@Entity
@Table(name = "license_pools")
@Getter
@Setter
@NoArgsConstructor
@EqualsAndHashCode(of = "id", callSuper = false)
public class LicensePool extends BaseEntity implements Allocatable {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "software_name", nullable = false, length = 200)
    private String softwareName;

    @Column(name = "license_type", nullable = false, length = 100)
    private String licenseType;

    @Column(name = "vendor_name", length = 200)
    private String vendorName;

    @Column(name = "total_count", nullable = false)
    private int totalCount;

    @Column(name = "available_count", nullable = false)
    private int availableCount;

    @Enumerated(EnumType.STRING)
    @Column(name = "pricing_model", nullable = false, length = 20)
    private PricingModel pricingModel;

    @Column(name = "unit_price", nullable = false, precision = 10, scale = 2)
    private BigDecimal unitPrice;

    @Column(name = "purchase_date")
    private LocalDate purchaseDate;

    @Column(name = "expiry_date", nullable = false)
    private LocalDate expiryDate;

    @Column(name = "notes", columnDefinition = "TEXT")
    private String notes;

    @Version
    @Column(name = "version", nullable = false)
    private Integer version;

    @Override
    public ResourceKind getKind() {
        return ResourceKind.LICENSE;
    }

    @Override
    public boolean tryClaim() {
        if (availableCount <= 0) {
            return false;
        }
        availableCount--;
        return true;
    }

    @Override
    public void release() {
        if (availableCount < totalCount) {
            availableCount++;
        }
    }

    /**
     * Adds newly purchased seats; they are immediately available.
     *
     * @throws ArithmeticException if the new total does not fit in an {@code int};
     *         neither counter is changed
     */
    public void addSeats(int delta) {
        if (delta < 0) {
            throw new IllegalArgumentException("Seat delta must not be negative: " + delta);
        }
        int newTotal = Math.addExact(totalCount, delta);
        int newAvailable = Math.addExact(availableCount, delta);
        totalCount = newTotal;
        availableCount = newAvailable;
    }

    public int getUsedCount() {
        return totalCount - availableCount;
    }

    public boolean isExpiredOn(LocalDate date) {
        return !expiryDate.isAfter(date);
    }

    public String getDisplayName() {
        return softwareName + " (" + licenseType + ")";
    }
}
