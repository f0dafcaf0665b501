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

import java.time.Instant;
import java.time.LocalDate;

/**
 * An employee's request to hand back a device or license seat they currently hold.
 *
 * <p>{@link #assignmentId} points into {@code device_assignments} or
 * {@code license_assignments} depending on {@link #requestType}. Completing the request
 * closes that ledger entry through the allocation engine.
 */
@Entity
@Table(name = "return_requests")
@Getter
@Setter
@NoArgsConstructor
@EqualsAndHashCode(of = "id", callSuper = false)
public class ReturnRequest extends BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "request_type", nullable = false, length = 10)
    private ResourceKind requestType;

    @Column(name = "holder_id", nullable = false, updatable = false)
    private Long holderId;

    @Column(name = "assignment_id", nullable = false, updatable = false)
    private Long assignmentId;

    @Column(name = "expected_return_date", nullable = false)
    private LocalDate expectedReturnDate;

    @Column(name = "return_reason", nullable = false, columnDefinition = "TEXT")
    private String returnReason;

    @Column(name = "condition_notes", columnDefinition = "TEXT")
    private String conditionNotes;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private ReturnRequestStatus status = ReturnRequestStatus.PENDING;

    @Column(name = "processed_by", length = 100)
    private String processedBy;

    @Column(name = "processed_at")
    private Instant processedAt;

    @Column(name = "actual_return_date")
    private LocalDate actualReturnDate;

    @Column(name = "admin_notes", columnDefinition = "TEXT")
    private String adminNotes;

    @Version
    @Column(name = "version", nullable = false)
    private Integer version;

    public void appendAdminNote(String label, String note) {
        if (note == null || note.isBlank()) {
            return;
        }
        String line = label + ": " + note;
        adminNotes = adminNotes == null || adminNotes.isBlank() ? line : adminNotes + "\n" + line;
    }
}
