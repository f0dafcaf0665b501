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
 * An employee's request for a device or a license seat.
 *
 * <p>The request names what is wanted ({@link #deviceCategory} or {@link #softwareName}),
 * not a concrete resource. The administrator picks the device or pool at fulfilment time,
 * and the resulting ledger entry id is stored in {@link #fulfilledAssignmentId}.
 */
@Entity
@Table(name = "resource_requests")
@Getter
@Setter
@NoArgsConstructor
@EqualsAndHashCode(of = "id", callSuper = false)
public class ResourceRequest extends BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "request_type", nullable = false, length = 10)
    private ResourceKind requestType;

    @Column(name = "holder_id", nullable = false, updatable = false)
    private Long holderId;

    @Enumerated(EnumType.STRING)
    @Column(name = "device_category", length = 20)
    private DeviceCategory deviceCategory;

    @Column(name = "software_name", length = 200)
    private String softwareName;

    @Column(name = "purpose", nullable = false, length = 500)
    private String purpose;

    @Column(name = "business_justification", columnDefinition = "TEXT")
    private String businessJustification;

    @Column(name = "expected_start_date", nullable = false)
    private LocalDate expectedStartDate;

    @Column(name = "expected_end_date")
    private LocalDate expectedEndDate;

    @Enumerated(EnumType.STRING)
    @Column(name = "priority", nullable = false, length = 10)
    private RequestPriority priority = RequestPriority.MEDIUM;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private ResourceRequestStatus status = ResourceRequestStatus.PENDING;

    /** Administrator who approved or rejected the request. */
    @Column(name = "decided_by", length = 100)
    private String decidedBy;

    @Column(name = "decided_at")
    private Instant decidedAt;

    @Column(name = "rejection_reason", columnDefinition = "TEXT")
    private String rejectionReason;

    @Column(name = "admin_notes", columnDefinition = "TEXT")
    private String adminNotes;

    @Column(name = "fulfilled_assignment_id")
    private Long fulfilledAssignmentId;

    @Column(name = "fulfilled_by", length = 100)
    private String fulfilledBy;

    @Column(name = "fulfilled_at")
    private Instant fulfilledAt;

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
