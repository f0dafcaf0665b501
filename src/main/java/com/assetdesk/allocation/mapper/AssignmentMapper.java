package com.assetdesk.allocation.mapper;

import com.assetdesk.allocation.dto.response.DeviceAssignmentResponse;
import com.assetdesk.allocation.dto.response.LicenseAssignmentResponse;
import com.assetdesk.allocation.entity.DeviceAssignment;
import com.assetdesk.allocation.entity.LicenseAssignment;

/**
 * Ledger entry mapping. Reads the associated device or pool, so call it while the
 * association is initialized (inside the loading transaction or after a fetch join).
 */
public final class AssignmentMapper {

    private AssignmentMapper() {}

    public static DeviceAssignmentResponse toResponse(DeviceAssignment assignment) {
        return new DeviceAssignmentResponse(
            assignment.getId(),
            assignment.getDevice().getId(),
            assignment.getDevice().getDisplayName(),
            assignment.getHolderId(),
            assignment.getAssignedDate(),
            assignment.getPlannedReturnDate(),
            assignment.getPurpose(),
            assignment.getStatus(),
            assignment.getReturnedDate(),
            assignment.getClosingNote(),
            assignment.getCreatedAt()
        );
    }

    public static LicenseAssignmentResponse toResponse(LicenseAssignment assignment) {
        return new LicenseAssignmentResponse(
            assignment.getId(),
            assignment.getPool().getId(),
            assignment.getPool().getSoftwareName(),
            assignment.getHolderId(),
            assignment.getAssignedDate(),
            assignment.getStartDate(),
            assignment.getEndDate(),
            assignment.getEffectiveExpiryDate(),
            assignment.getPurpose(),
            assignment.getStatus(),
            assignment.getClosedAt(),
            assignment.getClosingNote(),
            assignment.getCreatedAt()
        );
    }
}
