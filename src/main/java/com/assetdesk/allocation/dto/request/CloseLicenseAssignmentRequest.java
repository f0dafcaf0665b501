package com.assetdesk.allocation.dto.request;

import com.assetdesk.allocation.entity.LicenseAssignmentStatus;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record CloseLicenseAssignmentRequest(

    /** RETURNED or REVOKED. EXPIRED is reserved for the expiry sweep. */
    @NotNull(message = "Reason is required")
    LicenseAssignmentStatus reason,

    @Size(max = 10000, message = "Note must not exceed 10000 characters")
    String note
) {}
