package com.assetdesk.allocation.dto.response;

import com.assetdesk.allocation.entity.LicenseAssignmentStatus;

import java.time.Instant;
import java.time.LocalDate;

public record LicenseAssignmentResponse(
    Long id,
    Long poolId,
    String softwareName,
    Long holderId,
    LocalDate assignedDate,
    LocalDate startDate,
    LocalDate endDate,
    LocalDate effectiveExpiryDate,
    String purpose,
    LicenseAssignmentStatus status,
    Instant closedAt,
    String closingNote,
    Instant createdAt
) {}
