package com.assetdesk.allocation.dto.response;

import com.assetdesk.allocation.entity.DeviceAssignmentStatus;

import java.time.Instant;
import java.time.LocalDate;

public record DeviceAssignmentResponse(
    Long id,
    Long deviceId,
    String deviceName,
    Long holderId,
    LocalDate assignedDate,
    LocalDate plannedReturnDate,
    String purpose,
    DeviceAssignmentStatus status,
    LocalDate returnedDate,
    String closingNote,
    Instant createdAt
) {}
