package com.assetdesk.allocation.dto.response;

import com.assetdesk.allocation.entity.DeviceCategory;
import com.assetdesk.allocation.entity.RequestPriority;
import com.assetdesk.allocation.entity.ResourceKind;
import com.assetdesk.allocation.entity.ResourceRequestStatus;

import java.time.Instant;
import java.time.LocalDate;

public record ResourceRequestResponse(
    Long id,
    ResourceKind requestType,
    Long holderId,
    DeviceCategory deviceCategory,
    String softwareName,
    String purpose,
    String businessJustification,
    LocalDate expectedStartDate,
    LocalDate expectedEndDate,
    RequestPriority priority,
    ResourceRequestStatus status,
    String decidedBy,
    Instant decidedAt,
    String rejectionReason,
    String adminNotes,
    Long fulfilledAssignmentId,
    String fulfilledBy,
    Instant fulfilledAt,
    Instant createdAt
) {}
