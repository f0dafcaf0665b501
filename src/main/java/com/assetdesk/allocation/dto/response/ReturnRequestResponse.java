package com.assetdesk.allocation.dto.response;

import com.assetdesk.allocation.entity.ResourceKind;
import com.assetdesk.allocation.entity.ReturnRequestStatus;

import java.time.Instant;
import java.time.LocalDate;

public record ReturnRequestResponse(
    Long id,
    ResourceKind requestType,
    Long holderId,
    Long assignmentId,
    LocalDate expectedReturnDate,
    String returnReason,
    String conditionNotes,
    ReturnRequestStatus status,
    String processedBy,
    Instant processedAt,
    LocalDate actualReturnDate,
    String adminNotes,
    Instant createdAt
) {}
