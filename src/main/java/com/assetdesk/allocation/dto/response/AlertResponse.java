package com.assetdesk.allocation.dto.response;

import com.assetdesk.allocation.entity.ResourceKind;
import com.assetdesk.allocation.service.AlertSeverity;

import java.time.LocalDate;

/**
 * One expiry alert. Derived on every scan and never stored.
 *
 * <p>{@code assignmentId} and {@code holderId} are {@code null} for device warranty alerts.
 */
public record AlertResponse(
    ResourceKind resourceKind,
    Long resourceId,
    Long assignmentId,
    Long holderId,
    String label,
    LocalDate expiryDate,
    long daysUntilExpiry,
    AlertSeverity severity
) {}
