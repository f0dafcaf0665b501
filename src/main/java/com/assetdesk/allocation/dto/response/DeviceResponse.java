package com.assetdesk.allocation.dto.response;

import com.assetdesk.allocation.entity.DeviceCategory;
import com.assetdesk.allocation.entity.DeviceStatus;

import java.time.Instant;
import java.time.LocalDate;

public record DeviceResponse(
    Long id,
    DeviceCategory category,
    String manufacturer,
    String model,
    String serialNumber,
    LocalDate purchaseDate,
    LocalDate warrantyExpiry,
    DeviceStatus status,
    String notes,
    Instant createdAt,
    Instant updatedAt
) {}
