package com.assetdesk.allocation.dto.request;

import com.assetdesk.allocation.entity.DeviceStatus;
import jakarta.validation.constraints.NotNull;

public record UpdateDeviceStatusRequest(

    @NotNull(message = "Status is required")
    DeviceStatus status
) {}
