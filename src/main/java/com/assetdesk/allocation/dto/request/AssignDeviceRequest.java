package com.assetdesk.allocation.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.time.LocalDate;

public record AssignDeviceRequest(

    @NotNull(message = "Device ID is required")
    Long deviceId,

    @NotNull(message = "Holder ID is required")
    Long holderId,

    @NotBlank(message = "Purpose must not be blank")
    @Size(max = 500, message = "Purpose must not exceed 500 characters")
    String purpose,

    LocalDate plannedReturnDate
) {}
