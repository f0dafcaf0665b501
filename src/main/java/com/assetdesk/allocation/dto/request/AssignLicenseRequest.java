package com.assetdesk.allocation.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.time.LocalDate;

public record AssignLicenseRequest(

    @NotNull(message = "Pool ID is required")
    Long poolId,

    @NotNull(message = "Holder ID is required")
    Long holderId,

    @NotBlank(message = "Purpose must not be blank")
    @Size(max = 500, message = "Purpose must not exceed 500 characters")
    String purpose,

    @NotNull(message = "Start date is required")
    LocalDate startDate,

    LocalDate endDate
) {}
