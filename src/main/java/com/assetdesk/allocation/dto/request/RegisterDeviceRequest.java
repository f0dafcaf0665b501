package com.assetdesk.allocation.dto.request;

import com.assetdesk.allocation.entity.DeviceCategory;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

import java.time.LocalDate;

public record RegisterDeviceRequest(

    @NotNull(message = "Category is required")
    DeviceCategory category,

    @NotBlank(message = "Manufacturer must not be blank")
    @Size(max = 100, message = "Manufacturer must not exceed 100 characters")
    String manufacturer,

    @NotBlank(message = "Model must not be blank")
    @Size(max = 100, message = "Model must not exceed 100 characters")
    String model,

    @NotBlank(message = "Serial number must not be blank")
    @Size(max = 100, message = "Serial number must not exceed 100 characters")
    @Pattern(regexp = "[A-Z0-9\\-]+", message = "Serial number may contain only upper-case letters, digits and hyphens")
    String serialNumber,

    @NotNull(message = "Purchase date is required")
    LocalDate purchaseDate,

    @NotNull(message = "Warranty expiry is required")
    LocalDate warrantyExpiry,

    @Size(max = 10000, message = "Notes must not exceed 10000 characters")
    String notes
) {}
