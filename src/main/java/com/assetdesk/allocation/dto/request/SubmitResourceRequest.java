package com.assetdesk.allocation.dto.request;

import com.assetdesk.allocation.entity.DeviceCategory;
import com.assetdesk.allocation.entity.RequestPriority;
import com.assetdesk.allocation.entity.ResourceKind;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.time.LocalDate;

public record SubmitResourceRequest(

    @NotNull(message = "Request type is required")
    ResourceKind requestType,

    @NotNull(message = "Holder ID is required")
    Long holderId,

    DeviceCategory deviceCategory,

    @Size(max = 200, message = "Software name must not exceed 200 characters")
    String softwareName,

    @NotBlank(message = "Purpose must not be blank")
    @Size(max = 500, message = "Purpose must not exceed 500 characters")
    String purpose,

    @Size(max = 10000, message = "Business justification must not exceed 10000 characters")
    String businessJustification,

    @NotNull(message = "Expected start date is required")
    LocalDate expectedStartDate,

    LocalDate expectedEndDate,

    RequestPriority priority
) {}
