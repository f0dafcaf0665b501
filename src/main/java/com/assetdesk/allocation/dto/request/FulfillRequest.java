package com.assetdesk.allocation.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record FulfillRequest(

    /** Device id for DEVICE requests, license pool id for LICENSE requests. */
    @NotNull(message = "Resource ID is required")
    Long resourceId,

    @NotBlank(message = "Fulfilled-by must not be blank")
    @Size(max = 100, message = "Fulfilled-by must not exceed 100 characters")
    String fulfilledBy,

    @Size(max = 10000, message = "Notes must not exceed 10000 characters")
    String notes
) {}
