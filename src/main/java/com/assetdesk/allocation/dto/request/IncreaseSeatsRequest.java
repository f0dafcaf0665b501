package com.assetdesk.allocation.dto.request;

import jakarta.validation.constraints.NotNull;

public record IncreaseSeatsRequest(

    @NotNull(message = "Delta is required")
    Integer delta
) {}
