package com.assetdesk.allocation.dto.request;

import jakarta.validation.constraints.Size;

public record CancelRequest(

    @Size(max = 10000, message = "Reason must not exceed 10000 characters")
    String reason
) {}
