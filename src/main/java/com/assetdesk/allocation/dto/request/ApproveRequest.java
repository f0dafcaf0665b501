package com.assetdesk.allocation.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record ApproveRequest(

    @NotBlank(message = "Approver must not be blank")
    @Size(max = 100, message = "Approver must not exceed 100 characters")
    String decidedBy,

    @Size(max = 10000, message = "Notes must not exceed 10000 characters")
    String notes
) {}
