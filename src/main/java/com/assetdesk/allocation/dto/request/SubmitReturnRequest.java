package com.assetdesk.allocation.dto.request;

import com.assetdesk.allocation.entity.ResourceKind;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.time.LocalDate;

public record SubmitReturnRequest(

    @NotNull(message = "Request type is required")
    ResourceKind requestType,

    @NotNull(message = "Holder ID is required")
    Long holderId,

    @NotNull(message = "Assignment ID is required")
    Long assignmentId,

    @NotNull(message = "Expected return date is required")
    LocalDate expectedReturnDate,

    @NotBlank(message = "Return reason must not be blank")
    @Size(max = 10000, message = "Return reason must not exceed 10000 characters")
    String returnReason,

    @Size(max = 10000, message = "Condition notes must not exceed 10000 characters")
    String conditionNotes
) {}
