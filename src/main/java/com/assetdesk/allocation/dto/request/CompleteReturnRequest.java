package com.assetdesk.allocation.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import java.time.LocalDate;

public record CompleteReturnRequest(

    @NotBlank(message = "Processed-by must not be blank")
    @Size(max = 100, message = "Processed-by must not exceed 100 characters")
    String processedBy,

    LocalDate actualReturnDate,

    @Size(max = 10000, message = "Notes must not exceed 10000 characters")
    String notes
) {}
