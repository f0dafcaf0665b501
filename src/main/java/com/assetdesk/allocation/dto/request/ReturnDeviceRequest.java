package com.assetdesk.allocation.dto.request;

import jakarta.validation.constraints.Size;

import java.time.LocalDate;

/** Both fields are optional; the return date defaults to today. */
public record ReturnDeviceRequest(

    LocalDate returnedDate,

    @Size(max = 10000, message = "Note must not exceed 10000 characters")
    String note
) {}
