package com.assetdesk.allocation.dto.response;

import java.time.LocalDate;
import java.util.List;

public record SweepResponse(
    LocalDate asOf,
    int expiredCount,
    List<LicenseAssignmentResponse> expired
) {}
