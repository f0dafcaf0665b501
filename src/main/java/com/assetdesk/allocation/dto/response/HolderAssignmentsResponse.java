package com.assetdesk.allocation.dto.response;

import java.util.List;

public record HolderAssignmentsResponse(
    Long holderId,
    List<DeviceAssignmentResponse> devices,
    List<LicenseAssignmentResponse> licenses
) {}
