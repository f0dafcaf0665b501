package com.assetdesk.allocation.controller;

import com.assetdesk.allocation.dto.request.RegisterDeviceRequest;
import com.assetdesk.allocation.dto.request.UpdateDeviceStatusRequest;
import com.assetdesk.allocation.dto.response.DeviceAssignmentResponse;
import com.assetdesk.allocation.dto.response.DeviceResponse;
import com.assetdesk.allocation.dto.response.PagedResponse;
import com.assetdesk.allocation.entity.DeviceCategory;
import com.assetdesk.allocation.entity.DeviceStatus;
import com.assetdesk.allocation.service.AssignmentLedger;
import com.assetdesk.allocation.service.ResourceCatalogService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Pageable;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/devices")
@RequiredArgsConstructor
@Tag(name = "Devices", description = "Device catalog and administrative status")
public class DeviceController {

    private final ResourceCatalogService catalogService;
    private final AssignmentLedger assignmentLedger;

    @PostMapping
    @Operation(summary = "Register a device", description = "New devices start AVAILABLE.")
    @ApiResponse(responseCode = "201", description = "Device registered")
    @ApiResponse(responseCode = "400", description = "Validation error or duplicate serial number")
    public ResponseEntity<DeviceResponse> register(@Valid @RequestBody RegisterDeviceRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(catalogService.registerDevice(request));
    }

    @GetMapping
    @Operation(summary = "List devices", description = "Returns a paginated list of devices with optional filters.")
    public ResponseEntity<PagedResponse<DeviceResponse>> findAll(
            @Parameter(description = "Filter by category") @RequestParam(required = false) DeviceCategory category,
            @Parameter(description = "Filter by status") @RequestParam(required = false) DeviceStatus status,
            Pageable pageable) {
        return ResponseEntity.ok(PagedResponse.from(catalogService.findDevices(category, status, pageable)));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get device by ID")
    @ApiResponse(responseCode = "200", description = "Device found")
    @ApiResponse(responseCode = "404", description = "Device not found")
    public ResponseEntity<DeviceResponse> findById(@PathVariable Long id) {
        return ResponseEntity.ok(catalogService.getDevice(id));
    }

    @GetMapping("/{id}/active-assignments")
    @Operation(summary = "Active assignment of a device", description = "Empty list when the device is not held.")
    public ResponseEntity<List<DeviceAssignmentResponse>> activeAssignments(@PathVariable Long id) {
        return ResponseEntity.ok(assignmentLedger.listActiveForDevice(id));
    }

    @PatchMapping("/{id}/status")
    @Operation(summary = "Change device status", description = "Administrative transition to AVAILABLE, "
        + "MAINTENANCE or DISPOSED. ASSIGNED is set only by a device assignment.")
    @ApiResponse(responseCode = "200", description = "Status changed")
    @ApiResponse(responseCode = "400", description = "Target status is ASSIGNED")
    @ApiResponse(responseCode = "404", description = "Device not found")
    @ApiResponse(responseCode = "409", description = "Transition not allowed from the current state")
    public ResponseEntity<DeviceResponse> updateStatus(@PathVariable Long id,
                                                       @Valid @RequestBody UpdateDeviceStatusRequest request) {
        return ResponseEntity.ok(catalogService.setDeviceStatus(id, request.status()));
    }
}
