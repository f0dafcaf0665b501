package com.assetdesk.allocation.controller;

import com.assetdesk.allocation.dto.request.AssignDeviceRequest;
import com.assetdesk.allocation.dto.request.ReturnDeviceRequest;
import com.assetdesk.allocation.dto.response.DeviceAssignmentResponse;
import com.assetdesk.allocation.dto.response.PagedResponse;
import com.assetdesk.allocation.entity.DeviceAssignmentStatus;
import com.assetdesk.allocation.service.AllocationEngine;
import com.assetdesk.allocation.service.AssignmentLedger;
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
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/device-assignments")
@RequiredArgsConstructor
@Tag(name = "Device assignments", description = "Assigning devices to employees and taking them back")
public class DeviceAssignmentController {

    static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private final AllocationEngine allocationEngine;
    private final AssignmentLedger assignmentLedger;

    @PostMapping
    @Operation(summary = "Assign a device", description = "Assigns an AVAILABLE device. A retry with the same "
        + "Idempotency-Key returns the original assignment.")
    @ApiResponse(responseCode = "201", description = "Device assigned")
    @ApiResponse(responseCode = "400", description = "Validation error")
    @ApiResponse(responseCode = "404", description = "Device not found")
    @ApiResponse(responseCode = "409", description = "Device not available, or key reused for another assignment")
    public ResponseEntity<DeviceAssignmentResponse> assign(
            @RequestHeader(name = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey,
            @Valid @RequestBody AssignDeviceRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(allocationEngine.assignDevice(
            request.deviceId(), request.holderId(), request.purpose(), request.plannedReturnDate(), idempotencyKey));
    }

    @PatchMapping("/{id}/return")
    @Operation(summary = "Return a device", description = "Closes the assignment as RETURNED. The device "
        + "becomes AVAILABLE unless it was put into MAINTENANCE meanwhile.")
    @ApiResponse(responseCode = "200", description = "Device returned")
    @ApiResponse(responseCode = "404", description = "Assignment not found")
    @ApiResponse(responseCode = "409", description = "Assignment already closed")
    public ResponseEntity<DeviceAssignmentResponse> returnDevice(
            @PathVariable Long id,
            @Valid @RequestBody(required = false) ReturnDeviceRequest request) {
        return ResponseEntity.ok(allocationEngine.returnDevice(id,
            request != null ? request.returnedDate() : null,
            request != null ? request.note() : null));
    }

    @GetMapping
    @Operation(summary = "List device assignments")
    public ResponseEntity<PagedResponse<DeviceAssignmentResponse>> findAll(
            @Parameter(description = "Filter by device ID") @RequestParam(required = false) Long deviceId,
            @Parameter(description = "Filter by holder ID") @RequestParam(required = false) Long holderId,
            @Parameter(description = "Filter by status (ACTIVE, RETURNED)") @RequestParam(required = false) DeviceAssignmentStatus status,
            Pageable pageable) {
        return ResponseEntity.ok(PagedResponse.from(
            assignmentLedger.findDeviceAssignments(deviceId, holderId, status, pageable)));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get device assignment by ID")
    @ApiResponse(responseCode = "200", description = "Assignment found")
    @ApiResponse(responseCode = "404", description = "Assignment not found")
    public ResponseEntity<DeviceAssignmentResponse> findById(@PathVariable Long id) {
        return ResponseEntity.ok(assignmentLedger.getDeviceAssignment(id));
    }
}
