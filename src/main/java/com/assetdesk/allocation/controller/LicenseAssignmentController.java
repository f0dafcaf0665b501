package com.assetdesk.allocation.controller;

import com.assetdesk.allocation.dto.request.AssignLicenseRequest;
import com.assetdesk.allocation.dto.request.CloseLicenseAssignmentRequest;
import com.assetdesk.allocation.dto.response.LicenseAssignmentResponse;
import com.assetdesk.allocation.dto.response.PagedResponse;
import com.assetdesk.allocation.entity.LicenseAssignmentStatus;
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
@RequestMapping("/api/v1/license-assignments")
@RequiredArgsConstructor
@Tag(name = "License assignments", description = "License seat allocation with capacity control")
public class LicenseAssignmentController {

    private final AllocationEngine allocationEngine;
    private final AssignmentLedger assignmentLedger;

    @PostMapping
    @Operation(summary = "Assign a license seat", description = "Takes one seat from the pool. A retry with "
        + "the same Idempotency-Key returns the original assignment.")
    @ApiResponse(responseCode = "201", description = "Seat assigned")
    @ApiResponse(responseCode = "400", description = "Validation error or expired pool")
    @ApiResponse(responseCode = "404", description = "Pool not found")
    @ApiResponse(responseCode = "409", description = "No seats left, or holder already has a seat")
    public ResponseEntity<LicenseAssignmentResponse> assign(
            @RequestHeader(name = DeviceAssignmentController.IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey,
            @Valid @RequestBody AssignLicenseRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(allocationEngine.assignLicense(
            request.poolId(), request.holderId(), request.purpose(),
            request.startDate(), request.endDate(), idempotencyKey));
    }

    @PatchMapping("/{id}/close")
    @Operation(summary = "Return or revoke a license seat", description = "Closes an ACTIVE seat as RETURNED "
        + "or REVOKED and gives the seat back to the pool.")
    @ApiResponse(responseCode = "200", description = "Seat closed")
    @ApiResponse(responseCode = "400", description = "Reason is not RETURNED or REVOKED")
    @ApiResponse(responseCode = "404", description = "Assignment not found")
    @ApiResponse(responseCode = "409", description = "Assignment already closed")
    public ResponseEntity<LicenseAssignmentResponse> close(@PathVariable Long id,
                                                           @Valid @RequestBody CloseLicenseAssignmentRequest request) {
        return ResponseEntity.ok(allocationEngine.returnLicense(id, request.reason(), null, request.note()));
    }

    @GetMapping
    @Operation(summary = "List license assignments")
    public ResponseEntity<PagedResponse<LicenseAssignmentResponse>> findAll(
            @Parameter(description = "Filter by pool ID") @RequestParam(required = false) Long poolId,
            @Parameter(description = "Filter by holder ID") @RequestParam(required = false) Long holderId,
            @Parameter(description = "Filter by status") @RequestParam(required = false) LicenseAssignmentStatus status,
            Pageable pageable) {
        return ResponseEntity.ok(PagedResponse.from(
            assignmentLedger.findLicenseAssignments(poolId, holderId, status, pageable)));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get license assignment by ID")
    @ApiResponse(responseCode = "200", description = "Assignment found")
    @ApiResponse(responseCode = "404", description = "Assignment not found")
    public ResponseEntity<LicenseAssignmentResponse> findById(@PathVariable Long id) {
        return ResponseEntity.ok(assignmentLedger.getLicenseAssignment(id));
    }
}
