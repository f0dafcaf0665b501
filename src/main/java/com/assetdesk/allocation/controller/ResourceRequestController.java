package com.assetdesk.allocation.controller;

import com.assetdesk.allocation.dto.request.ApproveRequest;
import com.assetdesk.allocation.dto.request.CancelRequest;
import com.assetdesk.allocation.dto.request.FulfillRequest;
import com.assetdesk.allocation.dto.request.RejectRequest;
import com.assetdesk.allocation.dto.request.SubmitResourceRequest;
import com.assetdesk.allocation.dto.response.PagedResponse;
import com.assetdesk.allocation.dto.response.ResourceRequestResponse;
import com.assetdesk.allocation.entity.ResourceKind;
import com.assetdesk.allocation.entity.ResourceRequestStatus;
import com.assetdesk.allocation.service.ResourceRequestService;
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

@RestController
@RequestMapping("/api/v1/resource-requests")
@RequiredArgsConstructor
@Tag(name = "Resource requests", description = "Employee requests for devices and license seats")
public class ResourceRequestController {

    private final ResourceRequestService resourceRequestService;

    @PostMapping
    @Operation(summary = "Submit a resource request")
    @ApiResponse(responseCode = "201", description = "Request submitted as PENDING")
    @ApiResponse(responseCode = "400", description = "Validation error")
    public ResponseEntity<ResourceRequestResponse> submit(@Valid @RequestBody SubmitResourceRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(resourceRequestService.submit(request));
    }

    @PatchMapping("/{id}/approve")
    @Operation(summary = "Approve a pending request")
    @ApiResponse(responseCode = "200", description = "Request approved")
    @ApiResponse(responseCode = "409", description = "Request is not PENDING")
    public ResponseEntity<ResourceRequestResponse> approve(@PathVariable Long id,
                                                           @Valid @RequestBody ApproveRequest request) {
        return ResponseEntity.ok(resourceRequestService.approve(id, request));
    }

    @PatchMapping("/{id}/reject")
    @Operation(summary = "Reject a pending request")
    @ApiResponse(responseCode = "200", description = "Request rejected")
    @ApiResponse(responseCode = "409", description = "Request is not PENDING")
    public ResponseEntity<ResourceRequestResponse> reject(@PathVariable Long id,
                                                          @Valid @RequestBody RejectRequest request) {
        return ResponseEntity.ok(resourceRequestService.reject(id, request));
    }

    @PatchMapping("/{id}/fulfill")
    @Operation(summary = "Fulfil an approved request", description = "Assigns the given device or license pool "
        + "to the requester. If the assignment fails the request stays APPROVED.")
    @ApiResponse(responseCode = "200", description = "Request fulfilled")
    @ApiResponse(responseCode = "409", description = "Request is not APPROVED, or the resource is unavailable")
    public ResponseEntity<ResourceRequestResponse> fulfill(@PathVariable Long id,
                                                           @Valid @RequestBody FulfillRequest request) {
        return ResponseEntity.ok(resourceRequestService.fulfill(id, request));
    }

    @PatchMapping("/{id}/cancel")
    @Operation(summary = "Cancel a pending or approved request")
    @ApiResponse(responseCode = "200", description = "Request cancelled")
    @ApiResponse(responseCode = "409", description = "Request already decided or fulfilled")
    public ResponseEntity<ResourceRequestResponse> cancel(@PathVariable Long id,
                                                          @Valid @RequestBody(required = false) CancelRequest request) {
        return ResponseEntity.ok(resourceRequestService.cancel(id, request));
    }

    @GetMapping
    @Operation(summary = "List resource requests")
    public ResponseEntity<PagedResponse<ResourceRequestResponse>> findAll(
            @Parameter(description = "Filter by holder ID") @RequestParam(required = false) Long holderId,
            @Parameter(description = "Filter by status") @RequestParam(required = false) ResourceRequestStatus status,
            @Parameter(description = "Filter by type (DEVICE, LICENSE)") @RequestParam(required = false) ResourceKind type,
            Pageable pageable) {
        return ResponseEntity.ok(PagedResponse.from(resourceRequestService.findAll(holderId, status, type, pageable)));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get resource request by ID")
    @ApiResponse(responseCode = "200", description = "Request found")
    @ApiResponse(responseCode = "404", description = "Request not found")
    public ResponseEntity<ResourceRequestResponse> findById(@PathVariable Long id) {
        return ResponseEntity.ok(resourceRequestService.findById(id));
    }
}
