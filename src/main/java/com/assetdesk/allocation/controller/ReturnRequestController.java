package com.assetdesk.allocation.controller;

import com.assetdesk.allocation.dto.request.ApproveRequest;
import com.assetdesk.allocation.dto.request.CancelRequest;
import com.assetdesk.allocation.dto.request.CompleteReturnRequest;
import com.assetdesk.allocation.dto.request.SubmitReturnRequest;
import com.assetdesk.allocation.dto.response.PagedResponse;
import com.assetdesk.allocation.dto.response.ReturnRequestResponse;
import com.assetdesk.allocation.entity.ReturnRequestStatus;
import com.assetdesk.allocation.service.ReturnRequestService;
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
@RequestMapping("/api/v1/return-requests")
@RequiredArgsConstructor
@Tag(name = "Return requests", description = "Employee requests to hand back a device or license seat")
public class ReturnRequestController {

    private final ReturnRequestService returnRequestService;

    @PostMapping
    @Operation(summary = "Submit a return request", description = "The assignment must be ACTIVE and held by the holder.")
    @ApiResponse(responseCode = "201", description = "Request submitted as PENDING")
    @ApiResponse(responseCode = "400", description = "Validation error or assignment held by someone else")
    @ApiResponse(responseCode = "404", description = "Assignment not found")
    @ApiResponse(responseCode = "409", description = "Assignment closed, or an open return request exists")
    public ResponseEntity<ReturnRequestResponse> submit(@Valid @RequestBody SubmitReturnRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(returnRequestService.submit(request));
    }

    @PatchMapping("/{id}/approve")
    @Operation(summary = "Approve a pending return request")
    @ApiResponse(responseCode = "200", description = "Request approved")
    @ApiResponse(responseCode = "409", description = "Request is not PENDING")
    public ResponseEntity<ReturnRequestResponse> approve(@PathVariable Long id,
                                                         @Valid @RequestBody ApproveRequest request) {
        return ResponseEntity.ok(returnRequestService.approve(id, request));
    }

    @PatchMapping("/{id}/complete")
    @Operation(summary = "Complete a return", description = "Closes the assignment and frees the resource.")
    @ApiResponse(responseCode = "200", description = "Return completed")
    @ApiResponse(responseCode = "409", description = "Request already completed or cancelled")
    public ResponseEntity<ReturnRequestResponse> complete(@PathVariable Long id,
                                                          @Valid @RequestBody CompleteReturnRequest request) {
        return ResponseEntity.ok(returnRequestService.complete(id, request));
    }

    @PatchMapping("/{id}/cancel")
    @Operation(summary = "Cancel a return request")
    @ApiResponse(responseCode = "200", description = "Request cancelled")
    @ApiResponse(responseCode = "409", description = "Request already completed or cancelled")
    public ResponseEntity<ReturnRequestResponse> cancel(@PathVariable Long id,
                                                        @Valid @RequestBody(required = false) CancelRequest request) {
        return ResponseEntity.ok(returnRequestService.cancel(id, request));
    }

    @GetMapping
    @Operation(summary = "List return requests")
    public ResponseEntity<PagedResponse<ReturnRequestResponse>> findAll(
            @Parameter(description = "Filter by holder ID") @RequestParam(required = false) Long holderId,
            @Parameter(description = "Filter by status") @RequestParam(required = false) ReturnRequestStatus status,
            Pageable pageable) {
        return ResponseEntity.ok(PagedResponse.from(returnRequestService.findAll(holderId, status, pageable)));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get return request by ID")
    @ApiResponse(responseCode = "200", description = "Request found")
    @ApiResponse(responseCode = "404", description = "Request not found")
    public ResponseEntity<ReturnRequestResponse> findById(@PathVariable Long id) {
        return ResponseEntity.ok(returnRequestService.findById(id));
    }
}
