package com.assetdesk.allocation.controller;

import com.assetdesk.allocation.dto.request.IncreaseSeatsRequest;
import com.assetdesk.allocation.dto.request.RegisterLicensePoolRequest;
import com.assetdesk.allocation.dto.response.LicenseAssignmentResponse;
import com.assetdesk.allocation.dto.response.LicensePoolResponse;
import com.assetdesk.allocation.dto.response.PagedResponse;
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
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/license-pools")
@RequiredArgsConstructor
@Tag(name = "License pools", description = "License pool catalog and seat capacity")
public class LicensePoolController {

    private final ResourceCatalogService catalogService;
    private final AssignmentLedger assignmentLedger;

    @PostMapping
    @Operation(summary = "Register a license pool", description = "All seats start available.")
    @ApiResponse(responseCode = "201", description = "Pool registered")
    @ApiResponse(responseCode = "400", description = "Validation error")
    public ResponseEntity<LicensePoolResponse> register(@Valid @RequestBody RegisterLicensePoolRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(catalogService.registerLicensePool(request));
    }

    @GetMapping
    @Operation(summary = "List license pools")
    public ResponseEntity<PagedResponse<LicensePoolResponse>> findAll(
            @Parameter(description = "Case-insensitive substring of the software name")
            @RequestParam(required = false) String softwareName,
            Pageable pageable) {
        return ResponseEntity.ok(PagedResponse.from(catalogService.findLicensePools(softwareName, pageable)));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get license pool by ID")
    @ApiResponse(responseCode = "200", description = "Pool found")
    @ApiResponse(responseCode = "404", description = "Pool not found")
    public ResponseEntity<LicensePoolResponse> findById(@PathVariable Long id) {
        return ResponseEntity.ok(catalogService.getLicensePool(id));
    }

    @GetMapping("/{id}/active-assignments")
    @Operation(summary = "Active seats of a pool")
    public ResponseEntity<List<LicenseAssignmentResponse>> activeAssignments(@PathVariable Long id) {
        return ResponseEntity.ok(assignmentLedger.listActiveForPool(id));
    }

    @PostMapping("/{id}/seats")
    @Operation(summary = "Add purchased seats", description = "Increases total and available by the same delta.")
    @ApiResponse(responseCode = "200", description = "Seats added")
    @ApiResponse(responseCode = "400", description = "Negative delta")
    @ApiResponse(responseCode = "404", description = "Pool not found")
    public ResponseEntity<LicensePoolResponse> increaseSeats(@PathVariable Long id,
                                                             @Valid @RequestBody IncreaseSeatsRequest request) {
        return ResponseEntity.ok(catalogService.increaseLicenseTotal(id, request.delta()));
    }
}
