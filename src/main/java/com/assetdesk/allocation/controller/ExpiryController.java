package com.assetdesk.allocation.controller;

import com.assetdesk.allocation.dto.response.AlertResponse;
import com.assetdesk.allocation.dto.response.LicenseAssignmentResponse;
import com.assetdesk.allocation.dto.response.SweepResponse;
import com.assetdesk.allocation.service.AllocationEngine;
import com.assetdesk.allocation.service.ExpiryMonitor;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/api/v1/expiry")
@RequiredArgsConstructor
@Tag(name = "Expiry", description = "Expiry alerts and the expiry sweep")
public class ExpiryController {

    private final ExpiryMonitor expiryMonitor;
    private final AllocationEngine allocationEngine;
    private final Clock clock;

    @GetMapping("/alerts")
    @Operation(summary = "Scan for expiry alerts", description = "Active license seats and device warranties "
        + "expiring within the horizon, soonest first. Nothing is changed.")
    public ResponseEntity<List<AlertResponse>> alerts(
            @Parameter(description = "Reference date, defaults to today")
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate asOf,
            @Parameter(description = "Look-ahead in days")
            @RequestParam(defaultValue = "30") int horizonDays) {
        return ResponseEntity.ok(expiryMonitor.scan(asOf != null ? asOf : LocalDate.now(clock), horizonDays));
    }

    @PostMapping("/sweep")
    @Operation(summary = "Run the expiry sweep", description = "Closes as EXPIRED every active license seat "
        + "whose effective expiry is on or before the date and frees the seats.")
    public ResponseEntity<SweepResponse> sweep(
            @Parameter(description = "Reference date, defaults to today")
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate asOf) {
        LocalDate date = asOf != null ? asOf : LocalDate.now(clock);
        List<LicenseAssignmentResponse> expired = allocationEngine.sweepExpired(date);
        return ResponseEntity.ok(new SweepResponse(date, expired.size(), expired));
    }
}
