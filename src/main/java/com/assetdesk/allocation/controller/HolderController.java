package com.assetdesk.allocation.controller;

import com.assetdesk.allocation.dto.response.HolderAssignmentsResponse;
import com.assetdesk.allocation.service.AssignmentLedger;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/holders")
@RequiredArgsConstructor
@Tag(name = "Holders", description = "What an employee holds and has held")
public class HolderController {

    private final AssignmentLedger assignmentLedger;

    @GetMapping("/{holderId}/assignments")
    @Operation(summary = "Assignment history of a holder", description = "Device and license assignments, newest first.")
    public ResponseEntity<HolderAssignmentsResponse> assignments(@PathVariable Long holderId) {
        return ResponseEntity.ok(assignmentLedger.listForHolder(holderId));
    }
}
