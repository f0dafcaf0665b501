package com.assetdesk.allocation.service;

import com.assetdesk.allocation.dto.request.ApproveRequest;
import com.assetdesk.allocation.dto.request.CancelRequest;
import com.assetdesk.allocation.dto.request.CompleteReturnRequest;
import com.assetdesk.allocation.dto.request.SubmitReturnRequest;
import com.assetdesk.allocation.dto.response.ReturnRequestResponse;
import com.assetdesk.allocation.entity.DeviceAssignment;
import com.assetdesk.allocation.entity.LicenseAssignment;
import com.assetdesk.allocation.entity.LicenseAssignmentStatus;
import com.assetdesk.allocation.entity.ResourceKind;
import com.assetdesk.allocation.entity.ReturnRequest;
import com.assetdesk.allocation.entity.ReturnRequestStatus;
import com.assetdesk.allocation.exception.ConflictException;
import com.assetdesk.allocation.exception.InvalidTransitionException;
import com.assetdesk.allocation.exception.ResourceNotFoundException;
import com.assetdesk.allocation.exception.ValidationException;
import com.assetdesk.allocation.mapper.RequestMapper;
import com.assetdesk.allocation.repository.ReturnRequestRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.EnumSet;

/**
 * Workflow for handing back a held device or license seat. Completion closes the
 * ledger entry through the allocation engine in the same transaction.
 */
@Service
@RequiredArgsConstructor
public class ReturnRequestService {

    private static final Logger log = LoggerFactory.getLogger(ReturnRequestService.class);

    private static final EnumSet<ReturnRequestStatus> OPEN_STATUSES =
        EnumSet.of(ReturnRequestStatus.PENDING, ReturnRequestStatus.APPROVED);

    private final ReturnRequestRepository returnRequestRepository;
    private final AssignmentLedger assignmentLedger;
    private final AllocationEngine allocationEngine;
    private final Clock clock;

    @Transactional
    public ReturnRequestResponse submit(SubmitReturnRequest request) {
        Long assignmentId = request.assignmentId();
        if (request.requestType() == ResourceKind.DEVICE) {
            DeviceAssignment assignment = assignmentLedger.requireDeviceAssignment(assignmentId);
            requireHeldBy(assignment.getHolderId(), request.holderId(), assignmentId);
            if (!assignment.isActive()) {
                throw new InvalidTransitionException("DeviceAssignment", assignmentId, assignment.getStatus(),
                    "be returned");
            }
        } else {
            LicenseAssignment assignment = assignmentLedger.requireLicenseAssignment(assignmentId);
            requireHeldBy(assignment.getHolderId(), request.holderId(), assignmentId);
            if (!assignment.isActive()) {
                throw new InvalidTransitionException("LicenseAssignment", assignmentId, assignment.getStatus(),
                    "be returned");
            }
        }
        if (returnRequestRepository.existsByRequestTypeAndAssignmentIdAndStatusIn(
                request.requestType(), assignmentId, OPEN_STATUSES)) {
            throw new ConflictException("An open return request already exists for "
                + request.requestType() + " assignment " + assignmentId);
        }

        ReturnRequest saved = returnRequestRepository.save(RequestMapper.toEntity(request));
        log.info("Return request {} submitted by holder {} for {} assignment {}",
            saved.getId(), saved.getHolderId(), saved.getRequestType(), assignmentId);
        return RequestMapper.toResponse(saved);
    }

    @Transactional
    public ReturnRequestResponse approve(Long id, ApproveRequest request) {
        ReturnRequest entity = lock(id);
        if (entity.getStatus() != ReturnRequestStatus.PENDING) {
            throw new InvalidTransitionException("ReturnRequest", id, entity.getStatus(), "be approved");
        }

        entity.setStatus(ReturnRequestStatus.APPROVED);
        entity.appendAdminNote("Approved by " + request.decidedBy(), request.notes());
        return RequestMapper.toResponse(entity);
    }

    /**
     * Closes the referenced assignment (device RETURNED, or license RETURNED) and marks the
     * request COMPLETED. A device in MAINTENANCE can be returned and stays in MAINTENANCE.
     */
    @Transactional
    public ReturnRequestResponse complete(Long id, CompleteReturnRequest request) {
        ReturnRequest entity = lock(id);
        if (!entity.getStatus().isCompletable()) {
            throw new InvalidTransitionException("ReturnRequest", id, entity.getStatus(), "be completed");
        }

        LocalDate today = LocalDate.now(clock);
        LocalDate actual = request.actualReturnDate() != null ? request.actualReturnDate() : today;
        if (actual.isAfter(today)) {
            throw new ValidationException("Actual return date " + actual + " is in the future");
        }
        String note = request.notes() != null ? request.notes() : entity.getConditionNotes();

        if (entity.getRequestType() == ResourceKind.DEVICE) {
            allocationEngine.returnDevice(entity.getAssignmentId(), actual, note);
        } else {
            Instant closedAt = actual.equals(today) ? clock.instant() : actual.atStartOfDay(ZoneOffset.UTC).toInstant();
            allocationEngine.returnLicense(entity.getAssignmentId(), LicenseAssignmentStatus.RETURNED, closedAt, note);
        }

        entity.setStatus(ReturnRequestStatus.COMPLETED);
        entity.setProcessedBy(request.processedBy());
        entity.setProcessedAt(clock.instant());
        entity.setActualReturnDate(actual);
        log.info("Return request {} completed for {} assignment {}", id, entity.getRequestType(),
            entity.getAssignmentId());
        return RequestMapper.toResponse(entity);
    }

    @Transactional
    public ReturnRequestResponse cancel(Long id, CancelRequest request) {
        ReturnRequest entity = lock(id);
        if (!OPEN_STATUSES.contains(entity.getStatus())) {
            throw new InvalidTransitionException("ReturnRequest", id, entity.getStatus(), "be cancelled");
        }

        entity.setStatus(ReturnRequestStatus.CANCELLED);
        entity.appendAdminNote("Cancelled", request != null ? request.reason() : null);
        return RequestMapper.toResponse(entity);
    }

    @Transactional(readOnly = true)
    public ReturnRequestResponse findById(Long id) {
        ReturnRequest entity = returnRequestRepository.findById(id)
            .orElseThrow(() -> new ResourceNotFoundException("ReturnRequest", id));
        return RequestMapper.toResponse(entity);
    }

    @Transactional(readOnly = true)
    public Page<ReturnRequestResponse> findAll(Long holderId, ReturnRequestStatus status, Pageable pageable) {
        Specification<ReturnRequest> spec = Specification.where(null);

        if (holderId != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("holderId"), holderId));
        }
        if (status != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("status"), status));
        }

        return returnRequestRepository.findAll(spec, pageable)
            .map(RequestMapper::toResponse);
    }

    private ReturnRequest lock(Long id) {
        return returnRequestRepository.findByIdForUpdate(id)
            .orElseThrow(() -> new ResourceNotFoundException("ReturnRequest", id));
    }

    private static void requireHeldBy(Long actualHolderId, Long claimedHolderId, Long assignmentId) {
        if (!actualHolderId.equals(claimedHolderId)) {
            throw new ValidationException("Assignment " + assignmentId + " is not held by holder " + claimedHolderId);
        }
    }
}
