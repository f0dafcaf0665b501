package com.assetdesk.allocation.service;

import com.assetdesk.allocation.dto.request.ApproveRequest;
import com.assetdesk.allocation.dto.request.CancelRequest;
import com.assetdesk.allocation.dto.request.FulfillRequest;
import com.assetdesk.allocation.dto.request.RejectRequest;
import com.assetdesk.allocation.dto.request.SubmitResourceRequest;
import com.assetdesk.allocation.dto.response.ResourceRequestResponse;
import com.assetdesk.allocation.entity.ResourceKind;
import com.assetdesk.allocation.entity.ResourceRequest;
import com.assetdesk.allocation.entity.ResourceRequestStatus;
import com.assetdesk.allocation.exception.InvalidTransitionException;
import com.assetdesk.allocation.exception.ResourceNotFoundException;
import com.assetdesk.allocation.exception.ValidationException;
import com.assetdesk.allocation.mapper.RequestMapper;
import com.assetdesk.allocation.repository.ResourceRequestRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;

/**
 * Approval workflow in front of the allocation engine for new devices and license seats.
 *
 * <p>{@link #fulfill} calls the engine within the request's transaction, which the
 * engine joins: if the engine rejects the assignment, the whole transaction rolls back,
 * the request stays APPROVED and nothing is allocated.
 */
@Service
@RequiredArgsConstructor
public class ResourceRequestService {

    private static final Logger log = LoggerFactory.getLogger(ResourceRequestService.class);

    static final String IDEMPOTENCY_KEY_PREFIX = "resource-request-";

    private final ResourceRequestRepository resourceRequestRepository;
    private final AllocationEngine allocationEngine;
    private final Clock clock;

    @Transactional
    public ResourceRequestResponse submit(SubmitResourceRequest request) {
        if (request.requestType() == ResourceKind.DEVICE && request.deviceCategory() == null) {
            throw new ValidationException("Device requests must name a device category");
        }
        if (request.requestType() == ResourceKind.LICENSE
                && (request.softwareName() == null || request.softwareName().isBlank())) {
            throw new ValidationException("License requests must name the software");
        }
        if (request.expectedEndDate() != null && request.expectedEndDate().isBefore(request.expectedStartDate())) {
            throw new ValidationException("Expected end date " + request.expectedEndDate()
                + " is before the expected start date " + request.expectedStartDate());
        }

        ResourceRequest saved = resourceRequestRepository.save(RequestMapper.toEntity(request));
        log.info("Resource request {} submitted by holder {} ({})",
            saved.getId(), saved.getHolderId(), saved.getRequestType());
        return RequestMapper.toResponse(saved);
    }

    @Transactional
    public ResourceRequestResponse approve(Long id, ApproveRequest request) {
        ResourceRequest entity = lock(id);
        requireStatus(entity, ResourceRequestStatus.PENDING, "be approved");

        entity.setStatus(ResourceRequestStatus.APPROVED);
        entity.setDecidedBy(request.decidedBy());
        entity.setDecidedAt(clock.instant());
        entity.appendAdminNote("Approved by " + request.decidedBy(), request.notes());
        return RequestMapper.toResponse(entity);
    }

    @Transactional
    public ResourceRequestResponse reject(Long id, RejectRequest request) {
        ResourceRequest entity = lock(id);
        requireStatus(entity, ResourceRequestStatus.PENDING, "be rejected");

        entity.setStatus(ResourceRequestStatus.REJECTED);
        entity.setDecidedBy(request.decidedBy());
        entity.setDecidedAt(clock.instant());
        entity.setRejectionReason(request.reason());
        return RequestMapper.toResponse(entity);
    }

    /**
     * Assigns the chosen device or license pool to the requester and marks the request
     * FULFILLED. The request id doubles as the engine's idempotency key.
     */
    @Transactional
    public ResourceRequestResponse fulfill(Long id, FulfillRequest request) {
        ResourceRequest entity = lock(id);
        requireStatus(entity, ResourceRequestStatus.APPROVED, "be fulfilled");

        String key = IDEMPOTENCY_KEY_PREFIX + id;
        Long assignmentId = switch (entity.getRequestType()) {
            case DEVICE -> allocationEngine.assignDevice(
                request.resourceId(), entity.getHolderId(), entity.getPurpose(),
                entity.getExpectedEndDate(), key).id();
            case LICENSE -> allocationEngine.assignLicense(
                request.resourceId(), entity.getHolderId(), entity.getPurpose(),
                entity.getExpectedStartDate(), entity.getExpectedEndDate(), key).id();
        };

        entity.setStatus(ResourceRequestStatus.FULFILLED);
        entity.setFulfilledAssignmentId(assignmentId);
        entity.setFulfilledBy(request.fulfilledBy());
        entity.setFulfilledAt(clock.instant());
        entity.appendAdminNote("Fulfilled by " + request.fulfilledBy(), request.notes());
        log.info("Resource request {} fulfilled with {} assignment {}", id, entity.getRequestType(), assignmentId);
        return RequestMapper.toResponse(entity);
    }

    @Transactional
    public ResourceRequestResponse cancel(Long id, CancelRequest request) {
        ResourceRequest entity = lock(id);
        if (!entity.getStatus().isCancellable()) {
            throw new InvalidTransitionException("ResourceRequest", id, entity.getStatus(), "be cancelled");
        }

        entity.setStatus(ResourceRequestStatus.CANCELLED);
        entity.appendAdminNote("Cancelled", request != null ? request.reason() : null);
        return RequestMapper.toResponse(entity);
    }

    @Transactional(readOnly = true)
    public ResourceRequestResponse findById(Long id) {
        ResourceRequest entity = resourceRequestRepository.findById(id)
            .orElseThrow(() -> new ResourceNotFoundException("ResourceRequest", id));
        return RequestMapper.toResponse(entity);
    }

    @Transactional(readOnly = true)
    public Page<ResourceRequestResponse> findAll(Long holderId, ResourceRequestStatus status,
                                                 ResourceKind requestType, Pageable pageable) {
        Specification<ResourceRequest> spec = Specification.where(null);

        if (holderId != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("holderId"), holderId));
        }
        if (status != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("status"), status));
        }
        if (requestType != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("requestType"), requestType));
        }

        return resourceRequestRepository.findAll(spec, pageable)
            .map(RequestMapper::toResponse);
    }

    private ResourceRequest lock(Long id) {
        return resourceRequestRepository.findByIdForUpdate(id)
            .orElseThrow(() -> new ResourceNotFoundException("ResourceRequest", id));
    }

    private static void requireStatus(ResourceRequest entity, ResourceRequestStatus expected, String action) {
        if (entity.getStatus() != expected) {
            throw new InvalidTransitionException("ResourceRequest", entity.getId(), entity.getStatus(), action);
        }
    }
}
