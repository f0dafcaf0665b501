package com.assetdesk.allocation.service;

import com.assetdesk.allocation.dto.response.DeviceAssignmentResponse;
import com.assetdesk.allocation.dto.response.HolderAssignmentsResponse;
import com.assetdesk.allocation.dto.response.LicenseAssignmentResponse;
import com.assetdesk.allocation.entity.DeviceAssignment;
import com.assetdesk.allocation.entity.DeviceAssignmentStatus;
import com.assetdesk.allocation.entity.LicenseAssignment;
import com.assetdesk.allocation.entity.LicenseAssignmentStatus;
import com.assetdesk.allocation.exception.ConflictException;
import com.assetdesk.allocation.exception.InvalidTransitionException;
import com.assetdesk.allocation.exception.ResourceNotFoundException;
import com.assetdesk.allocation.exception.ValidationException;
import com.assetdesk.allocation.mapper.AssignmentMapper;
import com.assetdesk.allocation.repository.DeviceAssignmentRepository;
import com.assetdesk.allocation.repository.LicenseAssignmentRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

/**
 * Append-oriented record of who holds what.
 *
 * <p>Write methods run only inside the caller's transaction ({@link Propagation#MANDATORY})
 * and expect the caller to hold the lock of the affected resource. Entries are created
 * ACTIVE, closed exactly once, and never reopened or deleted.
 */
@Service
@RequiredArgsConstructor
public class AssignmentLedger {

    private final DeviceAssignmentRepository deviceAssignmentRepository;
    private final LicenseAssignmentRepository licenseAssignmentRepository;

    /**
     * Appends an ACTIVE entry for a device. Flushes so that a unique-index violation
     * surfaces here rather than at commit.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public DeviceAssignment recordAssignment(DeviceAssignment entry) {
        Long deviceId = entry.getDevice().getId();
        if (deviceAssignmentRepository.existsByDeviceIdAndStatus(deviceId, DeviceAssignmentStatus.ACTIVE)) {
            throw new ConflictException("Device " + deviceId + " already has an active assignment");
        }
        entry.setStatus(DeviceAssignmentStatus.ACTIVE);
        return deviceAssignmentRepository.saveAndFlush(entry);
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public LicenseAssignment recordAssignment(LicenseAssignment entry) {
        Long poolId = entry.getPool().getId();
        if (licenseAssignmentRepository.existsByPoolIdAndHolderIdAndStatus(
                poolId, entry.getHolderId(), LicenseAssignmentStatus.ACTIVE)) {
            throw new ConflictException("Holder " + entry.getHolderId()
                + " already has an active seat in license pool " + poolId);
        }
        entry.setStatus(LicenseAssignmentStatus.ACTIVE);
        return licenseAssignmentRepository.saveAndFlush(entry);
    }

    /** Loads the entry under its row lock. */
    @Transactional(propagation = Propagation.MANDATORY)
    public DeviceAssignment lockDeviceAssignment(Long id) {
        return deviceAssignmentRepository.findByIdForUpdate(id)
            .orElseThrow(() -> new ResourceNotFoundException("DeviceAssignment", id));
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public LicenseAssignment lockLicenseAssignment(Long id) {
        return licenseAssignmentRepository.findByIdForUpdate(id)
            .orElseThrow(() -> new ResourceNotFoundException("LicenseAssignment", id));
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public void closeAssignment(DeviceAssignment entry, DeviceAssignmentStatus terminalStatus,
                                LocalDate returnedDate, String note) {
        if (terminalStatus == null || !terminalStatus.isTerminal()) {
            throw new ValidationException("Target status " + terminalStatus + " is not terminal");
        }
        if (entry.getStatus().isTerminal()) {
            throw new InvalidTransitionException("DeviceAssignment", entry.getId(), entry.getStatus(), "be closed");
        }
        if (returnedDate.isBefore(entry.getAssignedDate())) {
            throw new ValidationException("Return date " + returnedDate
                + " is before the assigned date " + entry.getAssignedDate());
        }
        entry.setStatus(terminalStatus);
        entry.setReturnedDate(returnedDate);
        entry.setClosingNote(note);
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public void closeAssignment(LicenseAssignment entry, LicenseAssignmentStatus terminalStatus,
                                Instant closedAt, String note) {
        if (terminalStatus == null || !terminalStatus.isTerminal()) {
            throw new ValidationException("Target status " + terminalStatus + " is not terminal");
        }
        if (entry.getStatus().isTerminal()) {
            throw new InvalidTransitionException("LicenseAssignment", entry.getId(), entry.getStatus(), "be closed");
        }
        LocalDate closedOn = LocalDate.ofInstant(closedAt, ZoneOffset.UTC);
        if (closedOn.isBefore(entry.getAssignedDate())) {
            throw new ValidationException("Close date " + closedOn
                + " is before the assigned date " + entry.getAssignedDate());
        }
        entry.setStatus(terminalStatus);
        entry.setClosedAt(closedAt);
        entry.setClosingNote(note);
    }

    @Transactional(readOnly = true)
    public Optional<DeviceAssignment> findDeviceAssignmentByIdempotencyKey(String key) {
        return deviceAssignmentRepository.findByIdempotencyKey(key);
    }

    @Transactional(readOnly = true)
    public Optional<LicenseAssignment> findLicenseAssignmentByIdempotencyKey(String key) {
        return licenseAssignmentRepository.findByIdempotencyKey(key);
    }

    @Transactional(readOnly = true)
    public boolean hasActiveDeviceAssignment(Long deviceId) {
        return deviceAssignmentRepository.existsByDeviceIdAndStatus(deviceId, DeviceAssignmentStatus.ACTIVE);
    }

    @Transactional(readOnly = true)
    public DeviceAssignment requireDeviceAssignment(Long id) {
        return deviceAssignmentRepository.findByIdWithDevice(id)
            .orElseThrow(() -> new ResourceNotFoundException("DeviceAssignment", id));
    }

    @Transactional(readOnly = true)
    public LicenseAssignment requireLicenseAssignment(Long id) {
        return licenseAssignmentRepository.findByIdWithPool(id)
            .orElseThrow(() -> new ResourceNotFoundException("LicenseAssignment", id));
    }

    @Transactional(readOnly = true)
    public DeviceAssignmentResponse getDeviceAssignment(Long id) {
        return AssignmentMapper.toResponse(requireDeviceAssignment(id));
    }

    @Transactional(readOnly = true)
    public LicenseAssignmentResponse getLicenseAssignment(Long id) {
        return AssignmentMapper.toResponse(requireLicenseAssignment(id));
    }

    @Transactional(readOnly = true)
    public List<DeviceAssignmentResponse> listActiveForDevice(Long deviceId) {
        return deviceAssignmentRepository.findByDeviceIdAndStatus(deviceId, DeviceAssignmentStatus.ACTIVE)
            .stream()
            .map(AssignmentMapper::toResponse)
            .toList();
    }

    @Transactional(readOnly = true)
    public List<LicenseAssignmentResponse> listActiveForPool(Long poolId) {
        return licenseAssignmentRepository.findByPoolIdAndStatus(poolId, LicenseAssignmentStatus.ACTIVE)
            .stream()
            .map(AssignmentMapper::toResponse)
            .toList();
    }

    /** Full history for one holder, newest first, devices and licenses separately. */
    @Transactional(readOnly = true)
    public HolderAssignmentsResponse listForHolder(Long holderId) {
        List<DeviceAssignmentResponse> devices = deviceAssignmentRepository.findAllByHolderId(holderId)
            .stream()
            .map(AssignmentMapper::toResponse)
            .toList();
        List<LicenseAssignmentResponse> licenses = licenseAssignmentRepository.findAllByHolderId(holderId)
            .stream()
            .map(AssignmentMapper::toResponse)
            .toList();
        return new HolderAssignmentsResponse(holderId, devices, licenses);
    }

    @Transactional(readOnly = true)
    public Page<DeviceAssignmentResponse> findDeviceAssignments(Long deviceId, Long holderId,
                                                                DeviceAssignmentStatus status, Pageable pageable) {
        Specification<DeviceAssignment> spec = Specification.where(null);

        if (deviceId != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("device").get("id"), deviceId));
        }
        if (holderId != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("holderId"), holderId));
        }
        if (status != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("status"), status));
        }

        return deviceAssignmentRepository.findAll(spec, pageable)
            .map(AssignmentMapper::toResponse);
    }

    @Transactional(readOnly = true)
    public Page<LicenseAssignmentResponse> findLicenseAssignments(Long poolId, Long holderId,
                                                                  LicenseAssignmentStatus status, Pageable pageable) {
        Specification<LicenseAssignment> spec = Specification.where(null);

        if (poolId != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("pool").get("id"), poolId));
        }
        if (holderId != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("holderId"), holderId));
        }
        if (status != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("status"), status));
        }

        return licenseAssignmentRepository.findAll(spec, pageable)
            .map(AssignmentMapper::toResponse);
    }
}
