package com.assetdesk.allocation.service;

import com.assetdesk.allocation.dto.response.DeviceAssignmentResponse;
import com.assetdesk.allocation.dto.response.LicenseAssignmentResponse;
import com.assetdesk.allocation.entity.Device;
import com.assetdesk.allocation.entity.DeviceAssignment;
import com.assetdesk.allocation.entity.DeviceAssignmentStatus;
import com.assetdesk.allocation.entity.LicenseAssignment;
import com.assetdesk.allocation.entity.LicenseAssignmentStatus;
import com.assetdesk.allocation.entity.LicensePool;
import com.assetdesk.allocation.entity.ResourceKind;
import com.assetdesk.allocation.exception.CapacityExhaustedException;
import com.assetdesk.allocation.exception.ConflictException;
import com.assetdesk.allocation.exception.NotAvailableException;
import com.assetdesk.allocation.exception.ResourceNotFoundException;
import com.assetdesk.allocation.exception.ValidationException;
import com.assetdesk.allocation.mapper.AssignmentMapper;
import com.assetdesk.allocation.notification.ResourceEvent;
import com.assetdesk.allocation.notification.ResourceEventType;
import com.assetdesk.allocation.repository.DeviceRepository;
import com.assetdesk.allocation.repository.LicenseAssignmentRepository;
import com.assetdesk.allocation.repository.LicensePoolRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Assigns, returns, revokes and expires resources.
 *
 * <p>Every public method is one database transaction: the catalog row, the ledger entry
 * and the published event either all take effect or none does.
 *
 * <p><strong>Locking</strong>: the decision about a resource is made only after its row
 * lock is held ({@code findByIdForUpdate}). Operations that close an existing entry lock
 * the ledger row first and the catalog row second; assignments lock only the catalog row.
 * Two operations on different resources never wait for each other.
 *
 * <p><strong>Idempotency</strong>: a retried assignment carrying the same key gets the
 * original entry back. The key is checked after the resource lock, so a retry racing
 * its own first attempt waits for it and then sees its result.
 */
@Service
@RequiredArgsConstructor
public class AllocationEngine {

    private static final Logger log = LoggerFactory.getLogger(AllocationEngine.class);

    static final int MAX_IDEMPOTENCY_KEY_LENGTH = 100;

    private final DeviceRepository deviceRepository;
    private final LicensePoolRepository licensePoolRepository;
    private final LicenseAssignmentRepository licenseAssignmentRepository;
    private final AssignmentLedger assignmentLedger;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    @Transactional
    public DeviceAssignmentResponse assignDevice(Long deviceId, Long holderId, String purpose,
                                                 LocalDate plannedReturnDate, String idempotencyKey) {
        validateIdempotencyKey(idempotencyKey);
        LocalDate today = LocalDate.now(clock);
        if (plannedReturnDate != null && plannedReturnDate.isBefore(today)) {
            throw new ValidationException("Planned return date " + plannedReturnDate + " is in the past");
        }

        Device device = deviceRepository.findByIdForUpdate(deviceId)
            .orElseThrow(() -> new ResourceNotFoundException("Device", deviceId));

        Optional<DeviceAssignment> replay = findDeviceReplay(idempotencyKey, deviceId, holderId);
        if (replay.isPresent()) {
            log.debug("Idempotent replay of device assignment {} for key {}", replay.get().getId(), idempotencyKey);
            return AssignmentMapper.toResponse(replay.get());
        }

        if (!device.tryClaim()) {
            throw new NotAvailableException(deviceId, device.getStatus());
        }

        DeviceAssignment entry = new DeviceAssignment();
        entry.setDevice(device);
        entry.setHolderId(holderId);
        entry.setAssignedDate(today);
        entry.setPlannedReturnDate(plannedReturnDate);
        entry.setPurpose(purpose);
        entry.setIdempotencyKey(blankToNull(idempotencyKey));
        DeviceAssignment saved = assignmentLedger.recordAssignment(entry);

        log.info("Device {} assigned to holder {} (assignment {})", deviceId, holderId, saved.getId());
        publish(ResourceEventType.DEVICE_ASSIGNED, ResourceKind.DEVICE, deviceId, saved.getId(), holderId);
        return AssignmentMapper.toResponse(saved);
    }

    /**
     * Closes a device assignment as RETURNED. The device becomes AVAILABLE unless an
     * administrator moved it to MAINTENANCE while it was out.
     *
     * @param returnedDate defaults to today; may not precede the assigned date or lie in the future
     */
    @Transactional
    public DeviceAssignmentResponse returnDevice(Long assignmentId, LocalDate returnedDate, String note) {
        LocalDate today = LocalDate.now(clock);
        LocalDate date = returnedDate != null ? returnedDate : today;
        if (date.isAfter(today)) {
            throw new ValidationException("Return date " + date + " is in the future");
        }

        DeviceAssignment entry = assignmentLedger.lockDeviceAssignment(assignmentId);
        assignmentLedger.closeAssignment(entry, DeviceAssignmentStatus.RETURNED, date, note);

        Long deviceId = entry.getDevice().getId();
        Device device = deviceRepository.findByIdForUpdate(deviceId)
            .orElseThrow(() -> new ResourceNotFoundException("Device", deviceId));
        device.release();

        log.info("Device {} returned by holder {} (assignment {}), device now {}",
            deviceId, entry.getHolderId(), assignmentId, device.getStatus());
        publish(ResourceEventType.DEVICE_RETURNED, ResourceKind.DEVICE, deviceId, assignmentId, entry.getHolderId());
        return AssignmentMapper.toResponse(entry);
    }

    @Transactional
    public LicenseAssignmentResponse assignLicense(Long poolId, Long holderId, String purpose,
                                                   LocalDate startDate, LocalDate endDate, String idempotencyKey) {
        validateIdempotencyKey(idempotencyKey);
        if (startDate == null) {
            throw new ValidationException("Start date is required");
        }
        if (endDate != null && !startDate.isBefore(endDate)) {
            throw new ValidationException("End date " + endDate + " must be after start date " + startDate);
        }

        LicensePool pool = licensePoolRepository.findByIdForUpdate(poolId)
            .orElseThrow(() -> new ResourceNotFoundException("LicensePool", poolId));

        Optional<LicenseAssignment> replay = findLicenseReplay(idempotencyKey, poolId, holderId);
        if (replay.isPresent()) {
            log.debug("Idempotent replay of license assignment {} for key {}", replay.get().getId(), idempotencyKey);
            return AssignmentMapper.toResponse(replay.get());
        }

        LocalDate today = LocalDate.now(clock);
        if (pool.isExpiredOn(today)) {
            throw new ValidationException("License pool " + poolId + " expired on " + pool.getExpiryDate());
        }
        if (!startDate.isBefore(pool.getExpiryDate())) {
            throw new ValidationException("Start date " + startDate
                + " must be before the pool expiry date " + pool.getExpiryDate());
        }
        if (endDate != null && endDate.isAfter(pool.getExpiryDate())) {
            throw new ValidationException("End date " + endDate
                + " must not be after the pool expiry date " + pool.getExpiryDate());
        }

        if (!pool.tryClaim()) {
            throw new CapacityExhaustedException(poolId, pool.getTotalCount());
        }

        LicenseAssignment entry = new LicenseAssignment();
        entry.setPool(pool);
        entry.setHolderId(holderId);
        entry.setAssignedDate(today);
        entry.setStartDate(startDate);
        entry.setEndDate(endDate);
        entry.setPurpose(purpose);
        entry.setIdempotencyKey(blankToNull(idempotencyKey));
        LicenseAssignment saved = assignmentLedger.recordAssignment(entry);

        log.info("License pool {} seat assigned to holder {} (assignment {}), {} of {} left",
            poolId, holderId, saved.getId(), pool.getAvailableCount(), pool.getTotalCount());
        publish(ResourceEventType.LICENSE_ASSIGNED, ResourceKind.LICENSE, poolId, saved.getId(), holderId);
        return AssignmentMapper.toResponse(saved);
    }

    /**
     * Closes a license seat as RETURNED or REVOKED and gives the seat back to its pool.
     * EXPIRED is reserved for {@link #sweepExpired(LocalDate)}.
     */
    @Transactional
    public LicenseAssignmentResponse returnLicense(Long assignmentId, LicenseAssignmentStatus reason,
                                                   Instant closedAt, String note) {
        if (reason != LicenseAssignmentStatus.RETURNED && reason != LicenseAssignmentStatus.REVOKED) {
            throw new ValidationException("Reason must be RETURNED or REVOKED, got " + reason);
        }

        LicenseAssignment entry = assignmentLedger.lockLicenseAssignment(assignmentId);
        assignmentLedger.closeAssignment(entry, reason, closedAt != null ? closedAt : clock.instant(), note);

        LicensePool pool = lockPoolOf(entry);
        pool.release();

        ResourceEventType eventType = reason == LicenseAssignmentStatus.RETURNED
            ? ResourceEventType.LICENSE_RETURNED
            : ResourceEventType.LICENSE_REVOKED;
        log.info("License assignment {} closed as {}, pool {} has {} of {} seats free",
            assignmentId, reason, pool.getId(), pool.getAvailableCount(), pool.getTotalCount());
        publish(eventType, ResourceKind.LICENSE, pool.getId(), assignmentId, entry.getHolderId());
        return AssignmentMapper.toResponse(entry);
    }

    /**
     * Closes as EXPIRED every ACTIVE license assignment whose effective expiry date is on
     * or before {@code asOf}, releasing each seat. Running it again for the same date
     * changes nothing.
     *
     * <p>Locks are taken in two phases so the sweep keeps the ledger-then-catalog order:
     * first every candidate entry in ascending id order, then each affected pool once in
     * ascending id order. No pool is held while an entry lock is still being requested.
     * Candidates are re-read under their row lock; an entry returned or revoked since the
     * candidate query is skipped.
     */
    @Transactional
    public List<LicenseAssignmentResponse> sweepExpired(LocalDate asOf) {
        List<Long> candidateIds = licenseAssignmentRepository
            .findIdsByStatusExpiringOnOrBefore(LicenseAssignmentStatus.ACTIVE, asOf);

        Map<Long, List<LicenseAssignment>> dueByPool = new TreeMap<>();
        for (Long id : candidateIds) {
            LicenseAssignment entry = assignmentLedger.lockLicenseAssignment(id);
            if (!entry.isActive()) {
                log.debug("Skipping license assignment {}: already {}", id, entry.getStatus());
                continue;
            }
            if (entry.getEffectiveExpiryDate().isAfter(asOf)) {
                continue;
            }
            dueByPool.computeIfAbsent(entry.getPool().getId(), poolId -> new ArrayList<>()).add(entry);
        }

        Instant now = clock.instant();
        List<LicenseAssignmentResponse> expired = new ArrayList<>();
        for (Map.Entry<Long, List<LicenseAssignment>> due : dueByPool.entrySet()) {
            Long poolId = due.getKey();
            LicensePool pool = licensePoolRepository.findByIdForUpdate(poolId)
                .orElseThrow(() -> new ResourceNotFoundException("LicensePool", poolId));
            for (LicenseAssignment entry : due.getValue()) {
                assignmentLedger.closeAssignment(entry, LicenseAssignmentStatus.EXPIRED, now,
                    "Expired on " + entry.getEffectiveExpiryDate());
                pool.release();
                publish(ResourceEventType.LICENSE_EXPIRED, ResourceKind.LICENSE, poolId,
                    entry.getId(), entry.getHolderId());
                expired.add(AssignmentMapper.toResponse(entry));
            }
        }

        if (!expired.isEmpty()) {
            log.info("Expiry sweep as of {} closed {} license assignment(s)", asOf, expired.size());
        }
        return expired;
    }

    private LicensePool lockPoolOf(LicenseAssignment entry) {
        Long poolId = entry.getPool().getId();
        return licensePoolRepository.findByIdForUpdate(poolId)
            .orElseThrow(() -> new ResourceNotFoundException("LicensePool", poolId));
    }

    private Optional<DeviceAssignment> findDeviceReplay(String key, Long deviceId, Long holderId) {
        if (key == null || key.isBlank()) {
            return Optional.empty();
        }
        return assignmentLedger.findDeviceAssignmentByIdempotencyKey(key).map(prior -> {
            if (!prior.getDevice().getId().equals(deviceId) || !prior.getHolderId().equals(holderId)) {
                throw new ConflictException("Idempotency key '" + key + "' was already used for device "
                    + prior.getDevice().getId() + " and holder " + prior.getHolderId());
            }
            return prior;
        });
    }

    private Optional<LicenseAssignment> findLicenseReplay(String key, Long poolId, Long holderId) {
        if (key == null || key.isBlank()) {
            return Optional.empty();
        }
        return assignmentLedger.findLicenseAssignmentByIdempotencyKey(key).map(prior -> {
            if (!prior.getPool().getId().equals(poolId) || !prior.getHolderId().equals(holderId)) {
                throw new ConflictException("Idempotency key '" + key + "' was already used for license pool "
                    + prior.getPool().getId() + " and holder " + prior.getHolderId());
            }
            return prior;
        });
    }

    private void validateIdempotencyKey(String key) {
        if (key != null && key.length() > MAX_IDEMPOTENCY_KEY_LENGTH) {
            throw new ValidationException("Idempotency key must not exceed "
                + MAX_IDEMPOTENCY_KEY_LENGTH + " characters");
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    private void publish(ResourceEventType type, ResourceKind kind, Long resourceId,
                         Long assignmentId, Long holderId) {
        eventPublisher.publishEvent(ResourceEvent.of(type, kind, resourceId, assignmentId, holderId, clock.instant()));
    }
}
