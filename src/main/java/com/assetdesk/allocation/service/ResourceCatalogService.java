package com.assetdesk.allocation.service;

import com.assetdesk.allocation.dto.request.RegisterDeviceRequest;
import com.assetdesk.allocation.dto.request.RegisterLicensePoolRequest;
import com.assetdesk.allocation.dto.response.DeviceResponse;
import com.assetdesk.allocation.dto.response.LicensePoolResponse;
import com.assetdesk.allocation.entity.Device;
import com.assetdesk.allocation.entity.DeviceCategory;
import com.assetdesk.allocation.entity.DeviceStatus;
import com.assetdesk.allocation.entity.LicensePool;
import com.assetdesk.allocation.exception.InvalidTransitionException;
import com.assetdesk.allocation.exception.ResourceNotFoundException;
import com.assetdesk.allocation.exception.ValidationException;
import com.assetdesk.allocation.mapper.DeviceMapper;
import com.assetdesk.allocation.mapper.LicensePoolMapper;
import com.assetdesk.allocation.repository.DeviceRepository;
import com.assetdesk.allocation.repository.LicensePoolRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;

/**
 * Registration and administrative state of devices and license pools.
 *
 * <p>Status and seat-count changes load the row through its {@code FOR UPDATE} query, the
 * same lock the allocation engine takes, so an administrative change never interleaves
 * with an assignment of the same resource.
 */
@Service
@RequiredArgsConstructor
public class ResourceCatalogService {

    private static final Logger log = LoggerFactory.getLogger(ResourceCatalogService.class);

    private final DeviceRepository deviceRepository;
    private final LicensePoolRepository licensePoolRepository;
    private final AssignmentLedger assignmentLedger;

    @Transactional
    public DeviceResponse registerDevice(RegisterDeviceRequest request) {
        if (deviceRepository.existsBySerialNumber(request.serialNumber())) {
            throw new ValidationException("Serial number already registered: " + request.serialNumber());
        }
        if (request.warrantyExpiry().isBefore(request.purchaseDate())) {
            throw new ValidationException("Warranty expiry " + request.warrantyExpiry()
                + " must not be before purchase date " + request.purchaseDate());
        }
        Device saved = deviceRepository.save(DeviceMapper.toEntity(request));
        log.info("Registered device {} ({})", saved.getId(), saved.getSerialNumber());
        return DeviceMapper.toResponse(saved);
    }

    @Transactional
    public LicensePoolResponse registerLicensePool(RegisterLicensePoolRequest request) {
        if (request.totalCount() == null || request.totalCount() < 1) {
            throw new ValidationException("Total count must be at least 1");
        }
        if (request.unitPrice() == null || request.unitPrice().compareTo(BigDecimal.ZERO) < 0) {
            throw new ValidationException("Unit price must not be negative");
        }
        if (request.purchaseDate() != null && request.expiryDate().isBefore(request.purchaseDate())) {
            throw new ValidationException("Expiry date " + request.expiryDate()
                + " must not be before purchase date " + request.purchaseDate());
        }
        LicensePool saved = licensePoolRepository.save(LicensePoolMapper.toEntity(request));
        log.info("Registered license pool {} '{}' with {} seats",
            saved.getId(), saved.getSoftwareName(), saved.getTotalCount());
        return LicensePoolMapper.toResponse(saved);
    }

    /** Adds purchased seats. Totals only grow; there is no decrease operation. */
    @Transactional
    public LicensePoolResponse increaseLicenseTotal(Long poolId, int delta) {
        if (delta < 0) {
            throw new ValidationException("Seat delta must not be negative: " + delta);
        }
        LicensePool pool = licensePoolRepository.findByIdForUpdate(poolId)
            .orElseThrow(() -> new ResourceNotFoundException("LicensePool", poolId));
        try {
            pool.addSeats(delta);
        } catch (ArithmeticException e) {
            throw new ValidationException("License pool " + poolId + " cannot grow by " + delta
                + " seats: total would exceed " + Integer.MAX_VALUE);
        }
        log.info("License pool {} total increased by {} to {}", poolId, delta, pool.getTotalCount());
        return LicensePoolMapper.toResponse(pool);
    }

    /**
     * Administrative status change: AVAILABLE, MAINTENANCE or DISPOSED.
     *
     * <p>An assigned device may go to MAINTENANCE; it keeps its ACTIVE assignment and stays
     * in MAINTENANCE when returned. It may not be disposed of or made AVAILABLE until the
     * assignment is closed.
     */
    @Transactional
    public DeviceResponse setDeviceStatus(Long deviceId, DeviceStatus target) {
        if (target == null || !target.isAdministrative()) {
            throw new ValidationException("Status " + target + " cannot be set directly; "
                + "use a device assignment instead");
        }
        Device device = deviceRepository.findByIdForUpdate(deviceId)
            .orElseThrow(() -> new ResourceNotFoundException("Device", deviceId));
        DeviceStatus current = device.getStatus();

        if (current.isTerminal()) {
            throw new InvalidTransitionException("Device", deviceId, current, "change status to " + target);
        }
        if (target == DeviceStatus.DISPOSED || target == DeviceStatus.AVAILABLE) {
            boolean held = current == DeviceStatus.ASSIGNED
                || assignmentLedger.hasActiveDeviceAssignment(deviceId);
            if (held) {
                throw new InvalidTransitionException("Device " + deviceId + " cannot change status to "
                    + target + " while it has an active assignment; return it first");
            }
        }

        device.setStatus(target);
        log.info("Device {} status {} -> {}", deviceId, current, target);
        return DeviceMapper.toResponse(device);
    }

    @Transactional(readOnly = true)
    public DeviceResponse getDevice(Long id) {
        Device device = deviceRepository.findById(id)
            .orElseThrow(() -> new ResourceNotFoundException("Device", id));
        return DeviceMapper.toResponse(device);
    }

    @Transactional(readOnly = true)
    public LicensePoolResponse getLicensePool(Long id) {
        LicensePool pool = licensePoolRepository.findById(id)
            .orElseThrow(() -> new ResourceNotFoundException("LicensePool", id));
        return LicensePoolMapper.toResponse(pool);
    }

    @Transactional(readOnly = true)
    public Page<DeviceResponse> findDevices(DeviceCategory category, DeviceStatus status, Pageable pageable) {
        Specification<Device> spec = Specification.where(null);

        if (category != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("category"), category));
        }
        if (status != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("status"), status));
        }

        return deviceRepository.findAll(spec, pageable)
            .map(DeviceMapper::toResponse);
    }

    @Transactional(readOnly = true)
    public Page<LicensePoolResponse> findLicensePools(String softwareName, Pageable pageable) {
        Specification<LicensePool> spec = Specification.where(null);

        if (softwareName != null && !softwareName.isBlank()) {
            String pattern = "%" + softwareName.toLowerCase() + "%";
            spec = spec.and((root, query, cb) -> cb.like(cb.lower(root.get("softwareName")), pattern));
        }

        return licensePoolRepository.findAll(spec, pageable)
            .map(LicensePoolMapper::toResponse);
    }
}
