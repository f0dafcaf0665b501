package com.assetdesk.allocation.service;

import com.assetdesk.allocation.dto.response.AlertResponse;
import com.assetdesk.allocation.entity.Device;
import com.assetdesk.allocation.entity.DeviceStatus;
import com.assetdesk.allocation.entity.LicenseAssignment;
import com.assetdesk.allocation.entity.LicenseAssignmentStatus;
import com.assetdesk.allocation.entity.ResourceKind;
import com.assetdesk.allocation.exception.ValidationException;
import com.assetdesk.allocation.repository.DeviceRepository;
import com.assetdesk.allocation.repository.LicenseAssignmentRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Read-only scan producing expiry alerts for ACTIVE license seats and device warranties.
 *
 * <p>An alert is produced when {@code daysUntilExpiry <= horizonDays}; already expired
 * items are always reported. With the default 30-day horizon only EXPIRED, CRITICAL and
 * WARNING alerts appear. Alerts are recomputed on every call.
 */
@Service
@RequiredArgsConstructor
public class ExpiryMonitor {

    private static final Comparator<AlertResponse> ALERT_ORDER = Comparator
        .comparingLong(AlertResponse::daysUntilExpiry)
        .thenComparing(AlertResponse::resourceKind)
        .thenComparing(AlertResponse::resourceId)
        .thenComparing(AlertResponse::assignmentId, Comparator.nullsFirst(Comparator.naturalOrder()));

    private final LicenseAssignmentRepository licenseAssignmentRepository;
    private final DeviceRepository deviceRepository;

    @Transactional(readOnly = true)
    public List<AlertResponse> scan(LocalDate asOf, int horizonDays) {
        if (horizonDays < 0) {
            throw new ValidationException("Horizon must not be negative: " + horizonDays);
        }
        List<AlertResponse> alerts = new ArrayList<>();

        for (LicenseAssignment assignment :
                licenseAssignmentRepository.findAllWithPoolByStatus(LicenseAssignmentStatus.ACTIVE)) {
            LocalDate expiry = assignment.getEffectiveExpiryDate();
            long days = ChronoUnit.DAYS.between(asOf, expiry);
            if (isReportable(days, horizonDays)) {
                alerts.add(new AlertResponse(
                    ResourceKind.LICENSE,
                    assignment.getPool().getId(),
                    assignment.getId(),
                    assignment.getHolderId(),
                    assignment.getPool().getDisplayName(),
                    expiry,
                    days,
                    ExpiryClassifier.classify(days)));
            }
        }

        for (Device device : deviceRepository.findWarrantyExpiringOnOrBefore(
                asOf.plusDays(horizonDays), DeviceStatus.DISPOSED)) {
            long days = ChronoUnit.DAYS.between(asOf, device.getWarrantyExpiry());
            if (isReportable(days, horizonDays)) {
                alerts.add(new AlertResponse(
                    ResourceKind.DEVICE,
                    device.getId(),
                    null,
                    null,
                    device.getDisplayName() + " warranty",
                    device.getWarrantyExpiry(),
                    days,
                    ExpiryClassifier.classify(days)));
            }
        }

        alerts.sort(ALERT_ORDER);
        return alerts;
    }

    private static boolean isReportable(long daysUntilExpiry, int horizonDays) {
        return daysUntilExpiry <= 0 || daysUntilExpiry <= horizonDays;
    }
}
