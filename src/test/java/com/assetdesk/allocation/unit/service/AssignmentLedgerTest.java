package com.assetdesk.allocation.unit.service;

import com.assetdesk.allocation.dto.response.HolderAssignmentsResponse;
import com.assetdesk.allocation.entity.Device;
import com.assetdesk.allocation.entity.DeviceAssignment;
import com.assetdesk.allocation.entity.DeviceAssignmentStatus;
import com.assetdesk.allocation.entity.DeviceCategory;
import com.assetdesk.allocation.entity.DeviceStatus;
import com.assetdesk.allocation.entity.LicenseAssignment;
import com.assetdesk.allocation.entity.LicenseAssignmentStatus;
import com.assetdesk.allocation.entity.LicensePool;
import com.assetdesk.allocation.exception.ConflictException;
import com.assetdesk.allocation.exception.InvalidTransitionException;
import com.assetdesk.allocation.exception.ResourceNotFoundException;
import com.assetdesk.allocation.exception.ValidationException;
import com.assetdesk.allocation.repository.DeviceAssignmentRepository;
import com.assetdesk.allocation.repository.LicenseAssignmentRepository;
import com.assetdesk.allocation.service.AssignmentLedger;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AssignmentLedgerTest {

    private static final LocalDate ASSIGNED_ON = LocalDate.of(2025, 3, 1);

    @Mock
    private DeviceAssignmentRepository deviceAssignmentRepository;

    @Mock
    private LicenseAssignmentRepository licenseAssignmentRepository;

    @InjectMocks
    private AssignmentLedger assignmentLedger;

    @Test
    void recordAssignment_device_setsActiveAndFlushes() {
        DeviceAssignment entry = newDeviceEntry(null, DeviceAssignmentStatus.ACTIVE);
        entry.setStatus(null);
        when(deviceAssignmentRepository.existsByDeviceIdAndStatus(1L, DeviceAssignmentStatus.ACTIVE)).thenReturn(false);
        when(deviceAssignmentRepository.saveAndFlush(entry)).thenReturn(entry);

        DeviceAssignment saved = assignmentLedger.recordAssignment(entry);

        assertThat(saved.getStatus()).isEqualTo(DeviceAssignmentStatus.ACTIVE);
    }

    @Test
    void recordAssignment_deviceWithActiveEntry_throwsConflictException() {
        DeviceAssignment entry = newDeviceEntry(null, DeviceAssignmentStatus.ACTIVE);
        when(deviceAssignmentRepository.existsByDeviceIdAndStatus(1L, DeviceAssignmentStatus.ACTIVE)).thenReturn(true);

        assertThatThrownBy(() -> assignmentLedger.recordAssignment(entry))
            .isInstanceOf(ConflictException.class)
            .hasMessageContaining("already has an active assignment");

        verify(deviceAssignmentRepository, never()).saveAndFlush(any());
    }

    @Test
    void closeAssignment_device_setsTerminalFields() {
        DeviceAssignment entry = newDeviceEntry(5L, DeviceAssignmentStatus.ACTIVE);

        assignmentLedger.closeAssignment(entry, DeviceAssignmentStatus.RETURNED, ASSIGNED_ON.plusDays(3), "Scratched lid");

        assertThat(entry.getStatus()).isEqualTo(DeviceAssignmentStatus.RETURNED);
        assertThat(entry.getReturnedDate()).isEqualTo(ASSIGNED_ON.plusDays(3));
        assertThat(entry.getClosingNote()).isEqualTo("Scratched lid");
    }

    @Test
    void closeAssignment_device_sameDayReturnIsAllowed() {
        DeviceAssignment entry = newDeviceEntry(5L, DeviceAssignmentStatus.ACTIVE);

        assignmentLedger.closeAssignment(entry, DeviceAssignmentStatus.RETURNED, ASSIGNED_ON, null);

        assertThat(entry.isActive()).isFalse();
    }

    @Test
    void closeAssignment_deviceToActive_throwsValidationException() {
        DeviceAssignment entry = newDeviceEntry(5L, DeviceAssignmentStatus.ACTIVE);

        assertThatThrownBy(() -> assignmentLedger.closeAssignment(entry, DeviceAssignmentStatus.ACTIVE, ASSIGNED_ON, null))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("not terminal");
    }

    @Test
    void closeAssignment_licenseAlreadyRevoked_throwsInvalidTransitionException() {
        LicenseAssignment entry = newLicenseEntry(7L, LicenseAssignmentStatus.REVOKED);

        assertThatThrownBy(() -> assignmentLedger.closeAssignment(
                entry, LicenseAssignmentStatus.RETURNED, Instant.parse("2025-06-01T10:00:00Z"), null))
            .isInstanceOf(InvalidTransitionException.class)
            .hasMessageContaining("REVOKED");

        assertThat(entry.getStatus()).isEqualTo(LicenseAssignmentStatus.REVOKED);
    }

    @Test
    void closeAssignment_licenseClosedBeforeAssignedDate_throwsValidationException() {
        LicenseAssignment entry = newLicenseEntry(7L, LicenseAssignmentStatus.ACTIVE);
        Instant dayBefore = ASSIGNED_ON.minusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant();

        assertThatThrownBy(() -> assignmentLedger.closeAssignment(
                entry, LicenseAssignmentStatus.RETURNED, dayBefore, null))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("before the assigned date");

        assertThat(entry.getStatus()).isEqualTo(LicenseAssignmentStatus.ACTIVE);
        assertThat(entry.getClosedAt()).isNull();
    }

    @Test
    void closeAssignment_licenseClosedOnAssignedDate_closesEntry() {
        LicenseAssignment entry = newLicenseEntry(7L, LicenseAssignmentStatus.ACTIVE);
        Instant sameDay = ASSIGNED_ON.atStartOfDay(ZoneOffset.UTC).toInstant();

        assignmentLedger.closeAssignment(entry, LicenseAssignmentStatus.RETURNED, sameDay, "Project ended");

        assertThat(entry.getStatus()).isEqualTo(LicenseAssignmentStatus.RETURNED);
        assertThat(entry.getClosedAt()).isEqualTo(sameDay);
    }

    @Test
    void lockLicenseAssignment_notFound_throwsResourceNotFoundException() {
        when(licenseAssignmentRepository.findByIdForUpdate(99L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> assignmentLedger.lockLicenseAssignment(99L))
            .isInstanceOf(ResourceNotFoundException.class)
            .hasMessageContaining("LicenseAssignment");
    }

    @Test
    void listForHolder_combinesDevicesAndLicenses() {
        when(deviceAssignmentRepository.findAllByHolderId(10L))
            .thenReturn(List.of(newDeviceEntry(5L, DeviceAssignmentStatus.RETURNED)));
        when(licenseAssignmentRepository.findAllByHolderId(10L))
            .thenReturn(List.of(newLicenseEntry(7L, LicenseAssignmentStatus.ACTIVE),
                newLicenseEntry(8L, LicenseAssignmentStatus.EXPIRED)));

        HolderAssignmentsResponse response = assignmentLedger.listForHolder(10L);

        assertThat(response.holderId()).isEqualTo(10L);
        assertThat(response.devices()).hasSize(1);
        assertThat(response.licenses()).hasSize(2);
    }

    private DeviceAssignment newDeviceEntry(Long id, DeviceAssignmentStatus status) {
        Device device = new Device();
        ReflectionTestUtils.setField(device, "id", 1L);
        device.setCategory(DeviceCategory.PHONE);
        device.setManufacturer("Apple");
        device.setModel("iPhone 15");
        device.setSerialNumber("APL-1");
        device.setStatus(DeviceStatus.ASSIGNED);

        DeviceAssignment entry = new DeviceAssignment();
        ReflectionTestUtils.setField(entry, "id", id);
        entry.setDevice(device);
        entry.setHolderId(10L);
        entry.setAssignedDate(ASSIGNED_ON);
        entry.setPurpose("On-call phone");
        entry.setStatus(status);
        return entry;
    }

    private LicenseAssignment newLicenseEntry(Long id, LicenseAssignmentStatus status) {
        LicensePool pool = new LicensePool();
        ReflectionTestUtils.setField(pool, "id", 2L);
        pool.setSoftwareName("Jira");
        pool.setLicenseType("Standard");
        pool.setTotalCount(5);
        pool.setAvailableCount(4);
        pool.setExpiryDate(LocalDate.of(2026, 1, 1));

        LicenseAssignment entry = new LicenseAssignment();
        ReflectionTestUtils.setField(entry, "id", id);
        entry.setPool(pool);
        entry.setHolderId(10L);
        entry.setAssignedDate(ASSIGNED_ON);
        entry.setStartDate(ASSIGNED_ON);
        entry.setPurpose("Sprint planning");
        entry.setStatus(status);
        return entry;
    }
}
