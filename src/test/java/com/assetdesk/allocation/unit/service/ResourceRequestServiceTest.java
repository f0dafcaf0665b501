package com.assetdesk.allocation.unit.service;

import com.assetdesk.allocation.dto.request.ApproveRequest;
import com.assetdesk.allocation.dto.request.CancelRequest;
import com.assetdesk.allocation.dto.request.FulfillRequest;
import com.assetdesk.allocation.dto.request.RejectRequest;
import com.assetdesk.allocation.dto.request.SubmitResourceRequest;
import com.assetdesk.allocation.dto.response.DeviceAssignmentResponse;
import com.assetdesk.allocation.dto.response.LicenseAssignmentResponse;
import com.assetdesk.allocation.dto.response.ResourceRequestResponse;
import com.assetdesk.allocation.entity.DeviceAssignmentStatus;
import com.assetdesk.allocation.entity.DeviceCategory;
import com.assetdesk.allocation.entity.DeviceStatus;
import com.assetdesk.allocation.entity.LicenseAssignmentStatus;
import com.assetdesk.allocation.entity.RequestPriority;
import com.assetdesk.allocation.entity.ResourceKind;
import com.assetdesk.allocation.entity.ResourceRequest;
import com.assetdesk.allocation.entity.ResourceRequestStatus;
import com.assetdesk.allocation.exception.InvalidTransitionException;
import com.assetdesk.allocation.exception.NotAvailableException;
import com.assetdesk.allocation.exception.ValidationException;
import com.assetdesk.allocation.repository.ResourceRequestRepository;
import com.assetdesk.allocation.service.AllocationEngine;
import com.assetdesk.allocation.service.ResourceRequestService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ResourceRequestServiceTest {

    private static final Instant NOW = Instant.parse("2025-06-01T09:30:00Z");
    private static final LocalDate TODAY = LocalDate.of(2025, 6, 1);

    @Mock
    private ResourceRequestRepository resourceRequestRepository;

    @Mock
    private AllocationEngine allocationEngine;

    private ResourceRequestService resourceRequestService;

    @BeforeEach
    void setUp() {
        resourceRequestService = new ResourceRequestService(resourceRequestRepository, allocationEngine,
            Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void submit_deviceRequest_savesPendingWithDefaultPriority() {
        SubmitResourceRequest request = new SubmitResourceRequest(ResourceKind.DEVICE, 10L, DeviceCategory.LAPTOP,
            null, "New hire", "Starts Monday", TODAY, null, null);
        when(resourceRequestRepository.save(any(ResourceRequest.class))).thenAnswer(invocation -> {
            ResourceRequest entity = invocation.getArgument(0);
            ReflectionTestUtils.setField(entity, "id", 1L);
            return entity;
        });

        ResourceRequestResponse response = resourceRequestService.submit(request);

        assertThat(response.id()).isEqualTo(1L);
        assertThat(response.status()).isEqualTo(ResourceRequestStatus.PENDING);
        assertThat(response.priority()).isEqualTo(RequestPriority.MEDIUM);
    }

    @Test
    void submit_deviceRequestWithoutCategory_throwsValidationException() {
        SubmitResourceRequest request = new SubmitResourceRequest(ResourceKind.DEVICE, 10L, null,
            null, "New hire", null, TODAY, null, RequestPriority.HIGH);

        assertThatThrownBy(() -> resourceRequestService.submit(request))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("device category");

        verify(resourceRequestRepository, never()).save(any());
    }

    @Test
    void submit_licenseRequestWithoutSoftware_throwsValidationException() {
        SubmitResourceRequest request = new SubmitResourceRequest(ResourceKind.LICENSE, 10L, null,
            " ", "Design", null, TODAY, null, null);

        assertThatThrownBy(() -> resourceRequestService.submit(request))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("software");
    }

    @Test
    void submit_endBeforeStart_throwsValidationException() {
        SubmitResourceRequest request = new SubmitResourceRequest(ResourceKind.LICENSE, 10L, null,
            "Figma", "Design", null, TODAY, TODAY.minusDays(1), null);

        assertThatThrownBy(() -> resourceRequestService.submit(request))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("before the expected start date");
    }

    @Test
    void approve_pending_recordsDecision() {
        ResourceRequest entity = createRequest(1L, ResourceKind.DEVICE, ResourceRequestStatus.PENDING);
        when(resourceRequestRepository.findByIdForUpdate(1L)).thenReturn(Optional.of(entity));

        ResourceRequestResponse response = resourceRequestService.approve(1L, new ApproveRequest("it-admin", "OK"));

        assertThat(response.status()).isEqualTo(ResourceRequestStatus.APPROVED);
        assertThat(response.decidedBy()).isEqualTo("it-admin");
        assertThat(response.decidedAt()).isEqualTo(NOW);
        assertThat(response.adminNotes()).isEqualTo("Approved by it-admin: OK");
    }

    @Test
    void approve_alreadyRejected_throwsInvalidTransitionException() {
        ResourceRequest entity = createRequest(1L, ResourceKind.DEVICE, ResourceRequestStatus.REJECTED);
        when(resourceRequestRepository.findByIdForUpdate(1L)).thenReturn(Optional.of(entity));

        assertThatThrownBy(() -> resourceRequestService.approve(1L, new ApproveRequest("it-admin", null)))
            .isInstanceOf(InvalidTransitionException.class)
            .hasMessageContaining("REJECTED");
    }

    @Test
    void reject_pending_storesReason() {
        ResourceRequest entity = createRequest(1L, ResourceKind.LICENSE, ResourceRequestStatus.PENDING);
        when(resourceRequestRepository.findByIdForUpdate(1L)).thenReturn(Optional.of(entity));

        ResourceRequestResponse response =
            resourceRequestService.reject(1L, new RejectRequest("it-admin", "Budget freeze"));

        assertThat(response.status()).isEqualTo(ResourceRequestStatus.REJECTED);
        assertThat(response.rejectionReason()).isEqualTo("Budget freeze");
    }

    @Test
    void fulfill_approvedDeviceRequest_assignsDeviceWithRequestKey() {
        ResourceRequest entity = createRequest(1L, ResourceKind.DEVICE, ResourceRequestStatus.APPROVED);
        entity.setExpectedEndDate(TODAY.plusDays(90));
        when(resourceRequestRepository.findByIdForUpdate(1L)).thenReturn(Optional.of(entity));
        when(allocationEngine.assignDevice(5L, 10L, "New hire", TODAY.plusDays(90), "resource-request-1"))
            .thenReturn(deviceAssignment(42L));

        ResourceRequestResponse response =
            resourceRequestService.fulfill(1L, new FulfillRequest(5L, "it-admin", null));

        assertThat(response.status()).isEqualTo(ResourceRequestStatus.FULFILLED);
        assertThat(response.fulfilledAssignmentId()).isEqualTo(42L);
        assertThat(response.fulfilledBy()).isEqualTo("it-admin");
        assertThat(response.fulfilledAt()).isEqualTo(NOW);
    }

    @Test
    void fulfill_approvedLicenseRequest_assignsSeatForExpectedPeriod() {
        ResourceRequest entity = createRequest(2L, ResourceKind.LICENSE, ResourceRequestStatus.APPROVED);
        when(resourceRequestRepository.findByIdForUpdate(2L)).thenReturn(Optional.of(entity));
        when(allocationEngine.assignLicense(7L, 10L, "New hire", TODAY, null, "resource-request-2"))
            .thenReturn(licenseAssignment(43L));

        ResourceRequestResponse response =
            resourceRequestService.fulfill(2L, new FulfillRequest(7L, "it-admin", "Seat from pool 7"));

        assertThat(response.fulfilledAssignmentId()).isEqualTo(43L);
        assertThat(response.adminNotes()).contains("Seat from pool 7");
    }

    @Test
    void fulfill_whenDeviceUnavailable_leavesRequestApproved() {
        ResourceRequest entity = createRequest(1L, ResourceKind.DEVICE, ResourceRequestStatus.APPROVED);
        when(resourceRequestRepository.findByIdForUpdate(1L)).thenReturn(Optional.of(entity));
        when(allocationEngine.assignDevice(5L, 10L, "New hire", null, "resource-request-1"))
            .thenThrow(new NotAvailableException(5L, DeviceStatus.ASSIGNED));

        assertThatThrownBy(() -> resourceRequestService.fulfill(1L, new FulfillRequest(5L, "it-admin", null)))
            .isInstanceOf(NotAvailableException.class);

        assertThat(entity.getStatus()).isEqualTo(ResourceRequestStatus.APPROVED);
        assertThat(entity.getFulfilledAssignmentId()).isNull();
    }

    @Test
    void fulfill_pendingRequest_throwsInvalidTransitionException() {
        ResourceRequest entity = createRequest(1L, ResourceKind.DEVICE, ResourceRequestStatus.PENDING);
        when(resourceRequestRepository.findByIdForUpdate(1L)).thenReturn(Optional.of(entity));

        assertThatThrownBy(() -> resourceRequestService.fulfill(1L, new FulfillRequest(5L, "it-admin", null)))
            .isInstanceOf(InvalidTransitionException.class)
            .hasMessageContaining("be fulfilled");

        verifyNoInteractions(allocationEngine);
    }

    @Test
    void cancel_approvedRequest_withoutBody_cancels() {
        ResourceRequest entity = createRequest(1L, ResourceKind.DEVICE, ResourceRequestStatus.APPROVED);
        when(resourceRequestRepository.findByIdForUpdate(1L)).thenReturn(Optional.of(entity));

        ResourceRequestResponse response = resourceRequestService.cancel(1L, null);

        assertThat(response.status()).isEqualTo(ResourceRequestStatus.CANCELLED);
    }

    @Test
    void cancel_fulfilledRequest_throwsInvalidTransitionException() {
        ResourceRequest entity = createRequest(1L, ResourceKind.DEVICE, ResourceRequestStatus.FULFILLED);
        when(resourceRequestRepository.findByIdForUpdate(1L)).thenReturn(Optional.of(entity));

        assertThatThrownBy(() -> resourceRequestService.cancel(1L, new CancelRequest("No longer needed")))
            .isInstanceOf(InvalidTransitionException.class);

        verifyNoInteractions(allocationEngine);
    }

    private ResourceRequest createRequest(Long id, ResourceKind type, ResourceRequestStatus status) {
        ResourceRequest entity = new ResourceRequest();
        ReflectionTestUtils.setField(entity, "id", id);
        entity.setRequestType(type);
        entity.setHolderId(10L);
        if (type == ResourceKind.DEVICE) {
            entity.setDeviceCategory(DeviceCategory.LAPTOP);
        } else {
            entity.setSoftwareName("Figma");
        }
        entity.setPurpose("New hire");
        entity.setExpectedStartDate(TODAY);
        entity.setStatus(status);
        return entity;
    }

    private DeviceAssignmentResponse deviceAssignment(Long id) {
        return new DeviceAssignmentResponse(id, 5L, "Dell Latitude (SN-5)", 10L, TODAY, null, "New hire",
            DeviceAssignmentStatus.ACTIVE, null, null, NOW);
    }

    private LicenseAssignmentResponse licenseAssignment(Long id) {
        return new LicenseAssignmentResponse(id, 7L, "Figma", 10L, TODAY, TODAY, null, TODAY.plusYears(1),
            "New hire", LicenseAssignmentStatus.ACTIVE, null, null, NOW);
    }
}
