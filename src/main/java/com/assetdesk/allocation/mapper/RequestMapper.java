package com.assetdesk.allocation.mapper;

import com.assetdesk.allocation.dto.request.SubmitResourceRequest;
import com.assetdesk.allocation.dto.request.SubmitReturnRequest;
import com.assetdesk.allocation.dto.response.ResourceRequestResponse;
import com.assetdesk.allocation.dto.response.ReturnRequestResponse;
import com.assetdesk.allocation.entity.RequestPriority;
import com.assetdesk.allocation.entity.ResourceRequest;
import com.assetdesk.allocation.entity.ReturnRequest;

public final class RequestMapper {

    private RequestMapper() {}

    public static ResourceRequest toEntity(SubmitResourceRequest request) {
        ResourceRequest entity = new ResourceRequest();
        entity.setRequestType(request.requestType());
        entity.setHolderId(request.holderId());
        entity.setDeviceCategory(request.deviceCategory());
        entity.setSoftwareName(request.softwareName());
        entity.setPurpose(request.purpose());
        entity.setBusinessJustification(request.businessJustification());
        entity.setExpectedStartDate(request.expectedStartDate());
        entity.setExpectedEndDate(request.expectedEndDate());
        entity.setPriority(request.priority() != null ? request.priority() : RequestPriority.MEDIUM);
        return entity;
    }

    public static ReturnRequest toEntity(SubmitReturnRequest request) {
        ReturnRequest entity = new ReturnRequest();
        entity.setRequestType(request.requestType());
        entity.setHolderId(request.holderId());
        entity.setAssignmentId(request.assignmentId());
        entity.setExpectedReturnDate(request.expectedReturnDate());
        entity.setReturnReason(request.returnReason());
        entity.setConditionNotes(request.conditionNotes());
        return entity;
    }

    public static ResourceRequestResponse toResponse(ResourceRequest request) {
        return new ResourceRequestResponse(
            request.getId(),
            request.getRequestType(),
            request.getHolderId(),
            request.getDeviceCategory(),
            request.getSoftwareName(),
            request.getPurpose(),
            request.getBusinessJustification(),
            request.getExpectedStartDate(),
            request.getExpectedEndDate(),
            request.getPriority(),
            request.getStatus(),
            request.getDecidedBy(),
            request.getDecidedAt(),
            request.getRejectionReason(),
            request.getAdminNotes(),
            request.getFulfilledAssignmentId(),
            request.getFulfilledBy(),
            request.getFulfilledAt(),
            request.getCreatedAt()
        );
    }

    public static ReturnRequestResponse toResponse(ReturnRequest request) {
        return new ReturnRequestResponse(
            request.getId(),
            request.getRequestType(),
            request.getHolderId(),
            request.getAssignmentId(),
            request.getExpectedReturnDate(),
            request.getReturnReason(),
            request.getConditionNotes(),
            request.getStatus(),
            request.getProcessedBy(),
            request.getProcessedAt(),
            request.getActualReturnDate(),
            request.getAdminNotes(),
            request.getCreatedAt()
        );
    }
}
