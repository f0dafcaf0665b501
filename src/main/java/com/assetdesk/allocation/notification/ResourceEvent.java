package com.assetdesk.allocation.notification;

import com.assetdesk.allocation.dto.response.AlertResponse;
import com.assetdesk.allocation.entity.ResourceKind;
import com.assetdesk.allocation.service.AlertSeverity;

import java.time.Instant;

/**
 * Payload handed to the {@link Notifier}. Engine events carry the assignment and holder;
 * {@code severity} is set only for {@link ResourceEventType#EXPIRY_ALERT}.
 */
public record ResourceEvent(
    ResourceEventType eventType,
    ResourceKind resourceKind,
    Long resourceId,
    Long assignmentId,
    Long holderId,
    AlertSeverity severity,
    Instant timestamp
) {
    public static ResourceEvent of(ResourceEventType eventType, ResourceKind resourceKind,
                                   Long resourceId, Long assignmentId, Long holderId, Instant timestamp) {
        return new ResourceEvent(eventType, resourceKind, resourceId, assignmentId, holderId, null, timestamp);
    }

    public static ResourceEvent alert(AlertResponse alert, Instant timestamp) {
        return new ResourceEvent(ResourceEventType.EXPIRY_ALERT, alert.resourceKind(), alert.resourceId(),
            alert.assignmentId(), alert.holderId(), alert.severity(), timestamp);
    }
}
