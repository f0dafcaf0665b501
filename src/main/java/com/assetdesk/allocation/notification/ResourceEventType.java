package com.assetdesk.allocation.notification;

public enum ResourceEventType {
    DEVICE_ASSIGNED,
    DEVICE_RETURNED,
    LICENSE_ASSIGNED,
    LICENSE_RETURNED,
    LICENSE_REVOKED,
    LICENSE_EXPIRED,
    EXPIRY_ALERT
}
