package com.assetdesk.allocation.exception;

import com.assetdesk.allocation.entity.DeviceStatus;

public class NotAvailableException extends RetryableAllocationException {

    public NotAvailableException(Long deviceId, DeviceStatus currentStatus) {
        super("Device " + deviceId + " is not available for assignment; current status is " + currentStatus);
    }
}
