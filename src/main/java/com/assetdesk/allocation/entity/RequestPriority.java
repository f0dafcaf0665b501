package com.assetdesk.allocation.entity;

public enum RequestPriority {
    LOW,
    MEDIUM,
    HIGH,
    URGENT
}
