package com.assetdesk.allocation.service;

public enum AlertSeverity {
    EXPIRED,
    CRITICAL,
    WARNING,
    INFO
}
