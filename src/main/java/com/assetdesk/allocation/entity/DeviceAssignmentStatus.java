package com.assetdesk.allocation.entity;

public enum DeviceAssignmentStatus {
    ACTIVE,
    RETURNED;

    public boolean isTerminal() {
        return this != ACTIVE;
    }
}
