package com.assetdesk.allocation.entity;

public enum DeviceCategory {
    LAPTOP,
    DESKTOP,
    TABLET,
    PHONE
}
