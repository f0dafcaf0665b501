package com.assetdesk.allocation.entity;

public enum PricingModel {
    MONTHLY,
    YEARLY,
    PERPETUAL
}
