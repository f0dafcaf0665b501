package com.assetdesk.allocation.entity;

/**
 * The two kinds of allocatable resource. Also used as the type discriminator of
 * {@link ResourceRequest} and {@link ReturnRequest}.
 */
public enum ResourceKind {
    DEVICE,
    LICENSE
}
