package com.assetdesk.allocation.notification;

/**
 * Delivery endpoint for resource events. Implementations must not assume they run inside
 * a transaction; engine events arrive after the originating transaction has committed.
 */
public interface Notifier {

    void notify(ResourceEvent event);
}
