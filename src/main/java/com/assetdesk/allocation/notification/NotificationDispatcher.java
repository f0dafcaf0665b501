package com.assetdesk.allocation.notification;

import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Hands published {@link ResourceEvent}s to the {@link Notifier} once the publishing
 * transaction has committed. Events published outside a transaction (scheduler alerts)
 * are delivered immediately. A rolled-back transaction delivers nothing.
 */
@Component
@RequiredArgsConstructor
public class NotificationDispatcher {

    private static final Logger log = LoggerFactory.getLogger(NotificationDispatcher.class);

    private final Notifier notifier;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onResourceEvent(ResourceEvent event) {
        try {
            notifier.notify(event);
        } catch (RuntimeException ex) {
            log.warn("[ALERT][Notify][{}] resource={} assignment={} detail={}",
                event.eventType(), event.resourceId(), event.assignmentId(), ex.getMessage(), ex);
        }
    }
}
