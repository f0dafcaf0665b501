package com.assetdesk.allocation.notification;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class LoggingNotifier implements Notifier {

    private static final Logger log = LoggerFactory.getLogger(LoggingNotifier.class);

    @Override
    public void notify(ResourceEvent event) {
        if (event.eventType() == ResourceEventType.EXPIRY_ALERT) {
            log.info("[NOTIFY][{}] severity={} kind={} resource={} assignment={} holder={}",
                event.eventType(), event.severity(), event.resourceKind(), event.resourceId(),
                event.assignmentId(), event.holderId());
            return;
        }
        log.info("[NOTIFY][{}] kind={} resource={} assignment={} holder={} at={}",
            event.eventType(), event.resourceKind(), event.resourceId(),
            event.assignmentId(), event.holderId(), event.timestamp());
    }
}
