package com.assetdesk.allocation.scheduler;

import com.assetdesk.allocation.dto.response.AlertResponse;
import com.assetdesk.allocation.dto.response.LicenseAssignmentResponse;
import com.assetdesk.allocation.notification.ResourceEvent;
import com.assetdesk.allocation.service.AllocationEngine;
import com.assetdesk.allocation.service.ExpiryMonitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * Periodic expiry run: sweeps expired license seats, then scans for upcoming expiries and
 * forwards each alert to the notifier.
 *
 * <p>The sweep and the scan are separate transactions. A failure in either is logged and
 * the next scheduled run starts fresh.
 */
@Component
@ConditionalOnProperty(prefix = "allocation.expiry-monitor", name = "enabled", havingValue = "true",
    matchIfMissing = true)
public class ExpiryMonitorScheduler {

    private static final Logger log = LoggerFactory.getLogger(ExpiryMonitorScheduler.class);

    private final AllocationEngine allocationEngine;
    private final ExpiryMonitor expiryMonitor;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;
    private final int horizonDays;
    private final boolean dryRun;

    public ExpiryMonitorScheduler(
            AllocationEngine allocationEngine,
            ExpiryMonitor expiryMonitor,
            ApplicationEventPublisher eventPublisher,
            Clock clock,
            @Value("${allocation.expiry-monitor.horizon-days:30}") int horizonDays,
            @Value("${allocation.expiry-monitor.dry-run:false}") boolean dryRun
    ) {
        this.allocationEngine = allocationEngine;
        this.expiryMonitor = expiryMonitor;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
        this.horizonDays = horizonDays;
        this.dryRun = dryRun;
    }

    @Scheduled(cron = "${allocation.expiry-monitor.cron:0 0 * * * *}")
    public void run() {
        LocalDate today = LocalDate.now(clock);
        sweep(today);
        scan(today);
    }

    void sweep(LocalDate today) {
        if (dryRun) {
            log.info("[Expiry][{}] dry run, sweep skipped", today);
            return;
        }
        try {
            List<LicenseAssignmentResponse> expired = allocationEngine.sweepExpired(today);
            if (!expired.isEmpty()) {
                log.info("[Expiry][{}] expired {} license assignment(s)", today, expired.size());
            }
        } catch (RuntimeException ex) {
            log.warn("[ALERT][Batch][EXPIRY_SWEEP] asOf={} detail={}", today, ex.getMessage(), ex);
        }
    }

    void scan(LocalDate today) {
        try {
            List<AlertResponse> alerts = expiryMonitor.scan(today, horizonDays);
            Instant now = clock.instant();
            alerts.forEach(alert -> eventPublisher.publishEvent(ResourceEvent.alert(alert, now)));
            log.info("[Expiry][{}] {} alert(s) within {} days", today, alerts.size(), horizonDays);
        } catch (RuntimeException ex) {
            log.warn("[ALERT][Batch][EXPIRY_SCAN] asOf={} detail={}", today, ex.getMessage(), ex);
        }
    }
}
