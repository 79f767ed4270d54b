package com.sitely.ledger.scheduler;

import com.sitely.ledger.config.SiteLedgerProperties;
import com.sitely.ledger.service.RetentionSweeper;
import com.sitely.ledger.service.StorageInitializer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Starts the store with the application context and re-runs the retention
 * sweep on a schedule for processes that stay up for days.
 *
 * Default schedule: every day at 03:30 UTC. Override with
 * site-ledger.retention.cron.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class StorageScheduler {

    private final StorageInitializer storageInitializer;
    private final RetentionSweeper retentionSweeper;
    private final SiteLedgerProperties properties;

    /**
     * Initialization failure is fatal: the exception aborts context startup.
     */
    @PostConstruct
    public void onStartup() {
        if (!properties.isInitOnStartup()) {
            log.info("Ledger storage will initialise on first use");
            return;
        }
        storageInitializer.awaitReady();
    }

    @Scheduled(cron = "${site-ledger.retention.cron:0 30 3 * * *}", zone = "UTC")
    public void scheduledSweep() {
        if (!properties.getRetention().isScheduledSweepEnabled()) {
            return;
        }
        log.info("Scheduled retention sweep triggered");
        try {
            storageInitializer.awaitReady();
            retentionSweeper.sweep();
        } catch (Exception e) {
            log.error("Scheduled retention sweep failed: {}", e.getMessage(), e);
        }
    }
}
