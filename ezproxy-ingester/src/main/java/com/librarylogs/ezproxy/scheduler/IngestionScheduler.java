package com.librarylogs.ezproxy.scheduler;

import com.librarylogs.ezproxy.config.IngesterProperties;
import com.librarylogs.ezproxy.model.IngestionSummary;
import com.librarylogs.ezproxy.output.LedgerException;
import com.librarylogs.ezproxy.output.SinkSchema;
import com.librarylogs.ezproxy.service.IngestionCancelledException;
import com.librarylogs.ezproxy.service.LogIngestionService;
import com.librarylogs.ezproxy.service.LogSourceLoader;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Manages scheduled and on-startup runs.
 *
 * Default schedule: daily at 03:00 local time. The synchronizer skips files
 * modified in the last day, so a daily run picks up each log the day after it closes.
 *
 * Override with the ezproxy.scheduling.cron property.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class IngestionScheduler {

    private static final Duration SHUTDOWN_WAIT = Duration.ofMinutes(2);

    private final LogIngestionService ingestionService;
    private final LogSourceLoader sourceLoader;
    private final SinkSchema sinkSchema;
    private final IngesterProperties properties;

    /**
     * In production, make sure every sink table exists before the first run.
     */
    @PostConstruct
    public void onStartup() {
        if (!properties.isProduction()) {
            log.info("Dry-run mode: nothing will be copied or written to the database");
            return;
        }
        if (!properties.getSink().isCreateSchema()) {
            return;
        }
        try {
            sinkSchema.ensureSchema(sourceLoader.logTypes());
        } catch (Exception e) {
            log.warn("Could not initialise sink schema: {}", e.getMessage());
        }
    }

    @EventListener(ApplicationReadyEvent.class)
    public void runOnStartup() {
        if (properties.getScheduling().isRunOnStartup()) {
            log.info("run-on-startup=true, starting ingestion run");
            runSafely();
        } else {
            log.info("Ingester ready. Next scheduled run: {}", properties.getScheduling().getCron());
        }
    }

    @Scheduled(cron = "${ezproxy.scheduling.cron:0 0 3 * * ?}")
    public void scheduledRun() {
        log.info("Scheduled ingestion run triggered");
        runSafely();
    }

    @PreDestroy
    public void onShutdown() {
        if (ingestionService.cancel(SHUTDOWN_WAIT)) {
            log.info("Ingestion run cancelled for shutdown");
        }
    }

    private void runSafely() {
        try {
            IngestionSummary summary = ingestionService.syncAndIngest();
            log.info("Run finished: {}", summary);
        } catch (IngestionCancelledException e) {
            log.warn("Run cancelled: {}", e.getMessage());
        } catch (LedgerException e) {
            log.error("Run aborted, ledger unavailable: {}", e.getMessage(), e);
        } catch (IllegalStateException e) {
            log.warn("Run skipped: {}", e.getMessage());
        } catch (Exception e) {
            log.error("Run failed: {}", e.getMessage(), e);
        }
    }
}
