package com.librarylogs.ezproxy.service;

import com.librarylogs.ezproxy.config.IngesterProperties;
import com.librarylogs.ezproxy.model.IngestionSummary;
import com.librarylogs.ezproxy.model.LogSource;
import com.librarylogs.ezproxy.model.ProcessingRun;
import com.librarylogs.ezproxy.model.SyncReport;
import com.librarylogs.ezproxy.output.LedgerException;
import com.librarylogs.ezproxy.output.LedgerStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Drives a run: optionally syncs the archive, then loads every archived file that
 * has no successful run yet. Files with only failed runs are retried every time.
 *
 * One run at a time per process. A failed file never stops the run; a ledger
 * failure or a cancellation does.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class LogIngestionService {

    private final LogSourceLoader sourceLoader;
    private final LogParserRegistry parserRegistry;
    private final FileIngestionEngine engine;
    private final FileSynchronizer synchronizer;
    private final LedgerStore ledgerStore;
    private final FileStore fileStore;
    private final IngesterProperties properties;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile Thread worker;

    /**
     * The scheduled entry point: sync (when enabled) then ingest.
     */
    public IngestionSummary syncAndIngest() {
        return exclusively(() -> {
            if (properties.getScheduling().isSyncBeforeIngest()) {
                synchronizer.syncAll(properties.isProduction());
            }
            return ingestSources();
        });
    }

    public IngestionSummary ingestAll() {
        return exclusively(this::ingestSources);
    }

    public List<SyncReport> syncAll() {
        return exclusively(() -> synchronizer.syncAll(properties.isProduction()));
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Interrupts the current run and waits for it to roll back the file in progress.
     *
     * @return true if a run was in progress
     */
    public boolean cancel(Duration wait) {
        Thread current = worker;
        if (current == null) {
            return false;
        }

        log.warn("Cancelling ingestion run on thread {}", current.getName());
        current.interrupt();
        try {
            current.join(wait.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (current.isAlive()) {
            log.warn("Ingestion run did not stop within {}", wait);
        }
        return true;
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private <T> T exclusively(Supplier<T> body) {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("An ingestion run is already in progress");
        }
        worker = Thread.currentThread();
        try {
            return body.get();
        } finally {
            worker = null;
            running.set(false);
        }
    }

    private IngestionSummary ingestSources() {
        boolean production = properties.isProduction();
        log.info("Starting ingestion run ({})", production ? "production" : "dry run");

        Set<String> processed;
        if (production || ledgerStore.exists()) {
            processed = ledgerStore.processedFiles();
        } else {
            log.info("[dry-run] No ledger table yet; every archived file is treated as new");
            processed = Set.of();
        }
        IngestionSummary summary = IngestionSummary.EMPTY;

        for (LogSource source : sourceLoader.sources()) {
            summary = summary.plus(ingestSource(source, processed, production));
        }

        log.info("Ingestion run complete: {} succeeded, {} failed, {} skipped",
                summary.succeeded(), summary.failed(), summary.skipped());
        return summary;
    }

    private IngestionSummary ingestSource(LogSource source, Set<String> processed, boolean production) {
        LogParser parser = parserRegistry.getParser(source.getDialect());

        List<Path> files;
        try {
            files = fileStore.walk(Paths.get(source.getLogDirectory()));
        } catch (IOException e) {
            log.error("Cannot list {} for {}: {}", source.getLogDirectory(), source.getLogType(), e.getMessage(), e);
            return IngestionSummary.EMPTY;
        }

        int succeeded = 0;
        int failed = 0;
        int skipped = 0;

        for (Path file : files) {
            if (Thread.interrupted()) {
                throw new IngestionCancelledException(null, null);
            }

            String filePath = file.toString();
            if (processed.contains(filePath)) {
                log.info("Existing log: {}", filePath);
                skipped++;
                continue;
            }

            try {
                ProcessingRun run = engine.processFile(file, source.getLogType(), parser, production);
                if (run.isValid()) {
                    succeeded++;
                } else {
                    failed++;
                }
            } catch (LedgerException | IngestionCancelledException e) {
                throw e;
            } catch (RuntimeException e) {
                log.error("Unexpected error processing {}: {}", filePath, e.getMessage(), e);
                failed++;
            }
        }

        return new IngestionSummary(succeeded, failed, skipped);
    }
}
