package com.librarylogs.ezproxy.service;

import com.librarylogs.ezproxy.config.IngesterProperties;
import com.librarylogs.ezproxy.model.InvalidRecord;
import com.librarylogs.ezproxy.model.LogRecord;
import com.librarylogs.ezproxy.model.ParseResult;
import com.librarylogs.ezproxy.model.ProcessingRun;
import com.librarylogs.ezproxy.output.LedgerException;
import com.librarylogs.ezproxy.output.LedgerStore;
import com.librarylogs.ezproxy.output.OutputRouter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.channels.ClosedByInterruptException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Loads one log file batch by batch and records the outcome in the ledger.
 *
 * Outcomes:
 *   success    all batches loaded, one valid run recorded, earlier failed runs dropped
 *   failure    rows for the file deleted, one invalid run recorded with the error
 *   cancelled  rows for the file deleted, nothing recorded, exception rethrown
 *
 * Ledger failures are never turned into failed runs; they propagate and stop the run.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class FileIngestionEngine {

    private static final DateTimeFormatter PROGRESS_FORMAT = DateTimeFormatter.ofPattern("MM/dd/yyyy HH:mm:ss");

    private final LedgerStore ledgerStore;
    private final OutputRouter outputRouter;
    private final IngesterProperties properties;
    private final Clock clock;

    public ProcessingRun processFile(Path path, String logType, LogParser parser, boolean production) {
        String filePath = path.toString();
        LocalDateTime startedAt = now();
        log.info("{}: {}", filePath, startedAt.format(PROGRESS_FORMAT));

        ProcessingRun run = ProcessingRun.builder()
                .filePath(filePath)
                .logType(logType)
                .processingStartTime(startedAt)
                .valid(true)
                .build();

        // promotion only matters when the run is recorded
        boolean previouslyInvalid = production && ledgerStore.hasFailedRun(filePath);

        try {
            if (production && !ledgerStore.hasSuccessfulRun(filePath)) {
                // rows from an attempt that died before its run was recorded
                ledgerStore.purgeRecordsForFile(logType, filePath);
            }
            streamBatches(path, logType, parser, production, run);

        } catch (LedgerException e) {
            throw e;
        } catch (IngestionCancelledException e) {
            rollbackCancelled(run, production);
            throw e;
        } catch (Exception e) {
            if (isInterruption(e)) {
                rollbackCancelled(run, production);
                throw new IngestionCancelledException(filePath, e);
            }

            log.error("Failed processing {}: {}", filePath, describe(e), e);
            if (production) {
                ledgerStore.purgeRecordsForFile(logType, filePath);
            }
            run.setValid(false);
            run.setError(describe(e));
        }

        run.setProcessingEndTime(now());
        outputRouter.writeRun(run, run.isValid() && previouslyInvalid, production);

        log.info("{}: {} valid, {} invalid, {}", filePath, run.getNumOfLogs(), run.getNumInvalid(),
                run.isValid() ? "done" : "FAILED");
        return run;
    }

    private void streamBatches(Path path, String logType, LogParser parser, boolean production,
                               ProcessingRun run) throws IOException {
        String filePath = run.getFilePath();
        int batchNumber = 0;

        try (LineBatchReader reader = LineBatchReader.open(path, properties.getChunkSize())) {
            for (List<String> lines = reader.nextBatch(); !lines.isEmpty(); lines = reader.nextBatch()) {
                checkCancelled(filePath);

                ParseResult batch = parser.parse(lines);
                tag(batch, logType, run);
                run.setNumOfLogs(run.getNumOfLogs() + batch.valid().size());
                run.setNumInvalid(run.getNumInvalid() + batch.invalid().size());

                outputRouter.writeBatch(logType, filePath, batch, production);
                batchNumber++;
                log.debug("{}: batch {} loaded ({} lines)", filePath, batchNumber, batch.total());

                checkCancelled(filePath);
            }
        }
    }

    private void tag(ParseResult batch, String logType, ProcessingRun run) {
        for (LogRecord r : batch.valid()) {
            r.setFilePath(run.getFilePath());
            r.setProcessingStartTime(run.getProcessingStartTime());
        }
        for (InvalidRecord r : batch.invalid()) {
            r.setLogType(logType);
            r.setFilePath(run.getFilePath());
            r.setProcessingStartTime(run.getProcessingStartTime());
        }
    }

    private void checkCancelled(String filePath) {
        if (Thread.currentThread().isInterrupted()) {
            throw new IngestionCancelledException(filePath, null);
        }
    }

    private void rollbackCancelled(ProcessingRun run, boolean production) {
        // clear the flag so the purge statements are not interrupted as well
        Thread.interrupted();
        log.warn("Cancelled while processing {}; removing its rows", run.getFilePath());
        if (production) {
            ledgerStore.purgeRecordsForFile(run.getLogType(), run.getFilePath());
        }
    }

    private static boolean isInterruption(Throwable e) {
        if (Thread.currentThread().isInterrupted()) {
            return true;
        }
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof InterruptedException || t instanceof ClosedByInterruptException) {
                return true;
            }
        }
        return false;
    }

    private static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getName();
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock).truncatedTo(ChronoUnit.SECONDS);
    }
}
