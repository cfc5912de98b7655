package com.librarylogs.ezproxy.output;

import com.librarylogs.ezproxy.model.ParseResult;
import com.librarylogs.ezproxy.model.ProcessingRun;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Routes batches and run records to the database in production,
 * or to the preview writer in a dry run.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class OutputRouter {

    private final RecordSink recordSink;
    private final LedgerStore ledgerStore;
    private final PreviewWriter previewWriter;
    private final TransactionTemplate transactionTemplate;

    /**
     * Loads one batch. Valid and invalid rows commit together or not at all.
     */
    public void writeBatch(String logType, String filePath, ParseResult batch, boolean production) {
        if (!production) {
            previewWriter.writeBatch(logType, filePath, batch);
            return;
        }

        transactionTemplate.executeWithoutResult(status -> {
            recordSink.append(logType, batch.valid());
            recordSink.appendInvalid(batch.invalid());
        });
    }

    /**
     * Records the run, dropping earlier failed runs in the same transaction when
     * the file has just been promoted to valid.
     */
    public void writeRun(ProcessingRun run, boolean promote, boolean production) {
        if (!production) {
            previewWriter.writeRun(run);
            return;
        }

        try {
            transactionTemplate.executeWithoutResult(status -> {
                if (promote) {
                    ledgerStore.purgeStaleInvalidRuns(run.getFilePath());
                }
                ledgerStore.recordRun(run);
            });
        } catch (LedgerException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new LedgerException("Ledger failed to commit run for " + run.getFilePath(), e);
        }
    }
}
