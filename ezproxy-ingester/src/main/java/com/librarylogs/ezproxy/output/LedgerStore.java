package com.librarylogs.ezproxy.output;

import com.librarylogs.ezproxy.model.ProcessingRun;

import java.util.List;
import java.util.Set;

/**
 * Durable history of file attempts, and the only place that deletes loaded rows.
 *
 * Implementations do not retry: every failure surfaces as a {@link LedgerException}.
 */
public interface LedgerStore {

    /** False until the ledger table has been created; a dry run against a fresh sink reads it as empty. */
    boolean exists();

    /** Paths with at least one successful run. */
    Set<String> processedFiles();

    /** Paths with at least one failed run. */
    Set<String> invalidFiles();

    boolean hasSuccessfulRun(String filePath);

    boolean hasFailedRun(String filePath);

    /** Run history of one file, oldest first. */
    List<ProcessingRun> runsFor(String filePath);

    void recordRun(ProcessingRun run);

    /** Drops the failed runs of a file that has since loaded successfully. */
    void purgeStaleInvalidRuns(String filePath);

    /** Deletes every parsed and invalid row tagged with the file, in one transaction. */
    void purgeRecordsForFile(String logType, String filePath);
}
