package com.librarylogs.ezproxy.model;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one synchronizer pass over a source folder.
 *
 * @param eligible files newer than the watermark and older than the lag
 * @param copied   files actually copied (always empty in dry runs)
 * @param deferred eligible files newer than a failed copy, left for the next pass
 * @param failures per-file error messages; one bad file never stops the scan
 */
public record SyncReport(
        String logType,
        Instant watermark,
        List<Path> eligible,
        List<Path> copied,
        List<Path> deferred,
        Map<Path, String> failures) {

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
