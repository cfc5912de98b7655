package com.librarylogs.ezproxy.service;

import com.librarylogs.ezproxy.config.IngesterProperties;
import com.librarylogs.ezproxy.model.SyncReport;
import com.librarylogs.ezproxy.model.SyncTarget;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Copies new logs from the library server into the archive.
 *
 * A source file is new when it was modified after the newest file already in the
 * archive (the watermark) and at least {@code ezproxy.sync.lag} ago, so files the
 * proxy is still writing are left for a later run.
 *
 * The source folder is scanned without recursion; the archive is walked recursively.
 *
 * Eligible files are copied oldest first. Once a copy fails, newer files are deferred:
 * copying them would move the watermark past the failed file and it would never be
 * picked up again.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class FileSynchronizer {

    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy/MM/dd HH:mm:ss");

    private final FileStore fileStore;
    private final IngesterProperties properties;
    private final Clock clock;

    public List<SyncReport> syncAll(boolean production) {
        List<SyncReport> reports = new ArrayList<>();
        for (SyncTarget target : properties.getSync().getTargets()) {
            reports.add(sync(target, production));
        }
        return reports;
    }

    public SyncReport sync(SyncTarget target, boolean production) {
        log.info("Syncing {} from {} into {}", target.getLogType(), target.getSourceRoot(), target.getArchiveRoot());
        return sync(target.getLogType(), Paths.get(target.getSourceRoot()), Paths.get(target.getArchiveRoot()),
                target.getPattern(), production);
    }

    public SyncReport sync(String logType, Path sourceRoot, Path archiveRoot, String pattern, boolean production) {
        Map<Path, String> failures = new LinkedHashMap<>();
        List<Path> eligible = new ArrayList<>();
        List<Path> copied = new ArrayList<>();
        List<Path> deferred = new ArrayList<>();

        Instant watermark;
        List<Path> candidates;
        try {
            if (production) {
                fileStore.createDirectories(archiveRoot);
            }
            watermark = watermark(archiveRoot);
            candidates = fileStore.list(sourceRoot);
        } catch (IOException | RuntimeException e) {
            log.error("Cannot sync {} into {}: {}", sourceRoot, archiveRoot, e.getMessage(), e);
            failures.put(sourceRoot, describe(e));
            return new SyncReport(logType, null, eligible, copied, deferred, failures);
        }

        Instant cutoff = clock.instant().minus(properties.getSync().getLag());
        log.info("Watermark for {}: {}", archiveRoot, format(watermark));

        Map<Path, Instant> modifiedTimes = new HashMap<>();
        for (Path source : candidates) {
            if (pattern != null && !source.toString().contains(pattern)) {
                continue;
            }
            try {
                Instant modified = fileStore.lastModified(source);
                if (modified.isAfter(watermark) && modified.isBefore(cutoff)) {
                    modifiedTimes.put(source, modified);
                    eligible.add(source);
                }
            } catch (IOException | RuntimeException e) {
                log.error("Cannot read modification time of {}: {}", source, e.getMessage(), e);
                failures.put(source, describe(e));
            }
        }
        eligible.sort(Comparator.comparing((Path p) -> modifiedTimes.get(p)).thenComparing(Comparator.naturalOrder()));

        Path failedCopy = null;
        for (Path source : eligible) {
            String timestamp = format(modifiedTimes.get(source));
            if (!production) {
                log.info("[dry-run] copy {} {}", source, archiveRoot);
                log.info("[dry-run] timeStamp: {} File: {}", timestamp, source);
                continue;
            }
            if (failedCopy != null) {
                deferred.add(source);
                continue;
            }

            try {
                copied.add(fileStore.copyInto(source, archiveRoot));
                log.info("Copied {} ({})", source, timestamp);
            } catch (IOException | RuntimeException e) {
                log.error("Failed to copy {}: {}", source, e.getMessage(), e);
                failures.put(source, describe(e));
                failedCopy = source;
            }
        }

        if (!deferred.isEmpty()) {
            log.error("Deferred {} newer file(s) of {} until {} copies", deferred.size(), logType, failedCopy);
        }
        log.info("Sync of {} finished: {} eligible, {} copied, {} deferred, {} failed",
                logType, eligible.size(), copied.size(), deferred.size(), failures.size());
        return new SyncReport(logType, watermark, eligible, copied, deferred, failures);
    }

    /**
     * Newest modification time in the archive, or the configured default when the
     * archive is missing or empty.
     */
    Instant watermark(Path archiveRoot) throws IOException {
        Instant watermark = null;
        if (fileStore.exists(archiveRoot)) {
            for (Path archived : fileStore.walk(archiveRoot)) {
                Instant modified = fileStore.lastModified(archived);
                if (watermark == null || modified.isAfter(watermark)) {
                    watermark = modified;
                }
            }
        }
        return watermark != null
                ? watermark
                : properties.getSync().getDefaultWatermark().atZone(clock.getZone()).toInstant();
    }

    private String format(Instant instant) {
        return LocalDateTime.ofInstant(instant, clock.getZone()).format(TIMESTAMP_FORMAT);
    }

    private static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getName();
    }
}
