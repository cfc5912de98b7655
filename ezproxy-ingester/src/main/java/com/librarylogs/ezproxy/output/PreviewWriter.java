package com.librarylogs.ezproxy.output;

import com.librarylogs.ezproxy.config.IngesterProperties;
import com.librarylogs.ezproxy.config.IngesterProperties.Preview.PreviewMode;
import com.librarylogs.ezproxy.model.InvalidRecord;
import com.librarylogs.ezproxy.model.LogRecord;
import com.librarylogs.ezproxy.model.ParseResult;
import com.librarylogs.ezproxy.model.ProcessingRun;
import com.opencsv.CSVWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.FileWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Surfaces what a dry run would have loaded, without touching the database.
 *
 * LOG mode logs counts and a few sample rows per batch.
 * CSV mode appends everything to files under the preview directory:
 *   {outputDir}/{logType}/{sourceFileName}.valid.csv
 *   {outputDir}/{logType}/{sourceFileName}.invalid.csv
 *   {outputDir}/processing_time.csv
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class PreviewWriter {

    static final String[] RECORD_HEADERS = {
            "ip_address", "username", "click_time", "request", "http_code",
            "library_session", "referrer", "county", "state", "city",
            "ezproxy_session", "file_path", "processing_start_time"
    };

    static final String[] INVALID_HEADERS = {
            "log_line", "log_type", "file_path", "processing_start_time"
    };

    static final String[] RUN_HEADERS = {
            "file_path", "log_type", "processing_start_time", "processing_end_time",
            "valid", "num_of_logs", "num_invalid", "error"
    };

    private final IngesterProperties properties;

    public void writeBatch(String logType, String filePath, ParseResult batch) {
        IngesterProperties.Preview preview = properties.getPreview();
        log.info("[dry-run] {}: batch of {} valid / {} invalid lines for table {}",
                filePath, batch.valid().size(), batch.invalid().size(), logType);

        if (preview.getMode() == PreviewMode.CSV) {
            Path dir = Paths.get(preview.getOutputDir()).resolve(logType);
            String name = Paths.get(filePath).getFileName().toString();
            append(dir.resolve(name + ".valid.csv"), RECORD_HEADERS,
                    batch.valid().stream().map(this::toRow).toList());
            append(dir.resolve(name + ".invalid.csv"), INVALID_HEADERS,
                    batch.invalid().stream().map(this::toRow).toList());
        } else {
            batch.valid().stream().limit(preview.getSampleRows())
                    .forEach(r -> log.info("[dry-run]   {}", r));
            batch.invalid().stream().limit(preview.getSampleRows())
                    .forEach(r -> log.info("[dry-run]   invalid: {}", r.getLogLine()));
        }
    }

    public void writeRun(ProcessingRun run) {
        log.info("[dry-run] would record run: {}", run);
        if (properties.getPreview().getMode() == PreviewMode.CSV) {
            append(Paths.get(properties.getPreview().getOutputDir()).resolve("processing_time.csv"),
                    RUN_HEADERS, List.<String[]>of(toRow(run)));
        }
    }

    private void append(Path file, String[] headers, List<String[]> rows) {
        if (rows.isEmpty()) return;

        try {
            Files.createDirectories(file.getParent());
            boolean fresh = !Files.exists(file);

            try (CSVWriter writer = new CSVWriter(
                    new FileWriter(file.toFile(), StandardCharsets.UTF_8, true),
                    CSVWriter.DEFAULT_SEPARATOR,
                    CSVWriter.DEFAULT_QUOTE_CHARACTER,
                    CSVWriter.DEFAULT_ESCAPE_CHARACTER,
                    CSVWriter.DEFAULT_LINE_END)) {

                if (fresh && properties.getPreview().isIncludeHeader()) {
                    writer.writeNext(headers);
                }
                writer.writeAll(rows);
            }

            log.debug("Appended {} rows to preview {}", rows.size(), file);

        } catch (IOException e) {
            log.error("Failed to write preview file {}: {}", file, e.getMessage(), e);
            throw new RuntimeException("Preview write failed", e);
        }
    }

    private String[] toRow(LogRecord r) {
        return new String[]{
                str(r.getIpAddress()),
                str(r.getUsername()),
                str(r.getClickTime()),
                str(r.getRequest()),
                str(r.getHttpCode()),
                str(r.getLibrarySession()),
                str(r.getReferrer()),
                str(r.getCounty()),
                str(r.getState()),
                str(r.getCity()),
                str(r.getEzproxySession()),
                str(r.getFilePath()),
                str(r.getProcessingStartTime())
        };
    }

    private String[] toRow(InvalidRecord r) {
        return new String[]{
                str(r.getLogLine()),
                str(r.getLogType()),
                str(r.getFilePath()),
                str(r.getProcessingStartTime())
        };
    }

    private String[] toRow(ProcessingRun run) {
        return new String[]{
                str(run.getFilePath()),
                str(run.getLogType()),
                str(run.getProcessingStartTime()),
                str(run.getProcessingEndTime()),
                str(run.isValid()),
                str(run.getNumOfLogs()),
                str(run.getNumInvalid()),
                str(run.getError())
        };
    }

    private String str(Object val) {
        return val == null ? "" : val.toString();
    }
}
