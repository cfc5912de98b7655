package com.librarylogs.ezproxy.model;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * A raw line the parser could not turn into a {@link LogRecord}.
 * Stored verbatim in the shared invalid_logs table.
 */
@Data
@Builder
public class InvalidRecord {

    private String logLine;
    private String logType;
    private String filePath;
    private LocalDateTime processingStartTime;
}
