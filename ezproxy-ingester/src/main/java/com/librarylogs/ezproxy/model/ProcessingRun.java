package com.librarylogs.ezproxy.model;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * One attempt at loading one log file.
 * Stored in the processing_time table, which decides what later runs skip.
 */
@Data
@Builder
public class ProcessingRun {

    private String filePath;
    private String logType;
    private LocalDateTime processingStartTime;
    private LocalDateTime processingEndTime;
    private boolean valid;
    private long numOfLogs;
    private long numInvalid;
    private String error;           // null on success
}
