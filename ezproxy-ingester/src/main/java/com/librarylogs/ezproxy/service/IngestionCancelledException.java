package com.librarylogs.ezproxy.service;

/**
 * The operator interrupted a run. Rows already written for the current file have
 * been removed and no run was recorded, so the file is retried on the next run.
 */
public class IngestionCancelledException extends RuntimeException {

    private final String filePath;

    public IngestionCancelledException(String filePath, Throwable cause) {
        super(filePath != null
                ? "Ingestion cancelled while processing " + filePath
                : "Ingestion cancelled", cause);
        this.filePath = filePath;
    }

    /** File that was being processed, or null if cancelled between files. */
    public String getFilePath() {
        return filePath;
    }
}
