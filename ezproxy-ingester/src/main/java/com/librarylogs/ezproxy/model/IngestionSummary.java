package com.librarylogs.ezproxy.model;

public record IngestionSummary(int succeeded, int failed, int skipped) {

    public static final IngestionSummary EMPTY = new IngestionSummary(0, 0, 0);

    public IngestionSummary plus(IngestionSummary other) {
        return new IngestionSummary(
                succeeded + other.succeeded,
                failed + other.failed,
                skipped + other.skipped);
    }
}
