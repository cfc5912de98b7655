package com.librarylogs.ezproxy.model;

import java.util.List;

/**
 * Partition of one batch of raw lines. Every input line lands in exactly one list.
 */
public record ParseResult(List<LogRecord> valid, List<InvalidRecord> invalid) {

    public int total() {
        return valid.size() + invalid.size();
    }
}
