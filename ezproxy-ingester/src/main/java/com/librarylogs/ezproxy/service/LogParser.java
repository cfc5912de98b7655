package com.librarylogs.ezproxy.service;

import com.librarylogs.ezproxy.model.ParseResult;

import java.util.List;

/**
 * Strategy for one log dialect.
 *
 * Implementations must be pure: the same lines always give the same partition,
 * and a bad line is rejected into {@link ParseResult#invalid()} rather than thrown.
 * Returned records are untagged; the caller fills in file path, log type and run time.
 */
public interface LogParser {

    /** Dialect name used in log source configuration, e.g. "ezproxy". */
    String dialect();

    ParseResult parse(List<String> lines);
}
