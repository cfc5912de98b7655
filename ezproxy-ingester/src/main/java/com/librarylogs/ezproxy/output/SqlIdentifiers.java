package com.librarylogs.ezproxy.output;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Table names cannot be bound as statement parameters, so every log type is
 * checked here before it is spliced into SQL.
 */
public final class SqlIdentifiers {

    public static final String INVALID_LOGS = "invalid_logs";
    public static final String PROCESSING_TIME = "processing_time";

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z][A-Za-z0-9_]{0,127}");
    private static final Set<String> RESERVED = Set.of(INVALID_LOGS, PROCESSING_TIME);

    private SqlIdentifiers() {
    }

    /**
     * @return the log type unchanged
     * @throws IllegalArgumentException if it is not a plain identifier or names a ledger table
     */
    public static String requireLogType(String logType) {
        if (logType == null || !IDENTIFIER.matcher(logType).matches()) {
            throw new IllegalArgumentException("Log type is not a valid table name: " + logType);
        }
        if (RESERVED.contains(logType.toLowerCase(Locale.ROOT))) {
            throw new IllegalArgumentException("Log type collides with a ledger table: " + logType);
        }
        return logType;
    }
}
