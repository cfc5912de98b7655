package com.librarylogs.ezproxy.model;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * One successfully parsed access-log line, ready for the per-log-type table.
 *
 * Every field except {@code request} may be null: placeholder tokens ("-" or a
 * single space) are stored as NULL rather than as text.
 */
@Data
@Builder
public class LogRecord {

    // ── Parsed from the line ────────────────────────────────────────────────
    private String ipAddress;
    private String username;

    /** Click time without its UTC offset, as written by the proxy */
    private LocalDateTime clickTime;

    /** Request line, e.g. "GET /login?url=... HTTP/1.1". Never null */
    private String request;

    private Integer httpCode;
    private String librarySession;
    private String referrer;

    // ── Geo lookup columns, mostly "-" in practice ──────────────────────────
    private String county;
    private String state;
    private String city;

    /** 22-character EZproxy session id, when the line carries one */
    private String ezproxySession;

    // ── Lineage ─────────────────────────────────────────────────────────────
    private String filePath;
    private LocalDateTime processingStartTime;
}
