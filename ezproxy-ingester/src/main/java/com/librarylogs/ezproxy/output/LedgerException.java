package com.librarylogs.ezproxy.output;

/**
 * The processing ledger could not be read or written. No file can be safely
 * skipped, retried or rolled back after this, so the whole run stops.
 */
public class LedgerException extends RuntimeException {

    public LedgerException(String message, Throwable cause) {
        super(message, cause);
    }
}
