package com.librarylogs.ezproxy.output;

import com.librarylogs.ezproxy.model.InvalidRecord;
import com.librarylogs.ezproxy.model.LogRecord;

import java.util.List;

/**
 * Append-only destination for parsed and rejected lines.
 */
public interface RecordSink {

    void append(String logType, List<LogRecord> records);

    void appendInvalid(List<InvalidRecord> records);
}
