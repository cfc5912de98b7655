package com.librarylogs.ezproxy.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A directory of archived logs and the table its records go to.
 *
 * JSON form (CONFIG_FILE.json):
 *   [{"log_directory": "/data/LibraryLogs_RAW/ezproxy/proxyLogs", "log_type": "proxyLogs"}]
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LogSource {

    @JsonProperty("log_directory")
    private String logDirectory;

    @JsonProperty("log_type")
    private String logType;

    /** Parser dialect; the loader fills in EZproxy when it is omitted */
    @JsonProperty("dialect")
    private String dialect;
}
