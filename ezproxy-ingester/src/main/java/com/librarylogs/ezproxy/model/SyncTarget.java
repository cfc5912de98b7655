package com.librarylogs.ezproxy.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A stream of logs on the library server and the archive folder it is copied into.
 * Only entries of sourceRoot whose path contains {@code pattern} belong to the stream.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SyncTarget {

    private String logType;
    private String sourceRoot;
    private String archiveRoot;
    private String pattern;
}
