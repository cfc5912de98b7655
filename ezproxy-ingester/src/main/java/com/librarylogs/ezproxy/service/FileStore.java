package com.librarylogs.ezproxy.service;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

/**
 * File system operations the synchronizer and run driver depend on.
 * Source folders are only ever read; archive folders only ever receive new files.
 */
public interface FileStore {

    boolean exists(Path path);

    /** Regular files directly inside {@code dir}, sorted by path. */
    List<Path> list(Path dir) throws IOException;

    /** Regular files anywhere under {@code root}, sorted by path. */
    List<Path> walk(Path root) throws IOException;

    Instant lastModified(Path file) throws IOException;

    void createDirectories(Path dir) throws IOException;

    /**
     * Copies {@code source} into {@code targetDir} under the same name, keeping its
     * modification time. Never overwrites an existing file.
     *
     * @return the new file
     */
    Path copyInto(Path source, Path targetDir) throws IOException;
}
