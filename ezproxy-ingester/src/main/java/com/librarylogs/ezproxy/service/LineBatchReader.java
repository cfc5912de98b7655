package com.librarylogs.ezproxy.service;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a UTF-8 text file as consecutive batches of at most {@code batchSize}
 * non-blank lines, so only one batch is ever held in memory.
 */
public class LineBatchReader implements Closeable {

    private final BufferedReader reader;
    private final int batchSize;
    private boolean exhausted;

    private LineBatchReader(BufferedReader reader, int batchSize) {
        this.reader = reader;
        this.batchSize = batchSize;
    }

    public static LineBatchReader open(Path file, int batchSize) throws IOException {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be positive: " + batchSize);
        }
        return new LineBatchReader(Files.newBufferedReader(file, StandardCharsets.UTF_8), batchSize);
    }

    /**
     * @return the next batch, or an empty list once the file is exhausted
     */
    public List<String> nextBatch() throws IOException {
        if (exhausted) return List.of();

        List<String> batch = new ArrayList<>(Math.min(batchSize, 8192));
        String line;
        while (batch.size() < batchSize) {
            line = reader.readLine();
            if (line == null) {
                exhausted = true;
                break;
            }
            if (!line.isBlank()) {
                batch.add(line);
            }
        }
        return batch;
    }

    @Override
    public void close() throws IOException {
        reader.close();
    }
}
