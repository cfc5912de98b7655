package com.librarylogs.ezproxy.service;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LineBatchReaderTest {

    @TempDir
    Path tempDir;

    @Test
    void nextBatch_splitsFileIntoBoundedBatchesInOrder() throws IOException {
        Path file = tempDir.resolve("access.log");
        Files.writeString(file, "a\nb\nc\nd\ne\n");

        try (LineBatchReader reader = LineBatchReader.open(file, 2)) {
            assertThat(reader.nextBatch()).containsExactly("a", "b");
            assertThat(reader.nextBatch()).containsExactly("c", "d");
            assertThat(reader.nextBatch()).containsExactly("e");
            assertThat(reader.nextBatch()).isEmpty();
            assertThat(reader.nextBatch()).isEmpty();
        }
    }

    @Test
    void nextBatch_skipsBlankLines() throws IOException {
        Path file = tempDir.resolve("access.log");
        Files.writeString(file, "a\n\n   \nb\r\nc");

        try (LineBatchReader reader = LineBatchReader.open(file, 10)) {
            assertThat(reader.nextBatch()).containsExactly("a", "b", "c");
            assertThat(reader.nextBatch()).isEmpty();
        }
    }

    @Test
    void nextBatch_emptyFile_returnsNoBatches() throws IOException {
        Path file = tempDir.resolve("empty.log");
        Files.createFile(file);

        try (LineBatchReader reader = LineBatchReader.open(file, 10)) {
            assertThat(reader.nextBatch()).isEmpty();
        }
    }

    @Test
    void nextBatch_invalidUtf8_throws() throws IOException {
        Path file = tempDir.resolve("broken.log");
        Files.write(file, new byte[]{'o', 'k', '\n', (byte) 0xC3, (byte) 0x28, '\n'});

        try (LineBatchReader reader = LineBatchReader.open(file, 10)) {
            assertThatThrownBy(reader::nextBatch).isInstanceOf(IOException.class);
        }
    }

    @Test
    void open_rejectsNonPositiveBatchSize() throws IOException {
        Path file = tempDir.resolve("access.log");
        Files.writeString(file, "a\n");

        assertThatThrownBy(() -> LineBatchReader.open(file, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
