package com.librarylogs.ezproxy.service;

import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * {@link FileStore} over java.nio; works for local folders and mounted or UNC shares.
 *
 * Copies go over the network from the library server, so a failed copy is retried
 * with backoff (resilience4j instance "archiveCopy").
 */
@Component
@Slf4j
public class LocalFileStore implements FileStore {

    @Override
    public boolean exists(Path path) {
        return Files.exists(path);
    }

    @Override
    public List<Path> list(Path dir) throws IOException {
        try (Stream<Path> entries = Files.list(dir)) {
            return entries.filter(Files::isRegularFile).sorted().collect(Collectors.toList());
        }
    }

    @Override
    public List<Path> walk(Path root) throws IOException {
        try (Stream<Path> entries = Files.walk(root)) {
            return entries.filter(Files::isRegularFile).sorted().collect(Collectors.toList());
        }
    }

    @Override
    public Instant lastModified(Path file) throws IOException {
        return Files.getLastModifiedTime(file).toInstant();
    }

    @Override
    public void createDirectories(Path dir) throws IOException {
        Files.createDirectories(dir);
    }

    @Override
    @Retry(name = "archiveCopy")
    public Path copyInto(Path source, Path targetDir) throws IOException {
        Path target = targetDir.resolve(source.getFileName());
        log.debug("Copying {} -> {}", source, target);
        return Files.copy(source, target, StandardCopyOption.COPY_ATTRIBUTES);
    }
}
