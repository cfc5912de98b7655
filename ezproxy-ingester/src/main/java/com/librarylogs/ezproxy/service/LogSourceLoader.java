package com.librarylogs.ezproxy.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.librarylogs.ezproxy.config.IngesterProperties;
import com.librarylogs.ezproxy.model.LogSource;
import com.librarylogs.ezproxy.output.SqlIdentifiers;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads the log sources once at startup, from the JSON config file when one is
 * configured, otherwise from {@code ezproxy.sources}.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class LogSourceLoader {

    private final IngesterProperties properties;
    private final ObjectMapper objectMapper;
    private final LogParserRegistry parserRegistry;

    private List<LogSource> sources = List.of();

    @PostConstruct
    public void load() {
        List<LogSource> loaded = properties.getConfigFile() != null && !properties.getConfigFile().isBlank()
                ? readConfigFile(Paths.get(properties.getConfigFile()))
                : properties.getSources();

        for (LogSource source : loaded) {
            validate(source);
        }
        sources = List.copyOf(loaded);
        log.info("Loaded {} log source(s): {}", sources.size(), sources);
    }

    public List<LogSource> sources() {
        return sources;
    }

    public Set<String> logTypes() {
        Set<String> logTypes = new LinkedHashSet<>();
        sources.forEach(s -> logTypes.add(s.getLogType()));
        return logTypes;
    }

    List<LogSource> readConfigFile(Path file) {
        log.info("Reading log sources from {}", file);
        try {
            return objectMapper.readValue(Files.readString(file), new TypeReference<List<LogSource>>() {});
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read log source config " + file + ": " + e.getMessage(), e);
        }
    }

    private void validate(LogSource source) {
        if (source.getLogDirectory() == null || source.getLogDirectory().isBlank()) {
            throw new IllegalStateException("Log source without log_directory: " + source);
        }
        SqlIdentifiers.requireLogType(source.getLogType());
        if (source.getDialect() == null || source.getDialect().isBlank()) {
            source.setDialect(EzproxyLogParser.DIALECT);
        }
        if (!parserRegistry.supports(source.getDialect())) {
            throw new IllegalStateException("No parser for dialect '" + source.getDialect() + "' of " + source);
        }
    }
}
