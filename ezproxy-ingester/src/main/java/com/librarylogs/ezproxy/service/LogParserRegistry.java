package com.librarylogs.ezproxy.service;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Selects the {@link LogParser} for a log source's dialect.
 * Spring injects every parser bean; dialect names are matched case-insensitively.
 */
@Component
@Slf4j
public class LogParserRegistry {

    private final List<LogParser> parsers;

    public LogParserRegistry(List<LogParser> parsers) {
        this.parsers = parsers;
    }

    @PostConstruct
    public void init() {
        log.info("Registered {} log parser(s):", parsers.size());
        for (LogParser p : parsers) {
            log.info("  - {} ({})", p.dialect(), p.getClass().getSimpleName());
        }
    }

    public boolean supports(String dialect) {
        return parsers.stream().anyMatch(p -> p.dialect().equalsIgnoreCase(dialect));
    }

    public LogParser getParser(String dialect) {
        return parsers.stream()
                .filter(p -> p.dialect().equalsIgnoreCase(dialect))
                .findFirst()
                .orElseThrow(() -> new IllegalStateException(
                        "No parser found for dialect=" + dialect));
    }
}
