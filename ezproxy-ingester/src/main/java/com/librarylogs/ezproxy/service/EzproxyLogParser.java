package com.librarylogs.ezproxy.service;

import com.librarylogs.ezproxy.model.InvalidRecord;
import com.librarylogs.ezproxy.model.LogRecord;
import com.librarylogs.ezproxy.model.ParseResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses EZproxy access logs (Apache combined format plus EZproxy extras).
 *
 * Example:
 *   192.0.2.5 - jdoe [01/Jan/2020:10:00:00 -0500] "GET https://www.jstor.org:443/ HTTP/1.1" 200 1234
 *     SESSION1 https://search.lib.umich.edu/ "Mozilla/5.0 (Windows NT 10.0)" - - - ABCDEFGHIJKLMNOPQRSTUV
 *
 * Grammar rules, in order:
 *   1. referrer is the shortest run of text that lets the rest of the line match
 *   2. the quoted user agent is optional and discarded
 *   3. county, state and city are each the shortest text before the next single space
 *   4. a trailing 22-character token (or "-") is the EZproxy session id
 */
@Slf4j
@Component
public class EzproxyLogParser implements LogParser {

    public static final String DIALECT = "ezproxy";

    private static final Pattern LINE_PATTERN = Pattern.compile(
        "^(?<ipAddress>\\S+) \\S+ (?<username>\\S+)" +               // client, ident, user
        " \\[(?<clickTime>[\\w:/]+\\s[+\\-]\\d{4})\\]" +             // [01/Jan/2020:10:00:00 +0000]
        " \"(?<request>.*?)\\s?\"" +                                  // "GET /x HTTP/1.1"
        " (?<httpCode>\\d{3}|-) (?:\\d+|-\\s?)" +                     // status, bytes
        " (?<librarySession>\\S+)" +
        " (?<referrer>.+?)" +
        "(?: \"?\\\\?\"[^\"]*?\"\\\\?\"?)?" +                          // user agent, possibly escaped
        " (?<county>.*?|\\s) (?<state>.*?|\\s) (?<city>.*?|\\s)" +
        "(?:\\s(?<ezproxySession>\\S{22}|-))?$"
    );

    // Offset is dropped: click times are stored as the proxy's local time.
    private static final Pattern CLICK_TIME = Pattern.compile(
        "([0-9]{2}/[a-zA-Z]{3}/[0-9]{4}:[0-9]{2}:[0-9]{2}:[0-9]{2})");

    private static final DateTimeFormatter CLICK_TIME_FORMAT =
        DateTimeFormatter.ofPattern("dd/MMM/yyyy:HH:mm:ss", Locale.ENGLISH);

    @Override
    public String dialect() {
        return DIALECT;
    }

    @Override
    public ParseResult parse(List<String> lines) {
        List<LogRecord> valid = new ArrayList<>(lines.size());
        List<InvalidRecord> invalid = new ArrayList<>();

        for (String line : lines) {
            LogRecord record = parseLine(line);
            if (record != null) {
                valid.add(record);
            } else {
                invalid.add(InvalidRecord.builder().logLine(line).build());
            }
        }

        log.debug("Parsed batch: {} valid, {} invalid", valid.size(), invalid.size());
        return new ParseResult(valid, invalid);
    }

    /**
     * @return the record, or null when the line is not a usable EZproxy line
     */
    LogRecord parseLine(String line) {
        if (line == null) return null;

        Matcher matcher = LINE_PATTERN.matcher(line);
        if (!matcher.matches()) {
            log.trace("Line does not match EZproxy format: {}", line);
            return null;
        }

        try {
            String request = emptyToNull(nullToken(matcher.group("request")));
            if (request == null) {
                log.trace("No request in line: {}", line);
                return null;
            }

            String httpCode = nullToken(matcher.group("httpCode"));

            return LogRecord.builder()
                    .ipAddress(nullToken(matcher.group("ipAddress")))
                    .username(nullToken(matcher.group("username")))
                    .clickTime(parseClickTime(matcher.group("clickTime")))
                    .request(request)
                    .httpCode(httpCode != null ? Integer.valueOf(httpCode) : null)
                    .librarySession(nullToken(matcher.group("librarySession")))
                    .referrer(nullToken(matcher.group("referrer")))
                    .county(nullToken(matcher.group("county")))
                    .state(nullToken(matcher.group("state")))
                    .city(nullToken(matcher.group("city")))
                    .ezproxySession(nullToken(matcher.group("ezproxySession")))
                    .build();

        } catch (DateTimeParseException | NumberFormatException e) {
            log.trace("Rejected line {}: {}", line, e.getMessage());
            return null;
        }
    }

    LocalDateTime parseClickTime(String raw) {
        Matcher matcher = CLICK_TIME.matcher(raw);
        if (!matcher.find()) {
            throw new DateTimeParseException("No click time in " + raw, raw, 0);
        }
        return LocalDateTime.parse(matcher.group(1), CLICK_TIME_FORMAT);
    }

    /** "-" and a lone space are how EZproxy writes an empty field. */
    static String nullToken(String value) {
        if (value == null || value.equals("-") || value.equals(" ")) {
            return null;
        }
        return value;
    }

    private static String emptyToNull(String value) {
        return (value == null || value.isEmpty()) ? null : value;
    }
}
