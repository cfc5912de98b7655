package com.librarylogs.ezproxy.output;

import com.librarylogs.ezproxy.config.IngesterProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Creates the sink tables when they are missing. Existing tables are never altered.
 *
 * Tables:
 *   {log_type}       one per configured log type, parsed records
 *   invalid_logs     raw lines that failed to parse, all log types
 *   processing_time  one row per file attempt (the ledger)
 */
@Component
@Slf4j
public class SinkSchema {

    private final JdbcTemplate jdbcTemplate;
    private final SqlDialect dialect;

    @Autowired
    public SinkSchema(JdbcTemplate jdbcTemplate, IngesterProperties properties) {
        this(jdbcTemplate, properties.getSink().getDialect());
    }

    public SinkSchema(JdbcTemplate jdbcTemplate, SqlDialect dialect) {
        this.jdbcTemplate = jdbcTemplate;
        this.dialect = dialect;
    }

    public void ensureSchema(Collection<String> logTypes) {
        log.info("Ensuring sink schema exists ({} dialect)...", dialect);

        Set<String> tables = new LinkedHashSet<>(logTypes);
        for (String logType : tables) {
            createIfMissing(SqlIdentifiers.requireLogType(logType), recordTableDdl(logType));
        }
        createIfMissing(SqlIdentifiers.INVALID_LOGS, invalidLogsDdl());
        createIfMissing(SqlIdentifiers.PROCESSING_TIME, processingTimeDdl());

        log.info("Sink schema ready.");
    }

    private void createIfMissing(String table, String ddl) {
        if (tableExists(table)) {
            log.debug("Table {} already exists", table);
            return;
        }
        log.info("Creating table {}", table);
        jdbcTemplate.execute(ddl);
    }

    boolean tableExists(String table) {
        return tableExists(jdbcTemplate, table);
    }

    /** Looks the table up as given, upper-cased and lower-cased, since catalogs differ in case folding. */
    static boolean tableExists(JdbcTemplate jdbcTemplate, String table) {
        Boolean exists = jdbcTemplate.execute((ConnectionCallback<Boolean>) connection -> {
            DatabaseMetaData metaData = connection.getMetaData();
            Set<String> candidates = new LinkedHashSet<>(
                    List.of(table, table.toUpperCase(Locale.ROOT), table.toLowerCase(Locale.ROOT)));
            for (String candidate : candidates) {
                try (ResultSet rs = metaData.getTables(null, null, candidate, new String[]{"TABLE"})) {
                    if (rs.next()) {
                        return true;
                    }
                }
            }
            return false;
        });
        return Boolean.TRUE.equals(exists);
    }

    private String recordTableDdl(String logType) {
        String text = dialect.textType();
        String shortText = dialect.shortTextType();
        return """
            CREATE TABLE %s
            (
                ip_address             %s,
                username               %s,
                click_time             %s,
                request                %s NOT NULL,
                http_code              INTEGER,
                library_session        %s,
                referrer               %s,
                county                 %s,
                state                  %s,
                city                   %s,
                ezproxy_session        %s,
                file_path              %s NOT NULL,
                processing_start_time  %s NOT NULL
            )
            """.formatted(logType,
                shortText, shortText, dialect.timestampType(), text,
                shortText, text, shortText, shortText, shortText, shortText,
                shortText, dialect.timestampType());
    }

    private String invalidLogsDdl() {
        return """
            CREATE TABLE invalid_logs
            (
                log_line               %s,
                log_type               %s NOT NULL,
                file_path              %s NOT NULL,
                processing_start_time  %s NOT NULL
            )
            """.formatted(dialect.textType(), dialect.shortTextType(),
                dialect.shortTextType(), dialect.timestampType());
    }

    private String processingTimeDdl() {
        return """
            CREATE TABLE processing_time
            (
                file_path              %s NOT NULL,
                log_type               %s NOT NULL,
                processing_start_time  %s NOT NULL,
                processing_end_time    %s,
                valid                  %s NOT NULL,
                num_of_logs            BIGINT NOT NULL,
                num_invalid            BIGINT NOT NULL,
                error                  %s
            )
            """.formatted(dialect.shortTextType(), dialect.shortTextType(),
                dialect.timestampType(), dialect.timestampType(),
                dialect.booleanType(), dialect.textType());
    }
}
