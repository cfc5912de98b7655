package com.librarylogs.ezproxy.output;

import com.librarylogs.ezproxy.config.IngesterProperties;
import com.librarylogs.ezproxy.model.InvalidRecord;
import com.librarylogs.ezproxy.model.LogRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Writes records with batched, parameterised INSERTs.
 * Callers own the transaction; this class only issues statements.
 */
@Component
@Slf4j
public class JdbcRecordSink implements RecordSink {

    private final JdbcTemplate jdbcTemplate;
    private final int batchSize;

    @Autowired
    public JdbcRecordSink(JdbcTemplate jdbcTemplate, IngesterProperties properties) {
        this(jdbcTemplate, properties.getInsertBatchSize());
    }

    public JdbcRecordSink(JdbcTemplate jdbcTemplate, int batchSize) {
        this.jdbcTemplate = jdbcTemplate;
        this.batchSize = batchSize;
    }

    @Override
    public void append(String logType, List<LogRecord> records) {
        if (records.isEmpty()) return;

        String sql = """
            INSERT INTO %s
            (ip_address, username, click_time, request, http_code, library_session, referrer,
             county, state, city, ezproxy_session, file_path, processing_start_time)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """.formatted(SqlIdentifiers.requireLogType(logType));

        jdbcTemplate.batchUpdate(sql, records, batchSize, (ps, r) -> {
            setString(ps, 1, r.getIpAddress());
            setString(ps, 2, r.getUsername());
            setTimestamp(ps, 3, r.getClickTime());
            ps.setString(4, r.getRequest());
            if (r.getHttpCode() != null) {
                ps.setInt(5, r.getHttpCode());
            } else {
                ps.setNull(5, Types.INTEGER);
            }
            setString(ps, 6, r.getLibrarySession());
            setString(ps, 7, r.getReferrer());
            setString(ps, 8, r.getCounty());
            setString(ps, 9, r.getState());
            setString(ps, 10, r.getCity());
            setString(ps, 11, r.getEzproxySession());
            ps.setString(12, r.getFilePath());
            setTimestamp(ps, 13, r.getProcessingStartTime());
        });

        log.debug("Appended {} records to {}", records.size(), logType);
    }

    @Override
    public void appendInvalid(List<InvalidRecord> records) {
        if (records.isEmpty()) return;

        jdbcTemplate.batchUpdate("""
            INSERT INTO invalid_logs (log_line, log_type, file_path, processing_start_time)
            VALUES (?, ?, ?, ?)
            """, records, batchSize, (ps, r) -> {
            setString(ps, 1, r.getLogLine());
            ps.setString(2, r.getLogType());
            ps.setString(3, r.getFilePath());
            setTimestamp(ps, 4, r.getProcessingStartTime());
        });

        log.debug("Appended {} invalid lines", records.size());
    }

    private static void setString(PreparedStatement ps, int index, String value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.VARCHAR);
        } else {
            ps.setString(index, value);
        }
    }

    private static void setTimestamp(PreparedStatement ps, int index, LocalDateTime value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.TIMESTAMP);
        } else {
            ps.setTimestamp(index, Timestamp.valueOf(value));
        }
    }
}
