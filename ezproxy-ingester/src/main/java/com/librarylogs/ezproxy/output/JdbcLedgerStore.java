package com.librarylogs.ezproxy.output;

import com.librarylogs.ezproxy.model.ProcessingRun;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.Timestamp;
import java.sql.Types;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;

@Component
@Slf4j
@RequiredArgsConstructor
public class JdbcLedgerStore implements LedgerStore {

    private static final RowMapper<ProcessingRun> RUN_MAPPER = (rs, rowNum) -> {
        Timestamp end = rs.getTimestamp("processing_end_time");
        return ProcessingRun.builder()
                .filePath(rs.getString("file_path"))
                .logType(rs.getString("log_type"))
                .processingStartTime(rs.getTimestamp("processing_start_time").toLocalDateTime())
                .processingEndTime(end != null ? end.toLocalDateTime() : null)
                .valid(rs.getBoolean("valid"))
                .numOfLogs(rs.getLong("num_of_logs"))
                .numInvalid(rs.getLong("num_invalid"))
                .error(rs.getString("error"))
                .build();
    };

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;

    @Override
    public boolean exists() {
        return guard("look up the ledger table",
                () -> SinkSchema.tableExists(jdbcTemplate, SqlIdentifiers.PROCESSING_TIME));
    }

    @Override
    public Set<String> processedFiles() {
        return filesWithRun(true);
    }

    @Override
    public Set<String> invalidFiles() {
        return filesWithRun(false);
    }

    @Override
    public boolean hasSuccessfulRun(String filePath) {
        return countRuns(filePath, true) > 0;
    }

    @Override
    public boolean hasFailedRun(String filePath) {
        return countRuns(filePath, false) > 0;
    }

    @Override
    public List<ProcessingRun> runsFor(String filePath) {
        return guard("read runs for " + filePath, () -> jdbcTemplate.query("""
                SELECT file_path, log_type, processing_start_time, processing_end_time,
                       valid, num_of_logs, num_invalid, error
                FROM processing_time
                WHERE file_path = ?
                ORDER BY processing_start_time
                """, RUN_MAPPER, filePath));
    }

    @Override
    public void recordRun(ProcessingRun run) {
        guard("record run for " + run.getFilePath(), () -> jdbcTemplate.update("""
                INSERT INTO processing_time
                (file_path, log_type, processing_start_time, processing_end_time,
                 valid, num_of_logs, num_invalid, error)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?)
                """, ps -> {
                    ps.setString(1, run.getFilePath());
                    ps.setString(2, run.getLogType());
                    ps.setTimestamp(3, Timestamp.valueOf(run.getProcessingStartTime()));
                    if (run.getProcessingEndTime() != null) {
                        ps.setTimestamp(4, Timestamp.valueOf(run.getProcessingEndTime()));
                    } else {
                        ps.setNull(4, Types.TIMESTAMP);
                    }
                    ps.setBoolean(5, run.isValid());
                    ps.setLong(6, run.getNumOfLogs());
                    ps.setLong(7, run.getNumInvalid());
                    if (run.getError() != null) {
                        ps.setString(8, run.getError());
                    } else {
                        ps.setNull(8, Types.VARCHAR);
                    }
                }));
        log.debug("Recorded {} run for {}", run.isValid() ? "valid" : "invalid", run.getFilePath());
    }

    @Override
    public void purgeStaleInvalidRuns(String filePath) {
        int removed = guard("purge invalid runs for " + filePath, () -> jdbcTemplate.update(
                "DELETE FROM processing_time WHERE file_path = ? AND valid = ?", filePath, false));
        log.info("Removed {} stale invalid run(s) for {}", removed, filePath);
    }

    @Override
    public void purgeRecordsForFile(String logType, String filePath) {
        String table = SqlIdentifiers.requireLogType(logType);
        guard("purge records for " + filePath, () -> transactionTemplate.execute(status -> {
            int valid = jdbcTemplate.update("DELETE FROM " + table + " WHERE file_path = ?", filePath);
            int invalid = jdbcTemplate.update("DELETE FROM invalid_logs WHERE file_path = ?", filePath);
            log.info("Purged {} record(s) and {} invalid line(s) for {}", valid, invalid, filePath);
            return null;
        }));
    }

    private Set<String> filesWithRun(boolean valid) {
        return guard("read processed files", () -> new LinkedHashSet<>(jdbcTemplate.queryForList(
                "SELECT DISTINCT file_path FROM processing_time WHERE valid = ?", String.class, valid)));
    }

    private long countRuns(String filePath, boolean valid) {
        Long count = guard("count runs for " + filePath, () -> jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM processing_time WHERE file_path = ? AND valid = ?",
                Long.class, filePath, valid));
        return count == null ? 0 : count;
    }

    private <T> T guard(String action, Supplier<T> call) {
        try {
            return call.get();
        } catch (DataAccessException | TransactionException e) {
            throw new LedgerException("Ledger failed to " + action + ": " + e.getMessage(), e);
        }
    }
}
