package com.furnaceintel.pipeline.ledger;

import com.furnaceintel.pipeline.model.RunRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Local record of pipeline runs, one row per (date_run, range, mode).
 *
 * Re-running a key replaces its row, so a backfill can be repeated without piling up
 * ledger entries.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class RunLedger {

    private static final RowMapper<RunRecord> ROW_MAPPER = (rs, rowNum) -> RunRecord.builder()
            .runTime(rs.getString("run_time"))
            .dateRun(rs.getString("date_run"))
            .range(rs.getString("range"))
            .mode(rs.getString("mode"))
            .parameters(rs.getString("parameters"))
            .processId(rs.getLong("process_id"))
            .success(rs.getInt("success") == 1)
            .numRecords(rs.getInt("num_records"))
            .logPath(rs.getString("log_path"))
            .pointsFilePath(rs.getString("points_file_path"))
            .build();

    private final JdbcTemplate jdbcTemplate;

    public void init() {
        log.info("Ensuring run ledger schema exists...");

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS runs (
                id               INTEGER PRIMARY KEY AUTOINCREMENT,
                run_time         TEXT,
                date_run         TEXT,
                "range"          TEXT,
                mode             TEXT,
                parameters       TEXT,
                process_id       INTEGER,
                success          INTEGER,
                num_records      INTEGER,
                log_path         TEXT,
                points_file_path TEXT,
                UNIQUE(date_run, "range", mode) ON CONFLICT REPLACE
            )
        """);

        log.info("Run ledger ready.");
    }

    public void upsert(RunRecord run) {
        jdbcTemplate.update("""
            INSERT INTO runs (run_time, date_run, "range", mode, parameters, process_id,
                              success, num_records, log_path, points_file_path)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT(date_run, "range", mode) DO UPDATE SET
                run_time = excluded.run_time,
                parameters = excluded.parameters,
                process_id = excluded.process_id,
                success = excluded.success,
                num_records = excluded.num_records,
                log_path = excluded.log_path,
                points_file_path = excluded.points_file_path
            """,
                run.getRunTime(),
                run.getDateRun(),
                run.getRange(),
                run.getMode(),
                run.getParameters(),
                run.getProcessId(),
                run.isSuccess() ? 1 : 0,
                run.getNumRecords(),
                run.getLogPath(),
                run.getPointsFilePath());

        log.info("Logged {} run {} range {}: success={}, records={}",
                run.getMode(), run.getDateRun(), run.getRange(), run.isSuccess(), run.getNumRecords());
    }

    public Optional<RunRecord> find(String dateRun, String range, String mode) {
        List<RunRecord> rows = jdbcTemplate.query("""
            SELECT * FROM runs WHERE date_run = ? AND "range" = ? AND mode = ?
            """, ROW_MAPPER, dateRun, range, mode);
        return rows.stream().findFirst();
    }

    public List<RunRecord> findAll() {
        return jdbcTemplate.query("SELECT * FROM runs ORDER BY run_time DESC, id DESC", ROW_MAPPER);
    }
}
