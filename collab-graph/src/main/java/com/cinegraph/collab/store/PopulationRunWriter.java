package com.cinegraph.collab.store;

import com.cinegraph.collab.model.PopulationRun;
import io.github.resilience4j.retry.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Run bookkeeping. A failure to record a run is logged and never fails the
 * run itself.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class PopulationRunWriter {

    private final JdbcTemplate jdbcTemplate;
    private final Retry storeRetry;

    public void writeRun(PopulationRun run) {
        try {
            int updated = jdbcTemplate.update("""
                    UPDATE population_runs SET completed_at = ?, status = ?, works_processed = ?,
                        works_failed = ?, details_written = ?, error_message = ?
                    WHERE run_id = ?
                    """,
                    timestamp(run.getCompletedAt()), run.getStatus(), run.getWorksProcessed(),
                    run.getWorksFailed(), run.getDetailsWritten(), run.getErrorMessage(), run.getRunId());
            if (updated == 0) {
                jdbcTemplate.update("""
                        INSERT INTO population_runs
                        (run_id, kind, started_at, completed_at, status, works_processed,
                         works_failed, details_written, error_message)
                        VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
                        """,
                        run.getRunId(), run.getKind(), timestamp(run.getStartedAt()), timestamp(run.getCompletedAt()),
                        run.getStatus(), run.getWorksProcessed(), run.getWorksFailed(), run.getDetailsWritten(),
                        run.getErrorMessage());
            }
        } catch (DataAccessException e) {
            log.warn("Failed to write population run {}: {}", run.getRunId(), e.getMessage());
        }
    }

    public List<PopulationRun> recentRuns(int limit) {
        return storeRetry.executeSupplier(() -> jdbcTemplate.query("""
                SELECT run_id, kind, started_at, completed_at, status, works_processed,
                       works_failed, details_written, error_message
                FROM population_runs
                ORDER BY started_at DESC
                LIMIT ?
                """,
                (rs, i) -> PopulationRun.builder()
                        .runId(rs.getString("run_id"))
                        .kind(rs.getString("kind"))
                        .startedAt(rs.getTimestamp("started_at").toLocalDateTime())
                        .completedAt(rs.getTimestamp("completed_at") != null
                                ? rs.getTimestamp("completed_at").toLocalDateTime() : null)
                        .status(rs.getString("status"))
                        .worksProcessed(rs.getInt("works_processed"))
                        .worksFailed(rs.getInt("works_failed"))
                        .detailsWritten(rs.getInt("details_written"))
                        .errorMessage(rs.getString("error_message"))
                        .build(),
                limit));
    }

    private Timestamp timestamp(LocalDateTime value) {
        return value == null ? null : Timestamp.valueOf(value);
    }
}
