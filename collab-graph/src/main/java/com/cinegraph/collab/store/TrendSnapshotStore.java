package com.cinegraph.collab.store;

import com.cinegraph.collab.model.TrendScore;
import io.github.resilience4j.retry.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.PreparedStatement;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;

/**
 * Holds the current trend snapshot.
 *
 * A refresh deletes and rewrites trend_scores inside one transaction, so
 * readers see either the previous snapshot or the new one, never a mix.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class TrendSnapshotStore {

    private static final int BATCH_SIZE = 1000;

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final Retry storeRetry;

    /** One detail row of a pair that has activity after the window start. */
    public record PairActivity(long personLowId, long personHighId, Integer firstYear, Integer lastYear, int releaseYear) {
    }

    public List<PairActivity> activitySince(int windowStartYear) {
        return storeRetry.executeSupplier(() -> jdbcTemplate.query("""
                SELECT p.person_low_id, p.person_high_id, p.first_year, p.last_year, d.release_year
                FROM collaboration_pairs p
                JOIN collaboration_details d ON d.pair_id = p.id
                WHERE p.last_year > ?
                ORDER BY p.person_low_id, p.person_high_id, d.release_year
                """,
                (rs, i) -> new PairActivity(
                        rs.getLong("person_low_id"),
                        rs.getLong("person_high_id"),
                        Columns.intOrNull(rs, "first_year"),
                        Columns.intOrNull(rs, "last_year"),
                        rs.getInt("release_year")),
                windowStartYear));
    }

    public void replaceSnapshot(List<TrendScore> scores, int windowStartYear, Instant refreshedAt) {
        storeRetry.executeRunnable(() -> transactionTemplate.executeWithoutResult(status -> {
            jdbcTemplate.update("DELETE FROM trend_scores");

            for (int i = 0; i < scores.size(); i += BATCH_SIZE) {
                List<TrendScore> batch = scores.subList(i, Math.min(i + BATCH_SIZE, scores.size()));
                jdbcTemplate.batchUpdate("""
                        INSERT INTO trend_scores
                        (person_low_id, person_high_id, trend_score, recent_count, baseline_count, last_year)
                        VALUES (?, ?, ?, ?, ?, ?)
                        """, batch, batch.size(), (PreparedStatement ps, TrendScore s) -> {
                    ps.setLong(1, s.getPersonLowId());
                    ps.setLong(2, s.getPersonHighId());
                    ps.setBigDecimal(3, s.getTrendScore());
                    ps.setInt(4, s.getRecentCount());
                    ps.setInt(5, s.getBaselineCount());
                    ps.setObject(6, s.getLastYear());
                });
            }

            jdbcTemplate.update(
                    "INSERT INTO trend_refreshes (refreshed_at, window_start_year, pair_count) VALUES (?, ?, ?)",
                    Timestamp.from(refreshedAt), windowStartYear, scores.size());
        }));
        log.info("Trend snapshot replaced: {} pairs (window starts after {})", scores.size(), windowStartYear);
    }

    public List<TrendScore> top(int limit) {
        return storeRetry.executeSupplier(() -> jdbcTemplate.query("""
                SELECT person_low_id, person_high_id, trend_score, recent_count, baseline_count, last_year
                FROM trend_scores
                ORDER BY trend_score DESC, recent_count DESC, person_low_id, person_high_id
                LIMIT ?
                """,
                (rs, i) -> TrendScore.builder()
                        .personLowId(rs.getLong("person_low_id"))
                        .personHighId(rs.getLong("person_high_id"))
                        .trendScore(rs.getBigDecimal("trend_score"))
                        .recentCount(rs.getInt("recent_count"))
                        .baselineCount(rs.getInt("baseline_count"))
                        .lastYear(Columns.intOrNull(rs, "last_year"))
                        .build(),
                limit));
    }
}
