package com.cinegraph.collab.store;

import com.cinegraph.collab.model.Credit;
import com.cinegraph.collab.model.Work;
import io.github.resilience4j.retry.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Reads works and credits from the catalog tables written by the ingestion side:
 *
 *   works(id, release_year, rating, revenue)
 *   work_genres(work_id, genre)
 *   credits(work_id, person_id, role_kind, billing_order)
 *   people(id, ...)
 *
 * Works without a release year are not eligible for edges.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class JdbcCreditFeed implements CreditFeed {

    private final JdbcTemplate jdbcTemplate;
    private final Retry storeRetry;

    @Override
    public Optional<Work> findWork(long workId) {
        return storeRetry.executeSupplier(() -> loadWork(workId));
    }

    private Optional<Work> loadWork(long workId) {
        List<Work> works = jdbcTemplate.query("""
                SELECT id, release_year, rating, revenue
                FROM works
                WHERE id = ? AND release_year IS NOT NULL
                """,
                (rs, i) -> Work.builder()
                        .workId(rs.getLong("id"))
                        .releaseYear(rs.getInt("release_year"))
                        .rating(rs.getBigDecimal("rating"))
                        .revenue(Columns.longOrNull(rs, "revenue"))
                        .build(),
                workId);
        if (works.isEmpty()) {
            return Optional.empty();
        }

        Work work = works.get(0);
        work.setGenres(jdbcTemplate.queryForList(
                "SELECT genre FROM work_genres WHERE work_id = ? ORDER BY genre", String.class, workId));
        return Optional.of(work);
    }

    @Override
    public List<Credit> creditsFor(long workId) {
        return storeRetry.executeSupplier(() -> jdbcTemplate.query("""
                SELECT person_id, role_kind, billing_order
                FROM credits
                WHERE work_id = ?
                """,
                (rs, i) -> Credit.builder()
                        .personId(Columns.longOrNull(rs, "person_id"))
                        .roleKind(rs.getString("role_kind"))
                        .billingOrder(Columns.intOrNull(rs, "billing_order"))
                        .build(),
                workId));
    }

    @Override
    public List<Long> allWorkIds() {
        return storeRetry.executeSupplier(() -> jdbcTemplate.queryForList(
                "SELECT id FROM works WHERE release_year IS NOT NULL ORDER BY id", Long.class));
    }

    @Override
    public boolean personExists(long personId) {
        Integer found = storeRetry.executeSupplier(() -> jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM people WHERE id = ?", Integer.class, personId));
        return found != null && found > 0;
    }
}
