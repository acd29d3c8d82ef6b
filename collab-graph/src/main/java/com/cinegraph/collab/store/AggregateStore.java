package com.cinegraph.collab.store;

import com.cinegraph.collab.model.CollaborationDetail;
import com.cinegraph.collab.model.CollaborationPair;
import com.cinegraph.collab.model.CollaborationType;
import com.cinegraph.collab.model.PairCandidate;
import com.cinegraph.collab.model.PersonPair;
import com.cinegraph.collab.model.Work;
import com.cinegraph.collab.service.PairAggregates;
import io.github.resilience4j.retry.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.Timestamp;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Writes pair summaries and per-work detail rows.
 *
 * One transaction per work. Pairs are touched in canonical (low, high) order
 * so concurrent writers always lock shared rows in the same sequence. Each
 * pair's aggregates are recomputed from all of its detail rows rather than
 * incremented, which keeps re-applies and rebuilds exact.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class AggregateStore {

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final Retry storeRetry;
    private final Clock clock;

    static final RowMapper<CollaborationDetail> DETAIL_MAPPER = (rs, i) -> CollaborationDetail.builder()
            .pairId(rs.getLong("pair_id"))
            .workId(rs.getLong("work_id"))
            .collaborationType(CollaborationType.fromCode(rs.getString("collaboration_type")))
            .personLowRole(rs.getString("person_low_role"))
            .personHighRole(rs.getString("person_high_role"))
            .releaseYear(rs.getInt("release_year"))
            .rating(rs.getBigDecimal("rating"))
            .revenue(Columns.longOrNull(rs, "revenue"))
            .genres(Columns.split(rs.getString("genres"), s -> s))
            .build();

    static final RowMapper<CollaborationPair> PAIR_MAPPER = (rs, i) -> CollaborationPair.builder()
            .id(rs.getLong("id"))
            .personLowId(rs.getLong("person_low_id"))
            .personHighId(rs.getLong("person_high_id"))
            .collaborationCount(rs.getInt("collaboration_count"))
            .firstYear(Columns.intOrNull(rs, "first_year"))
            .lastYear(Columns.intOrNull(rs, "last_year"))
            .avgRating(rs.getBigDecimal("avg_rating"))
            .totalRevenue(rs.getLong("total_revenue"))
            .types(Columns.split(rs.getString("types"), CollaborationType::fromCode))
            .yearsActive(Columns.split(rs.getString("years_active"), Integer::valueOf))
            .peakYear(Columns.intOrNull(rs, "peak_year"))
            .genreDiversity(rs.getBigDecimal("genre_diversity"))
            .roleDiversity(rs.getBigDecimal("role_diversity"))
            .createdAt(rs.getTimestamp("created_at").toLocalDateTime())
            .updatedAt(rs.getTimestamp("updated_at").toLocalDateTime())
            .build();

    static final String PAIR_COLUMNS = """
            id, person_low_id, person_high_id, collaboration_count, first_year, last_year,
            avg_rating, total_revenue, types, years_active, peak_year,
            genre_diversity, role_diversity, created_at, updated_at
            """;

    static final String DETAIL_COLUMNS = """
            pair_id, work_id, collaboration_type, person_low_role, person_high_role,
            release_year, rating, revenue, genres
            """;

    /**
     * Merge one work's candidates into the store.
     *
     * @return number of detail rows inserted or re-typed; 0 when the work was already applied
     */
    public int apply(Work work, List<PairCandidate> candidates) {
        if (candidates.isEmpty()) return 0;

        List<PairCandidate> ordered = candidates.stream()
                .sorted((a, b) -> a.pair().compareTo(b.pair()))
                .collect(Collectors.toList());

        Integer written = storeRetry.executeSupplier(() ->
                transactionTemplate.execute(status -> applyInTransaction(work, ordered)));
        return written == null ? 0 : written;
    }

    private int applyInTransaction(Work work, List<PairCandidate> ordered) {
        Timestamp now = Timestamp.from(clock.instant());
        String genres = Columns.join(work.getGenres());
        int written = 0;

        for (PairCandidate candidate : ordered) {
            PersonPair pair = candidate.pair();

            jdbcTemplate.update("""
                    INSERT INTO collaboration_pairs
                    (person_low_id, person_high_id, collaboration_count, total_revenue, created_at, updated_at)
                    VALUES (?, ?, 0, 0, ?, ?)
                    ON CONFLICT DO NOTHING
                    """, pair.lowId(), pair.highId(), now, now);

            Long pairId = jdbcTemplate.queryForObject("""
                    SELECT id FROM collaboration_pairs
                    WHERE person_low_id = ? AND person_high_id = ?
                    FOR UPDATE
                    """, Long.class, pair.lowId(), pair.highId());

            int changed = jdbcTemplate.update("""
                    INSERT INTO collaboration_details
                    (pair_id, work_id, collaboration_type, person_low_role, person_high_role,
                     release_year, rating, revenue, genres)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
                    ON CONFLICT DO NOTHING
                    """,
                    pairId, work.getWorkId(), candidate.type().code(), candidate.lowRole(), candidate.highRole(),
                    work.getReleaseYear(), work.getRating(), work.getRevenue(), genres);

            if (changed == 0) {
                // Already applied; only a changed edge policy can alter the stored type.
                changed = jdbcTemplate.update("""
                        UPDATE collaboration_details
                        SET collaboration_type = ?, person_low_role = ?, person_high_role = ?
                        WHERE pair_id = ? AND work_id = ? AND collaboration_type <> ?
                        """,
                        candidate.type().code(), candidate.lowRole(), candidate.highRole(),
                        pairId, work.getWorkId(), candidate.type().code());
            }

            if (changed > 0) {
                recompute(pairId, pair, now);
                written++;
            }
        }

        log.debug("Work {}: {} candidates, {} detail rows written", work.getWorkId(), ordered.size(), written);
        return written;
    }

    private void recompute(long pairId, PersonPair pair, Timestamp now) {
        List<CollaborationDetail> details = jdbcTemplate.query(
                "SELECT " + DETAIL_COLUMNS + " FROM collaboration_details WHERE pair_id = ?",
                DETAIL_MAPPER, pairId);
        CollaborationPair aggregates = PairAggregates.compute(pair, details);

        jdbcTemplate.update("""
                UPDATE collaboration_pairs SET
                    collaboration_count = ?, first_year = ?, last_year = ?, avg_rating = ?,
                    total_revenue = ?, types = ?, years_active = ?, peak_year = ?,
                    genre_diversity = ?, role_diversity = ?, updated_at = ?
                WHERE id = ?
                """,
                aggregates.getCollaborationCount(),
                aggregates.getFirstYear(),
                aggregates.getLastYear(),
                aggregates.getAvgRating(),
                aggregates.getTotalRevenue(),
                Columns.join(aggregates.getTypes().stream().map(CollaborationType::code).collect(Collectors.toList())),
                Columns.join(aggregates.getYearsActive()),
                aggregates.getPeakYear(),
                aggregates.getGenreDiversity(),
                aggregates.getRoleDiversity(),
                now,
                pairId);
    }

    /** Removes every pair and detail row. Used by full rebuilds only. */
    public void deleteAll() {
        storeRetry.executeRunnable(() -> transactionTemplate.executeWithoutResult(status -> {
            int details = jdbcTemplate.update("DELETE FROM collaboration_details");
            int pairs = jdbcTemplate.update("DELETE FROM collaboration_pairs");
            log.info("Cleared {} collaboration pairs and {} detail rows", pairs, details);
        }));
    }

    public Optional<CollaborationPair> findPair(PersonPair pair) {
        List<CollaborationPair> rows = storeRetry.executeSupplier(() -> jdbcTemplate.query(
                "SELECT " + PAIR_COLUMNS + " FROM collaboration_pairs WHERE person_low_id = ? AND person_high_id = ?",
                PAIR_MAPPER, pair.lowId(), pair.highId()));
        return rows.stream().findFirst();
    }

    /** Every pair in canonical order. */
    public List<CollaborationPair> findAllPairs() {
        return storeRetry.executeSupplier(() -> jdbcTemplate.query(
                "SELECT " + PAIR_COLUMNS + " FROM collaboration_pairs ORDER BY person_low_id, person_high_id",
                PAIR_MAPPER));
    }
}
