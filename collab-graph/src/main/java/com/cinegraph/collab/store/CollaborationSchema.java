package com.cinegraph.collab.store;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * DDL for the tables this service owns. Every statement is idempotent so it
 * can run on each startup.
 *
 * Upstream catalog tables (works, work_genres, credits, people) are not
 * created here; they belong to the ingestion side.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CollaborationSchema {

    private final JdbcTemplate jdbcTemplate;

    public void ensureSchema() {
        log.info("Ensuring collaboration schema exists...");

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS collaboration_pairs
            (
                id                  BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                person_low_id       BIGINT       NOT NULL,
                person_high_id      BIGINT       NOT NULL,
                collaboration_count INTEGER      NOT NULL DEFAULT 0,
                first_year          INTEGER,
                last_year           INTEGER,
                avg_rating          NUMERIC(5,2),
                total_revenue       BIGINT       NOT NULL DEFAULT 0,
                types               VARCHAR(200),
                years_active        VARCHAR(2000),
                peak_year           INTEGER,
                genre_diversity     NUMERIC(3,2),
                role_diversity      NUMERIC(3,2),
                created_at          TIMESTAMP    NOT NULL,
                updated_at          TIMESTAMP    NOT NULL,
                CONSTRAINT collaboration_pairs_ordered CHECK (person_low_id < person_high_id),
                CONSTRAINT collaboration_pairs_unique UNIQUE (person_low_id, person_high_id)
            )
        """);
        jdbcTemplate.execute(
                "CREATE INDEX IF NOT EXISTS collaboration_pairs_high_idx ON collaboration_pairs (person_high_id, person_low_id)");
        jdbcTemplate.execute(
                "CREATE INDEX IF NOT EXISTS collaboration_pairs_last_year_idx ON collaboration_pairs (last_year)");

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS collaboration_details
            (
                id                  BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                pair_id             BIGINT       NOT NULL REFERENCES collaboration_pairs (id) ON DELETE CASCADE,
                work_id             BIGINT       NOT NULL,
                collaboration_type  VARCHAR(32)  NOT NULL,
                person_low_role     VARCHAR(64),
                person_high_role    VARCHAR(64),
                release_year        INTEGER      NOT NULL,
                rating              NUMERIC(5,2),
                revenue             BIGINT,
                genres              VARCHAR(1000),
                CONSTRAINT collaboration_details_unique UNIQUE (pair_id, work_id)
            )
        """);
        jdbcTemplate.execute(
                "CREATE INDEX IF NOT EXISTS collaboration_details_work_idx ON collaboration_details (work_id)");
        jdbcTemplate.execute(
                "CREATE INDEX IF NOT EXISTS collaboration_details_year_idx ON collaboration_details (release_year)");

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS path_cache
            (
                person_low_id       BIGINT        NOT NULL,
                person_high_id      BIGINT        NOT NULL,
                path                VARCHAR(1000) NOT NULL,
                path_length         INTEGER       NOT NULL,
                computed_at         TIMESTAMP     NOT NULL,
                expires_at          TIMESTAMP     NOT NULL,
                PRIMARY KEY (person_low_id, person_high_id),
                CONSTRAINT path_cache_ordered CHECK (person_low_id < person_high_id)
            )
        """);
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS path_cache_expires_idx ON path_cache (expires_at)");

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS trend_scores
            (
                person_low_id       BIGINT         NOT NULL,
                person_high_id      BIGINT         NOT NULL,
                trend_score         NUMERIC(14,4)  NOT NULL,
                recent_count        INTEGER        NOT NULL,
                baseline_count      INTEGER        NOT NULL,
                last_year           INTEGER,
                PRIMARY KEY (person_low_id, person_high_id)
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS trend_refreshes
            (
                id                  BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                refreshed_at        TIMESTAMP      NOT NULL,
                window_start_year   INTEGER        NOT NULL,
                pair_count          INTEGER        NOT NULL
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS population_runs
            (
                run_id              VARCHAR(36)    PRIMARY KEY,
                kind                VARCHAR(16)    NOT NULL,
                started_at          TIMESTAMP      NOT NULL,
                completed_at        TIMESTAMP,
                status              VARCHAR(16)    NOT NULL,
                works_processed     INTEGER        NOT NULL,
                works_failed        INTEGER        NOT NULL,
                details_written     INTEGER        NOT NULL,
                error_message       VARCHAR(2000)
            )
        """);

        log.info("Collaboration schema ready.");
    }
}
