package com.cinegraph.collab.store;

import com.cinegraph.collab.model.PathCacheEntry;
import com.cinegraph.collab.model.PersonPair;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persisted shortest-path cache, one row per canonical pair.
 *
 * Entries are never invalidated when edges change; they simply stop being
 * returned once expires_at has passed and are purged later.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class PathCacheRepository {

    private final JdbcTemplate jdbcTemplate;

    public Optional<PathCacheEntry> findUnexpired(PersonPair pair, Instant now) {
        List<PathCacheEntry> rows = jdbcTemplate.query("""
                SELECT person_low_id, person_high_id, path, path_length, computed_at, expires_at
                FROM path_cache
                WHERE person_low_id = ? AND person_high_id = ? AND expires_at > ?
                """,
                (rs, i) -> PathCacheEntry.builder()
                        .pair(new PersonPair(rs.getLong("person_low_id"), rs.getLong("person_high_id")))
                        .path(Columns.split(rs.getString("path"), Long::valueOf))
                        .pathLength(rs.getInt("path_length"))
                        .computedAt(rs.getTimestamp("computed_at").toInstant())
                        .expiresAt(rs.getTimestamp("expires_at").toInstant())
                        .build(),
                pair.lowId(), pair.highId(), Timestamp.from(now));
        return rows.stream().findFirst();
    }

    public void put(PathCacheEntry entry) {
        PersonPair pair = entry.getPair();
        String path = Columns.join(entry.getPath());
        Timestamp computedAt = Timestamp.from(entry.getComputedAt());
        Timestamp expiresAt = Timestamp.from(entry.getExpiresAt());

        int updated = jdbcTemplate.update("""
                UPDATE path_cache SET path = ?, path_length = ?, computed_at = ?, expires_at = ?
                WHERE person_low_id = ? AND person_high_id = ?
                """, path, entry.getPathLength(), computedAt, expiresAt, pair.lowId(), pair.highId());

        if (updated == 0) {
            jdbcTemplate.update("""
                    INSERT INTO path_cache (person_low_id, person_high_id, path, path_length, computed_at, expires_at)
                    VALUES (?, ?, ?, ?, ?, ?)
                    ON CONFLICT DO NOTHING
                    """, pair.lowId(), pair.highId(), path, entry.getPathLength(), computedAt, expiresAt);
        }
        log.debug("Cached path {} for {} until {}", path, pair, entry.getExpiresAt());
    }

    public int purgeExpired(Instant now) {
        return jdbcTemplate.update("DELETE FROM path_cache WHERE expires_at <= ?", Timestamp.from(now));
    }
}
