package com.cinegraph.collab.store;

import com.cinegraph.collab.model.CollaborationDetail;
import com.cinegraph.collab.model.CollaborationFilter;
import com.cinegraph.collab.model.CollaborationPair;
import com.cinegraph.collab.model.CollaborationType;
import com.cinegraph.collab.model.Collaborator;
import com.cinegraph.collab.model.PersonPair;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Read-side queries over the pair and detail tables: adjacency for path
 * search, ranked neighbours, per-pair and per-person breakdowns.
 */
@Component
@Slf4j
public class GraphReader {

    private static final int IN_CLAUSE_CHUNK = 500;
    private static final int SIMILAR_MIN_COUNT = 2;
    private static final BigDecimal SIMILAR_RATING_BAND = new BigDecimal("0.5");

    private final JdbcTemplate jdbcTemplate;
    private final NamedParameterJdbcTemplate namedJdbc;
    private final Retry storeRetry;

    public GraphReader(JdbcTemplate jdbcTemplate, Retry storeRetry) {
        this.jdbcTemplate = jdbcTemplate;
        this.namedJdbc = new NamedParameterJdbcTemplate(jdbcTemplate);
        this.storeRetry = storeRetry;
    }

    /** A detail row seen from one person's side. */
    public record PersonCollaboration(long otherPersonId, long workId, int releaseYear,
                                      BigDecimal rating, Long revenue, List<String> genres) {
    }

    /**
     * Neighbours of every id in {@code personIds}, one round trip per chunk.
     * People without edges are absent from the returned map.
     */
    public Map<Long, SortedSet<Long>> neighbours(Collection<Long> personIds) {
        Map<Long, SortedSet<Long>> adjacency = new HashMap<>();
        List<Long> ids = new ArrayList<>(personIds);

        for (int i = 0; i < ids.size(); i += IN_CLAUSE_CHUNK) {
            MapSqlParameterSource params = new MapSqlParameterSource(
                    "ids", ids.subList(i, Math.min(i + IN_CLAUSE_CHUNK, ids.size())));
            storeRetry.executeRunnable(() -> namedJdbc.query("""
                    SELECT person_low_id AS src, person_high_id AS dst
                    FROM collaboration_pairs WHERE person_low_id IN (:ids)
                    UNION ALL
                    SELECT person_high_id AS src, person_low_id AS dst
                    FROM collaboration_pairs WHERE person_high_id IN (:ids)
                    """, params, rs -> {
                adjacency.computeIfAbsent(rs.getLong("src"), k -> new TreeSet<>()).add(rs.getLong("dst"));
            }));
        }
        return adjacency;
    }

    public List<Collaborator> topCollaborators(long personId, CollaborationFilter filter, int limit) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("person", personId)
                .addValue("minCount", filter.minCount())
                .addValue("limit", limit);

        StringBuilder sql = new StringBuilder("""
                SELECT CASE WHEN p.person_low_id = :person THEN p.person_high_id ELSE p.person_low_id END AS other_id,
                       COUNT(d.id) AS matching
                FROM collaboration_pairs p
                JOIN collaboration_details d ON d.pair_id = p.id
                WHERE (p.person_low_id = :person OR p.person_high_id = :person)
                """);
        if (filter.type() != null) {
            sql.append(" AND d.collaboration_type = :type");
            params.addValue("type", filter.type().code());
        }
        if (filter.subjectRole() != null) {
            sql.append("""
                     AND ((p.person_low_id = :person AND d.person_low_role = :role)
                       OR (p.person_high_id = :person AND d.person_high_role = :role))
                    """);
            params.addValue("role", filter.subjectRole());
        }
        sql.append("""
                 GROUP BY p.person_low_id, p.person_high_id
                 HAVING COUNT(d.id) >= :minCount
                 ORDER BY matching DESC, other_id ASC
                 LIMIT :limit
                """);

        return storeRetry.executeSupplier(() -> namedJdbc.query(sql.toString(), params,
                (rs, i) -> new Collaborator(rs.getLong("other_id"), rs.getInt("matching"))));
    }

    /** Works a pair shares, newest first, optionally restricted to one type. */
    public List<CollaborationDetail> sharedWorks(PersonPair pair, CollaborationType type) {
        String sql = "SELECT " + prefixed(AggregateStore.DETAIL_COLUMNS) + """
                 FROM collaboration_details d
                 JOIN collaboration_pairs p ON d.pair_id = p.id
                 WHERE p.person_low_id = ? AND p.person_high_id = ?
                """;
        List<Object> args = new ArrayList<>(List.of(pair.lowId(), pair.highId()));
        if (type != null) {
            sql += " AND d.collaboration_type = ?";
            args.add(type.code());
        }
        String query = sql + " ORDER BY d.release_year DESC, d.work_id DESC";
        return storeRetry.executeSupplier(() ->
                jdbcTemplate.query(query, AggregateStore.DETAIL_MAPPER, args.toArray()));
    }

    public Optional<CollaborationDetail> latestSharedWork(PersonPair pair) {
        return sharedWorks(pair, null).stream().findFirst();
    }

    /**
     * Other performer-director pairs with at least two shared works. Pairs whose
     * average rating is within 0.5 of {@code reference} come first, then by count.
     */
    public List<CollaborationPair> similarPairs(CollaborationPair reference, int limit) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("id", reference.getId())
                .addValue("type", CollaborationType.PERFORMER_DIRECTOR.code())
                .addValue("minCount", SIMILAR_MIN_COUNT)
                .addValue("limit", limit);

        String closeness = "0";
        if (reference.getAvgRating() != null) {
            closeness = "CASE WHEN p.avg_rating IS NOT NULL AND ABS(p.avg_rating - :avg) < :band THEN 1 ELSE 0 END";
            params.addValue("avg", reference.getAvgRating()).addValue("band", SIMILAR_RATING_BAND);
        }

        String sql = "SELECT " + prefixed(AggregateStore.PAIR_COLUMNS, "p") + ", " + closeness + " AS close_rating"
                + """
                 FROM collaboration_pairs p
                 WHERE p.id <> :id
                   AND p.collaboration_count >= :minCount
                   AND EXISTS (SELECT 1 FROM collaboration_details d
                               WHERE d.pair_id = p.id AND d.collaboration_type = :type)
                 ORDER BY close_rating DESC, p.collaboration_count DESC, p.person_low_id, p.person_high_id
                 LIMIT :limit
                """;
        return storeRetry.executeSupplier(() -> namedJdbc.query(sql, params, AggregateStore.PAIR_MAPPER));
    }

    /** Every detail row involving {@code personId}, oldest first. */
    public List<PersonCollaboration> collaborationsOf(long personId) {
        MapSqlParameterSource params = new MapSqlParameterSource("person", personId);
        return storeRetry.executeSupplier(() -> namedJdbc.query("""
                SELECT CASE WHEN p.person_low_id = :person THEN p.person_high_id ELSE p.person_low_id END AS other_id,
                       d.work_id, d.release_year, d.rating, d.revenue, d.genres
                FROM collaboration_pairs p
                JOIN collaboration_details d ON d.pair_id = p.id
                WHERE p.person_low_id = :person OR p.person_high_id = :person
                ORDER BY d.release_year, d.work_id
                """, params, (rs, i) -> new PersonCollaboration(
                        rs.getLong("other_id"),
                        rs.getLong("work_id"),
                        rs.getInt("release_year"),
                        rs.getBigDecimal("rating"),
                        Columns.longOrNull(rs, "revenue"),
                        Columns.split(rs.getString("genres"), s -> s))));
    }

    /**
     * Streams every pair in canonical order without holding the table in memory.
     * A retried attempt resumes after the last pair already delivered.
     */
    public void forEachPair(Consumer<CollaborationPair> consumer) {
        AtomicReference<PersonPair> last = new AtomicReference<>();
        storeRetry.executeRunnable(() -> {
            PersonPair after = last.get();
            RowCallbackHandler handler = rs -> {
                CollaborationPair pair = AggregateStore.PAIR_MAPPER.mapRow(rs, 0);
                consumer.accept(pair);
                last.set(pair.pair());
            };
            if (after == null) {
                jdbcTemplate.query("SELECT " + AggregateStore.PAIR_COLUMNS
                        + " FROM collaboration_pairs ORDER BY person_low_id, person_high_id", handler);
            } else {
                jdbcTemplate.query("SELECT " + AggregateStore.PAIR_COLUMNS + """
                         FROM collaboration_pairs
                         WHERE person_low_id > ? OR (person_low_id = ? AND person_high_id > ?)
                         ORDER BY person_low_id, person_high_id
                        """, handler, after.lowId(), after.lowId(), after.highId());
            }
        });
    }

    private static String prefixed(String columns) {
        return prefixed(columns, "d");
    }

    private static String prefixed(String columns, String alias) {
        StringBuilder out = new StringBuilder();
        for (String column : columns.split(",")) {
            if (out.length() > 0) out.append(", ");
            out.append(alias).append('.').append(column.trim());
        }
        return out.toString();
    }
}
