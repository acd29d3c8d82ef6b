package com.cinegraph.collab.service;

import com.cinegraph.collab.config.CollabGraphProperties;
import com.cinegraph.collab.config.TestProperties;
import com.cinegraph.collab.model.CollaborationType;
import com.cinegraph.collab.model.PairCandidate;
import com.cinegraph.collab.model.PathHop;
import com.cinegraph.collab.model.PathResult;
import com.cinegraph.collab.model.PersonPair;
import com.cinegraph.collab.model.Work;
import com.cinegraph.collab.store.AggregateStore;
import com.cinegraph.collab.store.PathCacheRepository;
import com.cinegraph.collab.store.TestClock;
import com.cinegraph.collab.store.TestDatabase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessResourceException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Graph used by most tests:
 *
 *   1 - 2 - 3 - 4
 *   |           |
 *   5 --- 6 ----+
 *
 *   7 - 8        (separate component)
 */
class PathFinderTest {

    private TestDatabase db;
    private TestClock clock;
    private CollabGraphProperties properties;
    private PathFinder pathFinder;

    @BeforeEach
    void setUp() {
        db = TestDatabase.create();
        clock = TestClock.at("2024-06-01T00:00:00Z");
        properties = TestProperties.defaults();

        db.people(1, 2, 3, 4, 5, 6, 7, 8, 9);
        AggregateStore store = db.aggregateStore(clock);
        long workId = 100;
        for (long[] edge : new long[][]{{1, 2}, {2, 3}, {3, 4}, {1, 5}, {5, 6}, {6, 4}, {7, 8}}) {
            store.apply(Work.builder().workId(workId++).releaseYear(2000 + (int) edge[0]).build(),
                    List.of(new PairCandidate(PersonPair.of(edge[0], edge[1]),
                            CollaborationType.PERFORMER_PERFORMER, "performer", "performer")));
        }

        pathFinder = pathFinder(db.pathCache());
    }

    @Test
    void findsTheKnownThreeHopPath() {
        PathResult result = pathFinder.shortestPath(1, 4, 6);

        assertThat(result.found()).isTrue();
        assertThat(result.length()).isEqualTo(3);
        // Two three-hop routes exist; ascending expansion picks the one through 2.
        assertThat(result.path()).containsExactly(1L, 2L, 3L, 4L);
        assertThat(result.cached()).isFalse();
    }

    @Test
    void everyHopOfAFoundPathIsAStoredPair() {
        PathResult result = pathFinder.shortestPath(8, 7, 6);

        List<PathHop> hops = pathFinder.hops(pathFinder.shortestPath(1, 4, 6));

        assertThat(result.path()).containsExactly(8L, 7L);
        assertThat(hops).extracting(PathHop::workId).doesNotContainNull();
        assertThat(hops).extracting(PathHop::fromPersonId).containsExactly(1L, 2L, 3L);
    }

    @Test
    void tooShallowSearchFindsNothing() {
        PathResult result = pathFinder.shortestPath(1, 4, 2);

        assertThat(result.found()).isFalse();
        assertThat(result.length()).isEqualTo(-1);
        assertThat(result.path()).isEmpty();
    }

    @Test
    void disconnectedComponentsHaveNoPath() {
        assertThat(pathFinder.shortestPath(1, 8, 6).found()).isFalse();
        assertThat(pathFinder.shortestPath(9, 1, 6).found()).isFalse();
    }

    @Test
    void repeatedQueryIsServedFromCache() {
        PathResult first = pathFinder.shortestPath(1, 4, 6);
        PathResult second = pathFinder.shortestPath(1, 4, 6);

        assertThat(pathFinder.searchCount()).isEqualTo(1);
        assertThat(second.cached()).isTrue();
        assertThat(second.path()).isEqualTo(first.path());
    }

    @Test
    void cachedPathIsReturnedInTheAskedDirection() {
        pathFinder.shortestPath(1, 4, 6);

        PathResult reversed = pathFinder.shortestPath(4, 1, 6);

        assertThat(reversed.cached()).isTrue();
        assertThat(reversed.path()).containsExactly(4L, 3L, 2L, 1L);
        assertThat(pathFinder.searchCount()).isEqualTo(1);
    }

    @Test
    void cacheRowsAreCanonical() {
        pathFinder.shortestPath(4, 1, 6);

        Map<String, Object> row = db.jdbc().queryForMap(
                "SELECT person_low_id, person_high_id, path, path_length FROM path_cache "
                        + "WHERE person_low_id = 1 AND person_high_id = 4");
        assertThat(row.get("PATH")).isEqualTo("1,2,3,4");
        assertThat(((Number) row.get("PATH_LENGTH")).intValue()).isEqualTo(3);
        assertThat(db.jdbc().queryForObject(
                "SELECT COUNT(*) FROM path_cache WHERE person_low_id >= person_high_id", Integer.class)).isZero();
    }

    @Test
    void prefixesOfAFoundPathAreCachedToo() {
        pathFinder.shortestPath(1, 4, 6);

        PathResult prefix = pathFinder.shortestPath(1, 3, 6);

        assertThat(prefix.cached()).isTrue();
        assertThat(prefix.path()).containsExactly(1L, 2L, 3L);
        assertThat(pathFinder.searchCount()).isEqualTo(1);
    }

    @Test
    void prefixCachingCanBeSwitchedOff() {
        properties.getPaths().setOpportunisticCaching(false);
        PathFinder finder = pathFinder(db.pathCache());
        finder.shortestPath(1, 4, 6);

        assertThat(finder.shortestPath(1, 3, 6).cached()).isFalse();
        assertThat(finder.searchCount()).isEqualTo(2);
    }

    @Test
    void expiredEntryIsRecomputed() {
        pathFinder.shortestPath(1, 4, 6);

        clock.advance(properties.getPaths().getCacheTtl().plus(Duration.ofSeconds(1)));
        PathResult again = pathFinder.shortestPath(1, 4, 6);

        assertThat(again.cached()).isFalse();
        assertThat(again.path()).containsExactly(1L, 2L, 3L, 4L);
        assertThat(pathFinder.searchCount()).isEqualTo(2);
    }

    @Test
    void cachedPathLongerThanMaxDepthMeansNoPath() {
        pathFinder.shortestPath(1, 4, 6);

        PathResult shallow = pathFinder.shortestPath(1, 4, 2);

        assertThat(shallow.found()).isFalse();
        assertThat(pathFinder.searchCount()).isEqualTo(1);
    }

    @Test
    void noPathResultsAreNotCached() {
        pathFinder.shortestPath(1, 8, 6);
        pathFinder.shortestPath(1, 8, 6);

        assertThat(pathFinder.searchCount()).isEqualTo(2);
        assertThat(db.count("path_cache")).isZero();
    }

    @Test
    void samePersonIsAZeroLengthPath() {
        PathResult result = pathFinder.shortestPath(3, 3, 6);

        assertThat(result.found()).isTrue();
        assertThat(result.path()).containsExactly(3L);
        assertThat(result.length()).isZero();
        assertThat(pathFinder.hops(result)).isEmpty();
    }

    @Test
    void unknownPersonIsRejected() {
        assertThatThrownBy(() -> pathFinder.shortestPath(1, 404, 6))
                .isInstanceOf(UnknownPersonException.class)
                .hasMessageContaining("404");
    }

    @Test
    void nonPositiveDepthIsRejected() {
        assertThatThrownBy(() -> pathFinder.shortestPath(1, 4, 0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void brokenCacheDoesNotFailTheQuery() {
        PathCacheRepository broken = mock(PathCacheRepository.class);
        when(broken.findUnexpired(any(), any())).thenThrow(new DataAccessResourceFailureException("cache down"));
        doThrow(new DataAccessResourceFailureException("cache down")).when(broken).put(any());
        PathFinder finder = pathFinder(broken);

        PathResult result = finder.shortestPath(1, 4, 6);

        assertThat(result.path()).containsExactly(1L, 2L, 3L, 4L);
        assertThat(finder.shortestPath(1, 4, 6).found()).isTrue();
        assertThat(finder.searchCount()).isEqualTo(2);
    }

    @Test
    void droppedConnectionOnPersonLookupIsRetried() {
        AtomicInteger peopleLookups = new AtomicInteger();
        JdbcTemplate flaky = new JdbcTemplate(db.dataSource()) {
            @Override
            public <T> T queryForObject(String sql, Class<T> requiredType, Object... args) {
                if (sql.contains("FROM people") && peopleLookups.getAndIncrement() == 0) {
                    throw new TransientDataAccessResourceException("connection reset");
                }
                return super.queryForObject(sql, requiredType, args);
            }
        };
        PathFinder finder = new PathFinder(db.graphReader(), db.pathCache(), db.creditFeed(flaky),
                Runnable::run, clock, properties);

        PathResult result = finder.shortestPath(1, 2, 6);

        assertThat(result.path()).containsExactly(1L, 2L);
        assertThat(peopleLookups.get()).isGreaterThan(1);
    }

    private PathFinder pathFinder(PathCacheRepository cache) {
        return new PathFinder(db.graphReader(), cache, db.creditFeed(), Runnable::run, clock, properties);
    }
}
