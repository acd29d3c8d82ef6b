package com.cinegraph.collab.store;

import com.cinegraph.collab.model.CollaborationDetail;
import com.cinegraph.collab.model.CollaborationFilter;
import com.cinegraph.collab.model.CollaborationPair;
import com.cinegraph.collab.model.CollaborationType;
import com.cinegraph.collab.model.Collaborator;
import com.cinegraph.collab.model.PairCandidate;
import com.cinegraph.collab.model.PersonPair;
import com.cinegraph.collab.model.Work;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.TransientDataAccessResourceException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class GraphReaderTest {

    private static final long DIRECTOR = 10;

    private AggregateStore store;
    private GraphReader graphReader;

    @BeforeEach
    void setUp() {
        TestDatabase db = TestDatabase.create();
        store = db.aggregateStore(TestClock.at("2024-06-01T00:00:00Z"));
        graphReader = db.graphReader();

        // Person 10 directs 20 three times and 21 once, and acts alongside 20 once.
        directs(1, 2001, DIRECTOR, 20);
        directs(2, 2003, DIRECTOR, 20);
        directs(3, 2005, DIRECTOR, 20);
        directs(4, 2004, DIRECTOR, 21);
        store.apply(work(5, 2006), List.of(new PairCandidate(new PersonPair(DIRECTOR, 20),
                CollaborationType.PERFORMER_PERFORMER, "performer", "performer")));
        // 10 acts under director 22 twice
        store.apply(work(6, 2007), List.of(new PairCandidate(new PersonPair(DIRECTOR, 22),
                CollaborationType.PERFORMER_DIRECTOR, "performer", "director")));
        store.apply(work(7, 2008), List.of(new PairCandidate(new PersonPair(DIRECTOR, 22),
                CollaborationType.PERFORMER_DIRECTOR, "performer", "director")));
    }

    @Test
    void topCollaboratorsOrdersByCountThenId() {
        List<Collaborator> top = graphReader.topCollaborators(DIRECTOR, CollaborationFilter.none(), 10);

        assertThat(top).containsExactly(
                new Collaborator(20, 4),
                new Collaborator(22, 2),
                new Collaborator(21, 1));
    }

    @Test
    void typeFilterCountsOnlyMatchingWorks() {
        List<Collaborator> top = graphReader.topCollaborators(DIRECTOR,
                new CollaborationFilter(CollaborationType.PERFORMER_DIRECTOR, null, 1), 10);

        assertThat(top).containsExactly(
                new Collaborator(20, 3),
                new Collaborator(22, 2),
                new Collaborator(21, 1));
    }

    @Test
    void roleFilterRestrictsToWorksWhereTheSubjectHeldThatRole() {
        List<Collaborator> asDirector = graphReader.topCollaborators(DIRECTOR,
                new CollaborationFilter(CollaborationType.PERFORMER_DIRECTOR, "director", 1), 10);

        assertThat(asDirector).containsExactly(new Collaborator(20, 3), new Collaborator(21, 1));
    }

    @Test
    void minCountDropsOccasionalCollaborators() {
        List<Collaborator> frequent = graphReader.topCollaborators(DIRECTOR,
                new CollaborationFilter(null, null, 2), 10);

        assertThat(frequent).extracting(Collaborator::personId).containsExactly(20L, 22L);
    }

    @Test
    void limitTruncates() {
        assertThat(graphReader.topCollaborators(DIRECTOR, CollaborationFilter.none(), 1))
                .containsExactly(new Collaborator(20, 4));
    }

    @Test
    void sharedWorksAreNewestFirst() {
        List<CollaborationDetail> works = graphReader.sharedWorks(new PersonPair(DIRECTOR, 20), null);

        assertThat(works).extracting(CollaborationDetail::getWorkId).containsExactly(5L, 3L, 2L, 1L);
        assertThat(graphReader.sharedWorks(new PersonPair(DIRECTOR, 20), CollaborationType.PERFORMER_PERFORMER))
                .extracting(CollaborationDetail::getWorkId).containsExactly(5L);
        assertThat(graphReader.latestSharedWork(new PersonPair(DIRECTOR, 20)).orElseThrow().getReleaseYear())
                .isEqualTo(2006);
    }

    @Test
    void neighboursAreReportedFromBothSides() {
        Map<Long, SortedSet<Long>> adjacency = graphReader.neighbours(List.of(DIRECTOR, 20L, 99L));

        assertThat(adjacency.get(DIRECTOR)).containsExactly(20L, 21L, 22L);
        assertThat(adjacency.get(20L)).containsExactly(DIRECTOR);
        assertThat(adjacency).doesNotContainKey(99L);
    }

    @Test
    void forEachPairStreamsInCanonicalOrder() {
        List<PersonPair> seen = new ArrayList<>();
        graphReader.forEachPair(p -> seen.add(p.pair()));

        assertThat(seen).containsExactly(
                new PersonPair(DIRECTOR, 20), new PersonPair(DIRECTOR, 21), new PersonPair(DIRECTOR, 22));
        assertThat(store.findAllPairs()).extracting(CollaborationPair::pair).isEqualTo(seen);
    }

    @Test
    void similarPairsPreferCloseRatingsThenCount() {
        TestDatabase db = TestDatabase.create();
        AggregateStore fresh = db.aggregateStore(TestClock.at("2024-06-01T00:00:00Z"));
        long work = 100;
        // reference pair, average 7.00
        work = rated(fresh, work, new PersonPair(1, 2), CollaborationType.PERFORMER_DIRECTOR, "7.0", "7.0");
        // higher count but far from 7.00
        work = rated(fresh, work, new PersonPair(3, 4), CollaborationType.PERFORMER_DIRECTOR, "9.0", "9.0", "9.0");
        // close rating
        work = rated(fresh, work, new PersonPair(5, 6), CollaborationType.PERFORMER_DIRECTOR, "7.2", "7.2");
        // never performer-director
        work = rated(fresh, work, new PersonPair(7, 8), CollaborationType.PERFORMER_PERFORMER, "7.0", "7.0");
        // only one shared work
        rated(fresh, work, new PersonPair(9, 10), CollaborationType.PERFORMER_DIRECTOR, "7.0");

        GraphReader reader = db.graphReader();
        CollaborationPair reference = fresh.findPair(new PersonPair(1, 2)).orElseThrow();

        assertThat(reader.similarPairs(reference, 10)).extracting(CollaborationPair::pair)
                .containsExactly(new PersonPair(5, 6), new PersonPair(3, 4));
        assertThat(reader.similarPairs(reference, 1)).extracting(CollaborationPair::pair)
                .containsExactly(new PersonPair(5, 6));
    }

    @Test
    void interruptedPairStreamResumesWithoutRepeats() {
        TestDatabase db = TestDatabase.create();
        AggregateStore fresh = db.aggregateStore(TestClock.at("2024-06-01T00:00:00Z"));
        for (long other = 2; other <= 4; other++) {
            fresh.apply(work(other, 2000), List.of(new PairCandidate(new PersonPair(1, other),
                    CollaborationType.PERFORMER_PERFORMER, "performer", "performer")));
        }
        AtomicInteger attempts = new AtomicInteger();
        JdbcTemplate flaky = new JdbcTemplate(db.dataSource()) {
            @Override
            public void query(String sql, RowCallbackHandler rch) {
                if (attempts.getAndIncrement() == 0) {
                    super.query(sql, (RowCallbackHandler) rs -> {
                        rch.processRow(rs);
                        throw new TransientDataAccessResourceException("connection reset");
                    });
                    return;
                }
                super.query(sql, rch);
            }
        };

        List<PersonPair> seen = new ArrayList<>();
        new GraphReader(flaky, db.retry()).forEachPair(p -> seen.add(p.pair()));

        assertThat(seen).containsExactly(new PersonPair(1, 2), new PersonPair(1, 3), new PersonPair(1, 4));
    }

    private void directs(long workId, int year, long director, long performer) {
        store.apply(work(workId, year), List.of(new PairCandidate(PersonPair.of(director, performer),
                CollaborationType.PERFORMER_DIRECTOR, "director", "performer")));
    }

    private static long rated(AggregateStore target, long firstWork, PersonPair pair, CollaborationType type,
                              String... ratings) {
        long workId = firstWork;
        for (String rating : ratings) {
            target.apply(Work.builder().workId(workId).releaseYear(2000 + (int) (workId % 20))
                            .rating(new BigDecimal(rating)).build(),
                    List.of(new PairCandidate(pair, type, "performer",
                            type == CollaborationType.PERFORMER_DIRECTOR ? "director" : "performer")));
            workId++;
        }
        return workId;
    }

    private static Work work(long id, int year) {
        return Work.builder().workId(id).releaseYear(year).build();
    }
}
