package com.cinegraph.collab.service;

import com.cinegraph.collab.config.CollabGraphProperties;
import com.cinegraph.collab.model.PersonPair;
import com.cinegraph.collab.model.PersonYearTrend;
import com.cinegraph.collab.model.TrendScore;
import com.cinegraph.collab.store.GraphReader;
import com.cinegraph.collab.store.TrendSnapshotStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Year;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Ranks pairs by how much they have worked together lately compared with
 * their own history.
 *
 * For a pair with at least one work released after the window start:
 *
 *   recent_weighted = sum over recent works of 0.5 ^ (age / half_life)
 *   baseline_rate   = older works / years between first collaboration and window start
 *   trend_score     = recent_weighted / (1 + baseline_rate)
 *
 * Age is measured in release years from the current year, floored at zero.
 * The score grows with recent activity and shrinks for pairs that were
 * already frequent collaborators, so a new partnership outranks a long-running one
 * with the same recent output.
 */
@Service
@Slf4j
public class TrendEngine {

    private final TrendSnapshotStore snapshotStore;
    private final GraphReader graphReader;
    private final Clock clock;
    private final int windowYears;
    private final double halfLifeYears;

    private final AtomicBoolean refreshing = new AtomicBoolean(false);

    public TrendEngine(TrendSnapshotStore snapshotStore,
                       GraphReader graphReader,
                       Clock clock,
                       CollabGraphProperties properties) {
        this.snapshotStore = snapshotStore;
        this.graphReader = graphReader;
        this.clock = clock;
        this.windowYears = properties.getTrend().getWindowYears();
        this.halfLifeYears = properties.getTrend().getHalfLifeYears();
        if (windowYears < 1 || halfLifeYears <= 0) {
            throw new IllegalStateException("Trend window must be at least one year and half-life positive");
        }
    }

    /**
     * Recompute and replace the whole snapshot.
     *
     * @return number of pairs in the new snapshot
     * @throws AlreadyRunningException if a refresh is in flight
     */
    public int refresh() {
        acquire();
        return runRefresh();
    }

    /** Claims the refresh slot on the caller's thread, then refreshes on a new thread. */
    public void refreshAsync() {
        acquire();
        new Thread(() -> {
            try {
                runRefresh();
            } catch (RuntimeException e) {
                log.error("Trend refresh failed: {}", e.getMessage(), e);
            }
        }, "trend-refresh").start();
    }

    public List<TrendScore> topTrending(int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
        return snapshotStore.top(limit);
    }

    /**
     * Year-by-year collaboration history of one person, oldest year first.
     */
    public List<PersonYearTrend> personTimeline(long personId) {
        Map<Integer, YearAccumulator> years = new TreeMap<>();
        for (GraphReader.PersonCollaboration c : graphReader.collaborationsOf(personId)) {
            years.computeIfAbsent(c.releaseYear(), YearAccumulator::new).add(c);
        }

        Set<Long> seenBefore = new HashSet<>();
        List<PersonYearTrend> timeline = new ArrayList<>(years.size());
        for (YearAccumulator year : years.values()) {
            int newcomers = 0;
            for (Long other : year.collaborators) {
                if (!seenBefore.contains(other)) newcomers++;
            }
            seenBefore.addAll(year.collaborators);
            timeline.add(year.toTrend(newcomers));
        }
        return timeline;
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private void acquire() {
        if (!refreshing.compareAndSet(false, true)) {
            throw new AlreadyRunningException("Trend refresh");
        }
    }

    private int runRefresh() {
        try {
            int currentYear = Year.now(clock).getValue();
            int windowStart = currentYear - windowYears;
            log.info("Refreshing trend snapshot for activity after {}", windowStart);

            List<TrendScore> scores = score(snapshotStore.activitySince(windowStart), currentYear, windowStart);
            snapshotStore.replaceSnapshot(scores, windowStart, clock.instant());
            return scores.size();
        } finally {
            refreshing.set(false);
        }
    }

    List<TrendScore> score(List<TrendSnapshotStore.PairActivity> activity, int currentYear, int windowStart) {
        Map<PersonPair, PairAccumulator> byPair = new LinkedHashMap<>();
        for (TrendSnapshotStore.PairActivity row : activity) {
            byPair.computeIfAbsent(new PersonPair(row.personLowId(), row.personHighId()), k -> new PairAccumulator(row))
                    .add(row.releaseYear(), currentYear, windowStart);
        }

        List<TrendScore> scores = new ArrayList<>();
        for (PairAccumulator pair : byPair.values()) {
            if (pair.recentCount == 0) continue;
            scores.add(pair.toScore(windowStart));
        }
        scores.sort(Comparator.comparing(TrendScore::getTrendScore).reversed()
                .thenComparing(Comparator.comparingInt(TrendScore::getRecentCount).reversed())
                .thenComparingLong(TrendScore::getPersonLowId)
                .thenComparingLong(TrendScore::getPersonHighId));
        return scores;
    }

    private final class PairAccumulator {
        private final TrendSnapshotStore.PairActivity first;
        private double recentWeighted;
        private int recentCount;
        private int baselineCount;

        private PairAccumulator(TrendSnapshotStore.PairActivity first) {
            this.first = first;
        }

        private void add(int releaseYear, int currentYear, int windowStart) {
            if (releaseYear > windowStart) {
                int age = Math.max(0, currentYear - releaseYear);
                recentWeighted += Math.pow(0.5, age / halfLifeYears);
                recentCount++;
            } else {
                baselineCount++;
            }
        }

        private TrendScore toScore(int windowStart) {
            double baselineRate = 0;
            if (baselineCount > 0) {
                int firstYear = first.firstYear() != null ? first.firstYear() : windowStart;
                baselineRate = (double) baselineCount / Math.max(1, windowStart - firstYear + 1);
            }
            BigDecimal score = BigDecimal.valueOf(recentWeighted / (1 + baselineRate))
                    .setScale(4, RoundingMode.HALF_UP);
            return TrendScore.builder()
                    .personLowId(first.personLowId())
                    .personHighId(first.personHighId())
                    .trendScore(score)
                    .recentCount(recentCount)
                    .baselineCount(baselineCount)
                    .lastYear(first.lastYear())
                    .build();
        }
    }

    private static final class YearAccumulator {
        private final int year;
        private final Set<Long> collaborators = new TreeSet<>();
        private final Map<Long, GraphReader.PersonCollaboration> works = new LinkedHashMap<>();
        private final Set<String> genres = new TreeSet<>();

        private YearAccumulator(int year) {
            this.year = year;
        }

        private void add(GraphReader.PersonCollaboration c) {
            collaborators.add(c.otherPersonId());
            works.putIfAbsent(c.workId(), c);
            genres.addAll(c.genres());
        }

        private PersonYearTrend toTrend(int newCollaborators) {
            BigDecimal ratingSum = BigDecimal.ZERO;
            int rated = 0;
            long revenue = 0;
            for (GraphReader.PersonCollaboration work : works.values()) {
                if (work.rating() != null) {
                    ratingSum = ratingSum.add(work.rating());
                    rated++;
                }
                if (work.revenue() != null) {
                    revenue += work.revenue();
                }
            }
            return PersonYearTrend.builder()
                    .year(year)
                    .uniqueCollaborators(collaborators.size())
                    .newCollaborators(newCollaborators)
                    .totalCollaborations(works.size())
                    .avgRating(rated == 0 ? null : ratingSum.divide(BigDecimal.valueOf(rated), 2, RoundingMode.HALF_UP))
                    .totalRevenue(revenue)
                    .genres(List.copyOf(genres))
                    .build();
        }
    }
}
