package com.cinegraph.collab.service;

import com.cinegraph.collab.model.CollaborationDetail;
import com.cinegraph.collab.model.CollaborationPair;
import com.cinegraph.collab.model.CollaborationType;
import com.cinegraph.collab.model.PersonPair;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Derives a pair's summary from its complete detail set.
 *
 * Pure function of the detail rows: the result does not depend on the order
 * the rows arrive in, which is what lets a rebuild and any sequence of
 * incremental applies agree exactly.
 */
public final class PairAggregates {

    static final int MAX_ROLE_TYPES = 5;
    static final int MAX_GENRES = 10;

    private PairAggregates() {
    }

    public static CollaborationPair compute(PersonPair pair, List<CollaborationDetail> details) {
        TreeSet<CollaborationType> types = new TreeSet<>();
        TreeSet<String> genres = new TreeSet<>();
        TreeMap<Integer, Integer> perYear = new TreeMap<>();
        BigDecimal ratingSum = BigDecimal.ZERO;
        int rated = 0;
        long revenue = 0;

        for (CollaborationDetail d : details) {
            types.add(d.getCollaborationType());
            perYear.merge(d.getReleaseYear(), 1, Integer::sum);
            if (d.getRating() != null) {
                ratingSum = ratingSum.add(d.getRating());
                rated++;
            }
            if (d.getRevenue() != null) {
                revenue += d.getRevenue();
            }
            if (d.getGenres() != null) {
                d.getGenres().stream().filter(Objects::nonNull).forEach(genres::add);
            }
        }

        return CollaborationPair.builder()
                .personLowId(pair.lowId())
                .personHighId(pair.highId())
                .collaborationCount(details.size())
                .firstYear(perYear.isEmpty() ? null : perYear.firstKey())
                .lastYear(perYear.isEmpty() ? null : perYear.lastKey())
                .avgRating(rated == 0 ? null : ratingSum.divide(BigDecimal.valueOf(rated), 2, RoundingMode.HALF_UP))
                .totalRevenue(revenue)
                .types(List.copyOf(types))
                .yearsActive(List.copyOf(perYear.keySet()))
                .peakYear(peakYear(perYear))
                .genreDiversity(ratio(genres.size(), MAX_GENRES))
                .roleDiversity(ratio(types.size(), MAX_ROLE_TYPES))
                .build();
    }

    // Earliest year wins a tie: TreeMap iterates ascending and only a strictly greater count replaces.
    private static Integer peakYear(TreeMap<Integer, Integer> perYear) {
        Integer peak = null;
        int best = 0;
        for (Map.Entry<Integer, Integer> e : perYear.entrySet()) {
            if (e.getValue() > best) {
                best = e.getValue();
                peak = e.getKey();
            }
        }
        return peak;
    }

    private static BigDecimal ratio(int count, int max) {
        return BigDecimal.valueOf(Math.min(count, max))
                .divide(BigDecimal.valueOf(max), 2, RoundingMode.HALF_UP);
    }
}
