package com.cinegraph.collab.model;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Cached shortest path for a canonical pair. The stored path always runs
 * from the low id to the high id.
 */
@Data
@Builder
public class PathCacheEntry {

    private PersonPair pair;
    private List<Long> path;
    private int pathLength;
    private Instant computedAt;
    private Instant expiresAt;

    public static PathCacheEntry of(List<Long> path, Instant computedAt, Instant expiresAt) {
        long first = path.get(0);
        long last = path.get(path.size() - 1);
        PersonPair pair = PersonPair.of(first, last);
        List<Long> canonical = new ArrayList<>(path);
        if (first != pair.lowId()) {
            Collections.reverse(canonical);
        }
        return PathCacheEntry.builder()
                .pair(pair)
                .path(List.copyOf(canonical))
                .pathLength(canonical.size() - 1)
                .computedAt(computedAt)
                .expiresAt(expiresAt)
                .build();
    }

    /** The cached path walked from {@code personId} to the other end. */
    public List<Long> orientedFrom(long personId) {
        if (personId == pair.lowId()) {
            return path;
        }
        List<Long> reversed = new ArrayList<>(path);
        Collections.reverse(reversed);
        return reversed;
    }
}
