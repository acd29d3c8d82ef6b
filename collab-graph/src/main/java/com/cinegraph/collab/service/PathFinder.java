package com.cinegraph.collab.service;

import com.cinegraph.collab.config.CollabGraphProperties;
import com.cinegraph.collab.model.PathCacheEntry;
import com.cinegraph.collab.model.PathHop;
import com.cinegraph.collab.model.PathResult;
import com.cinegraph.collab.model.PersonPair;
import com.cinegraph.collab.store.CreditFeed;
import com.cinegraph.collab.store.GraphReader;
import com.cinegraph.collab.store.PathCacheRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * "Six degrees" search over the collaboration graph.
 *
 * Any stored pair is an edge, regardless of type or count. The search runs
 * breadth-first one level at a time, fetching the whole frontier's neighbours
 * in a single query, and stops at maxDepth. Neighbours are expanded in
 * ascending id order, so among equally short paths the result is stable.
 *
 * Results are cached per canonical pair for a fixed TTL. The cache is an
 * optimisation only: read or write failures fall back to searching.
 */
@Service
@Slf4j
public class PathFinder {

    private final GraphReader graphReader;
    private final PathCacheRepository pathCache;
    private final CreditFeed creditFeed;
    private final Executor cacheExecutor;
    private final Clock clock;
    private final Duration cacheTtl;
    private final boolean opportunisticCaching;

    private final AtomicLong searches = new AtomicLong();

    public PathFinder(GraphReader graphReader,
                      PathCacheRepository pathCache,
                      CreditFeed creditFeed,
                      @Qualifier("pathCacheExecutor") Executor cacheExecutor,
                      Clock clock,
                      CollabGraphProperties properties) {
        this.graphReader = graphReader;
        this.pathCache = pathCache;
        this.creditFeed = creditFeed;
        this.cacheExecutor = cacheExecutor;
        this.clock = clock;
        this.cacheTtl = properties.getPaths().getCacheTtl();
        this.opportunisticCaching = properties.getPaths().isOpportunisticCaching();
    }

    /**
     * @throws IllegalArgumentException if maxDepth is not positive
     * @throws UnknownPersonException   if either person does not exist
     */
    public PathResult shortestPath(long from, long to, int maxDepth) {
        if (maxDepth <= 0) {
            throw new IllegalArgumentException("maxDepth must be positive, got " + maxDepth);
        }
        requireKnown(from);
        requireKnown(to);

        if (from == to) {
            return PathResult.found(from, to, maxDepth, List.of(from), false);
        }

        Optional<PathCacheEntry> cached = cachedPath(PersonPair.of(from, to));
        if (cached.isPresent()) {
            PathCacheEntry entry = cached.get();
            if (entry.getPathLength() > maxDepth) {
                // The cached path is a shortest path, so nothing fits inside maxDepth.
                return PathResult.noPath(from, to, maxDepth);
            }
            return PathResult.found(from, to, maxDepth, entry.orientedFrom(from), true);
        }

        searches.incrementAndGet();
        List<Long> path = search(from, to, maxDepth);
        if (path.isEmpty()) {
            log.debug("No path between {} and {} within {} hops", from, to, maxDepth);
            return PathResult.noPath(from, to, maxDepth);
        }

        cacheAsync(path);
        return PathResult.found(from, to, maxDepth, path, false);
    }

    /** Each hop of the path paired with the most recent work the two people share. */
    public List<PathHop> hops(PathResult result) {
        if (!result.found() || result.length() == 0) {
            return List.of();
        }
        List<PathHop> hops = new ArrayList<>(result.length());
        List<Long> path = result.path();
        for (int i = 0; i + 1 < path.size(); i++) {
            long a = path.get(i);
            long b = path.get(i + 1);
            hops.add(graphReader.latestSharedWork(PersonPair.of(a, b))
                    .map(d -> new PathHop(a, b, d.getWorkId(), d.getReleaseYear()))
                    .orElse(new PathHop(a, b, null, null)));
        }
        return hops;
    }

    /** Number of searches that actually ran, i.e. cache misses. */
    public long searchCount() {
        return searches.get();
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private List<Long> search(long from, long to, int maxDepth) {
        Map<Long, Long> parent = new HashMap<>();
        Set<Long> visited = new HashSet<>();
        visited.add(from);
        List<Long> frontier = List.of(from);

        for (int depth = 1; depth <= maxDepth && !frontier.isEmpty(); depth++) {
            Map<Long, SortedSet<Long>> adjacency = graphReader.neighbours(frontier);
            List<Long> next = new ArrayList<>();

            for (Long node : frontier) {
                for (Long neighbour : adjacency.getOrDefault(node, Collections.emptySortedSet())) {
                    if (!visited.add(neighbour)) continue;
                    parent.put(neighbour, node);
                    if (neighbour == to) {
                        return reconstruct(parent, from, to);
                    }
                    next.add(neighbour);
                }
            }
            log.trace("Level {}: {} new people reached", depth, next.size());
            frontier = next;
        }
        return List.of();
    }

    private List<Long> reconstruct(Map<Long, Long> parent, long from, long to) {
        List<Long> path = new ArrayList<>();
        Long node = to;
        while (node != null) {
            path.add(node);
            node = node == from ? null : parent.get(node);
        }
        Collections.reverse(path);
        return path;
    }

    private Optional<PathCacheEntry> cachedPath(PersonPair pair) {
        try {
            return pathCache.findUnexpired(pair, clock.instant());
        } catch (DataAccessException e) {
            log.warn("Path cache read failed for {}, searching instead: {}", pair, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Store the path, and with opportunistic caching every prefix of it too:
     * BFS already proved each prefix is a shortest path to its last person.
     */
    private void cacheAsync(List<Long> path) {
        Instant now = clock.instant();
        Instant expiresAt = now.plus(cacheTtl);
        List<PathCacheEntry> entries = new ArrayList<>();
        int firstEnd = opportunisticCaching ? 1 : path.size() - 1;
        for (int end = firstEnd; end < path.size(); end++) {
            entries.add(PathCacheEntry.of(path.subList(0, end + 1), now, expiresAt));
        }

        try {
            CompletableFuture.runAsync(() -> entries.forEach(pathCache::put), cacheExecutor)
                    .exceptionally(e -> {
                        log.warn("Path cache write failed for {}: {}", entries.get(entries.size() - 1).getPair(),
                                e.getMessage());
                        return null;
                    });
        } catch (RejectedExecutionException e) {
            log.warn("Path cache write skipped, executor saturated: {}", e.getMessage());
        }
    }

    private void requireKnown(long personId) {
        if (!creditFeed.personExists(personId)) {
            throw new UnknownPersonException(personId);
        }
    }
}
