package com.cinegraph.collab.service;

import com.cinegraph.collab.config.CollabGraphProperties;
import com.cinegraph.collab.model.CollaborationDetail;
import com.cinegraph.collab.model.CollaborationFilter;
import com.cinegraph.collab.model.CollaborationPair;
import com.cinegraph.collab.model.CollaborationType;
import com.cinegraph.collab.model.Collaborator;
import com.cinegraph.collab.model.PathHop;
import com.cinegraph.collab.model.PathResult;
import com.cinegraph.collab.model.PersonPair;
import com.cinegraph.collab.model.PersonYearTrend;
import com.cinegraph.collab.model.TrendScore;
import com.cinegraph.collab.store.AggregateStore;
import com.cinegraph.collab.store.CreditFeed;
import com.cinegraph.collab.store.GraphReader;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Read operations over the collaboration graph.
 *
 * Absent data is a normal result (empty Optional, empty list, no-path); only
 * bad arguments and unknown people are exceptions.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CollaborationQueryService {

    private final AggregateStore aggregateStore;
    private final GraphReader graphReader;
    private final PathFinder pathFinder;
    private final TrendEngine trendEngine;
    private final CreditFeed creditFeed;
    private final CollabGraphProperties properties;

    public Optional<CollaborationPair> pairStats(long personA, long personB) {
        return aggregateStore.findPair(PersonPair.of(personA, personB));
    }

    /**
     * Other performer-director pairs that resemble the (a, b) pair: at least two
     * shared works, close average rating first. Empty when (a, b) never worked together.
     */
    public List<CollaborationPair> similarCollaborations(long personA, long personB, int limit) {
        requirePositive(limit);
        return aggregateStore.findPair(PersonPair.of(personA, personB))
                .map(pair -> graphReader.similarPairs(pair, limit))
                .orElse(List.of());
    }

    /**
     * People {@code personId} has worked with most, restricted by {@code filter}.
     * The count is the number of works matching the filter.
     */
    public List<Collaborator> topCollaborators(long personId, CollaborationFilter filter, int limit) {
        requirePositive(limit);
        requireKnown(personId);
        return graphReader.topCollaborators(personId, filter == null ? CollaborationFilter.none() : filter, limit);
    }

    public List<CollaborationDetail> sharedWorks(long personA, long personB, CollaborationType type) {
        return graphReader.sharedWorks(PersonPair.of(personA, personB), type);
    }

    public PathResult shortestPath(long from, long to, Integer maxDepth) {
        int depth = maxDepth != null ? maxDepth : properties.getPaths().getDefaultMaxDepth();
        return pathFinder.shortestPath(from, to, depth);
    }

    public List<PathHop> pathHops(PathResult result) {
        return pathFinder.hops(result);
    }

    public List<TrendScore> topTrending(int limit) {
        return trendEngine.topTrending(limit);
    }

    public List<PersonYearTrend> personTimeline(long personId) {
        requireKnown(personId);
        return trendEngine.personTimeline(personId);
    }

    private void requireKnown(long personId) {
        if (!creditFeed.personExists(personId)) {
            throw new UnknownPersonException(personId);
        }
    }

    private void requirePositive(int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive, got " + limit);
        }
    }
}
