package com.cinegraph.collab.model;

import java.util.List;

/**
 * Outcome of a shortest path query. "No path within maxDepth" is a normal
 * result ({@code found == false}), not an error.
 *
 * @param path   person ids from {@code fromPersonId} to {@code toPersonId} inclusive, empty when not found
 * @param length number of hops, -1 when not found
 * @param cached whether the answer came from the path cache
 */
public record PathResult(long fromPersonId,
                         long toPersonId,
                         int maxDepth,
                         boolean found,
                         List<Long> path,
                         int length,
                         boolean cached) {

    public static PathResult found(long from, long to, int maxDepth, List<Long> path, boolean cached) {
        return new PathResult(from, to, maxDepth, true, List.copyOf(path), path.size() - 1, cached);
    }

    public static PathResult noPath(long from, long to, int maxDepth) {
        return new PathResult(from, to, maxDepth, false, List.of(), -1, false);
    }
}
