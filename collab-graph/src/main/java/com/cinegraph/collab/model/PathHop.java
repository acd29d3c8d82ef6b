package com.cinegraph.collab.model;

/**
 * One step of a path with the work that connects the two people.
 * workId and releaseYear are null if the edge disappeared after the path was cached.
 */
public record PathHop(long fromPersonId, long toPersonId, Long workId, Integer releaseYear) {
}
