package com.cinegraph.collab.model;

/**
 * One edge produced by the edge builder for a single work, with the role
 * each side held on that work.
 */
public record PairCandidate(PersonPair pair, CollaborationType type, String lowRole, String highRole) {
}
