package com.cinegraph.collab.model;

/**
 * Canonical unordered pair of people: low id first, always.
 */
public record PersonPair(long lowId, long highId) implements Comparable<PersonPair> {

    public PersonPair {
        if (lowId >= highId) {
            throw new IllegalArgumentException(
                    "Pair must be canonically ordered with distinct ids: " + lowId + "," + highId);
        }
    }

    public static PersonPair of(long a, long b) {
        if (a == b) {
            throw new IllegalArgumentException("A pair needs two different people, got " + a + " twice");
        }
        return a < b ? new PersonPair(a, b) : new PersonPair(b, a);
    }

    public long other(long personId) {
        if (personId == lowId) return highId;
        if (personId == highId) return lowId;
        throw new IllegalArgumentException(personId + " is not part of " + this);
    }

    @Override
    public int compareTo(PersonPair o) {
        int c = Long.compare(lowId, o.lowId);
        return c != 0 ? c : Long.compare(highId, o.highId);
    }

    @Override
    public String toString() {
        return "(" + lowId + "," + highId + ")";
    }
}
