package com.cinegraph.collab.model;

import java.util.Locale;

/**
 * Restricts top collaborator queries.
 *
 * @param type        only count works where the pair had this type, null for any
 * @param subjectRole only count works where the queried person held this role, null for any
 * @param minCount    minimum number of matching works
 */
public record CollaborationFilter(CollaborationType type, String subjectRole, int minCount) {

    public static CollaborationFilter none() {
        return new CollaborationFilter(null, null, 1);
    }

    public CollaborationFilter {
        if (minCount < 1) {
            throw new IllegalArgumentException("minCount must be at least 1");
        }
        subjectRole = subjectRole == null || subjectRole.isBlank() ? null : subjectRole.trim().toLowerCase(Locale.ROOT);
    }
}
