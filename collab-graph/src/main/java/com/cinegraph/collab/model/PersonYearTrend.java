package com.cinegraph.collab.model;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.util.List;

/**
 * One year of a person's collaboration history.
 */
@Data
@Builder
public class PersonYearTrend {

    private int year;
    private int uniqueCollaborators;

    /** Collaborators met for the first time this year */
    private int newCollaborators;

    /** Distinct works with at least one collaboration */
    private int totalCollaborations;

    private BigDecimal avgRating;
    private long totalRevenue;
    private List<String> genres;
}
