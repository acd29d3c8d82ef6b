package com.cinegraph.collab.model;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Summary of every qualifying collaboration between two people.
 *
 * All aggregate fields are recomputed from the pair's detail rows on each
 * write, so two stores fed the same works in any order hold equal aggregates.
 */
@Data
@Builder(toBuilder = true)
public class CollaborationPair {

    private Long id;

    // ── Identity ────────────────────────────────────────────────────────────
    private long personLowId;
    private long personHighId;

    // ── Aggregates ──────────────────────────────────────────────────────────
    /** Distinct works the two share */
    private int collaborationCount;

    private Integer firstYear;
    private Integer lastYear;

    /** Mean of the known work ratings; null when none of the works is rated */
    private BigDecimal avgRating;

    /** Sum of the known work revenues */
    private long totalRevenue;

    private List<CollaborationType> types;
    private List<Integer> yearsActive;
    private Integer peakYear;
    private BigDecimal genreDiversity;
    private BigDecimal roleDiversity;

    // ── Bookkeeping ─────────────────────────────────────────────────────────
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public PersonPair pair() {
        return new PersonPair(personLowId, personHighId);
    }

    /** Copy holding only the aggregate values, for equality checks across stores. */
    public CollaborationPair aggregatesOnly() {
        return toBuilder().id(null).createdAt(null).updatedAt(null).build();
    }
}
