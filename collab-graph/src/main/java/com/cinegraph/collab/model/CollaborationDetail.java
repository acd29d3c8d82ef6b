package com.cinegraph.collab.model;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.util.List;

/**
 * Per-work row behind a {@link CollaborationPair}. Unique per (pair, work).
 */
@Data
@Builder
public class CollaborationDetail {

    private Long pairId;
    private long workId;
    private CollaborationType collaborationType;

    /** Role the low-id person held on this work */
    private String personLowRole;
    private String personHighRole;

    // Denormalized work facts
    private int releaseYear;
    private BigDecimal rating;
    private Long revenue;

    @Builder.Default
    private List<String> genres = List.of();
}
