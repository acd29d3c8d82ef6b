package com.cinegraph.collab.model;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.util.List;

/**
 * Work metadata as read from the upstream catalog.
 * Only workId and releaseYear are guaranteed; rating and revenue may be null.
 */
@Data
@Builder
public class Work {

    private long workId;
    private int releaseYear;

    /** 0-10 quality rating, null when unknown */
    private BigDecimal rating;

    /** Non-negative revenue figure, null when unknown */
    private Long revenue;

    @Builder.Default
    private List<String> genres = List.of();
}
