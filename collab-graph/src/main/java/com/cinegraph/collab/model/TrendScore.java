package com.cinegraph.collab.model;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;

@Data
@Builder
public class TrendScore {

    private long personLowId;
    private long personHighId;
    private BigDecimal trendScore;

    /** Collaborations inside the recent window */
    private int recentCount;

    /** Collaborations before the recent window */
    private int baselineCount;

    private Integer lastYear;
}
