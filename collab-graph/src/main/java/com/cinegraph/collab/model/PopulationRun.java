package com.cinegraph.collab.model;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * Tracks each rebuild or batch population for observability.
 * Stored in the population_runs table.
 */
@Data
@Builder
public class PopulationRun {

    private String runId;           // UUID
    private String kind;            // REBUILD | BATCH
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private String status;          // RUNNING | SUCCESS | FAILED
    private int worksProcessed;
    private int worksFailed;
    private int detailsWritten;
    private String errorMessage;    // null on success
}
