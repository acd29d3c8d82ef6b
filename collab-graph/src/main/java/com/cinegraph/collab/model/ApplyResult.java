package com.cinegraph.collab.model;

public record ApplyResult(long workId, int candidates, int detailsWritten, int skippedCredits) {
}
