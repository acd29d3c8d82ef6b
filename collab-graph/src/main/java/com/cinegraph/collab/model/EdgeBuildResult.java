package com.cinegraph.collab.model;

import java.util.List;

public record EdgeBuildResult(long workId, List<PairCandidate> candidates, int skippedCredits, int rejectedSelfPairs) {
}
