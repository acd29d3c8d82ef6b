package com.cinegraph.collab.config;

import com.cinegraph.collab.model.ApplyResult;
import com.cinegraph.collab.model.CollaborationFilter;
import com.cinegraph.collab.model.CollaborationType;
import com.cinegraph.collab.model.PathResult;
import com.cinegraph.collab.output.PairCsvExporter;
import com.cinegraph.collab.service.AlreadyRunningException;
import com.cinegraph.collab.service.CollaborationQueryService;
import com.cinegraph.collab.service.PopulationService;
import com.cinegraph.collab.service.TrendEngine;
import com.cinegraph.collab.service.UnknownPersonException;
import com.cinegraph.collab.store.PopulationRunWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@Slf4j
@RequiredArgsConstructor
public class CollaborationController {

    private final CollaborationQueryService queryService;
    private final PopulationService populationService;
    private final TrendEngine trendEngine;
    private final PopulationRunWriter runWriter;
    private final PairCsvExporter csvExporter;

    // ── Collaboration queries ─────────────────────────────────────────────────

    /**
     * Summary for one pair.
     *
     * GET /collaborations/pair?a=17&b=42
     */
    @GetMapping("/collaborations/pair")
    public ResponseEntity<?> getPair(@RequestParam long a, @RequestParam long b) {
        try {
            return queryService.pairStats(a, b)
                    .<ResponseEntity<?>>map(ResponseEntity::ok)
                    .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                            .body(Map.of("error", "No collaboration between " + a + " and " + b)));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("Pair query failed for {} / {}: {}", a, b, e.getMessage(), e);
            return ResponseEntity.internalServerError().body(Map.of("error", String.valueOf(e.getMessage())));
        }
    }

    /**
     * Works a pair shares, newest first.
     *
     * GET /collaborations/pair/works?a=17&b=42&type=performer-director
     */
    @GetMapping("/collaborations/pair/works")
    public ResponseEntity<?> getSharedWorks(
            @RequestParam long a,
            @RequestParam long b,
            @RequestParam(required = false) String type) {
        try {
            CollaborationType parsed = type == null ? null : CollaborationType.fromCode(type);
            return ResponseEntity.ok(queryService.sharedWorks(a, b, parsed));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("Shared works query failed for {} / {}: {}", a, b, e.getMessage(), e);
            return ResponseEntity.internalServerError().body(Map.of("error", String.valueOf(e.getMessage())));
        }
    }

    /**
     * Performer-director pairs resembling this one.
     *
     * GET /collaborations/pair/similar?a=17&b=42&limit=10
     */
    @GetMapping("/collaborations/pair/similar")
    public ResponseEntity<?> getSimilarPairs(
            @RequestParam long a,
            @RequestParam long b,
            @RequestParam(defaultValue = "10") int limit) {
        try {
            return ResponseEntity.ok(queryService.similarCollaborations(a, b, limit));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("Similar pairs query failed for {} / {}: {}", a, b, e.getMessage(), e);
            return ResponseEntity.internalServerError().body(Map.of("error", String.valueOf(e.getMessage())));
        }
    }

    /**
     * GET /collaborations/people/42/top?type=performer-director&role=director&minCount=2&limit=10
     */
    @GetMapping("/collaborations/people/{personId}/top")
    public ResponseEntity<?> getTopCollaborators(
            @PathVariable long personId,
            @RequestParam(required = false) String type,
            @RequestParam(required = false) String role,
            @RequestParam(defaultValue = "1") int minCount,
            @RequestParam(defaultValue = "10") int limit) {
        try {
            CollaborationFilter filter = new CollaborationFilter(
                    type == null ? null : CollaborationType.fromCode(type), role, minCount);
            return ResponseEntity.ok(queryService.topCollaborators(personId, filter, limit));
        } catch (UnknownPersonException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("Top collaborators query failed for {}: {}", personId, e.getMessage(), e);
            return ResponseEntity.internalServerError().body(Map.of("error", String.valueOf(e.getMessage())));
        }
    }

    @GetMapping("/collaborations/people/{personId}/timeline")
    public ResponseEntity<?> getTimeline(@PathVariable long personId) {
        try {
            return ResponseEntity.ok(queryService.personTimeline(personId));
        } catch (UnknownPersonException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("Timeline query failed for {}: {}", personId, e.getMessage(), e);
            return ResponseEntity.internalServerError().body(Map.of("error", String.valueOf(e.getMessage())));
        }
    }

    /**
     * Shortest collaboration chain between two people.
     *
     * GET /paths?from=17&to=99&maxDepth=6&withWorks=true
     *
     * "No path" is a 200 with found=false.
     */
    @GetMapping("/paths")
    public ResponseEntity<?> getPath(
            @RequestParam long from,
            @RequestParam long to,
            @RequestParam(required = false) Integer maxDepth,
            @RequestParam(defaultValue = "false") boolean withWorks) {
        try {
            PathResult result = queryService.shortestPath(from, to, maxDepth);
            if (!withWorks) {
                return ResponseEntity.ok(result);
            }
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("result", result);
            body.put("hops", queryService.pathHops(result));
            return ResponseEntity.ok(body);
        } catch (UnknownPersonException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("Path query failed for {} -> {}: {}", from, to, e.getMessage(), e);
            return ResponseEntity.internalServerError().body(Map.of("error", String.valueOf(e.getMessage())));
        }
    }

    @GetMapping("/trending")
    public ResponseEntity<?> getTrending(@RequestParam(defaultValue = "20") int limit) {
        try {
            return ResponseEntity.ok(queryService.topTrending(limit));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("Trending query failed: {}", e.getMessage(), e);
            return ResponseEntity.internalServerError().body(Map.of("error", String.valueOf(e.getMessage())));
        }
    }

    // ── Population and maintenance triggers ───────────────────────────────────

    @PostMapping("/population/works/{workId}")
    public ResponseEntity<?> applyWork(@PathVariable long workId) {
        try {
            ApplyResult result = populationService.applyIncremental(workId);
            return ResponseEntity.ok(result);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("Apply failed for work {}: {}", workId, e.getMessage(), e);
            return ResponseEntity.internalServerError().body(Map.of("error", String.valueOf(e.getMessage())));
        }
    }

    @PostMapping("/population/rebuild")
    public ResponseEntity<Map<String, String>> rebuild() {
        try {
            populationService.rebuildAllAsync();
            return ResponseEntity.accepted().body(Map.of("status", "accepted", "target", "rebuild"));
        } catch (AlreadyRunningException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
        }
    }

    @GetMapping("/population/runs")
    public ResponseEntity<?> recentRuns(@RequestParam(defaultValue = "20") int limit) {
        if (limit <= 0) {
            return ResponseEntity.badRequest().body(Map.of("error", "limit must be positive"));
        }
        return ResponseEntity.ok(runWriter.recentRuns(limit));
    }

    @PostMapping("/trending/refresh")
    public ResponseEntity<Map<String, String>> refreshTrending() {
        try {
            trendEngine.refreshAsync();
            return ResponseEntity.accepted().body(Map.of("status", "accepted", "target", "trend-refresh"));
        } catch (AlreadyRunningException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
        }
    }

    @PostMapping("/export/pairs")
    public ResponseEntity<Map<String, String>> exportPairs() {
        try {
            Path file = csvExporter.exportPairs();
            return ResponseEntity.ok(Map.of("status", "written", "file", file.toString()));
        } catch (Exception e) {
            log.error("Pair export failed: {}", e.getMessage(), e);
            return ResponseEntity.internalServerError().body(Map.of("error", String.valueOf(e.getMessage())));
        }
    }
}
