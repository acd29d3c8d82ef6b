package com.cinegraph.collab.scheduler;

import com.cinegraph.collab.config.CollabGraphProperties;
import com.cinegraph.collab.service.AlreadyRunningException;
import com.cinegraph.collab.service.PopulationService;
import com.cinegraph.collab.service.TrendEngine;
import com.cinegraph.collab.store.CollaborationSchema;
import com.cinegraph.collab.store.PathCacheRepository;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Startup schema check plus the recurring jobs.
 *
 * Default schedules: trend refresh daily at 03:00 UTC, expired path cache
 * purge hourly. Override with collab-graph.trend.cron and
 * collab-graph.paths.purge-cron.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CollaborationScheduler {

    private final CollaborationSchema schema;
    private final PopulationService populationService;
    private final TrendEngine trendEngine;
    private final PathCacheRepository pathCache;
    private final CollabGraphProperties properties;
    private final Clock clock;

    /**
     * On application startup:
     *  1. Always ensure the owned tables exist
     *  2. Optionally start a full rebuild if collab-graph.population.rebuild-on-startup=true
     */
    @PostConstruct
    public void onStartup() {
        schema.ensureSchema();

        if (properties.getPopulation().isRebuildOnStartup()) {
            log.info("rebuild-on-startup=true, starting full rebuild in the background");
            try {
                populationService.rebuildAllAsync();
            } catch (AlreadyRunningException e) {
                log.warn("Startup rebuild skipped: {}", e.getMessage());
            }
        } else {
            log.info("Collaboration graph ready. Trend refresh schedule: {}", properties.getTrend().getCron());
        }
    }

    @Scheduled(cron = "${collab-graph.trend.cron:0 0 3 * * ?}", zone = "UTC")
    public void scheduledTrendRefresh() {
        log.info("Scheduled trend refresh triggered");
        try {
            int pairs = trendEngine.refresh();
            log.info("Scheduled trend refresh completed: {} pairs scored", pairs);
        } catch (AlreadyRunningException e) {
            log.info("Skipping scheduled trend refresh: {}", e.getMessage());
        } catch (Exception e) {
            log.error("Scheduled trend refresh failed: {}", e.getMessage(), e);
        }
    }

    @Scheduled(cron = "${collab-graph.paths.purge-cron:0 0 * * * ?}", zone = "UTC")
    public void purgeExpiredPaths() {
        log.debug("Running path cache purge...");
        try {
            int purged = pathCache.purgeExpired(clock.instant());
            if (purged > 0) {
                log.info("Path cache purge completed: {} expired entries removed", purged);
            }
        } catch (Exception e) {
            log.error("Path cache purge failed: {}", e.getMessage(), e);
        }
    }
}
