package com.cinegraph.collab.service;

import com.cinegraph.collab.model.ApplyResult;
import com.cinegraph.collab.model.Credit;
import com.cinegraph.collab.model.EdgeBuildResult;
import com.cinegraph.collab.model.PopulationRun;
import com.cinegraph.collab.model.Work;
import com.cinegraph.collab.store.AggregateStore;
import com.cinegraph.collab.store.CreditFeed;
import com.cinegraph.collab.store.PopulationRunWriter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Write entrypoints: apply one work, apply a batch, rebuild everything.
 *
 * Works are independent, so batches and rebuilds fan out over the population
 * executor. A rebuild may overlap with incremental applies (both converge on
 * the same rows) but never with another rebuild.
 */
@Service
@Slf4j
public class PopulationService {

    private final CreditFeed creditFeed;
    private final EdgeBuilder edgeBuilder;
    private final AggregateStore aggregateStore;
    private final PopulationRunWriter runWriter;
    private final Executor populationExecutor;
    private final Clock clock;

    private final AtomicBoolean rebuilding = new AtomicBoolean(false);

    public PopulationService(CreditFeed creditFeed,
                             EdgeBuilder edgeBuilder,
                             AggregateStore aggregateStore,
                             PopulationRunWriter runWriter,
                             @Qualifier("populationExecutor") Executor populationExecutor,
                             Clock clock) {
        this.creditFeed = creditFeed;
        this.edgeBuilder = edgeBuilder;
        this.aggregateStore = aggregateStore;
        this.runWriter = runWriter;
        this.populationExecutor = populationExecutor;
        this.clock = clock;
    }

    /**
     * Process one work's credits and merge the resulting edges.
     * Re-applying a work that is already stored changes nothing.
     *
     * @throws IllegalArgumentException if the work is unknown or has no release year
     */
    public ApplyResult applyIncremental(long workId) {
        Work work = creditFeed.findWork(workId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown work or missing release year: " + workId));
        List<Credit> credits = creditFeed.creditsFor(workId);

        EdgeBuildResult edges = edgeBuilder.build(workId, credits);
        int written = aggregateStore.apply(work, edges.candidates());

        log.debug("Applied work {}: {} credits, {} candidates, {} detail rows written",
                workId, credits.size(), edges.candidates().size(), written);
        return new ApplyResult(workId, edges.candidates().size(), written, edges.skippedCredits());
    }

    /** Apply several works in parallel. Failures of single works are counted, not thrown. */
    public PopulationRun applyBatch(List<Long> workIds) {
        PopulationRun run = startRun("BATCH");
        try {
            processAll(workIds, run);
            run.setStatus(run.getWorksFailed() == 0 ? "SUCCESS" : "FAILED");
        } catch (RuntimeException e) {
            log.error("Batch population failed: {}", e.getMessage(), e);
            run.setStatus("FAILED");
            run.setErrorMessage(e.getMessage());
        } finally {
            finishRun(run);
        }
        return run;
    }

    /**
     * Drop every pair and detail row and regenerate them from all works.
     *
     * @throws AlreadyRunningException if another rebuild is in flight
     */
    public PopulationRun rebuildAll() {
        acquireRebuild();
        return runRebuild();
    }

    /**
     * Claim the rebuild slot on the caller's thread, then run the rebuild on a
     * new thread. Overlap is reported to the caller immediately.
     */
    public void rebuildAllAsync() {
        acquireRebuild();
        new Thread(this::runRebuild, "collab-rebuild").start();
    }

    public boolean isRebuilding() {
        return rebuilding.get();
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private void acquireRebuild() {
        if (!rebuilding.compareAndSet(false, true)) {
            throw new AlreadyRunningException("Collaboration rebuild");
        }
    }

    private PopulationRun runRebuild() {
        PopulationRun run = startRun("REBUILD");
        try {
            log.info("Starting full collaboration rebuild...");
            aggregateStore.deleteAll();
            List<Long> workIds = creditFeed.allWorkIds();
            log.info("Rebuilding from {} works", workIds.size());

            processAll(workIds, run);

            run.setStatus(run.getWorksFailed() == 0 ? "SUCCESS" : "FAILED");
            log.info("Rebuild complete: {} works, {} failed, {} detail rows",
                    run.getWorksProcessed(), run.getWorksFailed(), run.getDetailsWritten());
        } catch (RuntimeException e) {
            log.error("Rebuild failed: {}", e.getMessage(), e);
            run.setStatus("FAILED");
            run.setErrorMessage(e.getMessage());
        } finally {
            finishRun(run);
            rebuilding.set(false);
        }
        return run;
    }

    private void processAll(List<Long> workIds, PopulationRun run) {
        AtomicInteger processed = new AtomicInteger();
        AtomicInteger failed = new AtomicInteger();
        AtomicInteger details = new AtomicInteger();

        List<CompletableFuture<Void>> futures = new ArrayList<>(workIds.size());
        for (Long workId : workIds) {
            futures.add(CompletableFuture.runAsync(() -> {
                try {
                    ApplyResult result = applyIncremental(workId);
                    details.addAndGet(result.detailsWritten());
                    int done = processed.incrementAndGet();
                    if (done % 1000 == 0) {
                        log.info("Processed {}/{} works", done, workIds.size());
                    }
                } catch (RuntimeException e) {
                    failed.incrementAndGet();
                    log.error("Failed to apply work {}: {}", workId, e.getMessage(), e);
                }
            }, populationExecutor));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        run.setWorksProcessed(processed.get());
        run.setWorksFailed(failed.get());
        run.setDetailsWritten(details.get());
    }

    private PopulationRun startRun(String kind) {
        PopulationRun run = PopulationRun.builder()
                .runId(UUID.randomUUID().toString())
                .kind(kind)
                .startedAt(LocalDateTime.now(clock))
                .status("RUNNING")
                .build();
        runWriter.writeRun(run);
        return run;
    }

    private void finishRun(PopulationRun run) {
        run.setCompletedAt(LocalDateTime.now(clock));
        runWriter.writeRun(run);
    }
}
