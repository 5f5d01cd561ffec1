package com.hotelintel.sampler.service;

import com.hotelintel.sampler.config.SamplerProperties;
import com.hotelintel.sampler.config.SamplingPlanLoader;
import com.hotelintel.sampler.exception.SamplerBusyException;
import com.hotelintel.sampler.exception.TransientFetchException;
import com.hotelintel.sampler.model.CandidateItem;
import com.hotelintel.sampler.model.FetchTask;
import com.hotelintel.sampler.model.SampleRun;
import com.hotelintel.sampler.model.SamplingPlan;
import com.hotelintel.sampler.model.TaskKind;
import com.hotelintel.sampler.model.TaskStatus;
import com.hotelintel.sampler.output.OutputRouter;
import com.hotelintel.sampler.output.SampleStore;
import com.hotelintel.sampler.pacing.DelayKind;
import com.hotelintel.sampler.pacing.PacingPolicy;
import com.hotelintel.sampler.planner.DedupLedger;
import com.hotelintel.sampler.planner.SegmentQuotaPlanner;
import com.hotelintel.sampler.planner.TierRequest;
import com.hotelintel.sampler.planner.ZoneOutcome;
import com.hotelintel.sampler.reviews.AllocationResult;
import com.hotelintel.sampler.scheduler.TaskScheduler;
import com.hotelintel.sampler.scheduler.TaskStats;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Orchestrates acquisition over the single browser session.
 *
 * A plan run walks regions and zones strictly in plan order. Every tier visit the
 * planner makes becomes a LIST_FETCH task, retried in place through the task state
 * machine; review work is queued as REVIEW_FETCH tasks and drained separately.
 *
 * Entry points that drive the browser share one session lock. A second caller while
 * the session is held gets {@link SamplerBusyException}.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AcquisitionService {

    private final SegmentQuotaPlanner planner;
    private final TaskScheduler taskScheduler;
    private final ListingFetcher listingFetcher;
    private final ReviewAcquisitionService reviewAcquisition;
    private final OutputRouter outputRouter;
    private final SampleStore sampleStore;
    private final PacingPolicy pacing;
    private final SamplingPlanLoader planLoader;
    private final SamplerProperties properties;
    private final Clock clock;

    private final ReentrantLock sessionLock = new ReentrantLock();
    private final AtomicBoolean cancelRequested = new AtomicBoolean();

    // ── Plan runs ────────────────────────────────────────────────────────────

    public RunSummary planAndRun() {
        return planAndRun(planLoader.load());
    }

    /**
     * Samples every zone of {@code plan}. Shortfalls are reported, never thrown; only
     * plan exhaustion or {@link #cancel()} ends the run.
     */
    public RunSummary planAndRun(SamplingPlan plan) {
        acquireSession();
        cancelRequested.set(false);

        SampleRun run = SampleRun.builder()
                .runId(UUID.randomUUID().toString())
                .startedAt(now())
                .status("RUNNING")
                .itemsTargeted(plan.expectedTotal())
                .build();
        outputRouter.writeSampleRun(run);
        log.info("Run {} started: {} regions, {} items expected", run.getRunId(),
                plan.regions().size(), plan.expectedTotal());

        DedupLedger ledger = new DedupLedger();
        List<ZoneOutcome> zones = new ArrayList<>();
        List<String> writeErrors = new ArrayList<>();

        try {
            regions:
            for (int r = 0; r < plan.regions().size(); r++) {
                SamplingPlan.Region region = plan.regions().get(r);
                if (r > 0) pacing.pause(DelayKind.INTER_REGION);
                log.info("Region {} ({}/{})", region.name(), r + 1, plan.regions().size());

                for (int z = 0; z < region.zones().size(); z++) {
                    if (cancelRequested.get()) {
                        log.warn("Run {} cancelled by operator", run.getRunId());
                        run.setStatus("CANCELLED");
                        break regions;
                    }
                    if (z > 0) pacing.pause(DelayKind.INTER_ZONE);

                    SamplingPlan.Zone zone = region.zones().get(z);
                    ZoneOutcome outcome = planner.planZone(region, zone, region.tiersFor(zone), ledger,
                            request -> fetchTier(plan.cityCode(), request));
                    zones.add(outcome);
                    persistZone(outcome, run.getRunId(), writeErrors);
                }
            }
            if ("RUNNING".equals(run.getStatus())) {
                run.setStatus("SUCCESS");
            }
        } catch (RuntimeException e) {
            log.error("Run {} failed: {}", run.getRunId(), e.getMessage(), e);
            run.setStatus("FAILED");
            writeErrors.add(e.getMessage());
            throw e;
        } finally {
            RunSummary summary = RunSummary.of(run.getRunId(), run.getStatus(), plan.expectedTotal(), zones);
            run.setItemsAccepted(summary.accepted());
            run.setZonesShort(summary.shortfallByZone().size());
            run.setErrorMessage(writeErrors.isEmpty() ? null : String.join("; ", writeErrors));
            run.setCompletedAt(now());
            outputRouter.writeSampleRun(run);
            sessionLock.unlock();
            log.info("Run {} {}: {}/{} accepted, {} zones short", run.getRunId(), run.getStatus(),
                    summary.accepted(), summary.targeted(), summary.shortfallByZone().size());
        }

        return RunSummary.of(run.getRunId(), run.getStatus(), plan.expectedTotal(), zones);
    }

    // ── Review tasks ─────────────────────────────────────────────────────────

    /**
     * Queues a REVIEW_FETCH task for each stored item with enough reviews and no open
     * review task.
     */
    public List<String> createReviewTasksForEligibleItems() {
        int min = properties.getTasks().getReviewTaskMinReviewCount();
        List<String> taskIds = new ArrayList<>();
        for (CandidateItem item : sampleStore.findItemsWithMinReviews(min)) {
            if (taskScheduler.hasOpenReviewTask(item.getItemId())) {
                log.debug("Item {} already has an open review task", item.getItemId());
                continue;
            }
            taskIds.add(taskScheduler.enqueueReviewTask(item).getTaskId());
        }
        log.info("Created {} review tasks for items with at least {} reviews", taskIds.size(), min);
        return taskIds;
    }

    /**
     * Executes up to {@code limit} runnable tasks in queue order.
     *
     * @param kind null for any kind
     */
    public DrainSummary runPendingTasks(TaskKind kind, int limit) {
        acquireSession();
        cancelRequested.set(false);
        int completed = 0, skipped = 0, retrying = 0, failed = 0;
        List<FetchTask> batch = List.of();
        try {
            batch = taskScheduler.nextBatch(kind, limit);
            log.info("Draining {} pending {} tasks", batch.size(), kind != null ? kind : "");

            for (int i = 0; i < batch.size(); i++) {
                if (cancelRequested.get()) {
                    log.warn("Task drain cancelled after {} tasks", i);
                    break;
                }
                if (i > 0) pacing.pause(DelayKind.INTER_REQUEST);

                FetchTask task = batch.get(i);
                execute(task);
                switch (task.getStatus()) {
                    case COMPLETED -> completed++;
                    case SKIPPED -> skipped++;
                    case PENDING -> retrying++;
                    case FAILED -> failed++;
                    default -> log.warn("Task {} left in {}", task.getTaskId(), task.getStatus());
                }
            }
        } finally {
            sessionLock.unlock();
        }
        DrainSummary summary = new DrainSummary(batch.size(), completed, skipped, retrying, failed);
        log.info("Task drain finished: {}", summary);
        return summary;
    }

    // ── Operator controls ────────────────────────────────────────────────────

    public TaskStats stats() {
        return taskScheduler.stats();
    }

    public int resetFailed() {
        return taskScheduler.resetFailed();
    }

    /** Asks the current run or drain to stop at the next zone or task boundary. */
    public boolean cancel() {
        if (!isBusy()) return false;
        cancelRequested.set(true);
        log.info("Cancellation requested");
        return true;
    }

    public boolean isBusy() {
        return sessionLock.isLocked();
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private void acquireSession() {
        if (!sessionLock.tryLock()) {
            throw new SamplerBusyException("Browser session is busy with another run");
        }
    }

    /**
     * The planner's tier fetcher: one LIST_FETCH task per tier visit, retried in place
     * until it completes or fails for good. A task that fails for good yields nothing.
     */
    private List<CandidateItem> fetchTier(String cityCode, TierRequest request) {
        FetchTask task = taskScheduler.enqueueListTask(request.region(), request.zone(), request.tier(),
                request.requested());
        while (true) {
            Optional<List<CandidateItem>> result = attemptListTask(task, cityCode, request);
            if (result.isPresent()) {
                pacing.pause(DelayKind.INTER_REQUEST);
                return result.get();
            }
            if (task.getStatus() == TaskStatus.FAILED || cancelRequested.get()) {
                return List.of();
            }
            waitForBackoff(task);
        }
    }

    /** One attempt; empty when the attempt failed and the task was sent back or failed. */
    private Optional<List<CandidateItem>> attemptListTask(FetchTask task, String cityCode, TierRequest request) {
        taskScheduler.start(task);
        try {
            List<CandidateItem> candidates = listingFetcher.fetch(cityCode, request);
            if (candidates.isEmpty()) {
                taskScheduler.skip(task, "no listings after offset " + request.offset());
            } else {
                taskScheduler.complete(task, candidates.size());
            }
            return Optional.of(candidates);
        } catch (TransientFetchException e) {
            taskScheduler.fail(task, e.getMessage());
            return Optional.empty();
        } catch (RuntimeException e) {
            log.error("List task {} for {}/{} errored: {}", task.getTaskId(), request.zone().code(),
                    request.tier().level(), e.getMessage(), e);
            taskScheduler.fail(task, e.getClass().getSimpleName() + ": " + e.getMessage());
            return Optional.empty();
        }
    }

    private void execute(FetchTask task) {
        switch (task.getKind()) {
            case REVIEW_FETCH -> executeReviewTask(task);
            case LIST_FETCH -> executeListTask(task);
        }
    }

    private void executeReviewTask(FetchTask task) {
        taskScheduler.start(task);
        try {
            Integer known = sampleStore.findItem(task.getItemId()).map(CandidateItem::getReviewCount).orElse(null);
            AllocationResult result = reviewAcquisition.acquire(task.getItemId(), known);
            if (result.isSkipped()) {
                taskScheduler.skip(task, result.reason());
            } else {
                taskScheduler.complete(task, result.total());
            }
        } catch (TransientFetchException e) {
            taskScheduler.fail(task, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Review task {} for item {} errored: {}", task.getTaskId(), task.getItemId(), e.getMessage(), e);
            taskScheduler.fail(task, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    /**
     * Re-runs a list task left in the queue by an earlier, interrupted run. Dedup is
     * per task here, so the store's item key is what prevents duplicates.
     */
    private void executeListTask(FetchTask task) {
        SamplingPlan plan = planLoader.load();
        SamplingPlan.Region region;
        SamplingPlan.Zone zone;
        SamplingPlan.PriceTier tier;
        try {
            region = plan.region(task.getRegion());
            zone = region.zone(task.getZoneCode());
            tier = region.tiersFor(zone).stream()
                    .filter(t -> t.level().equals(task.getTierLevel()))
                    .findFirst()
                    .orElseThrow(() -> new IllegalArgumentException("Unknown tier " + task.getTierLevel()));
        } catch (IllegalArgumentException e) {
            taskScheduler.start(task);
            taskScheduler.skip(task, "no longer in plan: " + e.getMessage());
            return;
        }
        List<SamplingPlan.PriceTier> tiers = region.tiersFor(zone);
        int requested = task.getItemsTarget() != null ? task.getItemsTarget() : tier.targetCount();

        TierRequest request = new TierRequest(region, zone, tier, requested, 0, TierRequest.Pass.FORWARD);
        Optional<List<CandidateItem>> result = attemptListTask(task, plan.cityCode(), request);
        if (result.isEmpty()) return;

        DedupLedger ledger = new DedupLedger();
        List<CandidateItem> accepted = new ArrayList<>();
        for (CandidateItem candidate : result.get()) {
            if (accepted.size() >= requested) break;
            if (candidate.getItemId() == null) continue;
            if (ledger.accept(region.name(), candidate.getItemId())) {
                SegmentQuotaPlanner.stratify(candidate, region, zone, tiers, tier);
                accepted.add(candidate);
            }
        }
        try {
            outputRouter.writeItems(accepted, "task-" + task.getTaskId());
        } catch (RuntimeException e) {
            log.error("Failed to persist {} items for task {}: {}", accepted.size(), task.getTaskId(), e.getMessage(), e);
        }
    }

    private void persistZone(ZoneOutcome outcome, String runId, List<String> errors) {
        try {
            outputRouter.writeItems(outcome.accepted(), runId);
        } catch (RuntimeException e) {
            log.error("Failed to persist {} items for zone {}: {}",
                    outcome.accepted().size(), outcome.zoneCode(), e.getMessage(), e);
            errors.add("zone " + outcome.zoneCode() + ": " + e.getMessage());
        }
    }

    private void waitForBackoff(FetchTask task) {
        if (task.getNextAttemptAfter() == null) return;
        Duration wait = Duration.between(now(), task.getNextAttemptAfter());
        if (wait.isNegative() || wait.isZero()) return;
        log.info("Waiting {} s before retrying task {}", wait.toSeconds(), task.getTaskId());
        sleepMs(wait.toMillis());
    }

    private void sleepMs(long ms) {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }
}
