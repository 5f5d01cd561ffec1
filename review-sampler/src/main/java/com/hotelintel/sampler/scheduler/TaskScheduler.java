package com.hotelintel.sampler.scheduler;

import com.hotelintel.sampler.config.SamplerProperties;
import com.hotelintel.sampler.model.CandidateItem;
import com.hotelintel.sampler.model.FetchTask;
import com.hotelintel.sampler.model.SamplingPlan;
import com.hotelintel.sampler.model.TaskKind;
import com.hotelintel.sampler.model.TaskStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Owner of the fetch task state machine. Nothing else changes a task's status.
 *
 * <pre>
 *   PENDING ──start──▶ IN_PROGRESS ──complete──▶ COMPLETED
 *                          │ ──skip────────▶ SKIPPED
 *                          │ ──fail, retries left──▶ PENDING (backoff)
 *                          │ ──fail, retries used──▶ FAILED
 *   FAILED ──resetFailed──▶ PENDING
 * </pre>
 *
 * Each transition updates the task row and appends a task_events row in one transaction.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class TaskScheduler {

    private final TaskRepository repository;
    private final TransactionTemplate transactionTemplate;
    private final SamplerProperties properties;
    private final Clock clock;

    // ── Enqueue ──────────────────────────────────────────────────────────────

    public FetchTask enqueueListTask(SamplingPlan.Region region,
                                     SamplingPlan.Zone zone,
                                     SamplingPlan.PriceTier tier,
                                     int requested) {
        FetchTask task = FetchTask.builder()
                .taskId(UUID.randomUUID().toString())
                .kind(TaskKind.LIST_FETCH)
                .region(region.name())
                .zoneCode(zone.code())
                .tierLevel(tier.level())
                .priority(listPriority(region, tier))
                .itemsTarget(requested)
                .createdAt(now())
                .build();
        insert(task);
        return task;
    }

    public FetchTask enqueueReviewTask(CandidateItem item) {
        int reviewCount = item.getReviewCount() != null ? item.getReviewCount() : 0;
        FetchTask task = FetchTask.builder()
                .taskId(UUID.randomUUID().toString())
                .kind(TaskKind.REVIEW_FETCH)
                .region(item.getRegion())
                .zoneCode(item.getZoneCode())
                .itemId(item.getItemId())
                .priority(reviewPriority(item.getReviewCount(), item.getRating()))
                .itemsTarget(Math.min(reviewCount, properties.getReviews().getMaxPerItem()))
                .createdAt(now())
                .build();
        insert(task);
        return task;
    }

    public boolean hasOpenReviewTask(String itemId) {
        return repository.hasOpenReviewTask(itemId);
    }

    // ── Queue ────────────────────────────────────────────────────────────────

    /**
     * Up to {@code limit} runnable tasks: PENDING and out of backoff, by priority then age.
     *
     * @param kind null for any kind
     */
    public List<FetchTask> nextBatch(TaskKind kind, int limit) {
        return repository.findReady(kind, now(), limit);
    }

    public FetchTask get(String taskId) {
        return repository.findById(taskId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown task: " + taskId));
    }

    // ── Transitions ──────────────────────────────────────────────────────────

    public void start(FetchTask task) {
        require(task, TaskStatus.PENDING);
        task.setStatus(TaskStatus.IN_PROGRESS);
        task.setStartedAt(now());
        task.setNextAttemptAfter(null);
        transition(task, TaskStatus.PENDING, "attempt " + (task.getRetryCount() + 1));
    }

    public void complete(FetchTask task, int itemsCrawled) {
        require(task, TaskStatus.IN_PROGRESS);
        task.setStatus(TaskStatus.COMPLETED);
        task.setItemsCrawled(itemsCrawled);
        task.setCompletedAt(now());
        task.setErrorReason(null);
        transition(task, TaskStatus.IN_PROGRESS, itemsCrawled + " items");
    }

    /** Terminal "nothing to do" outcome, e.g. an item below the review threshold. */
    public void skip(FetchTask task, String reason) {
        require(task, TaskStatus.IN_PROGRESS);
        task.setStatus(TaskStatus.SKIPPED);
        task.setErrorReason(reason);
        task.setCompletedAt(now());
        transition(task, TaskStatus.IN_PROGRESS, reason);
    }

    /**
     * Records a failed attempt. The task goes back to PENDING with an exponential backoff
     * until {@code maxRetries} attempts have failed, then becomes FAILED.
     */
    public void fail(FetchTask task, String reason) {
        require(task, TaskStatus.IN_PROGRESS);
        int maxRetries = properties.getTasks().getMaxRetries();
        int previous = task.getRetryCount();
        int attempts = previous + 1;

        task.setRetryCount(attempts);
        task.setErrorReason(reason);

        if (attempts >= maxRetries) {
            task.setStatus(TaskStatus.FAILED);
            task.setCompletedAt(now());
            task.setNextAttemptAfter(null);
        } else {
            task.setStatus(TaskStatus.PENDING);
            task.setNextAttemptAfter(now().plus(backoff(previous)));
        }
        transition(task, TaskStatus.IN_PROGRESS, reason);
    }

    /** Reopens every FAILED task with a clean retry budget. */
    public int resetFailed() {
        Integer reset = transactionTemplate.execute(status -> {
            List<FetchTask> failed = repository.findByStatus(TaskStatus.FAILED);
            LocalDateTime at = now();
            for (FetchTask task : failed) {
                task.setStatus(TaskStatus.PENDING);
                task.setRetryCount(0);
                task.setErrorReason(null);
                task.setNextAttemptAfter(null);
                task.setStartedAt(null);
                task.setCompletedAt(null);
                repository.update(task);
                repository.recordEvent(new TaskEvent(task.getTaskId(), TaskStatus.FAILED, TaskStatus.PENDING,
                        "reset", at));
            }
            return failed.size();
        });
        int count = reset != null ? reset : 0;
        log.info("Reset {} failed tasks to PENDING", count);
        return count;
    }

    /**
     * Returns tasks left IN_PROGRESS by a process that died mid-attempt to PENDING. The
     * interrupted attempt is not counted against the retry limit. Only safe while no
     * worker holds the browser session, i.e. at startup.
     */
    public int recoverInterrupted() {
        Integer recovered = transactionTemplate.execute(status -> {
            List<FetchTask> stuck = repository.findByStatus(TaskStatus.IN_PROGRESS);
            LocalDateTime at = now();
            for (FetchTask task : stuck) {
                task.setStatus(TaskStatus.PENDING);
                task.setStartedAt(null);
                task.setNextAttemptAfter(null);
                repository.update(task);
                repository.recordEvent(new TaskEvent(task.getTaskId(), TaskStatus.IN_PROGRESS, TaskStatus.PENDING,
                        "recovered after restart", at));
            }
            return stuck.size();
        });
        int count = recovered != null ? recovered : 0;
        if (count > 0) {
            log.warn("Recovered {} tasks left IN_PROGRESS by an earlier process", count);
        }
        return count;
    }

    public TaskStats stats() {
        return TaskStats.from(repository.countByKindAndStatus());
    }

    public List<TaskEvent> history(String taskId) {
        return repository.findEvents(taskId);
    }

    // ── Priorities ───────────────────────────────────────────────────────────

    public static int listPriority(SamplingPlan.Region region, SamplingPlan.PriceTier tier) {
        return region.weight() + tier.weight();
    }

    /** Volume bonus (over 1000: 10, over 500: 8, over 200: 5) plus the integer part of the rating. */
    public static int reviewPriority(Integer reviewCount, Double rating) {
        int count = reviewCount != null ? reviewCount : 0;
        int priority;
        if (count > 1000) {
            priority = 10;
        } else if (count > 500) {
            priority = 8;
        } else if (count > 200) {
            priority = 5;
        } else {
            priority = 0;
        }
        if (rating != null) {
            priority += rating.intValue();
        }
        return priority;
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    Duration backoff(int retryCount) {
        return properties.getTasks().getRetryBackoff().multipliedBy(1L << Math.min(retryCount, 16));
    }

    private void insert(FetchTask task) {
        transactionTemplate.executeWithoutResult(status -> {
            repository.insert(task);
            repository.recordEvent(new TaskEvent(task.getTaskId(), null, TaskStatus.PENDING, "created", task.getCreatedAt()));
        });
        log.debug("Enqueued {} task {} for {} (priority {})",
                task.getKind(), task.getTaskId(), task.scopeLabel(), task.getPriority());
    }

    private void transition(FetchTask task, TaskStatus from, String reason) {
        transactionTemplate.executeWithoutResult(status -> {
            repository.update(task);
            repository.recordEvent(new TaskEvent(task.getTaskId(), from, task.getStatus(), reason, now()));
        });

        switch (task.getStatus()) {
            case FAILED -> log.error("Task {} ({}) FAILED after {} attempts: {}",
                    task.getTaskId(), task.scopeLabel(), task.getRetryCount(), reason);
            case PENDING -> log.warn("Task {} ({}) attempt {} failed, retry after {}: {}",
                    task.getTaskId(), task.scopeLabel(), task.getRetryCount(), task.getNextAttemptAfter(), reason);
            case SKIPPED -> log.info("Task {} ({}) SKIPPED: {}", task.getTaskId(), task.scopeLabel(), reason);
            default -> log.info("Task {} ({}) {} -> {}: {}",
                    task.getTaskId(), task.scopeLabel(), from, task.getStatus(), reason);
        }
    }

    private void require(FetchTask task, TaskStatus expected) {
        if (task.getStatus() != expected) {
            throw new IllegalStateException("Task " + task.getTaskId() + " is " + task.getStatus()
                    + ", expected " + expected);
        }
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }
}
