package com.hotelintel.sampler.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * A unit of fetch work, stored in the fetch_tasks table so the queue survives restarts.
 *
 * Status is only ever changed by {@code TaskScheduler}; everything else reads it.
 * LIST_FETCH tasks are scoped by (region, zoneCode, tierLevel), REVIEW_FETCH by itemId.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class FetchTask {

    private String taskId;
    private TaskKind kind;

    // ── Scope ───────────────────────────────────────────────────────────────
    private String region;
    private String zoneCode;
    private String tierLevel;
    private String itemId;

    // ── State ───────────────────────────────────────────────────────────────
    private int priority;

    /**
     * Written only by {@code TaskScheduler}, which records a task_events row for every
     * change. The setter stays public because the scheduler lives in another package.
     */
    @Builder.Default
    private TaskStatus status = TaskStatus.PENDING;

    private int retryCount;
    private String errorReason;

    // ── Timestamps ──────────────────────────────────────────────────────────
    private LocalDateTime createdAt;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;

    /** Earliest time a retried task may be picked again; null when not backing off */
    private LocalDateTime nextAttemptAfter;

    // ── Results ─────────────────────────────────────────────────────────────
    private int itemsCrawled;
    private Integer itemsTarget;

    public String scopeLabel() {
        return kind == TaskKind.REVIEW_FETCH
                ? "item " + itemId
                : region + "/" + zoneCode + "/" + tierLevel;
    }
}
