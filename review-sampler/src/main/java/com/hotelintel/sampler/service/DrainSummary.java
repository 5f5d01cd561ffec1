package com.hotelintel.sampler.service;

/** Outcome counts for one {@code runPendingTasks} call. */
public record DrainSummary(int picked, int completed, int skipped, int retrying, int failed) {

    public static DrainSummary empty() {
        return new DrainSummary(0, 0, 0, 0, 0);
    }
}
