package com.hotelintel.sampler.planner;

/** Requested versus actual for one tier visit, in the order the planner made them. */
public record TierAttempt(String tierLevel, TierRequest.Pass pass, int requested, int actual) {

    public int deficit() {
        return Math.max(0, requested - actual);
    }
}
