package com.hotelintel.sampler.planner;

import com.hotelintel.sampler.model.SamplingPlan;

import java.util.List;

/**
 * Per-zone quota bookkeeping. Lives for the duration of one {@code planZone} call.
 */
class QuotaState {

    private final int targetTotal;
    private int remaining;
    private int carryOver;

    QuotaState(int targetTotal) {
        this.targetTotal = targetTotal;
        this.remaining = targetTotal;
    }

    static QuotaState forTiers(List<SamplingPlan.PriceTier> tiers) {
        return new QuotaState(tiers.stream().mapToInt(SamplingPlan.PriceTier::targetCount).sum());
    }

    /** Forward-pass request for a tier: its own target plus whatever earlier tiers left unfilled. */
    int forwardRequest(SamplingPlan.PriceTier tier) {
        return Math.min(tier.targetCount() + carryOver, remaining);
    }

    void recordForward(int requested, int actual) {
        remaining -= actual;
        carryOver = Math.max(0, requested - actual);
    }

    void recordReverse(int actual) {
        remaining -= actual;
        carryOver = remaining;
    }

    int targetTotal() {
        return targetTotal;
    }

    int remaining() {
        return remaining;
    }

    int carryOver() {
        return carryOver;
    }
}
