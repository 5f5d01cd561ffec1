package com.hotelintel.sampler.planner;

import com.hotelintel.sampler.model.SamplingPlan;

/**
 * One bounded fetch against a (zone, tier) cell.
 *
 * @param requested how many new items the planner still wants from this tier
 * @param offset    ranked listings of this tier already consumed earlier in the zone;
 *                  the fetcher starts after them
 */
public record TierRequest(SamplingPlan.Region region,
                          SamplingPlan.Zone zone,
                          SamplingPlan.PriceTier tier,
                          int requested,
                          int offset,
                          Pass pass) {

    public enum Pass { FORWARD, REVERSE }
}
