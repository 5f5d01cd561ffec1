package com.hotelintel.sampler.planner;

import com.hotelintel.sampler.model.CandidateItem;

import java.util.List;

/**
 * Result of planning one zone. A positive shortfall is an observable deficiency,
 * not an error.
 */
public record ZoneOutcome(String region,
                          String zoneCode,
                          String zoneName,
                          int target,
                          List<CandidateItem> accepted,
                          List<TierAttempt> attempts) {

    public ZoneOutcome {
        accepted = List.copyOf(accepted);
        attempts = List.copyOf(attempts);
    }

    public int shortfall() {
        return Math.max(0, target - accepted.size());
    }

    public boolean isShort() {
        return shortfall() > 0;
    }
}
