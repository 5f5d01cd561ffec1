package com.hotelintel.sampler.reviews;

import com.hotelintel.sampler.model.Outcome;
import com.hotelintel.sampler.model.ReviewPool;
import com.hotelintel.sampler.model.ReviewRecord;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Reviews chosen for one item, in acquisition order, with per-pool counts.
 * A skipped result (too few reviews on the item) has no records.
 */
public record AllocationResult(String itemId,
                               Outcome.Kind kind,
                               String reason,
                               List<ReviewRecord> records,
                               Map<ReviewPool, Integer> poolCounts) {

    public AllocationResult {
        records = List.copyOf(records);
        EnumMap<ReviewPool, Integer> counts = new EnumMap<>(ReviewPool.class);
        for (ReviewPool pool : ReviewPool.values()) {
            counts.put(pool, poolCounts.getOrDefault(pool, 0));
        }
        poolCounts = counts;
    }

    public static AllocationResult skipped(String itemId, String reason) {
        return new AllocationResult(itemId, Outcome.Kind.SKIPPED, reason, List.of(), Map.of());
    }

    public boolean isSkipped() {
        return kind == Outcome.Kind.SKIPPED;
    }

    public int count(ReviewPool pool) {
        return poolCounts.get(pool);
    }

    public int total() {
        return records.size();
    }
}
