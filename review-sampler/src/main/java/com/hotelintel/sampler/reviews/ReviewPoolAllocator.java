package com.hotelintel.sampler.reviews;

import com.hotelintel.sampler.config.SamplerProperties;
import com.hotelintel.sampler.model.Outcome;
import com.hotelintel.sampler.model.ReviewFilter;
import com.hotelintel.sampler.model.ReviewPool;
import com.hotelintel.sampler.model.ReviewQuery;
import com.hotelintel.sampler.model.ReviewRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Waterfall allocation of an item's reviews into NEGATIVE, EVIDENCE and RECENCY pools.
 *
 * Pools are filled strictly in that order under one shared budget of {@code maxTotal}.
 * A pool stops at its cap, when the source runs out, after too many pages, or after
 * {@code maxStalePages} consecutive pages that add no new review id. The last guard
 * exists because the site sometimes serves the same page again under a filter change.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ReviewPoolAllocator {

    private final SamplerProperties properties;

    public AllocationResult allocate(String itemId, Integer totalReviewCount, int maxTotal, ReviewSource source) {
        SamplerProperties.Reviews cfg = properties.getReviews();

        if (totalReviewCount != null && totalReviewCount < cfg.getMinReviewThreshold()) {
            log.info("Item {} has {} reviews, below threshold {}; skipping",
                    itemId, totalReviewCount, cfg.getMinReviewThreshold());
            return AllocationResult.skipped(itemId,
                    "review count " + totalReviewCount + " below " + cfg.getMinReviewThreshold());
        }

        Map<String, ReviewRecord> collected = new LinkedHashMap<>();
        Map<ReviewPool, Integer> counts = new EnumMap<>(ReviewPool.class);

        for (ReviewPool pool : ReviewPool.values()) {
            int budget = maxTotal - collected.size();
            if (budget <= 0) {
                log.debug("Item {}: budget exhausted before pool {}", itemId, pool);
                break;
            }
            int cap = Math.min(capFor(pool, cfg), budget);
            int added = fillPool(itemId, pool, cap, source, collected, cfg);
            counts.put(pool, added);
            log.info("Item {}: pool {} took {}/{} (total {})", itemId, pool.code(), added, cap, collected.size());
        }

        return new AllocationResult(itemId, Outcome.Kind.ACCEPTED, null,
                new ArrayList<>(collected.values()), counts);
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private int capFor(ReviewPool pool, SamplerProperties.Reviews cfg) {
        return switch (pool) {
            case NEGATIVE -> cfg.getNegativeCap();
            case EVIDENCE -> cfg.getEvidenceCap();
            case RECENCY -> Integer.MAX_VALUE;
        };
    }

    private int fillPool(String itemId,
                         ReviewPool pool,
                         int cap,
                         ReviewSource source,
                         Map<String, ReviewRecord> collected,
                         SamplerProperties.Reviews cfg) {
        int added = 0;
        int stalePages = 0;

        for (ReviewFilter filter : pool.filters()) {
            if (added >= cap) break;
            ReviewQuery query = new ReviewQuery(filter, pool.imagesOnly());

            for (int page = 0; page < cfg.getMaxPagesPerFilter() && added < cap; page++) {
                ReviewSource.Page result = source.fetchPage(query, page);
                if (result.reviews().isEmpty()) {
                    log.debug("Item {}: filter {} exhausted at page {}", itemId, filter, page);
                    break;
                }

                int fresh = 0;
                for (ReviewRecord review : result.reviews()) {
                    if (added >= cap) break;
                    if (review.getReviewId() == null || collected.containsKey(review.getReviewId())) continue;
                    review.setSourcePool(pool);
                    collected.put(review.getReviewId(), review);
                    added++;
                    fresh++;
                }

                if (fresh == 0) {
                    stalePages++;
                    if (stalePages >= cfg.getMaxStalePages()) {
                        log.warn("Item {}: {} consecutive pages with no new reviews in pool {}, abandoning pool",
                                itemId, stalePages, pool.code());
                        return added;
                    }
                } else {
                    stalePages = 0;
                }

                if (!result.hasNext()) break;
            }
        }
        return added;
    }
}
