package com.hotelintel.sampler.planner;

import com.hotelintel.sampler.model.SamplingPlan;

import java.util.List;

/**
 * Assigns a listing to the tier its price actually falls in. The site's price filter
 * is loose, so a listing fetched under one tier may belong to a neighbour.
 */
public final class PriceClassifier {

    private PriceClassifier() {
    }

    /**
     * @return the matching tier level; prices below the first tier clamp to it, above the
     *         last clamp to the last; {@code fallback} when the price is unknown
     */
    public static String classify(List<SamplingPlan.PriceTier> tiers, Integer price, String fallback) {
        if (price == null || tiers.isEmpty()) return fallback;
        for (SamplingPlan.PriceTier tier : tiers) {
            if (tier.contains(price)) return tier.level();
        }
        SamplingPlan.PriceTier first = tiers.get(0);
        return price < first.min() ? first.level() : tiers.get(tiers.size() - 1).level();
    }
}
