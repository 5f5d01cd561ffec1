package com.hotelintel.sampler.model;

import java.util.List;

/**
 * Waterfall review pools, declared in acquisition order.
 *
 * Negative and image-bearing reviews are scarce, so they are taken first
 * under the shared per-item budget; RECENCY only tops up what is left.
 */
public enum ReviewPool {

    NEGATIVE(List.of(ReviewFilter.BAD, ReviewFilter.MEDIUM), false),
    EVIDENCE(List.of(ReviewFilter.ALL), true),
    RECENCY(List.of(ReviewFilter.ALL), false);

    private final List<ReviewFilter> filters;
    private final boolean imagesOnly;

    ReviewPool(List<ReviewFilter> filters, boolean imagesOnly) {
        this.filters = filters;
        this.imagesOnly = imagesOnly;
    }

    public List<ReviewFilter> filters() {
        return filters;
    }

    public boolean imagesOnly() {
        return imagesOnly;
    }

    public String code() {
        return name().toLowerCase();
    }
}
