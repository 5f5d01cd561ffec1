package com.hotelintel.sampler.model;

/** One filter combination on the review tab. */
public record ReviewQuery(ReviewFilter filter, boolean imagesOnly) {
}
