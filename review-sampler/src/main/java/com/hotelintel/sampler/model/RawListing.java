package com.hotelintel.sampler.model;

import lombok.Builder;
import lombok.Data;

/**
 * Listing row exactly as the page driver scraped it: strings, untrimmed, unvalidated.
 * Kept separate from {@link CandidateItem} to isolate page coupling.
 */
@Data
@Builder
public class RawListing {
    private String itemId;
    private String name;
    private String latitude;
    private String longitude;
    private String ratingText;
    private String reviewCountText;
    private String priceText;
    private String address;
    private String starLevel;
}
