package com.hotelintel.sampler.driver;

import com.hotelintel.sampler.model.RawListing;
import com.hotelintel.sampler.model.RawReview;
import com.hotelintel.sampler.model.ReviewQuery;
import com.hotelintel.sampler.pacing.MotionStep;

import java.util.List;
import java.util.OptionalInt;

/**
 * The page-driving collaborator: one browser session on the source site.
 *
 * Implementations are stateful and single-threaded; callers hold the acquisition
 * session lock while using them. Nothing here decides what to fetch or how much.
 */
public interface PageDriver {

    /** @return false when the page could not be loaded */
    boolean navigate(String url);

    /** Listings on the current search result page, after scrolling it fully. */
    ListPage extractListPage();

    /** Advance to the next search result page; false when there is none. */
    boolean nextListPage();

    /**
     * Reviews on the current detail page. Page 0 applies {@code query}'s filters and
     * starts from the first page; later indices advance one page at a time.
     */
    ReviewPage extractReviewPage(ReviewQuery query, int pageIndex);

    /** Total review count shown on the detail page, when readable. */
    OptionalInt totalReviewCount();

    boolean challengePresent();

    /** Width in pixels of the slider track, when a slider challenge is showing. */
    OptionalInt sliderTrackLength();

    /** Replay {@code motion} on the slider handle; true when the site accepted it. */
    boolean dragSlider(List<MotionStep> motion);

    record ListPage(List<RawListing> listings, boolean hasNext) {
        public static ListPage empty() {
            return new ListPage(List.of(), false);
        }
    }

    record ReviewPage(List<RawReview> reviews, boolean hasNext) {
        public static ReviewPage empty() {
            return new ReviewPage(List.of(), false);
        }
    }
}
