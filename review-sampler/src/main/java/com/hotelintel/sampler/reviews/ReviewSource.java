package com.hotelintel.sampler.reviews;

import com.hotelintel.sampler.model.ReviewQuery;
import com.hotelintel.sampler.model.ReviewRecord;

import java.util.List;

/**
 * Paged access to one item's reviews under a filter.
 *
 * Page 0 starts a fresh filter; callers request indices in order. Records are already
 * normalised and carry their content-addressed id.
 */
@FunctionalInterface
public interface ReviewSource {

    Page fetchPage(ReviewQuery query, int pageIndex);

    record Page(List<ReviewRecord> reviews, boolean hasNext) {

        public Page {
            reviews = reviews == null ? List.of() : List.copyOf(reviews);
        }

        public static Page last(List<ReviewRecord> reviews) {
            return new Page(reviews, false);
        }
    }
}
