package com.hotelintel.sampler.service;

import com.hotelintel.sampler.driver.ChallengeHandler;
import com.hotelintel.sampler.driver.PageDriver;
import com.hotelintel.sampler.model.Outcome;
import com.hotelintel.sampler.model.RawReview;
import com.hotelintel.sampler.model.ReviewQuery;
import com.hotelintel.sampler.model.ReviewRecord;
import com.hotelintel.sampler.reviews.ReviewSource;
import lombok.RequiredArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/** Review pages for one item, read off the detail page the driver is already on. */
@RequiredArgsConstructor
class DriverReviewSource implements ReviewSource {

    private final String itemId;
    private final PageDriver driver;
    private final ChallengeHandler challengeHandler;
    private final CandidateMapper mapper;

    @Override
    public Page fetchPage(ReviewQuery query, int pageIndex) {
        challengeHandler.ensureClear(driver);
        PageDriver.ReviewPage page = driver.extractReviewPage(query, pageIndex);

        List<ReviewRecord> reviews = new ArrayList<>();
        for (RawReview raw : page.reviews()) {
            Outcome<ReviewRecord> mapped = mapper.mapReview(raw, itemId);
            if (mapped.isAccepted()) {
                reviews.add(mapped.value());
            }
        }
        return new Page(reviews, page.hasNext());
    }
}
