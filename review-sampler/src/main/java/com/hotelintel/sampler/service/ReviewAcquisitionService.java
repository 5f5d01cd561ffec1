package com.hotelintel.sampler.service;

import com.hotelintel.sampler.config.SamplerProperties;
import com.hotelintel.sampler.driver.ChallengeHandler;
import com.hotelintel.sampler.driver.PageDriver;
import com.hotelintel.sampler.driver.SourceUrls;
import com.hotelintel.sampler.exception.TransientFetchException;
import com.hotelintel.sampler.model.ReviewPool;
import com.hotelintel.sampler.output.OutputRouter;
import com.hotelintel.sampler.reviews.AllocationResult;
import com.hotelintel.sampler.reviews.ReviewPoolAllocator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.util.OptionalInt;

/**
 * Collects one item's reviews: open its detail page, run the pool waterfall, persist.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ReviewAcquisitionService {

    private final ObjectProvider<PageDriver> driverProvider;
    private final ChallengeHandler challengeHandler;
    private final SourceUrls urls;
    private final CandidateMapper mapper;
    private final ReviewPoolAllocator allocator;
    private final OutputRouter outputRouter;
    private final SamplerProperties properties;

    /**
     * @param knownReviewCount review count from the listing page, used when the detail
     *                         page does not show one
     * @throws TransientFetchException when the page cannot be loaded or yields nothing
     *                                 although the item has reviews
     */
    public AllocationResult acquire(String itemId, Integer knownReviewCount) {
        PageDriver driver = BrowserSession.require(driverProvider);
        String url = urls.detailUrl(itemId);
        if (!driver.navigate(url)) {
            throw new TransientFetchException("Navigation failed: " + url);
        }
        challengeHandler.ensureClear(driver);

        OptionalInt shown = driver.totalReviewCount();
        Integer total = shown.isPresent() ? Integer.valueOf(shown.getAsInt()) : knownReviewCount;
        log.info("Item {}: {} reviews listed", itemId, total);

        AllocationResult result = allocator.allocate(itemId, total, properties.getReviews().getMaxPerItem(),
                new DriverReviewSource(itemId, driver, challengeHandler, mapper));
        if (result.isSkipped()) {
            return result;
        }
        if (result.total() == 0 && total != null && total > 0) {
            throw new TransientFetchException("No reviews extracted for item " + itemId + " listing " + total);
        }

        outputRouter.writeReviews(result.records(), itemId);
        log.info("Item {}: stored {} reviews (negative {}, evidence {}, recency {})", itemId, result.total(),
                result.count(ReviewPool.NEGATIVE), result.count(ReviewPool.EVIDENCE), result.count(ReviewPool.RECENCY));
        return result;
    }
}
