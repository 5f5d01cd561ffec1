package com.hotelintel.sampler.service;

import com.hotelintel.sampler.driver.ChallengeHandler;
import com.hotelintel.sampler.driver.PageDriver;
import com.hotelintel.sampler.driver.SourceUrls;
import com.hotelintel.sampler.exception.TransientFetchException;
import com.hotelintel.sampler.model.CandidateItem;
import com.hotelintel.sampler.model.Outcome;
import com.hotelintel.sampler.model.RawListing;
import com.hotelintel.sampler.planner.TierRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Fetches one tier's ranked listings through the page driver.
 *
 * Returns at most {@code requested} candidates starting at {@code offset} in the site's
 * ranking, so a reverse-pass request picks up where the forward pass stopped.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ListingFetcher {

    private final ObjectProvider<PageDriver> driverProvider;
    private final ChallengeHandler challengeHandler;
    private final SourceUrls urls;
    private final CandidateMapper mapper;

    public List<CandidateItem> fetch(String cityCode, TierRequest request) {
        PageDriver driver = BrowserSession.require(driverProvider);
        String url = urls.searchUrl(cityCode, request.zone(), request.tier());
        if (!driver.navigate(url)) {
            throw new TransientFetchException("Navigation failed: " + url);
        }
        challengeHandler.ensureClear(driver);

        int wanted = request.offset() + request.requested();
        List<CandidateItem> ranked = new ArrayList<>();
        int page = 1;

        while (true) {
            PageDriver.ListPage listPage = driver.extractListPage();
            for (RawListing raw : listPage.listings()) {
                Outcome<CandidateItem> mapped = mapper.mapListing(raw, cityCode);
                if (mapped.isAccepted()) {
                    ranked.add(mapped.value());
                }
            }
            log.debug("Tier {} zone {} page {}: {} ranked so far",
                    request.tier().level(), request.zone().code(), page, ranked.size());

            if (ranked.size() >= wanted || !listPage.hasNext() || !driver.nextListPage()) {
                break;
            }
            challengeHandler.ensureClear(driver);
            page++;
        }

        if (ranked.size() <= request.offset()) {
            return List.of();
        }
        return new ArrayList<>(ranked.subList(request.offset(), Math.min(wanted, ranked.size())));
    }
}
