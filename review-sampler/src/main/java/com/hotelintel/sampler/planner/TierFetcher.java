package com.hotelintel.sampler.planner;

import com.hotelintel.sampler.model.CandidateItem;

import java.util.List;

/**
 * Source of ranked candidates for one tier request. Implementations return at most
 * {@code offset + requested} ranked listings' worth, starting after {@code offset};
 * an empty list means the tier has nothing more to give.
 */
@FunctionalInterface
public interface TierFetcher {

    List<CandidateItem> fetch(TierRequest request);
}
