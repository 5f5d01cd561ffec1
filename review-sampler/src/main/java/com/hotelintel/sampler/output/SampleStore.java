package com.hotelintel.sampler.output;

import com.hotelintel.sampler.model.CandidateItem;
import com.hotelintel.sampler.model.ReviewRecord;
import com.hotelintel.sampler.model.SampleRun;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Relational store for sampled items, reviews and run metadata.
 *
 * Upserts are idempotent and keyed by the record id; a re-upsert overlays non-null
 * fields the same way {@code merge} does in memory.
 */
public interface SampleStore {

    void ensureSchema();

    /** Upserts all items in one transaction; a failure leaves none of them written. */
    void upsertItems(List<CandidateItem> items);

    /** Upserts all reviews in one transaction; a failure leaves none of them written. */
    void upsertReviews(List<ReviewRecord> reviews);

    void upsertItem(CandidateItem item);

    void upsertReview(ReviewRecord review);

    /** Items with at least {@code minReviewCount} reviews, most reviewed first. */
    List<CandidateItem> findItemsWithMinReviews(int minReviewCount);

    Optional<CandidateItem> findItem(String itemId);

    List<ReviewRecord> findReviews(String itemId);

    /**
     * Runs {@code work} in one transaction: commit on return, rollback on exception. A
     * retry replays the whole of {@code work}, so it must be idempotent.
     */
    <T> T withTransaction(Supplier<T> work);

    void writeSampleRun(SampleRun run);
}
