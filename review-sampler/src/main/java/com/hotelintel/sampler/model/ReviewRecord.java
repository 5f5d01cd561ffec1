package com.hotelintel.sampler.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Normalised guest review.
 *
 * reviewId is content-addressed (see {@code ReviewIdentity}) so the same review
 * fetched through two pools, or on two runs, collapses to one row.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ReviewRecord {

    private String reviewId;
    private String itemId;
    private String author;
    private String content;
    private String summary;

    // ── Scores (1-5) ────────────────────────────────────────────────────────
    private Double scoreClean;
    private Double scoreLocation;
    private Double scoreService;
    private Double scoreValue;

    /** Mean of the axis scores that were present, one decimal */
    private Double overallScore;

    @Builder.Default
    private List<String> tags = new ArrayList<>();

    @Builder.Default
    private List<String> imageUrls = new ArrayList<>();

    private boolean hasImages;
    private String roomType;
    private LocalDateTime reviewDate;

    // ── Merchant reply ──────────────────────────────────────────────────────
    private String replyContent;
    private LocalDateTime replyDate;

    private ReviewPool sourcePool;
    private LocalDateTime scrapedAt;

    /**
     * Overlay the non-null fields of {@code other}. Collections replace only when
     * the incoming one is non-empty; hasImages is sticky once true.
     */
    public ReviewRecord merge(ReviewRecord other) {
        if (other == null) return this;
        if (other.reviewId != null) reviewId = other.reviewId;
        if (other.itemId != null) itemId = other.itemId;
        if (other.author != null) author = other.author;
        if (other.content != null) content = other.content;
        if (other.summary != null) summary = other.summary;
        if (other.scoreClean != null) scoreClean = other.scoreClean;
        if (other.scoreLocation != null) scoreLocation = other.scoreLocation;
        if (other.scoreService != null) scoreService = other.scoreService;
        if (other.scoreValue != null) scoreValue = other.scoreValue;
        if (other.overallScore != null) overallScore = other.overallScore;
        if (other.tags != null && !other.tags.isEmpty()) tags = new ArrayList<>(other.tags);
        if (other.imageUrls != null && !other.imageUrls.isEmpty()) imageUrls = new ArrayList<>(other.imageUrls);
        hasImages = hasImages || other.hasImages;
        if (other.roomType != null) roomType = other.roomType;
        if (other.reviewDate != null) reviewDate = other.reviewDate;
        if (other.replyContent != null) replyContent = other.replyContent;
        if (other.replyDate != null) replyDate = other.replyDate;
        if (other.sourcePool != null) sourcePool = other.sourcePool;
        if (other.scrapedAt != null) scrapedAt = other.scrapedAt;
        return this;
    }
}
