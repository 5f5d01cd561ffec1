package com.hotelintel.sampler.service;

import com.hotelintel.sampler.model.CandidateItem;
import com.hotelintel.sampler.model.Outcome;
import com.hotelintel.sampler.model.RawListing;
import com.hotelintel.sampler.model.RawReview;
import com.hotelintel.sampler.model.ReviewRecord;
import com.hotelintel.sampler.reviews.ReviewIdentity;
import com.hotelintel.sampler.reviews.ReviewNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Maps raw scraped listings and reviews to the normalised domain records.
 *
 * Malformed input never throws: it comes back as {@link Outcome#failed(String)} and is
 * logged at WARN, so one bad row cannot fail the surrounding task. Free-text fields are
 * clipped to the widths of the sample store's columns.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CandidateMapper {

    private static final int MAX_ID_LENGTH = 64;
    private static final int MAX_NAME_LENGTH = 200;
    private static final int MAX_ADDRESS_LENGTH = 500;
    private static final int MAX_STAR_LEVEL_LENGTH = 50;
    private static final int MAX_AUTHOR_LENGTH = 100;
    private static final int MAX_CONTENT_LENGTH = 4000;
    private static final int MAX_SUMMARY_LENGTH = 500;
    private static final int MAX_ROOM_TYPE_LENGTH = 100;
    private static final int MAX_TAGS_JSON_LENGTH = 2000;
    private static final int MAX_IMAGES_JSON_LENGTH = 4000;

    private final Clock clock;

    /**
     * Convert a listing row to a CandidateItem. Stratification fields (region, zone,
     * tiers) are left for the planner to fill.
     */
    public Outcome<CandidateItem> mapListing(RawListing raw, String cityCode) {
        String itemId = emptyToNull(raw.getItemId());
        if (itemId == null) {
            return drop("listing without id: " + raw.getName());
        }
        if (itemId.strip().length() > MAX_ID_LENGTH) {
            return drop("listing id longer than " + MAX_ID_LENGTH + " characters");
        }
        String name = ReviewNormalizer.cleanText(raw.getName());
        if (name.isEmpty() || name.length() > MAX_NAME_LENGTH) {
            return drop("listing " + itemId + " has no usable name");
        }

        Double lat = parseDouble(raw.getLatitude());
        Double lng = parseDouble(raw.getLongitude());
        if (lat != null && (lat < -90 || lat > 90) || lng != null && (lng < -180 || lng > 180)) {
            return drop("listing " + itemId + " has coordinates out of range: " + lat + "," + lng);
        }

        Double rating = ReviewNormalizer.extractDecimal(raw.getRatingText());
        if (rating != null && (rating < 0 || rating > 5)) {
            return drop("listing " + itemId + " has rating out of range: " + rating);
        }

        return Outcome.accepted(CandidateItem.builder()
                .itemId(itemId.strip())
                .name(name)
                .address(clip(ReviewNormalizer.cleanText(raw.getAddress()), MAX_ADDRESS_LENGTH))
                .cityCode(cityCode)
                .latitude(lat)
                .longitude(lng)
                .starLevel(clip(ReviewNormalizer.cleanText(raw.getStarLevel()), MAX_STAR_LEVEL_LENGTH))
                .rating(rating)
                .reviewCount(ReviewNormalizer.extractInt(raw.getReviewCountText()))
                .basePrice(ReviewNormalizer.extractInt(raw.getPriceText()))
                .scrapedAt(LocalDateTime.now(clock))
                .build());
    }

    public Outcome<ReviewRecord> mapReview(RawReview raw, String itemId) {
        if (emptyToNull(itemId) == null) {
            return drop("review without parent item");
        }
        String content = clip(ReviewNormalizer.cleanText(raw.getContent()), MAX_CONTENT_LENGTH);
        if (content == null) {
            return drop("empty review content for item " + itemId);
        }
        String author = clip(ReviewNormalizer.cleanText(raw.getAuthor()), MAX_AUTHOR_LENGTH);

        List<String> styles = raw.getScoreStyles() != null ? raw.getScoreStyles() : List.of();
        Double clean = score(styles, 0);
        Double location = score(styles, 1);
        Double service = score(styles, 2);
        Double value = score(styles, 3);

        List<String> images = fitJson(raw.getImageUrls(), MAX_IMAGES_JSON_LENGTH);
        String reply = clip(ReviewNormalizer.cleanText(raw.getReplyContent()), MAX_CONTENT_LENGTH);

        return Outcome.accepted(ReviewRecord.builder()
                .reviewId(ReviewIdentity.of(itemId, content, author))
                .itemId(itemId)
                .author(author)
                .content(content)
                .summary(clip(ReviewNormalizer.cleanText(raw.getSummary()), MAX_SUMMARY_LENGTH))
                .scoreClean(clean)
                .scoreLocation(location)
                .scoreService(service)
                .scoreValue(value)
                .overallScore(ReviewNormalizer.mean(clean, location, service, value))
                .tags(fitJson(ReviewNormalizer.extractTags(content), MAX_TAGS_JSON_LENGTH))
                .imageUrls(images)
                .hasImages(!images.isEmpty())
                .roomType(clip(ReviewNormalizer.cleanText(raw.getRoomType()), MAX_ROOM_TYPE_LENGTH))
                .reviewDate(ReviewNormalizer.parseDate(raw.getDateText()))
                .replyContent(reply)
                .replyDate(reply != null ? ReviewNormalizer.parseDate(raw.getReplyDateText()) : null)
                .scrapedAt(LocalDateTime.now(clock))
                .build());
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private <T> Outcome<T> drop(String reason) {
        log.warn("Dropping record: {}", reason);
        return Outcome.failed(reason);
    }

    /** Axis score at {@code index}; out-of-range values are treated as missing. */
    private Double score(List<String> styles, int index) {
        if (index >= styles.size()) return null;
        Double score = ReviewNormalizer.parseStarScore(styles.get(index));
        return score != null && score >= 1 && score <= 5 ? score : null;
    }

    private Double parseDouble(String val) {
        if (val == null || val.isBlank()) return null;
        try {
            return Double.parseDouble(val.strip());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private String emptyToNull(String val) {
        return (val == null || val.isBlank()) ? null : val;
    }

    /** Null for empty text, otherwise at most {@code max} characters. */
    private String clip(String val, int max) {
        if (val.isEmpty()) return null;
        return val.length() > max ? val.substring(0, max) : val;
    }

    /** Leading values whose JSON array form stays within {@code budget} characters. */
    private List<String> fitJson(List<String> values, int budget) {
        List<String> kept = new ArrayList<>();
        if (values == null) return kept;
        int length = 2;
        for (String value : values) {
            if (value == null) continue;
            // two quotes and a comma, plus one escape per quote or backslash
            int cost = value.length() + 3 + (int) value.chars().filter(c -> c == '"' || c == '\\').count();
            if (length + cost > budget) {
                log.debug("Dropping {} of {} values to fit {} characters", values.size() - kept.size(), values.size(), budget);
                break;
            }
            kept.add(value);
            length += cost;
        }
        return kept;
    }
}
