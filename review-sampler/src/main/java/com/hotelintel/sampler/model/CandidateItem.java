package com.hotelintel.sampler.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * A de-duplicated hotel listing ready for persistence.
 *
 * Schema design notes:
 *  - itemId is the source's own listing id (shid) and the upsert key
 *  - fetchedTier is provenance: the tier whose search returned the listing
 *  - classifiedTier is authoritative: the tier the listing's price falls into
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class CandidateItem {

    // ── Source identifiers ──────────────────────────────────────────────────
    private String itemId;
    private String name;
    private String address;
    private String cityCode;

    // ── Location ────────────────────────────────────────────────────────────
    private Double latitude;
    private Double longitude;

    // ── Attributes ──────────────────────────────────────────────────────────
    private String starLevel;

    /** Rating on the source's 0-5 scale */
    private Double rating;

    private Integer reviewCount;

    /** Lowest nightly price shown on the listing page */
    private Integer basePrice;

    // ── Stratification ──────────────────────────────────────────────────────
    private String region;
    private String zoneCode;
    private String zoneName;
    private String fetchedTier;
    private String classifiedTier;

    // ── Metadata ────────────────────────────────────────────────────────────
    private LocalDateTime scrapedAt;

    /**
     * Overlay the non-null fields of {@code other} onto this item.
     * Null fields in {@code other} never erase what is already known.
     */
    public CandidateItem merge(CandidateItem other) {
        if (other == null) return this;
        if (other.itemId != null) itemId = other.itemId;
        if (other.name != null) name = other.name;
        if (other.address != null) address = other.address;
        if (other.cityCode != null) cityCode = other.cityCode;
        if (other.latitude != null) latitude = other.latitude;
        if (other.longitude != null) longitude = other.longitude;
        if (other.starLevel != null) starLevel = other.starLevel;
        if (other.rating != null) rating = other.rating;
        if (other.reviewCount != null) reviewCount = other.reviewCount;
        if (other.basePrice != null) basePrice = other.basePrice;
        if (other.region != null) region = other.region;
        if (other.zoneCode != null) zoneCode = other.zoneCode;
        if (other.zoneName != null) zoneName = other.zoneName;
        if (other.fetchedTier != null) fetchedTier = other.fetchedTier;
        if (other.classifiedTier != null) classifiedTier = other.classifiedTier;
        if (other.scrapedAt != null) scrapedAt = other.scrapedAt;
        return this;
    }
}
