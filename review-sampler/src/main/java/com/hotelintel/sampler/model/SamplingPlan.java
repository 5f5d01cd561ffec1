package com.hotelintel.sampler.model;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Hierarchical sampling plan: region → business zone → price tier.
 * Loaded once per run from the plan resource and never mutated.
 *
 * Order matters everywhere in this structure: regions and zones are processed
 * in list order, tiers in ascending price order.
 */
public record SamplingPlan(String cityCode, List<Region> regions) {

    public SamplingPlan {
        regions = regions == null ? List.of() : List.copyOf(regions);
    }

    /** Sum of every tier target across every zone. */
    public int expectedTotal() {
        return regions.stream().mapToInt(Region::expectedTotal).sum();
    }

    /** Expected item count per region, in plan order. */
    public Map<String, Integer> expectedByRegion() {
        Map<String, Integer> breakdown = new LinkedHashMap<>();
        for (Region region : regions) {
            breakdown.put(region.name(), region.expectedTotal());
        }
        return breakdown;
    }

    public Region region(String name) {
        return regions.stream()
                .filter(r -> r.name().equals(name))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown region: " + name));
    }

    // ── Nested types ────────────────────────────────────────────────────────

    /**
     * A functional region. {@code weight} feeds list-task priority; {@code tiers}
     * is the default tier list for zones that do not declare their own.
     */
    public record Region(String name, int weight, List<Zone> zones, List<PriceTier> tiers) {

        public Region {
            zones = zones == null ? List.of() : List.copyOf(zones);
            tiers = tiers == null ? List.of() : List.copyOf(tiers);
        }

        public List<PriceTier> tiersFor(Zone zone) {
            return zone.tiers().isEmpty() ? tiers : zone.tiers();
        }

        public int expectedTotal() {
            return zones.stream()
                    .mapToInt(z -> tiersFor(z).stream().mapToInt(PriceTier::targetCount).sum())
                    .sum();
        }

        public Zone zone(String code) {
            return zones.stream()
                    .filter(z -> z.code().equals(code))
                    .findFirst()
                    .orElseThrow(() -> new IllegalArgumentException("Unknown zone " + code + " in " + name));
        }
    }

    public record Zone(String code, String name, List<PriceTier> tiers) {

        @JsonCreator
        public Zone {
            tiers = tiers == null ? List.of() : List.copyOf(tiers);
        }

        public Zone(String code, String name) {
            this(code, name, List.of());
        }
    }

    /**
     * A price band with its sampling target. {@code min} is inclusive, {@code max} exclusive.
     */
    public record PriceTier(String level, int min, int max, int targetCount, int weight) {

        public boolean contains(int price) {
            return price >= min && price < max;
        }
    }
}
