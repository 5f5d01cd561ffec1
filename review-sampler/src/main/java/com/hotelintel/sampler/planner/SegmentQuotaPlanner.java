package com.hotelintel.sampler.planner;

import com.hotelintel.sampler.exception.TransientFetchException;
import com.hotelintel.sampler.model.CandidateItem;
import com.hotelintel.sampler.model.SamplingPlan;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns one zone's tier targets into a bounded sequence of tier fetches with
 * elastic backfill.
 *
 * Forward pass, ascending price: tier i is asked for {@code target_i + carryOver},
 * and whatever it fails to deliver is carried to tier i+1.
 *
 * Reverse pass, only if the zone is still short: walk tiers from the most expensive
 * down, skipping the most expensive one, asking each for the whole remainder.
 * Reverse fetches resume after the listings the tier already gave up.
 *
 * The zone total never exceeds the sum of its tier targets. A zone still short after
 * both passes is reported through {@link ZoneOutcome#shortfall()}.
 */
@Component
@Slf4j
public class SegmentQuotaPlanner {

    public ZoneOutcome planZone(SamplingPlan.Region region,
                                SamplingPlan.Zone zone,
                                List<SamplingPlan.PriceTier> tiers,
                                DedupLedger ledger,
                                TierFetcher fetcher) {

        QuotaState quota = QuotaState.forTiers(tiers);
        int[] consumed = new int[tiers.size()];
        List<CandidateItem> accepted = new ArrayList<>();
        List<TierAttempt> attempts = new ArrayList<>();

        log.info("Planning zone {} ({}) in {}: target {} across {} tiers",
                zone.code(), zone.name(), region.name(), quota.targetTotal(), tiers.size());

        // ── Forward pass ─────────────────────────────────────────────────────
        for (int i = 0; i < tiers.size(); i++) {
            SamplingPlan.PriceTier tier = tiers.get(i);
            int requested = quota.forwardRequest(tier);
            if (requested <= 0) {
                continue;
            }
            int actual = attempt(region, zone, tiers, i, requested, TierRequest.Pass.FORWARD,
                    consumed, ledger, fetcher, accepted);
            quota.recordForward(requested, actual);
            attempts.add(new TierAttempt(tier.level(), TierRequest.Pass.FORWARD, requested, actual));

            if (actual < requested) {
                log.info("Tier {} in zone {} delivered {}/{}, carrying {} forward",
                        tier.level(), zone.code(), actual, requested, quota.carryOver());
            }
        }

        // ── Reverse pass ─────────────────────────────────────────────────────
        // Reverse index 0 (the most expensive tier) is skipped. Whether that is a
        // deliberate guard against re-querying the top tier is still open; see DESIGN.md.
        for (int r = 1; r < tiers.size() && quota.remaining() > 0; r++) {
            int i = tiers.size() - 1 - r;
            SamplingPlan.PriceTier tier = tiers.get(i);
            int requested = quota.remaining();
            int actual = attempt(region, zone, tiers, i, requested, TierRequest.Pass.REVERSE,
                    consumed, ledger, fetcher, accepted);
            quota.recordReverse(actual);
            attempts.add(new TierAttempt(tier.level(), TierRequest.Pass.REVERSE, requested, actual));
            log.info("Backfill from tier {} in zone {}: {}/{}", tier.level(), zone.code(), actual, requested);
        }

        ZoneOutcome outcome = new ZoneOutcome(region.name(), zone.code(), zone.name(),
                quota.targetTotal(), accepted, attempts);

        if (outcome.isShort()) {
            log.warn("Zone {} ({}) short by {}: {}/{} accepted after forward and reverse passes",
                    zone.code(), zone.name(), outcome.shortfall(), accepted.size(), quota.targetTotal());
        } else {
            log.info("Zone {} ({}) filled: {}/{}", zone.code(), zone.name(), accepted.size(), quota.targetTotal());
        }
        return outcome;
    }

    /**
     * Stamps region, zone and both tier fields on an accepted candidate. The classified
     * tier comes from the price and may differ from the tier that was searched.
     */
    public static void stratify(CandidateItem candidate,
                                SamplingPlan.Region region,
                                SamplingPlan.Zone zone,
                                List<SamplingPlan.PriceTier> tiers,
                                SamplingPlan.PriceTier fetchedTier) {
        candidate.setRegion(region.name());
        candidate.setZoneCode(zone.code());
        candidate.setZoneName(zone.name());
        candidate.setFetchedTier(fetchedTier.level());
        candidate.setClassifiedTier(PriceClassifier.classify(tiers, candidate.getBasePrice(), fetchedTier.level()));
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private int attempt(SamplingPlan.Region region,
                        SamplingPlan.Zone zone,
                        List<SamplingPlan.PriceTier> tiers,
                        int tierIndex,
                        int requested,
                        TierRequest.Pass pass,
                        int[] consumed,
                        DedupLedger ledger,
                        TierFetcher fetcher,
                        List<CandidateItem> accepted) {

        SamplingPlan.PriceTier tier = tiers.get(tierIndex);
        TierRequest request = new TierRequest(region, zone, tier, requested, consumed[tierIndex], pass);

        List<CandidateItem> candidates;
        try {
            candidates = fetcher.fetch(request);
        } catch (TransientFetchException e) {
            log.warn("Tier {} in zone {} unavailable ({} pass): {}", tier.level(), zone.code(), pass, e.getMessage());
            return 0;
        } catch (RuntimeException e) {
            log.error("Tier {} in zone {} errored ({} pass): {}: {}", tier.level(), zone.code(), pass,
                    e.getClass().getSimpleName(), e.getMessage(), e);
            return 0;
        }

        int actual = 0;
        int scanned = 0;
        for (CandidateItem candidate : candidates) {
            if (actual >= requested) break;
            scanned++;
            if (candidate.getItemId() == null) continue;

            if (!ledger.accept(region.name(), candidate.getItemId())) {
                log.debug("Item {} already accepted in region {}, not credited to zone {}",
                        candidate.getItemId(), region.name(), zone.code());
                continue;
            }

            stratify(candidate, region, zone, tiers, tier);
            accepted.add(candidate);
            actual++;
        }
        consumed[tierIndex] += scanned;
        return actual;
    }
}
