package com.hotelintel.sampler.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hotelintel.sampler.model.SamplingPlan;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads the sampling plan JSON named by {@code sampler.plan.location}.
 *
 * Example layout:
 * <pre>
 * { "cityCode": "440100",
 *   "regions": [ { "name": "CBD", "weight": 10,
 *                  "zones": [ {"code": "39584", "name": "Zhujiang New Town"} ],
 *                  "tiers": [ {"level": "economy", "min": 0, "max": 300, "targetCount": 4, "weight": 3} ] } ] }
 * </pre>
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SamplingPlanLoader {

    private final ObjectMapper objectMapper;
    private final ResourceLoader resourceLoader;
    private final SamplerProperties properties;

    public SamplingPlan load() {
        return load(properties.getPlan().getLocation());
    }

    public SamplingPlan load(String location) {
        Resource resource = resourceLoader.getResource(location);
        try (InputStream in = resource.getInputStream()) {
            SamplingPlan plan = objectMapper.readValue(in, SamplingPlan.class);
            validate(plan);
            log.info("Loaded sampling plan from {}: {} regions, {} items expected",
                    location, plan.regions().size(), plan.expectedTotal());
            return plan;
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read sampling plan " + location + ": " + e.getMessage(), e);
        }
    }

    /**
     * Tiers must be in ascending price order with non-negative targets; zone codes
     * must be unique within the plan.
     */
    void validate(SamplingPlan plan) {
        if (plan.regions().isEmpty()) {
            throw new IllegalArgumentException("Sampling plan has no regions");
        }
        Set<String> zoneCodes = new HashSet<>();
        for (SamplingPlan.Region region : plan.regions()) {
            for (SamplingPlan.Zone zone : region.zones()) {
                if (!zoneCodes.add(zone.code())) {
                    throw new IllegalArgumentException("Duplicate zone code " + zone.code());
                }
                List<SamplingPlan.PriceTier> tiers = region.tiersFor(zone);
                if (tiers.isEmpty()) {
                    throw new IllegalArgumentException("Zone " + zone.code() + " has no price tiers");
                }
                for (int i = 0; i < tiers.size(); i++) {
                    SamplingPlan.PriceTier tier = tiers.get(i);
                    if (tier.targetCount() < 0 || tier.min() >= tier.max()) {
                        throw new IllegalArgumentException("Invalid tier " + tier.level() + " in zone " + zone.code());
                    }
                    if (i > 0 && tiers.get(i - 1).min() > tier.min()) {
                        throw new IllegalArgumentException("Tiers of zone " + zone.code() + " are not in ascending price order");
                    }
                }
            }
        }
    }
}
