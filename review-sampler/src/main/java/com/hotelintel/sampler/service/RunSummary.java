package com.hotelintel.sampler.service;

import com.hotelintel.sampler.planner.ZoneOutcome;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of one plan run. {@code shortfallByZone} only lists zones that ended short,
 * keyed by zone code.
 */
public record RunSummary(String runId,
                         String status,
                         int targeted,
                         int accepted,
                         Map<String, Integer> shortfallByZone,
                         List<ZoneOutcome> zones) {

    public RunSummary {
        shortfallByZone = new LinkedHashMap<>(shortfallByZone);
        zones = List.copyOf(zones);
    }

    public static RunSummary of(String runId, String status, int targeted, List<ZoneOutcome> zones) {
        Map<String, Integer> shortfall = new LinkedHashMap<>();
        int accepted = 0;
        for (ZoneOutcome zone : zones) {
            accepted += zone.accepted().size();
            if (zone.isShort()) {
                shortfall.put(zone.zoneCode(), zone.shortfall());
            }
        }
        return new RunSummary(runId, status, targeted, accepted, shortfall, zones);
    }
}
