package com.hotelintel.sampler.planner;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Remembers which item identifiers have been accepted in each scope during one run.
 *
 * The scope is the region, wider than the zone: business zones in one region overlap
 * geographically and the same listing often shows up in two of them. Crediting it
 * once keeps overlapping zones from inflating each other's quota.
 *
 * Create one ledger per run and pass it down. The database's unique key on item_id
 * is the second, independent line of defence across runs.
 */
public class DedupLedger {

    private final Map<String, Set<String>> acceptedByScope = new HashMap<>();

    /**
     * @return true and record the identifier on first sight within {@code scopeId}, false thereafter
     */
    public boolean accept(String scopeId, String identifier) {
        if (scopeId == null || identifier == null) {
            throw new IllegalArgumentException("scopeId and identifier are required");
        }
        return acceptedByScope.computeIfAbsent(scopeId, k -> new HashSet<>()).add(identifier);
    }

    public boolean contains(String scopeId, String identifier) {
        Set<String> ids = acceptedByScope.get(scopeId);
        return ids != null && ids.contains(identifier);
    }

    public int size(String scopeId) {
        Set<String> ids = acceptedByScope.get(scopeId);
        return ids == null ? 0 : ids.size();
    }
}
