package com.williamcallahan.movie_discovery_engine.model;

import java.util.Map;

/**
 * Point-in-time snapshot of the offline cache
 *
 * @param totalItems entries currently held in memory
 * @param validItems entries not yet expired
 * @param expiredItems entries past their expiry that have not been swept
 * @param categoryCounts number of indexed ids per category
 */
public record CacheStats(int totalItems, int validItems, int expiredItems, Map<CacheCategory, Integer> categoryCounts) {

    public CacheStats {
        categoryCounts = categoryCounts == null ? Map.of() : Map.copyOf(categoryCounts);
    }
}
