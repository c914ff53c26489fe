/**
 * Buckets of catalog data held by the offline cache, each with its own freshness window
 *
 * @author William Callahan
 */
package com.williamcallahan.movie_discovery_engine.model;

import java.time.Duration;

public enum CacheCategory {
    TRENDING(Duration.ofHours(1)),
    POPULAR(Duration.ofHours(24)),
    TOP_RATED(Duration.ofHours(24)),
    NOW_PLAYING(Duration.ofHours(1)),
    UPCOMING(Duration.ofHours(12)),
    RECENT(Duration.ofHours(6)),
    SEARCH(Duration.ofMinutes(30)),
    WATCHLIST_RELATED(Duration.ofHours(2)),
    RECOMMENDATIONS(Duration.ofHours(2));

    /** TTL for items cached without a category */
    public static final Duration DEFAULT_TTL = Duration.ofHours(24);

    private final Duration ttl;

    CacheCategory(Duration ttl) {
        this.ttl = ttl;
    }

    public Duration getTtl() {
        return ttl;
    }

    public static Duration ttlFor(CacheCategory category) {
        return category == null ? DEFAULT_TTL : category.ttl;
    }
}
