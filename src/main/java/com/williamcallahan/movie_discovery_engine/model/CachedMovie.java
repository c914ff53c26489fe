package com.williamcallahan.movie_discovery_engine.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Duration;
import java.time.Instant;

/**
 * Movie held by the offline cache together with its freshness window.
 * Never updated in place; a refetch replaces the whole entry.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CachedMovie(Movie movie, Instant cachedAt, Instant expiresAt) {

    public static CachedMovie of(Movie movie, Instant now, Duration ttl) {
        return new CachedMovie(movie, now, now.plus(ttl));
    }

    public boolean isExpired(Instant now) {
        return now.isAfter(expiresAt);
    }

    public Duration age(Instant now) {
        return Duration.between(cachedAt, now);
    }
}
