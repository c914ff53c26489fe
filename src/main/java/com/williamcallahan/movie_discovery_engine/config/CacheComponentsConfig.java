/**
 * Configuration class for cache-related components and beans
 * It handles:
 * - The shared time source used by every TTL and expiry computation
 * - One request coalescer per catalog resource kind, each with its own default TTL
 *   (list pages pass their own TTL; similar and recommended pages use the list default)
 *
 * @author William Callahan
 */
package com.williamcallahan.movie_discovery_engine.config;

import com.williamcallahan.movie_discovery_engine.model.Credits;
import com.williamcallahan.movie_discovery_engine.model.Movie;
import com.williamcallahan.movie_discovery_engine.model.MovieResponse;
import com.williamcallahan.movie_discovery_engine.model.VideoResponse;
import com.williamcallahan.movie_discovery_engine.service.cache.RequestCoalescer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

@Configuration
public class CacheComponentsConfig {

    @Value("${app.coalescer.max-entries:1000}")
    private long maxEntries;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RequestCoalescer<String, MovieResponse> movieListCoalescer(
            @Value("${app.coalescer.lists.default-ttl:30m}") Duration defaultTtl, Clock clock) {
        return new RequestCoalescer<>("movie-lists", defaultTtl, maxEntries, clock);
    }

    @Bean
    public RequestCoalescer<Integer, Movie> movieDetailCoalescer(
            @Value("${app.coalescer.details.default-ttl:24h}") Duration defaultTtl, Clock clock) {
        return new RequestCoalescer<>("movie-details", defaultTtl, maxEntries, clock);
    }

    @Bean
    public RequestCoalescer<Integer, VideoResponse> movieVideoCoalescer(
            @Value("${app.coalescer.videos.default-ttl:24h}") Duration defaultTtl, Clock clock) {
        return new RequestCoalescer<>("movie-videos", defaultTtl, maxEntries, clock);
    }

    @Bean
    public RequestCoalescer<Integer, Credits> movieCreditsCoalescer(
            @Value("${app.coalescer.credits.default-ttl:24h}") Duration defaultTtl, Clock clock) {
        return new RequestCoalescer<>("movie-credits", defaultTtl, maxEntries, clock);
    }
}
