/**
 * Configuration for retry behavior against the movie catalog API
 *
 * @author William Callahan
 *
 * Features:
 * - Exponential backoff with jitter to avoid synchronized retry bursts
 * - Retry budget and delay caps read from application properties
 */

package com.williamcallahan.movie_discovery_engine.config;

import com.williamcallahan.movie_discovery_engine.util.RetryBackoffPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class RetryConfig {

    private static final Logger logger = LoggerFactory.getLogger(RetryConfig.class);

    @Value("${app.retry.tmdb.max-retries:3}")
    private int tmdbMaxRetries;

    @Value("${app.retry.tmdb.base-delay-ms:1000}")
    private long tmdbBaseDelay;

    @Value("${app.retry.tmdb.max-delay-ms:30000}")
    private long tmdbMaxDelay;

    @Value("${app.retry.tmdb.jitter-factor:0.5}")
    private double tmdbJitterFactor;

    /**
     * Creates the backoff policy used by the catalog API client
     *
     * @return RetryBackoffPolicy for catalog requests
     */
    @Bean
    public RetryBackoffPolicy tmdbRetryBackoffPolicy() {
        logger.info("Catalog API retry policy: maxRetries={}, baseDelay={}ms, maxDelay={}ms, jitter={}",
            tmdbMaxRetries, tmdbBaseDelay, tmdbMaxDelay, tmdbJitterFactor);
        return new RetryBackoffPolicy(
            tmdbMaxRetries,
            Duration.ofMillis(tmdbBaseDelay),
            Duration.ofMillis(tmdbMaxDelay),
            tmdbJitterFactor);
    }
}
