package com.williamcallahan.movie_discovery_engine.scheduler;

import com.williamcallahan.movie_discovery_engine.model.CacheStats;
import com.williamcallahan.movie_discovery_engine.service.ApiRequestMonitor;
import com.williamcallahan.movie_discovery_engine.service.cache.MovieRequestCoalescer;
import com.williamcallahan.movie_discovery_engine.service.cache.OfflineMovieCache;
import com.williamcallahan.movie_discovery_engine.service.recommendation.RecommendationEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Scheduler that sweeps expired cache entries and persists the recommendation profile.
 */
@Component
public class CacheMaintenanceScheduler {

    private static final Logger logger = LoggerFactory.getLogger(CacheMaintenanceScheduler.class);

    private final OfflineMovieCache offlineCache;
    private final MovieRequestCoalescer requestCoalescer;
    private final RecommendationEngine recommendationEngine;
    private final ApiRequestMonitor apiRequestMonitor;

    public CacheMaintenanceScheduler(OfflineMovieCache offlineCache,
                                     MovieRequestCoalescer requestCoalescer,
                                     RecommendationEngine recommendationEngine,
                                     ApiRequestMonitor apiRequestMonitor) {
        this.offlineCache = offlineCache;
        this.requestCoalescer = requestCoalescer;
        this.recommendationEngine = recommendationEngine;
        this.apiRequestMonitor = apiRequestMonitor;
    }

    /**
     * Drops expired offline entries and writes the cache back to disk.
     */
    @Scheduled(cron = "${app.offline-cache.sweep-cron:0 0 * * * *}")
    public void sweepOfflineCache() {
        int removed = offlineCache.clearExpired();
        CacheStats stats = offlineCache.getStats();
        logger.info("Offline cache sweep removed {} movie(s); {} valid of {} remaining",
            removed, stats.validItems(), stats.totalItems());
    }

    /**
     * Runs every five minutes to drop coalescer results whose TTL has elapsed.
     */
    @Scheduled(fixedDelayString = "${app.coalescer.sweep-interval-ms:300000}")
    public void sweepCoalescerCaches() {
        int removed = requestCoalescer.clearExpiredCaches();
        if (removed > 0) {
            logger.debug("Coalescer sweep removed {} expired result(s)", removed);
        }
    }

    @Scheduled(fixedDelayString = "${app.recommendation.flush-interval-ms:60000}")
    public void flushRecommendationProfile() {
        recommendationEngine.flush();
    }

    /**
     * Logs the catalog API usage report once an hour.
     */
    @Scheduled(cron = "0 55 * * * *")
    public void logApiUsage() {
        logger.info(apiRequestMonitor.generateReport());
    }
}
