package com.williamcallahan.movie_discovery_engine.model;

import java.time.Instant;
import java.util.Map;

/**
 * Outcome of an offline download run
 *
 * @param stored number of movies written to the offline cache, per category that downloaded
 * @param failed failure message per category that could not be downloaded
 * @param syncedAt when the run finished
 */
public record OfflineDownloadReport(Map<CacheCategory, Integer> stored,
                                    Map<CacheCategory, String> failed,
                                    Instant syncedAt) {

    public OfflineDownloadReport {
        stored = stored == null ? Map.of() : Map.copyOf(stored);
        failed = failed == null ? Map.of() : Map.copyOf(failed);
    }

    public boolean isComplete() {
        return failed.isEmpty();
    }
}
