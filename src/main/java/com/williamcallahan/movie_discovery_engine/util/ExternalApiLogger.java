package com.williamcallahan.movie_discovery_engine.util;

import org.slf4j.Logger;

/**
 * Centralized logging for calls against the external movie catalog API.
 *
 * Every line carries the [EXTERNAL-API] prefix so request, retry and failure
 * traffic can be grepped out of the application log:
 * - HTTP requests and responses
 * - Retry attempts with their computed backoff
 * - Final failures after classification
 * - Offline cache fallbacks
 */
public final class ExternalApiLogger {

    private static final String PREFIX = "[EXTERNAL-API]";

    private ExternalApiLogger() {
    }

    /**
     * Log an outgoing HTTP request; the API key is never part of the logged URL
     */
    public static void logHttpRequest(Logger log, String method, String endpoint, String description) {
        log.info("{} [HTTP] {} {} ({})", PREFIX, method, endpoint, description);
    }

    /**
     * Log a decoded HTTP response
     */
    public static void logHttpResponse(Logger log, int statusCode, String endpoint, int bodySize) {
        log.info("{} [HTTP] Response: status={}, endpoint={}, bodySize={} bytes", PREFIX, statusCode, endpoint, bodySize);
    }

    /**
     * Log a retry that is about to be scheduled
     */
    public static void logRetryScheduled(Logger log, String endpoint, long attempt, long delayMs, String reason) {
        log.warn("{} [RETRY] {} attempt #{} in {}ms after: {}", PREFIX, endpoint, attempt, delayMs, reason);
    }

    /**
     * Log an external API call failure
     */
    public static void logApiCallFailure(Logger log, String apiName, String endpoint, String kind, String reason) {
        log.warn("{} [{}] FAILURE: {} failed with {} - {}", PREFIX, apiName, endpoint, kind, reason);
    }

    /**
     * Log a request answered from the offline cache instead of the network
     */
    public static void logOfflineFallback(Logger log, String category, int itemCount, String reason) {
        log.info("{} [OFFLINE] Serving {} cached item(s) for category={} after: {}", PREFIX, itemCount, category, reason);
    }
}
