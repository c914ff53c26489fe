/**
 * Service for monitoring catalog API request metrics
 * - Tracks request counts by endpoint
 * - Maintains hourly, daily and total success/failure counters
 * - Produces a plain-text report for diagnostics
 *
 * @author William Callahan
 */
package com.williamcallahan.movie_discovery_engine.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

@Service
public class ApiRequestMonitor {
    private static final Logger logger = LoggerFactory.getLogger(ApiRequestMonitor.class);
    private static final DateTimeFormatter TIME_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final AtomicLong totalRequests = new AtomicLong(0);
    private final AtomicLong totalSuccessful = new AtomicLong(0);
    private final AtomicLong totalFailed = new AtomicLong(0);

    private final AtomicInteger hourlyRequests = new AtomicInteger(0);
    private final AtomicInteger hourlySuccessful = new AtomicInteger(0);
    private final AtomicInteger hourlyFailed = new AtomicInteger(0);

    private final AtomicInteger dailyRequests = new AtomicInteger(0);
    private final AtomicInteger dailySuccessful = new AtomicInteger(0);
    private final AtomicInteger dailyFailed = new AtomicInteger(0);

    private final Map<String, AtomicInteger> endpointCounts = new ConcurrentHashMap<>();

    private volatile LocalDateTime lastHourlyReset = LocalDateTime.now();
    private volatile LocalDateTime lastDailyReset = LocalDateTime.now();

    /**
     * Records a successful catalog request
     * @param endpoint The catalog path that was called
     */
    public void recordSuccessfulRequest(String endpoint) {
        totalRequests.incrementAndGet();
        totalSuccessful.incrementAndGet();
        hourlyRequests.incrementAndGet();
        hourlySuccessful.incrementAndGet();
        dailyRequests.incrementAndGet();
        dailySuccessful.incrementAndGet();
        endpointCounts.computeIfAbsent(endpoint, k -> new AtomicInteger(0)).incrementAndGet();

        int hourly = hourlyRequests.get();
        if (hourly % 50 == 0) {
            logger.info("Catalog API request count: {} in the current hour", hourly);
        }
    }

    /**
     * Records a failed catalog request attempt
     * @param endpoint The catalog path that was called
     * @param errorMessage Classified failure description
     */
    public void recordFailedRequest(String endpoint, String errorMessage) {
        totalRequests.incrementAndGet();
        totalFailed.incrementAndGet();
        hourlyRequests.incrementAndGet();
        hourlyFailed.incrementAndGet();
        dailyRequests.incrementAndGet();
        dailyFailed.incrementAndGet();
        endpointCounts.computeIfAbsent(endpoint, k -> new AtomicInteger(0)).incrementAndGet();

        logger.warn("Failed catalog API request to endpoint {}: {}", endpoint, errorMessage);
    }

    @Scheduled(cron = "0 0 * * * ?")
    public void resetHourlyCounters() {
        int requests = hourlyRequests.getAndSet(0);
        int successful = hourlySuccessful.getAndSet(0);
        int failed = hourlyFailed.getAndSet(0);
        lastHourlyReset = LocalDateTime.now();
        logger.info("Hourly API metrics reset. Previous hour: {} requests ({} successful, {} failed)",
            requests, successful, failed);
    }

    @Scheduled(cron = "0 0 0 * * ?")
    public void resetDailyCounters() {
        int requests = dailyRequests.getAndSet(0);
        int successful = dailySuccessful.getAndSet(0);
        int failed = dailyFailed.getAndSet(0);
        endpointCounts.clear();
        lastDailyReset = LocalDateTime.now();
        logger.info("Daily API metrics reset. Previous day: {} requests ({} successful, {} failed)",
            requests, successful, failed);
    }

    public int getCurrentHourlyRequests() {
        return hourlyRequests.get();
    }

    public int getCurrentDailyRequests() {
        return dailyRequests.get();
    }

    public long getTotalRequests() {
        return totalRequests.get();
    }

    public long getTotalFailed() {
        return totalFailed.get();
    }

    /**
     * Requests recorded for one endpoint since the last daily reset
     */
    public int getEndpointCount(String endpoint) {
        AtomicInteger count = endpointCounts.get(endpoint);
        return count == null ? 0 : count.get();
    }

    /**
     * Generates a human-readable report of catalog API usage
     * @return String containing the formatted report
     */
    public String generateReport() {
        StringBuilder report = new StringBuilder();
        report.append(String.format("Catalog API Request Report%n"));
        report.append(String.format("==========================%n"));
        report.append(String.format("Generated at: %s%n%n", TIME_FORMATTER.format(LocalDateTime.now())));
        report.append(String.format("  Hourly: %d requests (%d successful, %d failed)%n",
            hourlyRequests.get(), hourlySuccessful.get(), hourlyFailed.get()));
        report.append(String.format("  Daily: %d requests (%d successful, %d failed)%n",
            dailyRequests.get(), dailySuccessful.get(), dailyFailed.get()));
        report.append(String.format("  Total: %d requests (%d successful, %d failed)%n%n",
            totalRequests.get(), totalSuccessful.get(), totalFailed.get()));
        report.append(String.format("Endpoint Counts:%n"));
        new TreeMap<>(endpointCounts).forEach((endpoint, count) ->
            report.append(String.format("  %s: %d requests%n", endpoint, count.get())));
        report.append(String.format("%nLast Reset Times:%n"));
        report.append(String.format("  Hourly: %s%n", TIME_FORMATTER.format(lastHourlyReset)));
        report.append(String.format("  Daily: %s%n", TIME_FORMATTER.format(lastDailyReset)));
        return report.toString();
    }
}
