/**
 * Debounces free-text movie search so that only the last query in a burst reaches the catalog
 *
 * @author William Callahan
 *
 * Features:
 * - Each new search cancels the previous pending one outright
 * - Waits the debounce interval on a shared scheduler; a search cancelled while waiting sends nothing
 * - Repeating the last serviced page-1 query answers immediately from memory
 * - Dispatches through the request coalescer so identical searches share one network call
 */
package com.williamcallahan.movie_discovery_engine.service;

import com.williamcallahan.movie_discovery_engine.config.AsyncConfig;
import com.williamcallahan.movie_discovery_engine.model.MovieResponse;
import com.williamcallahan.movie_discovery_engine.service.cache.MovieRequestCoalescer;
import com.williamcallahan.movie_discovery_engine.util.AsyncUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;

@Slf4j
@Service
public class SearchDebouncer {

    private final MovieRequestCoalescer requestCoalescer;
    private final ScheduledExecutorService scheduler;
    private final Duration debounceInterval;

    private final Object lock = new Object();
    // Guarded by lock
    private CompletableFuture<MovieResponse> pendingSearch;
    private String lastQuery;
    private MovieResponse lastResult;

    public SearchDebouncer(MovieRequestCoalescer requestCoalescer,
                           @Qualifier(AsyncConfig.CATALOG_SCHEDULER) ScheduledExecutorService scheduler,
                           @Value("${app.search.debounce-ms:300}") long debounceMillis) {
        this.requestCoalescer = requestCoalescer;
        this.scheduler = scheduler;
        this.debounceInterval = Duration.ofMillis(debounceMillis);
    }

    /**
     * Schedules a search after the debounce interval
     *
     * @param query user-entered text; surrounding whitespace is ignored
     * @param page 1-based result page
     * @return future for this search; it ends cancelled if a newer search supersedes it
     */
    public CompletableFuture<MovieResponse> search(String query, int page) {
        String normalized = query == null ? "" : query.trim();
        CompletableFuture<MovieResponse> result = new CompletableFuture<>();

        synchronized (lock) {
            if (pendingSearch != null) {
                pendingSearch.cancel(true);
                pendingSearch = null;
            }
            if (page == 1 && lastResult != null && normalized.equals(lastQuery)) {
                log.debug("Returning remembered results for '{}'", normalized);
                return CompletableFuture.completedFuture(lastResult);
            }
            if (normalized.isEmpty()) {
                return CompletableFuture.completedFuture(MovieResponse.empty());
            }
            pendingSearch = result;
        }

        CompletableFuture<Void> sleep = AsyncUtils.delay(debounceInterval, scheduler);
        AsyncUtils.propagateCancellation(result, sleep);
        sleep.whenComplete((ignored, sleepError) -> {
            if (sleepError != null || result.isDone()) {
                return;
            }
            dispatch(normalized, page, result);
        });
        return result;
    }

    private void dispatch(String query, int page, CompletableFuture<MovieResponse> result) {
        log.debug("Dispatching debounced search '{}' page {}", query, page);
        CompletableFuture<MovieResponse> request = requestCoalescer.search(query, page);
        AsyncUtils.propagateCancellation(result, request);
        request.whenComplete((response, ex) -> {
            synchronized (lock) {
                if (pendingSearch == result) {
                    pendingSearch = null;
                }
                if (result.isCancelled()) {
                    return;
                }
                if (ex == null && page == 1) {
                    lastQuery = query;
                    lastResult = response;
                }
            }
            if (ex == null) {
                result.complete(response);
            } else {
                result.completeExceptionally(AsyncUtils.unwrap(ex));
            }
        });
    }

    /**
     * Cancels the pending search, if any
     */
    public void cancel() {
        synchronized (lock) {
            if (pendingSearch != null) {
                pendingSearch.cancel(true);
                pendingSearch = null;
            }
        }
    }

    /**
     * Forgets the remembered query and results
     */
    public void clearCache() {
        synchronized (lock) {
            lastQuery = null;
            lastResult = null;
        }
    }
}
