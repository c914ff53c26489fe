/**
 * Consumer-facing entry point for movie discovery
 *
 * @author William Callahan
 *
 * Features:
 * - List, detail and search lookups routed through the request coalescer
 * - First pages of each list are written to the offline cache for later use
 * - Falls back to offline data when the network is unreachable
 * - Offline cache writes run on a dedicated executor, never on the HTTP client's event loop
 * - Debounced search, paced batch lookups and cache-first category reads
 * - Bulk offline download of whole categories; a failed category does not discard the others
 * - Personalized ordering of any category via the recommendation engine
 */
package com.williamcallahan.movie_discovery_engine.service;

import com.williamcallahan.movie_discovery_engine.config.AsyncConfig;
import com.williamcallahan.movie_discovery_engine.exception.CatalogApiException;
import com.williamcallahan.movie_discovery_engine.exception.CatalogErrorKind;
import com.williamcallahan.movie_discovery_engine.model.CacheCategory;
import com.williamcallahan.movie_discovery_engine.model.Credits;
import com.williamcallahan.movie_discovery_engine.model.FetchResult;
import com.williamcallahan.movie_discovery_engine.model.Movie;
import com.williamcallahan.movie_discovery_engine.model.MovieResponse;
import com.williamcallahan.movie_discovery_engine.model.OfflineDownloadReport;
import com.williamcallahan.movie_discovery_engine.model.VideoResponse;
import com.williamcallahan.movie_discovery_engine.service.cache.CacheFirstFetcher;
import com.williamcallahan.movie_discovery_engine.service.cache.MovieRequestCoalescer;
import com.williamcallahan.movie_discovery_engine.service.cache.OfflineMovieCache;
import com.williamcallahan.movie_discovery_engine.service.recommendation.RecommendationEngine;
import com.williamcallahan.movie_discovery_engine.util.AsyncUtils;
import com.williamcallahan.movie_discovery_engine.util.ExternalApiLogger;
import com.williamcallahan.movie_discovery_engine.util.LoggingUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.stream.IntStream;

@Slf4j
@Service
public class MovieCatalogService {

    static final int DETAIL_BATCH_CONCURRENCY = 5;
    static final int PAGE_BATCH_CONCURRENCY = 3;

    private final MovieRequestCoalescer requestCoalescer;
    private final OfflineMovieCache offlineCache;
    private final SearchDebouncer searchDebouncer;
    private final BatchRequestManager batchRequestManager;
    private final RecommendationEngine recommendationEngine;
    private final Executor cacheWriteExecutor;
    private final Clock clock;

    private volatile Instant lastOfflineSync;

    public MovieCatalogService(MovieRequestCoalescer requestCoalescer,
                               OfflineMovieCache offlineCache,
                               SearchDebouncer searchDebouncer,
                               BatchRequestManager batchRequestManager,
                               RecommendationEngine recommendationEngine,
                               @Qualifier(AsyncConfig.OFFLINE_CACHE_EXECUTOR) Executor cacheWriteExecutor,
                               Clock clock) {
        this.requestCoalescer = requestCoalescer;
        this.offlineCache = offlineCache;
        this.searchDebouncer = searchDebouncer;
        this.batchRequestManager = batchRequestManager;
        this.recommendationEngine = recommendationEngine;
        this.cacheWriteExecutor = cacheWriteExecutor;
        this.clock = clock;
    }

    // ==================== Category lists ====================

    public CompletableFuture<MovieResponse> trending(int page) {
        return listPage(CacheCategory.TRENDING, page);
    }

    public CompletableFuture<MovieResponse> popular(int page) {
        return listPage(CacheCategory.POPULAR, page);
    }

    public CompletableFuture<MovieResponse> topRated(int page) {
        return listPage(CacheCategory.TOP_RATED, page);
    }

    public CompletableFuture<MovieResponse> nowPlaying(int page) {
        return listPage(CacheCategory.NOW_PLAYING, page);
    }

    public CompletableFuture<MovieResponse> upcoming(int page) {
        return listPage(CacheCategory.UPCOMING, page);
    }

    public CompletableFuture<MovieResponse> recent(int page) {
        return listPage(CacheCategory.RECENT, page);
    }

    /**
     * Fetches one page of a list category
     * Page 1 refreshes the offline copy of the category; when the network is unreachable
     * and the offline copy is still usable, it is returned as a single page instead
     *
     * @param category one of the list categories (trending, popular, top rated, now playing, upcoming, recent)
     * @param page 1-based page number
     */
    public CompletableFuture<MovieResponse> listPage(CacheCategory category, int page) {
        return fetchList(category, page)
            .thenApplyAsync(response -> {
                if (page == 1 && !response.results().isEmpty()) {
                    offlineCache.cacheMovies(response.results(), category);
                }
                return response;
            }, cacheWriteExecutor)
            .exceptionally(ex -> offlineFallback(category, ex));
    }

    private MovieResponse offlineFallback(CacheCategory category, Throwable ex) {
        CatalogApiException failure = CatalogApiException.from(ex);
        if (failure.getKind() == CatalogErrorKind.TRANSPORT && offlineCache.hasCachedData(category)) {
            List<Movie> cached = offlineCache.getMovies(category);
            ExternalApiLogger.logOfflineFallback(log, category.name(), cached.size(), failure.getMessage());
            return MovieResponse.singlePage(cached);
        }
        throw new CompletionException(failure);
    }

    private CompletableFuture<MovieResponse> fetchList(CacheCategory category, int page) {
        return switch (category) {
            case TRENDING -> requestCoalescer.trending(page);
            case POPULAR -> requestCoalescer.popular(page);
            case TOP_RATED -> requestCoalescer.topRated(page);
            case NOW_PLAYING -> requestCoalescer.nowPlaying(page);
            case UPCOMING -> requestCoalescer.upcoming(page);
            case RECENT -> requestCoalescer.recent(page);
            default -> throw new IllegalArgumentException("Category " + category + " is not a catalog list");
        };
    }

    // ==================== Single movies ====================

    /**
     * Movie details, remembered offline; served from the offline cache when the network is unreachable
     */
    public CompletableFuture<Movie> movieDetails(int movieId) {
        return requestCoalescer.movieDetails(movieId)
            .thenApplyAsync(movie -> {
                offlineCache.cache(movie);
                return movie;
            }, cacheWriteExecutor)
            .exceptionally(ex -> {
                CatalogApiException failure = CatalogApiException.from(ex);
                Optional<Movie> cached = failure.getKind() == CatalogErrorKind.TRANSPORT
                    ? offlineCache.get(movieId)
                    : Optional.empty();
                if (cached.isPresent()) {
                    ExternalApiLogger.logOfflineFallback(log, "movie " + movieId, 1, failure.getMessage());
                    return cached.get();
                }
                throw new CompletionException(failure);
            });
    }

    public CompletableFuture<VideoResponse> videos(int movieId) {
        return requestCoalescer.videos(movieId);
    }

    public CompletableFuture<Credits> credits(int movieId) {
        return requestCoalescer.credits(movieId);
    }

    public CompletableFuture<MovieResponse> similar(int movieId, int page) {
        return requestCoalescer.similar(movieId, page);
    }

    public CompletableFuture<MovieResponse> recommendations(int movieId, int page) {
        return requestCoalescer.recommendations(movieId, page);
    }

    // ==================== Search ====================

    public CompletableFuture<MovieResponse> search(String query, int page) {
        return requestCoalescer.search(query, page);
    }

    /**
     * Search-as-you-type entry point; superseded calls end cancelled
     */
    public CompletableFuture<MovieResponse> searchDebounced(String query, int page) {
        return searchDebouncer.search(query, page);
    }

    public void cancelSearch() {
        searchDebouncer.cancel();
    }

    // ==================== Batches ====================

    /**
     * Details for many movies, five at a time, in the order the ids were given
     */
    public CompletableFuture<List<Movie>> fetchMovieDetails(List<Integer> movieIds) {
        return batchRequestManager.fetchBatch(movieIds, this::movieDetails, DETAIL_BATCH_CONCURRENCY);
    }

    /**
     * Consecutive pages of a list category, three at a time
     *
     * @param fromPage first page, inclusive
     * @param toPage last page, inclusive
     */
    public CompletableFuture<List<MovieResponse>> fetchPages(CacheCategory category, int fromPage, int toPage) {
        if (fromPage < 1 || toPage < fromPage) {
            return CompletableFuture.failedFuture(
                new IllegalArgumentException("Invalid page range " + fromPage + ".." + toPage));
        }
        List<Integer> pages = IntStream.rangeClosed(fromPage, toPage).boxed().toList();
        return batchRequestManager.fetchBatch(pages, page -> listPage(category, page), PAGE_BATCH_CONCURRENCY);
    }

    // ==================== Offline ====================

    /**
     * Offline copy of a category when it is mostly fresh, refreshed in the background;
     * otherwise page 1 from the network
     */
    public CompletableFuture<FetchResult<List<Movie>>> cachedFirst(CacheCategory category, boolean forceRefresh) {
        return cacheFirstFetcher(category).fetch(forceRefresh);
    }

    public CompletableFuture<FetchResult<List<Movie>>> cachedFirst(CacheCategory category) {
        return cachedFirst(category, false);
    }

    CacheFirstFetcher<List<Movie>> cacheFirstFetcher(CacheCategory category) {
        return new CacheFirstFetcher<>(
            category.name(),
            () -> offlineCache.hasCachedData(category)
                ? Optional.of(offlineCache.getMovies(category))
                : Optional.empty(),
            () -> fetchList(category, 1).thenApplyAsync(MovieResponse::results, cacheWriteExecutor),
            movies -> offlineCache.cacheMovies(movies, category));
    }

    /**
     * Downloads page 1 of each category into the offline cache
     * Each category is stored as soon as it arrives; a failed category is reported and skipped
     *
     * @return what was stored and what failed, per category
     */
    public CompletableFuture<OfflineDownloadReport> downloadForOffline(List<CacheCategory> categories) {
        List<CacheCategory> targets = List.copyOf(categories);
        Map<CacheCategory, Integer> stored = new ConcurrentHashMap<>();
        Map<CacheCategory, String> failed = new ConcurrentHashMap<>();
        log.info("Downloading {} categor(ies) for offline use", targets.size());
        return batchRequestManager
            .fetchBatch(targets, category -> downloadCategory(category, stored, failed), PAGE_BATCH_CONCURRENCY)
            .thenApply(ignored -> {
                Instant syncedAt = clock.instant();
                lastOfflineSync = syncedAt;
                if (!failed.isEmpty()) {
                    log.warn("Offline download finished with {} failed categor(ies): {}", failed.size(), failed.keySet());
                }
                return new OfflineDownloadReport(stored, failed, syncedAt);
            });
    }

    /**
     * @return when the last offline download finished, if one has
     */
    public Optional<Instant> getLastOfflineSync() {
        return Optional.ofNullable(lastOfflineSync);
    }

    private CompletableFuture<Boolean> downloadCategory(CacheCategory category,
                                                        Map<CacheCategory, Integer> stored,
                                                        Map<CacheCategory, String> failed) {
        CompletableFuture<MovieResponse> fetch;
        try {
            fetch = fetchList(category, 1);
        } catch (IllegalArgumentException e) {
            fetch = CompletableFuture.failedFuture(e);
        }
        CompletableFuture<Boolean> download = fetch
            .thenApplyAsync(response -> {
                offlineCache.cacheMovies(response.results(), category);
                stored.put(category, response.results().size());
                return true;
            }, cacheWriteExecutor)
            .exceptionally(ex -> {
                Throwable cause = AsyncUtils.unwrap(ex);
                LoggingUtils.warn(log, cause, "Failed to download {} for offline use", category);
                failed.put(category, String.valueOf(cause.getMessage()));
                return false;
            });
        return AsyncUtils.propagateCancellation(download, fetch);
    }

    // ==================== Personalization ====================

    /**
     * Page 1 of a category, unseen movies only, best personal match first
     */
    public CompletableFuture<List<Movie>> personalized(CacheCategory category, int limit) {
        return listPage(category, 1)
            .thenApply(response -> recommendationEngine.getRecommendations(response.results(), limit));
    }
}
