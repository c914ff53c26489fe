/**
 * Tests for MovieCatalogService
 * - Page 1 of every list refreshes the offline copy
 * - Network failures fall back to usable offline data; other failures propagate
 * - Batch, offline download, cache-first and personalization wiring
 * - Offline cache writes go through the cache write executor
 *
 * @author William Callahan
 */
package com.williamcallahan.movie_discovery_engine.service;

import com.williamcallahan.movie_discovery_engine.exception.CatalogApiException;
import com.williamcallahan.movie_discovery_engine.exception.CatalogErrorKind;
import com.williamcallahan.movie_discovery_engine.model.CacheCategory;
import com.williamcallahan.movie_discovery_engine.model.FetchResult;
import com.williamcallahan.movie_discovery_engine.model.Movie;
import com.williamcallahan.movie_discovery_engine.model.MovieResponse;
import com.williamcallahan.movie_discovery_engine.model.OfflineDownloadReport;
import com.williamcallahan.movie_discovery_engine.service.cache.MovieRequestCoalescer;
import com.williamcallahan.movie_discovery_engine.service.cache.OfflineMovieCache;
import com.williamcallahan.movie_discovery_engine.service.recommendation.RecommendationEngine;
import com.williamcallahan.movie_discovery_engine.testutil.MovieTestData;
import com.williamcallahan.movie_discovery_engine.testutil.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class MovieCatalogServiceTest {

    @TempDir
    Path tempDir;

    @Mock
    private MovieRequestCoalescer requestCoalescer;

    @Mock
    private SearchDebouncer searchDebouncer;

    @Mock
    private RecommendationEngine recommendationEngine;

    private ScheduledExecutorService scheduler;
    private MutableClock clock;
    private OfflineMovieCache offlineCache;
    private BatchRequestManager batchRequestManager;
    private final AtomicInteger cacheWrites = new AtomicInteger();
    private MovieCatalogService catalogService;

    @BeforeEach
    void setUp() {
        scheduler = Executors.newSingleThreadScheduledExecutor();
        clock = MutableClock.startingAt("2025-05-01T08:00:00Z");
        offlineCache = newOfflineCache();
        batchRequestManager = new BatchRequestManager(scheduler, 3, 0);
        Executor countingExecutor = task -> {
            cacheWrites.incrementAndGet();
            task.run();
        };
        catalogService = newCatalogService(countingExecutor);
    }

    private OfflineMovieCache newOfflineCache() {
        return new OfflineMovieCache(MovieTestData.objectMapper(), clock, tempDir.toString(), 200, Duration.ofDays(7));
    }

    private MovieCatalogService newCatalogService(Executor cacheWriteExecutor) {
        return new MovieCatalogService(requestCoalescer, offlineCache, searchDebouncer,
            batchRequestManager, recommendationEngine, cacheWriteExecutor, clock);
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    private static <T> CompletableFuture<T> networkDown() {
        return CompletableFuture.failedFuture(CatalogApiException.from(new IOException("Connection refused")));
    }

    private static List<Integer> ids(List<Movie> movies) {
        return movies.stream().map(Movie::id).toList();
    }

    // ==================== Lists and offline fallback ====================

    @Test
    void firstPage_isWrittenToOfflineCache() {
        given(requestCoalescer.popular(1)).willReturn(CompletableFuture.completedFuture(MovieTestData.page(1, 1, 2, 3)));

        MovieResponse response = catalogService.popular(1).join();

        assertThat(response.results()).hasSize(3);
        assertThat(ids(offlineCache.getMovies(CacheCategory.POPULAR))).containsExactly(1, 2, 3);
        assertThat(cacheWrites).hasValue(1);
    }

    @Test
    void offlineCacheWrite_runsOnCacheWriteExecutor() throws Exception {
        ExecutorService writer = Executors.newSingleThreadExecutor(task -> new Thread(task, "offline-cache-test"));
        try {
            CompletableFuture<MovieResponse> network = new CompletableFuture<>();
            given(requestCoalescer.popular(1)).willReturn(network);
            String[] writerThread = new String[1];

            CompletableFuture<MovieResponse> response = newCatalogService(writer).popular(1)
                .whenComplete((value, ex) -> writerThread[0] = Thread.currentThread().getName());
            network.complete(MovieTestData.page(1, 1, 2));
            response.get(5, TimeUnit.SECONDS);

            assertThat(writerThread[0]).isEqualTo("offline-cache-test");
            assertThat(ids(offlineCache.getMovies(CacheCategory.POPULAR))).containsExactly(1, 2);
        } finally {
            writer.shutdownNow();
        }
    }

    @Test
    void laterPages_areNotWrittenToOfflineCache() {
        given(requestCoalescer.trending(2)).willReturn(CompletableFuture.completedFuture(MovieTestData.page(2, 7, 8)));

        catalogService.trending(2).join();

        assertThat(offlineCache.getMovies(CacheCategory.TRENDING)).isEmpty();
    }

    @Test
    void networkFailure_fallsBackToOfflineCategory() {
        offlineCache.cacheMovies(MovieTestData.movies(4, 5), CacheCategory.TOP_RATED);
        given(requestCoalescer.topRated(1)).willReturn(networkDown());

        MovieResponse response = catalogService.topRated(1).join();

        assertThat(ids(response.results())).containsExactly(4, 5);
        assertThat(response.page()).isEqualTo(1);
        assertThat(response.totalPages()).isEqualTo(1);
    }

    @Test
    void networkFailure_withoutOfflineData_propagates() {
        given(requestCoalescer.upcoming(1)).willReturn(networkDown());

        assertThatThrownBy(() -> catalogService.upcoming(1).join())
            .isInstanceOf(CompletionException.class)
            .cause()
            .isInstanceOfSatisfying(CatalogApiException.class,
                e -> assertThat(e.getKind()).isEqualTo(CatalogErrorKind.TRANSPORT));
    }

    @Test
    void nonNetworkFailure_propagatesEvenWithOfflineData() {
        offlineCache.cacheMovies(MovieTestData.movies(4, 5), CacheCategory.NOW_PLAYING);
        given(requestCoalescer.nowPlaying(1))
            .willReturn(CompletableFuture.failedFuture(CatalogApiException.unauthorized("Invalid API key")));

        assertThatThrownBy(() -> catalogService.nowPlaying(1).join())
            .isInstanceOf(CompletionException.class)
            .cause()
            .isInstanceOfSatisfying(CatalogApiException.class,
                e -> assertThat(e.getKind()).isEqualTo(CatalogErrorKind.UNAUTHORIZED));
    }

    @Test
    void nonListCategory_isRejected() {
        assertThatThrownBy(() -> catalogService.listPage(CacheCategory.SEARCH, 1))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void movieDetails_areRememberedAndServedOffline() {
        Movie movie = MovieTestData.movie(550);
        given(requestCoalescer.movieDetails(550))
            .willReturn(CompletableFuture.completedFuture(movie), networkDown());

        assertThat(catalogService.movieDetails(550).join()).isEqualTo(movie);
        assertThat(catalogService.movieDetails(550).join().title()).isEqualTo("Movie 550");
    }

    // ==================== Batches ====================

    @Test
    void fetchMovieDetails_returnsInInputOrder() throws Exception {
        given(requestCoalescer.movieDetails(anyInt()))
            .willAnswer(invocation -> CompletableFuture.completedFuture(MovieTestData.movie(invocation.<Integer>getArgument(0))));

        List<Movie> movies = catalogService.fetchMovieDetails(List.of(9, 3, 7, 1, 5, 2)).get(5, TimeUnit.SECONDS);

        assertThat(ids(movies)).containsExactly(9, 3, 7, 1, 5, 2);
    }

    @Test
    void fetchPages_rejectsInvalidRange() {
        assertThat(catalogService.fetchPages(CacheCategory.POPULAR, 3, 2)).isCompletedExceptionally();
        assertThat(catalogService.fetchPages(CacheCategory.POPULAR, 0, 2)).isCompletedExceptionally();
    }

    @Test
    void fetchPages_loadsEachPage() throws Exception {
        given(requestCoalescer.popular(anyInt()))
            .willAnswer(invocation -> CompletableFuture.completedFuture(
                MovieTestData.page(invocation.<Integer>getArgument(0), invocation.<Integer>getArgument(0) * 10)));

        List<MovieResponse> pages = catalogService.fetchPages(CacheCategory.POPULAR, 1, 4).get(5, TimeUnit.SECONDS);

        assertThat(pages).extracting(MovieResponse::page).containsExactly(1, 2, 3, 4);
    }

    @Test
    void downloadForOffline_storesEachCategory() throws Exception {
        given(requestCoalescer.trending(1)).willReturn(CompletableFuture.completedFuture(MovieTestData.page(1, 1, 2)));
        given(requestCoalescer.upcoming(1)).willReturn(CompletableFuture.completedFuture(MovieTestData.page(1, 3, 4, 5)));

        OfflineDownloadReport report = catalogService
            .downloadForOffline(List.of(CacheCategory.TRENDING, CacheCategory.UPCOMING))
            .get(5, TimeUnit.SECONDS);

        assertThat(report.stored()).containsEntry(CacheCategory.TRENDING, 2).containsEntry(CacheCategory.UPCOMING, 3);
        assertThat(report.isComplete()).isTrue();
        assertThat(ids(offlineCache.getMovies(CacheCategory.UPCOMING))).containsExactly(3, 4, 5);
        assertThat(catalogService.getLastOfflineSync()).contains(Instant.parse("2025-05-01T08:00:00Z"));
    }

    @Test
    void downloadForOffline_keepsSuccessfulCategoriesWhenOneFails() throws Exception {
        given(requestCoalescer.trending(1)).willReturn(CompletableFuture.completedFuture(MovieTestData.page(1, 1, 2)));
        given(requestCoalescer.popular(1)).willReturn(networkDown());
        given(requestCoalescer.upcoming(1)).willReturn(CompletableFuture.completedFuture(MovieTestData.page(1, 3, 4, 5)));

        OfflineDownloadReport report = catalogService
            .downloadForOffline(List.of(CacheCategory.TRENDING, CacheCategory.POPULAR, CacheCategory.UPCOMING))
            .get(5, TimeUnit.SECONDS);

        assertThat(report.stored()).containsOnlyKeys(CacheCategory.TRENDING, CacheCategory.UPCOMING);
        assertThat(report.failed()).containsOnlyKeys(CacheCategory.POPULAR);
        assertThat(report.isComplete()).isFalse();
        assertThat(ids(offlineCache.getMovies(CacheCategory.TRENDING))).containsExactly(1, 2);
        assertThat(ids(offlineCache.getMovies(CacheCategory.UPCOMING))).containsExactly(3, 4, 5);
        assertThat(offlineCache.hasCachedData(CacheCategory.POPULAR)).isFalse();
        assertThat(catalogService.getLastOfflineSync()).isPresent();
    }

    // ==================== Cache-first and personalization ====================

    @Test
    void cachedFirst_usesNetworkWhenNothingIsCached() {
        given(requestCoalescer.recent(1)).willReturn(CompletableFuture.completedFuture(MovieTestData.page(1, 11, 12)));

        FetchResult<List<Movie>> result = catalogService.cachedFirst(CacheCategory.RECENT).join();

        assertThat(result.fromCache()).isFalse();
        assertThat(ids(result.data())).containsExactly(11, 12);
        assertThat(offlineCache.hasCachedData(CacheCategory.RECENT)).isTrue();
    }

    @Test
    void cachedFirst_servesOfflineCopyAndRefreshes() {
        offlineCache.cacheMovies(MovieTestData.movies(1, 2), CacheCategory.RECENT);
        clock.advance(Duration.ofHours(2));
        given(requestCoalescer.recent(1)).willReturn(CompletableFuture.completedFuture(MovieTestData.page(1, 3, 4)));

        FetchResult<List<Movie>> result = catalogService.cachedFirst(CacheCategory.RECENT).join();

        assertThat(result.fromCache()).isTrue();
        assertThat(ids(result.data())).containsExactly(1, 2);
        assertThat(ids(offlineCache.getMovies(CacheCategory.RECENT))).containsExactly(3, 4);

        clock.advance(Duration.ofHours(5));
        assertThat(offlineCache.hasCachedData(CacheCategory.RECENT)).isTrue();
        OfflineMovieCache reloaded = newOfflineCache();
        reloaded.loadFromDisk();
        assertThat(ids(reloaded.getMovies(CacheCategory.RECENT))).containsExactly(3, 4);
    }

    @Test
    void personalized_ranksFirstPageThroughRecommendationEngine() {
        MovieResponse page = MovieTestData.page(1, 1, 2, 3);
        given(requestCoalescer.popular(1)).willReturn(CompletableFuture.completedFuture(page));
        given(recommendationEngine.getRecommendations(page.results(), 2)).willReturn(MovieTestData.movies(3, 1));

        List<Movie> personalized = catalogService.personalized(CacheCategory.POPULAR, 2).join();

        assertThat(ids(personalized)).containsExactly(3, 1);
    }

    @Test
    void searchDebounced_delegatesToDebouncer() {
        CompletableFuture<MovieResponse> pending = new CompletableFuture<>();
        given(searchDebouncer.search("alien", 1)).willReturn(pending);

        assertThat(catalogService.searchDebounced("alien", 1)).isSameAs(pending);

        catalogService.cancelSearch();
        verify(searchDebouncer).cancel();
    }
}
