/**
 * Coalescing front for the catalog API client, one coalescer per resource kind
 *
 * @author William Callahan
 *
 * Features:
 * - List pages keyed as "<list>_<page>" with TTLs matched to how fast each list changes
 * - Similar and recommended pages use the list coalescer's configured default TTL
 * - Details, videos and credits keyed by movie id, each kept for its coalescer's configured default TTL
 * - Bulk clear, expiry sweep and cancellation across every resource kind
 */
package com.williamcallahan.movie_discovery_engine.service.cache;

import com.williamcallahan.movie_discovery_engine.model.Credits;
import com.williamcallahan.movie_discovery_engine.model.Movie;
import com.williamcallahan.movie_discovery_engine.model.MovieResponse;
import com.williamcallahan.movie_discovery_engine.model.VideoResponse;
import com.williamcallahan.movie_discovery_engine.service.TmdbApiClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;

@Slf4j
@Service
public class MovieRequestCoalescer {

    static final Duration TRENDING_TTL = Duration.ofMinutes(5);
    static final Duration POPULAR_TTL = Duration.ofMinutes(10);
    static final Duration TOP_RATED_TTL = Duration.ofHours(1);
    static final Duration NOW_PLAYING_TTL = Duration.ofMinutes(10);
    static final Duration UPCOMING_TTL = Duration.ofHours(1);
    static final Duration RECENT_TTL = Duration.ofMinutes(30);
    static final Duration SEARCH_TTL = Duration.ofMinutes(5);

    private final TmdbApiClient apiClient;
    private final RequestCoalescer<String, MovieResponse> listCoalescer;
    private final RequestCoalescer<Integer, Movie> detailCoalescer;
    private final RequestCoalescer<Integer, VideoResponse> videoCoalescer;
    private final RequestCoalescer<Integer, Credits> creditsCoalescer;

    public MovieRequestCoalescer(TmdbApiClient apiClient,
                                 @Qualifier("movieListCoalescer") RequestCoalescer<String, MovieResponse> listCoalescer,
                                 @Qualifier("movieDetailCoalescer") RequestCoalescer<Integer, Movie> detailCoalescer,
                                 @Qualifier("movieVideoCoalescer") RequestCoalescer<Integer, VideoResponse> videoCoalescer,
                                 @Qualifier("movieCreditsCoalescer") RequestCoalescer<Integer, Credits> creditsCoalescer) {
        this.apiClient = apiClient;
        this.listCoalescer = listCoalescer;
        this.detailCoalescer = detailCoalescer;
        this.videoCoalescer = videoCoalescer;
        this.creditsCoalescer = creditsCoalescer;
    }

    public CompletableFuture<MovieResponse> trending(int page) {
        return listCoalescer.coalesce("trending_" + page, TRENDING_TTL, () -> apiClient.trending(page));
    }

    public CompletableFuture<MovieResponse> popular(int page) {
        return listCoalescer.coalesce("popular_" + page, POPULAR_TTL, () -> apiClient.popular(page));
    }

    public CompletableFuture<MovieResponse> topRated(int page) {
        return listCoalescer.coalesce("topRated_" + page, TOP_RATED_TTL, () -> apiClient.topRated(page));
    }

    public CompletableFuture<MovieResponse> nowPlaying(int page) {
        return listCoalescer.coalesce("nowPlaying_" + page, NOW_PLAYING_TTL, () -> apiClient.nowPlaying(page));
    }

    public CompletableFuture<MovieResponse> upcoming(int page) {
        return listCoalescer.coalesce("upcoming_" + page, UPCOMING_TTL, () -> apiClient.upcoming(page));
    }

    public CompletableFuture<MovieResponse> recent(int page) {
        return listCoalescer.coalesce("recent_" + page, RECENT_TTL, () -> apiClient.discoverRecent(page));
    }

    /**
     * Search results keyed by the trimmed, lower-cased query; a blank query never reaches the coalescer
     */
    public CompletableFuture<MovieResponse> search(String query, int page) {
        if (query == null || query.isBlank()) {
            return CompletableFuture.completedFuture(MovieResponse.empty());
        }
        String normalized = query.trim().toLowerCase(Locale.ROOT);
        return listCoalescer.coalesce("search_" + normalized + "_" + page, SEARCH_TTL,
            () -> apiClient.search(query.trim(), page));
    }

    public CompletableFuture<MovieResponse> similar(int movieId, int page) {
        return listCoalescer.coalesce("similar_" + movieId + "_" + page,
            () -> apiClient.similar(movieId, page));
    }

    public CompletableFuture<MovieResponse> recommendations(int movieId, int page) {
        return listCoalescer.coalesce("recommendations_" + movieId + "_" + page,
            () -> apiClient.recommendations(movieId, page));
    }

    public CompletableFuture<Movie> movieDetails(int movieId) {
        return detailCoalescer.coalesce(movieId, () -> apiClient.movieDetails(movieId));
    }

    public CompletableFuture<VideoResponse> videos(int movieId) {
        return videoCoalescer.coalesce(movieId, () -> apiClient.videos(movieId));
    }

    public CompletableFuture<Credits> credits(int movieId) {
        return creditsCoalescer.coalesce(movieId, () -> apiClient.credits(movieId));
    }

    public void clearAllCaches() {
        coalescers().forEach(RequestCoalescer::invalidateAll);
        log.info("Cleared all coalescer caches");
    }

    /**
     * @return number of expired entries removed across all resource kinds
     */
    public int clearExpiredCaches() {
        return coalescers().stream().mapToInt(RequestCoalescer::evictExpired).sum();
    }

    public void cancelAllRequests() {
        coalescers().forEach(RequestCoalescer::cancelAll);
    }

    public int pendingCount() {
        return coalescers().stream().mapToInt(RequestCoalescer::pendingCount).sum();
    }

    public int cacheSize() {
        return coalescers().stream().mapToInt(RequestCoalescer::cacheSize).sum();
    }

    List<RequestCoalescer<?, ?>> coalescers() {
        return List.of(listCoalescer, detailCoalescer, videoCoalescer, creditsCoalescer);
    }
}
