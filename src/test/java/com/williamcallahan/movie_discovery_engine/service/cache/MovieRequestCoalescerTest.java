package com.williamcallahan.movie_discovery_engine.service.cache;

import com.williamcallahan.movie_discovery_engine.model.Credits;
import com.williamcallahan.movie_discovery_engine.model.Movie;
import com.williamcallahan.movie_discovery_engine.model.MovieResponse;
import com.williamcallahan.movie_discovery_engine.model.VideoResponse;
import com.williamcallahan.movie_discovery_engine.service.TmdbApiClient;
import com.williamcallahan.movie_discovery_engine.testutil.MovieTestData;
import com.williamcallahan.movie_discovery_engine.testutil.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class MovieRequestCoalescerTest {

    @Mock
    private TmdbApiClient apiClient;

    private MutableClock clock;
    private MovieRequestCoalescer requestCoalescer;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2025-03-01T10:00:00Z");
        requestCoalescer = newCoalescer(Duration.ofMinutes(30), Duration.ofHours(24));
    }

    private MovieRequestCoalescer newCoalescer(Duration listTtl, Duration detailTtl) {
        return new MovieRequestCoalescer(apiClient,
                new RequestCoalescer<String, MovieResponse>("movie-lists", listTtl, 100, clock),
                new RequestCoalescer<Integer, Movie>("movie-details", detailTtl, 100, clock),
                new RequestCoalescer<Integer, VideoResponse>("movie-videos", detailTtl, 100, clock),
                new RequestCoalescer<Integer, Credits>("movie-credits", detailTtl, 100, clock));
    }

    @Test
    void concurrentPopularRequests_shareOneClientCall() {
        AtomicInteger counter = new AtomicInteger();
        CompletableFuture<MovieResponse> inFlight = new CompletableFuture<>();
        given(apiClient.popular(1)).willAnswer(invocation -> {
            counter.incrementAndGet();
            return inFlight;
        });

        CompletableFuture<MovieResponse> first = requestCoalescer.popular(1);
        CompletableFuture<MovieResponse> second = requestCoalescer.popular(1);
        inFlight.complete(MovieTestData.page(1, counter.get()));

        assertThat(first.join()).isSameAs(second.join());
        assertThat(first.join().results().get(0).id()).isEqualTo(1);
        verify(apiClient, times(1)).popular(1);
    }

    @Test
    void popularResults_areReusedWithinTtl() {
        given(apiClient.popular(1)).willReturn(CompletableFuture.completedFuture(MovieTestData.page(1, 5)));

        requestCoalescer.popular(1).join();
        clock.advance(Duration.ofMinutes(9));
        requestCoalescer.popular(1).join();
        verify(apiClient, times(1)).popular(1);

        clock.advance(Duration.ofMinutes(1));
        requestCoalescer.popular(1).join();
        verify(apiClient, times(2)).popular(1);
    }

    @Test
    void detailsAndRelatedPages_useConfiguredDefaultTtls() {
        MovieRequestCoalescer configured = newCoalescer(Duration.ofMinutes(15), Duration.ofHours(2));
        given(apiClient.movieDetails(603)).willReturn(CompletableFuture.completedFuture(MovieTestData.movie(603)));
        given(apiClient.similar(603, 1)).willReturn(CompletableFuture.completedFuture(MovieTestData.page(1, 604)));

        configured.movieDetails(603).join();
        configured.similar(603, 1).join();
        clock.advance(Duration.ofMinutes(14));
        configured.similar(603, 1).join();
        verify(apiClient, times(1)).similar(603, 1);

        clock.advance(Duration.ofMinutes(1));
        configured.similar(603, 1).join();
        verify(apiClient, times(2)).similar(603, 1);

        clock.advance(Duration.ofMinutes(104));
        configured.movieDetails(603).join();
        verify(apiClient, times(1)).movieDetails(603);

        clock.advance(Duration.ofMinutes(1));
        configured.movieDetails(603).join();
        verify(apiClient, times(2)).movieDetails(603);
    }

    @Test
    void differentPages_useDifferentKeys() {
        given(apiClient.trending(anyInt())).willAnswer(invocation ->
                CompletableFuture.completedFuture(MovieTestData.page(invocation.<Integer>getArgument(0), 1)));

        assertThat(requestCoalescer.trending(1).join().page()).isEqualTo(1);
        assertThat(requestCoalescer.trending(2).join().page()).isEqualTo(2);
        verify(apiClient).trending(1);
        verify(apiClient).trending(2);
    }

    @Test
    void searchKey_ignoresCaseAndSurroundingWhitespace() {
        given(apiClient.search("Dune", 1)).willReturn(CompletableFuture.completedFuture(MovieTestData.page(1, 438631)));

        requestCoalescer.search("Dune", 1).join();
        MovieResponse second = requestCoalescer.search("  dune ", 1).join();

        assertThat(second.results()).extracting(Movie::id).containsExactly(438631);
        verify(apiClient, times(1)).search(anyString(), anyInt());
    }

    @Test
    void blankSearch_neverReachesClient() {
        assertThat(requestCoalescer.search(" ", 1).join().results()).isEmpty();
        verify(apiClient, never()).search(anyString(), anyInt());
    }

    @Test
    void clearAllCaches_forcesRefetch() {
        given(apiClient.movieDetails(27205)).willReturn(CompletableFuture.completedFuture(MovieTestData.movie(27205)));

        requestCoalescer.movieDetails(27205).join();
        requestCoalescer.clearAllCaches();
        requestCoalescer.movieDetails(27205).join();

        verify(apiClient, times(2)).movieDetails(27205);
        assertThat(requestCoalescer.cacheSize()).isEqualTo(1);
    }

    @Test
    void clearExpiredCaches_countsAcrossResourceKinds() {
        given(apiClient.trending(1)).willReturn(CompletableFuture.completedFuture(MovieTestData.page(1, 1)));
        given(apiClient.movieDetails(1)).willReturn(CompletableFuture.completedFuture(MovieTestData.movie(1)));

        requestCoalescer.trending(1).join();
        requestCoalescer.movieDetails(1).join();
        clock.advance(Duration.ofMinutes(6));

        assertThat(requestCoalescer.clearExpiredCaches()).isEqualTo(1);
        assertThat(requestCoalescer.cacheSize()).isEqualTo(1);
    }

    @Test
    void cancelAllRequests_cancelsInFlightWork() {
        CompletableFuture<MovieResponse> inFlight = new CompletableFuture<>();
        given(apiClient.upcoming(1)).willReturn(inFlight);

        requestCoalescer.upcoming(1);
        assertThat(requestCoalescer.pendingCount()).isEqualTo(1);

        requestCoalescer.cancelAllRequests();

        assertThat(inFlight.isCancelled()).isTrue();
        assertThat(requestCoalescer.pendingCount()).isZero();
    }
}
