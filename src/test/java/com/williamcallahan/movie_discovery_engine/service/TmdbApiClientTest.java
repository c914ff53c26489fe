/**
 * Tests for TmdbApiClient
 * - Verifies request construction and response decoding
 * - Exercises retry classification and the retry budget
 * - Ensures cancellation during backoff stops further attempts
 *
 * @author William Callahan
 */
package com.williamcallahan.movie_discovery_engine.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.movie_discovery_engine.config.TmdbConfigurationProperties;
import com.williamcallahan.movie_discovery_engine.exception.CatalogApiException;
import com.williamcallahan.movie_discovery_engine.exception.CatalogErrorKind;
import com.williamcallahan.movie_discovery_engine.model.Movie;
import com.williamcallahan.movie_discovery_engine.model.MovieResponse;
import com.williamcallahan.movie_discovery_engine.service.credentials.ApiKeyProvider;
import com.williamcallahan.movie_discovery_engine.testutil.InMemoryCredentialStore;
import com.williamcallahan.movie_discovery_engine.testutil.MovieTestData;
import com.williamcallahan.movie_discovery_engine.testutil.MutableClock;
import com.williamcallahan.movie_discovery_engine.testutil.StubExchangeFunction;
import com.williamcallahan.movie_discovery_engine.util.RetryBackoffPolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowable;

class TmdbApiClientTest {

    private static final String API_KEY = "0123456789abcdef0123456789abcdef";

    private final ObjectMapper objectMapper = MovieTestData.objectMapper();
    private final MutableClock clock = MutableClock.startingAt("2025-06-15T12:00:00Z");
    private StubExchangeFunction exchange;
    private ApiRequestMonitor monitor;
    private TmdbConfigurationProperties properties;

    @BeforeEach
    void setUp() {
        exchange = new StubExchangeFunction();
        monitor = new ApiRequestMonitor();
        properties = new TmdbConfigurationProperties();
        properties.getApi().setKey(API_KEY);
    }

    private TmdbApiClient client(int maxRetries, Duration baseDelay) {
        ApiKeyProvider keyProvider = new ApiKeyProvider(new InMemoryCredentialStore(), properties);
        RetryBackoffPolicy policy = new RetryBackoffPolicy(maxRetries, baseDelay, baseDelay.multipliedBy(8), 0.0);
        return new TmdbApiClient(WebClient.builder().exchangeFunction(exchange), keyProvider, monitor,
                policy, objectMapper, properties, clock);
    }

    private TmdbApiClient client() {
        return client(3, Duration.ofMillis(1));
    }

    private static CatalogApiException failureOf(CompletableFuture<?> future) {
        Throwable thrown = catchThrowable(future::join);
        assertThat(thrown).isInstanceOf(CompletionException.class);
        assertThat(thrown.getCause()).isInstanceOf(CatalogApiException.class);
        return (CatalogApiException) thrown.getCause();
    }

    @Test
    void popular_decodesPageAndSendsApiKey() {
        exchange.respond(HttpStatus.OK, MovieTestData.pageJson(objectMapper, 1, 11, 12));

        MovieResponse response = client().popular(1).join();

        assertThat(response.page()).isEqualTo(1);
        assertThat(response.results()).extracting(Movie::id).containsExactly(11, 12);
        assertThat(response.results().get(0).genreIds()).containsExactly(28, 12);
        assertThat(response.totalPages()).isEqualTo(5);

        URI uri = exchange.requests().get(0);
        assertThat(uri.getPath()).isEqualTo("/3/movie/popular");
        assertThat(uri.getQuery()).contains("page=1").contains("api_key=" + API_KEY);
        assertThat(monitor.getTotalRequests()).isEqualTo(1);
    }

    @Test
    void execute_emitsDecodedValue() {
        exchange.respond(HttpStatus.OK, MovieTestData.movieJson(objectMapper, 603, "The Matrix").toString());

        StepVerifier.create(client().execute(CatalogEndpoint.movieDetails(603)))
                .assertNext(movie -> {
                    assertThat(movie.id()).isEqualTo(603);
                    assertThat(movie.title()).isEqualTo("The Matrix");
                    assertThat(movie.originalTitle()).isEqualTo("The Matrix");
                })
                .verifyComplete();
    }

    @Test
    void serverErrors_areRetriedUntilSuccess() {
        exchange.respond(HttpStatus.SERVICE_UNAVAILABLE, "{}")
                .respond(HttpStatus.BAD_GATEWAY, "{}")
                .respond(HttpStatus.OK, MovieTestData.pageJson(objectMapper, 1, 1));

        MovieResponse response = client().popular(1).join();

        assertThat(response.results()).hasSize(1);
        assertThat(exchange.requestCount()).isEqualTo(3);
        assertThat(monitor.getTotalFailed()).isEqualTo(2);
    }

    @Test
    void rateLimited_isRetried() {
        exchange.respond(HttpStatus.TOO_MANY_REQUESTS, "{}")
                .respond(HttpStatus.OK, MovieTestData.pageJson(objectMapper, 1, 1));

        client().trending(1).join();

        assertThat(exchange.requestCount()).isEqualTo(2);
    }

    @Test
    void retryBudget_isNeverExceeded() {
        exchange.respond(HttpStatus.INTERNAL_SERVER_ERROR, "{}");

        CatalogApiException failure = failureOf(client(3, Duration.ofMillis(1)).popular(1));

        assertThat(failure.getKind()).isEqualTo(CatalogErrorKind.SERVER_ERROR);
        assertThat(failure.getStatusCode()).hasValue(500);
        assertThat(exchange.requestCount()).isEqualTo(4);
    }

    @Test
    void transportErrors_areRetried() {
        exchange.fail(new IOException("Connection reset"))
                .respond(HttpStatus.OK, MovieTestData.pageJson(objectMapper, 1, 7));

        MovieResponse response = client().upcoming(1).join();

        assertThat(response.results()).extracting(Movie::id).containsExactly(7);
        assertThat(exchange.requestCount()).isEqualTo(2);
    }

    @Test
    void notFound_isNotRetried() {
        exchange.respond(HttpStatus.NOT_FOUND, "{\"status_message\":\"missing\"}");

        CatalogApiException failure = failureOf(client().movieDetails(42));

        assertThat(failure.getKind()).isEqualTo(CatalogErrorKind.INVALID_REQUEST);
        assertThat(failure.isRetryable()).isFalse();
        assertThat(exchange.requestCount()).isEqualTo(1);
    }

    @Test
    void unauthorized_surfacesImmediatelyAndRequiresUserAction() {
        exchange.respond(HttpStatus.UNAUTHORIZED, "{\"status_message\":\"Invalid API key\"}");

        CatalogApiException failure = failureOf(client().popular(1));

        assertThat(failure.getKind()).isEqualTo(CatalogErrorKind.UNAUTHORIZED);
        assertThat(failure.requiresUserAction()).isTrue();
        assertThat(exchange.requestCount()).isEqualTo(1);
    }

    @Test
    void decodeFailures_areNeverRetried() {
        exchange.respond(HttpStatus.OK, "{\"page\": \"not-a-number\", \"results\": 5");

        CatalogApiException failure = failureOf(client().popular(1));

        assertThat(failure.getKind()).isEqualTo(CatalogErrorKind.DECODE);
        assertThat(exchange.requestCount()).isEqualTo(1);
    }

    @Test
    void missingApiKey_failsWithoutRequest() {
        properties.getApi().setKey(null);

        CatalogApiException failure = failureOf(client().popular(1));

        assertThat(failure.getKind()).isEqualTo(CatalogErrorKind.UNAUTHORIZED);
        assertThat(exchange.requestCount()).isZero();
    }

    @Test
    void blankSearch_returnsEmptyPageWithoutRequest() {
        MovieResponse response = client().search("   ", 1).join();

        assertThat(response.results()).isEmpty();
        assertThat(exchange.requestCount()).isZero();
    }

    @Test
    void search_sendsTrimmedQueryAndExcludesAdult() {
        exchange.respond(HttpStatus.OK, MovieTestData.pageJson(objectMapper, 1, 5));

        client().search("  dune  ", 1).join();

        String query = exchange.requests().get(0).getQuery();
        assertThat(query).contains("query=dune").contains("include_adult=false");
    }

    @Test
    void search_percentEncodesReservedCharacters() {
        exchange.respond(HttpStatus.OK, MovieTestData.pageJson(objectMapper, 1, 5));

        client().search("C++", 1).join();
        client().search("Fast & Furious", 1).join();

        URI plus = exchange.requests().get(0);
        URI ampersand = exchange.requests().get(1);
        assertThat(plus.getRawQuery()).contains("query=C%2B%2B");
        assertThat(plus.getQuery()).contains("query=C++");
        assertThat(ampersand.getRawQuery()).contains("query=Fast%20%26%20Furious");
        assertThat(ampersand.getRawQuery()).contains("page=1");
    }

    @Test
    void cancellationDuringBackoff_preventsFurtherAttempts() throws InterruptedException {
        exchange.respond(HttpStatus.SERVICE_UNAVAILABLE, "{}")
                .respond(HttpStatus.OK, MovieTestData.pageJson(objectMapper, 1, 1));
        CompletableFuture<MovieResponse> future = client(3, Duration.ofMillis(500)).popular(1);

        long deadline = System.currentTimeMillis() + 2_000;
        while (exchange.requestCount() < 1 && System.currentTimeMillis() < deadline) {
            Thread.sleep(5);
        }
        future.cancel(true);
        Thread.sleep(1_000);

        assertThat(exchange.requestCount()).isEqualTo(1);
        assertThat(future.isCancelled()).isTrue();
        assertThatThrownBy(future::join).isInstanceOf(CancellationException.class);
    }
}
