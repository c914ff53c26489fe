/**
 * Client for the movie catalog (TMDB) HTTP API
 *
 * @author William Callahan
 *
 * Features:
 * - Performs one logical GET per call and decodes the typed response
 * - Classifies failures (rate limit, server, transport, decode, credentials)
 * - Retries transient failures with exponential backoff and jitter
 * - Cancelling the subscriber (or the returned future) stops any pending retry
 * - Records every attempt with the API request monitor
 * - Never touches cache state; remembering results is the coalescer's job
 */
package com.williamcallahan.movie_discovery_engine.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.movie_discovery_engine.config.TmdbConfigurationProperties;
import com.williamcallahan.movie_discovery_engine.exception.CatalogApiException;
import com.williamcallahan.movie_discovery_engine.exception.CatalogErrorKind;
import com.williamcallahan.movie_discovery_engine.model.Credits;
import com.williamcallahan.movie_discovery_engine.model.Genre;
import com.williamcallahan.movie_discovery_engine.model.Movie;
import com.williamcallahan.movie_discovery_engine.model.MovieResponse;
import com.williamcallahan.movie_discovery_engine.model.Person;
import com.williamcallahan.movie_discovery_engine.model.VideoResponse;
import com.williamcallahan.movie_discovery_engine.service.credentials.ApiKeyProvider;
import com.williamcallahan.movie_discovery_engine.util.ExternalApiLogger;
import com.williamcallahan.movie_discovery_engine.util.LoggingUtils;
import com.williamcallahan.movie_discovery_engine.util.RetryBackoffPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

@Service
@Slf4j
public class TmdbApiClient {

    private static final String API_NAME = "TMDB";

    private final WebClient webClient;
    private final ApiKeyProvider apiKeyProvider;
    private final ApiRequestMonitor apiRequestMonitor;
    private final RetryBackoffPolicy backoffPolicy;
    private final ObjectMapper objectMapper;
    private final TmdbConfigurationProperties properties;
    private final Clock clock;

    /**
     * Constructs TmdbApiClient with required dependencies
     *
     * @param webClientBuilder WebClient builder
     * @param apiKeyProvider source of the catalog API key
     * @param apiRequestMonitor API request tracking service
     * @param backoffPolicy delay schedule for retries
     * @param objectMapper decoder for response bodies
     * @param properties catalog base URL and timeouts
     * @param clock time source for date-relative endpoints
     */
    public TmdbApiClient(WebClient.Builder webClientBuilder,
                         ApiKeyProvider apiKeyProvider,
                         ApiRequestMonitor apiRequestMonitor,
                         RetryBackoffPolicy backoffPolicy,
                         ObjectMapper objectMapper,
                         TmdbConfigurationProperties properties,
                         Clock clock) {
        this.webClient = webClientBuilder.build();
        this.apiKeyProvider = apiKeyProvider;
        this.apiRequestMonitor = apiRequestMonitor;
        this.backoffPolicy = backoffPolicy;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Executes the endpoint, retrying transient failures
     * Errors are always {@link CatalogApiException}
     *
     * @param endpoint typed endpoint descriptor
     * @return Mono emitting the decoded response
     */
    public <T> Mono<T> execute(CatalogEndpoint<T> endpoint) {
        return Mono.defer(() -> {
            String apiKey = apiKeyProvider.getApiKey().orElse(null);
            if (apiKey == null) {
                log.warn("No catalog API key configured - refusing request for {}", endpoint.getDescription());
                return Mono.error(CatalogApiException.unauthorized("Catalog API key is not configured"));
            }
            URI uri = buildUri(endpoint, apiKey);
            return attempt(endpoint, uri).retryWhen(retrySpec(endpoint));
        })
        .doOnError(ex -> {
            CatalogApiException failure = CatalogApiException.from(ex);
            ExternalApiLogger.logApiCallFailure(log, API_NAME, endpoint.getPath(), failure.getKind().name(), failure.getMessage());
        })
        .doOnCancel(() -> log.debug("Catalog request cancelled: {}", endpoint.getDescription()));
    }

    /**
     * Same as {@link #execute(CatalogEndpoint)} but as a future
     * Cancelling the future cancels the in-flight request and any pending backoff
     */
    public <T> CompletableFuture<T> fetch(CatalogEndpoint<T> endpoint) {
        CompletableFuture<T> future = new CompletableFuture<>();
        Disposable subscription = execute(endpoint).subscribe(
            future::complete,
            future::completeExceptionally,
            () -> {
                if (!future.isDone()) {
                    future.completeExceptionally(new CatalogApiException(CatalogErrorKind.DECODE,
                        "Empty response from " + endpoint.getPath()));
                }
            });
        future.whenComplete((value, ex) -> {
            if (future.isCancelled()) {
                subscription.dispose();
            }
        });
        return future;
    }

    public CompletableFuture<MovieResponse> trending(int page) {
        return fetch(CatalogEndpoint.trending(page));
    }

    public CompletableFuture<MovieResponse> popular(int page) {
        return fetch(CatalogEndpoint.popular(page));
    }

    public CompletableFuture<MovieResponse> topRated(int page) {
        return fetch(CatalogEndpoint.topRated(page));
    }

    public CompletableFuture<MovieResponse> nowPlaying(int page) {
        return fetch(CatalogEndpoint.nowPlaying(page));
    }

    public CompletableFuture<MovieResponse> upcoming(int page) {
        return fetch(CatalogEndpoint.upcoming(page));
    }

    public CompletableFuture<MovieResponse> discoverRecent(int page) {
        return fetch(CatalogEndpoint.discoverRecent(page, LocalDate.now(clock)));
    }

    /**
     * Searches movies by title; a blank query yields an empty first page without a request
     */
    public CompletableFuture<MovieResponse> search(String query, int page) {
        if (query == null || query.isBlank()) {
            return CompletableFuture.completedFuture(MovieResponse.empty());
        }
        return fetch(CatalogEndpoint.search(query.trim(), page));
    }

    public CompletableFuture<Movie> movieDetails(int movieId) {
        return fetch(CatalogEndpoint.movieDetails(movieId));
    }

    public CompletableFuture<VideoResponse> videos(int movieId) {
        return fetch(CatalogEndpoint.videos(movieId));
    }

    public CompletableFuture<Credits> credits(int movieId) {
        return fetch(CatalogEndpoint.credits(movieId));
    }

    public CompletableFuture<Person> person(int personId) {
        return fetch(CatalogEndpoint.person(personId));
    }

    public CompletableFuture<Genre.GenreList> genres() {
        return fetch(CatalogEndpoint.genres());
    }

    public CompletableFuture<MovieResponse> similar(int movieId, int page) {
        return fetch(CatalogEndpoint.similar(movieId, page));
    }

    public CompletableFuture<MovieResponse> recommendations(int movieId, int page) {
        return fetch(CatalogEndpoint.recommendations(movieId, page));
    }

    private <T> Mono<T> attempt(CatalogEndpoint<T> endpoint, URI uri) {
        Duration timeout = endpoint.isSearch()
            ? properties.getApi().getSearchTimeout()
            : properties.getApi().getTimeout();

        return Mono.defer(() -> {
            ExternalApiLogger.logHttpRequest(log, "GET", endpoint.getPath(), endpoint.getDescription());
            return webClient.get()
                .uri(uri)
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .toEntity(String.class)
                .timeout(timeout);
        })
        .map(entity -> decode(endpoint, entity))
        .doOnSuccess(value -> apiRequestMonitor.recordSuccessfulRequest(endpoint.getPath()))
        .onErrorMap(CatalogApiException::from)
        .doOnError(ex -> apiRequestMonitor.recordFailedRequest(endpoint.getPath(), ex.getMessage()));
    }

    private <T> T decode(CatalogEndpoint<T> endpoint, ResponseEntity<String> entity) {
        String body = entity.getBody();
        int status = entity.getStatusCode().value();
        ExternalApiLogger.logHttpResponse(log, status, endpoint.getPath(), body == null ? 0 : body.length());
        if (body == null || body.isBlank()) {
            throw new CatalogApiException(CatalogErrorKind.DECODE, "Empty body from " + endpoint.getPath(), status, null);
        }
        try {
            T value = objectMapper.readValue(body, endpoint.getResponseType());
            if (value == null) {
                throw new CatalogApiException(CatalogErrorKind.DECODE, "Null body from " + endpoint.getPath(), status, null);
            }
            return value;
        } catch (JsonProcessingException e) {
            throw new CatalogApiException(CatalogErrorKind.DECODE,
                "Response from " + endpoint.getPath() + " did not match " + endpoint.getResponseType().getSimpleName(),
                status, e);
        }
    }

    private Retry retrySpec(CatalogEndpoint<?> endpoint) {
        return Retry.from(signals -> signals.concatMap(signal -> {
            CatalogApiException failure = CatalogApiException.from(signal.failure());
            long retry = signal.totalRetries();
            if (!failure.isRetryable()) {
                return Mono.<Long>error(failure);
            }
            if (retry >= backoffPolicy.getMaxRetries()) {
                LoggingUtils.error(log, failure, "All {} retries failed for {}", backoffPolicy.getMaxRetries(), endpoint.getPath());
                return Mono.<Long>error(failure);
            }
            Duration delay = backoffPolicy.delayFor(retry);
            ExternalApiLogger.logRetryScheduled(log, endpoint.getPath(), retry + 1, delay.toMillis(), failure.getKind().name());
            return Mono.delay(delay).thenReturn(retry);
        }));
    }

    private URI buildUri(CatalogEndpoint<?> endpoint, String apiKey) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(properties.getApi().getBaseUrl())
            .path(endpoint.getPath());
        // Values are expanded as URI variables so reserved characters such as '+' are percent-encoded
        Map<String, String> values = new LinkedHashMap<>(endpoint.getQueryParams());
        values.put("api_key", apiKey);
        values.keySet().forEach(name -> builder.queryParam(name, "{" + name + "}"));
        return builder.encode().buildAndExpand(values).toUri();
    }
}
