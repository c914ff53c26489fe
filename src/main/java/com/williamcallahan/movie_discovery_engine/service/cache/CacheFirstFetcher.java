package com.williamcallahan.movie_discovery_engine.service.cache;

import com.williamcallahan.movie_discovery_engine.model.FetchResult;
import com.williamcallahan.movie_discovery_engine.util.AsyncUtils;
import com.williamcallahan.movie_discovery_engine.util.LoggingUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Serves a value from the offline cache when it has one and refreshes it from the network in the background.
 * Without cached data, or when forced, the network is authoritative and the cache is only a fallback.
 *
 * @param <T> fetched value type
 */
public class CacheFirstFetcher<T> {

    private static final Logger logger = LoggerFactory.getLogger(CacheFirstFetcher.class);

    private final String name;
    private final Supplier<Optional<T>> cacheReader;
    private final Supplier<CompletableFuture<T>> networkFetcher;
    private final Consumer<T> cacheWriter;

    /**
     * @param name label used in log lines
     * @param cacheReader returns usable cached data, or empty
     * @param networkFetcher starts a network fetch
     * @param cacheWriter saves a successful network result
     */
    public CacheFirstFetcher(String name,
                             Supplier<Optional<T>> cacheReader,
                             Supplier<CompletableFuture<T>> networkFetcher,
                             Consumer<T> cacheWriter) {
        this.name = name;
        this.cacheReader = cacheReader;
        this.networkFetcher = networkFetcher;
        this.cacheWriter = cacheWriter;
    }

    public CompletableFuture<FetchResult<T>> fetch() {
        return fetch(false);
    }

    /**
     * @param forceRefresh skip the cache and go straight to the network
     * @return cached data (with a background refresh started) or fresh network data
     */
    public CompletableFuture<FetchResult<T>> fetch(boolean forceRefresh) {
        if (!forceRefresh) {
            Optional<T> cached = cacheReader.get();
            if (cached.isPresent()) {
                logger.debug("[{}] serving cached data, refreshing in background", name);
                refreshInBackground();
                return CompletableFuture.completedFuture(FetchResult.cached(cached.get()));
            }
        }

        return startNetworkFetch()
            .thenApply(data -> {
                cacheWriter.accept(data);
                return FetchResult.network(data);
            })
            .exceptionally(ex -> {
                Optional<T> fallback = cacheReader.get();
                if (fallback.isPresent()) {
                    logger.info("[{}] network fetch failed, falling back to cached data: {}",
                        name, AsyncUtils.unwrap(ex).getMessage());
                    return FetchResult.cached(fallback.get());
                }
                throw ex instanceof CompletionException ce ? ce : new CompletionException(ex);
            });
    }

    /**
     * Network refresh whose failure is only logged; the caller already holds cached data
     */
    CompletableFuture<Void> refreshInBackground() {
        return startNetworkFetch()
            .thenAccept(cacheWriter)
            .exceptionally(ex -> {
                LoggingUtils.warn(logger, AsyncUtils.unwrap(ex), "[{}] background refresh failed", name);
                return null;
            });
    }

    private CompletableFuture<T> startNetworkFetch() {
        try {
            CompletableFuture<T> future = networkFetcher.get();
            return future == null
                ? CompletableFuture.failedFuture(new IllegalStateException("No network fetch for " + name))
                : future;
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }
}
