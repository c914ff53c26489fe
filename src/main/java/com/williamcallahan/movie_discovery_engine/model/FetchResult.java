package com.williamcallahan.movie_discovery_engine.model;

/**
 * Result of a cache-first fetch
 *
 * @param data the value returned to the caller
 * @param fromCache true when {@code data} came from the offline cache rather than the network
 */
public record FetchResult<T>(T data, boolean fromCache) {

    public static <T> FetchResult<T> cached(T data) {
        return new FetchResult<>(data, true);
    }

    public static <T> FetchResult<T> network(T data) {
        return new FetchResult<>(data, false);
    }
}
