/**
 * Deduplicates concurrent identical requests and remembers their results for a short TTL
 *
 * @author William Callahan
 *
 * Features:
 * - At most one in-flight producer per key; every concurrent caller shares its outcome
 * - Successful results are cached per key with a caller-supplied or default TTL
 * - A failed produce-cycle clears the pending slot so the next call retries
 * - Each caller gets its own dependent future; cancelling it only drops that caller's interest
 * - cancel(key) and cancelAll() abort the shared work for every waiter
 * - Completed values live in a size-bounded Caffeine cache; expiry follows the injected Clock
 */
package com.williamcallahan.movie_discovery_engine.service.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import com.williamcallahan.movie_discovery_engine.util.AsyncUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Supplier;

public class RequestCoalescer<K, V> {

    private static final Logger logger = LoggerFactory.getLogger(RequestCoalescer.class);

    private final String name;
    private final Duration defaultTtl;
    private final Clock clock;
    private final Cache<K, CachedValue<V>> completed;
    // Guarded by lock, as is every read-then-write on completed
    private final Map<K, CompletableFuture<V>> pending = new HashMap<>();
    private final Object lock = new Object();

    /**
     * @param name label used in log lines
     * @param defaultTtl TTL applied when a caller does not supply one
     * @param maxEntries upper bound on remembered results
     * @param clock time source for expiry checks
     */
    public RequestCoalescer(String name, Duration defaultTtl, long maxEntries, Clock clock) {
        this.name = name;
        this.defaultTtl = defaultTtl;
        this.clock = clock;
        this.completed = Caffeine.newBuilder()
            .maximumSize(maxEntries)
            .recordStats()
            .build();
    }

    public CompletableFuture<V> coalesce(K key, Supplier<? extends CompletionStage<V>> producer) {
        return coalesce(key, defaultTtl, producer);
    }

    /**
     * Returns the cached value for {@code key}, joins the in-flight request for it,
     * or starts {@code producer} when neither exists
     *
     * @param key coalescing key
     * @param ttl how long a successful result stays fresh; a call at or after the TTL produces again
     * @param producer started at most once per key while a request is pending
     * @return a future private to this caller
     */
    public CompletableFuture<V> coalesce(K key, Duration ttl, Supplier<? extends CompletionStage<V>> producer) {
        CompletableFuture<V> shared;
        boolean owner = false;
        synchronized (lock) {
            CachedValue<V> cached = completed.getIfPresent(key);
            if (cached != null) {
                if (!cached.isExpired(clock.instant())) {
                    logger.debug("[{}] cache hit for {}", name, key);
                    return CompletableFuture.completedFuture(cached.value());
                }
                completed.invalidate(key);
            }
            shared = pending.get(key);
            if (shared == null) {
                shared = new CompletableFuture<>();
                pending.put(key, shared);
                owner = true;
            } else {
                logger.debug("[{}] joining in-flight request for {}", name, key);
            }
        }

        if (owner) {
            launch(key, ttl == null ? defaultTtl : ttl, producer, shared);
        }
        return shared.copy();
    }

    private void launch(K key, Duration ttl, Supplier<? extends CompletionStage<V>> producer, CompletableFuture<V> shared) {
        CompletableFuture<V> source;
        try {
            CompletionStage<V> stage = producer.get();
            source = stage == null
                ? CompletableFuture.failedFuture(new IllegalStateException("Producer returned no result for " + key))
                : stage.toCompletableFuture();
        } catch (RuntimeException e) {
            source = CompletableFuture.failedFuture(e);
        }

        AsyncUtils.propagateCancellation(shared, source);
        source.whenComplete((value, ex) -> settle(key, ttl, shared, value, ex));
    }

    private void settle(K key, Duration ttl, CompletableFuture<V> shared, V value, Throwable ex) {
        synchronized (lock) {
            boolean current = pending.remove(key, shared);
            if (current && ex == null) {
                completed.put(key, new CachedValue<>(value, clock.instant().plus(ttl)));
            }
        }
        if (ex == null) {
            shared.complete(value);
        } else {
            Throwable cause = AsyncUtils.unwrap(ex);
            logger.debug("[{}] request for {} failed: {}", name, key, cause.toString());
            shared.completeExceptionally(cause);
        }
    }

    /**
     * Drops the cached value for a key; an in-flight request is left alone
     */
    public void invalidate(K key) {
        synchronized (lock) {
            completed.invalidate(key);
        }
    }

    public void invalidateAll() {
        synchronized (lock) {
            completed.invalidateAll();
        }
    }

    /**
     * Cancels the in-flight request for a key for every caller waiting on it
     *
     * @return true when a pending request existed
     */
    public boolean cancel(K key) {
        CompletableFuture<V> shared;
        synchronized (lock) {
            shared = pending.remove(key);
        }
        if (shared == null) {
            return false;
        }
        shared.cancel(true);
        logger.debug("[{}] cancelled in-flight request for {}", name, key);
        return true;
    }

    public void cancelAll() {
        List<CompletableFuture<V>> cancelled;
        synchronized (lock) {
            cancelled = new ArrayList<>(pending.values());
            pending.clear();
        }
        AsyncUtils.cancelAll(cancelled);
        if (!cancelled.isEmpty()) {
            logger.debug("[{}] cancelled {} in-flight request(s)", name, cancelled.size());
        }
    }

    /**
     * Removes only entries whose TTL has elapsed
     *
     * @return number of entries removed
     */
    public int evictExpired() {
        Instant now = clock.instant();
        int removed = 0;
        synchronized (lock) {
            for (Map.Entry<K, CachedValue<V>> entry : new ArrayList<>(completed.asMap().entrySet())) {
                if (entry.getValue().isExpired(now)) {
                    completed.invalidate(entry.getKey());
                    removed++;
                }
            }
        }
        return removed;
    }

    public int pendingCount() {
        synchronized (lock) {
            return pending.size();
        }
    }

    public int cacheSize() {
        synchronized (lock) {
            return completed.asMap().size();
        }
    }

    public CacheStats stats() {
        return completed.stats();
    }

    public String getName() {
        return name;
    }

    public Duration getDefaultTtl() {
        return defaultTtl;
    }

    private record CachedValue<V>(V value, Instant expiresAt) {
        boolean isExpired(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }
}
