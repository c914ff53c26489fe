/**
 * Runs many keyed fetches in small concurrent chunks with a pause between chunks
 *
 * @author William Callahan
 *
 * Features:
 * - Chunk size bounds the number of simultaneous requests
 * - Next chunk starts only after the whole previous chunk has finished, then a pacing delay
 * - Fail-fast: the first failure fails the batch, cancels its siblings and stops further chunks
 * - Results come back in input order
 * - Cancelling the returned future cancels in-flight fetches and any pending pacing delay
 */
package com.williamcallahan.movie_discovery_engine.service;

import com.williamcallahan.movie_discovery_engine.config.AsyncConfig;
import com.williamcallahan.movie_discovery_engine.util.AsyncUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.Function;

@Slf4j
@Service
public class BatchRequestManager {

    private final ScheduledExecutorService scheduler;
    private final int defaultMaxConcurrent;
    private final Duration delayBetweenBatches;

    public BatchRequestManager(@Qualifier(AsyncConfig.CATALOG_SCHEDULER) ScheduledExecutorService scheduler,
                               @Value("${app.batch.max-concurrent:3}") int defaultMaxConcurrent,
                               @Value("${app.batch.delay-between-batches-ms:100}") long delayBetweenBatchesMs) {
        if (defaultMaxConcurrent < 1) {
            throw new IllegalArgumentException("app.batch.max-concurrent must be at least 1");
        }
        this.scheduler = scheduler;
        this.defaultMaxConcurrent = defaultMaxConcurrent;
        this.delayBetweenBatches = Duration.ofMillis(delayBetweenBatchesMs);
    }

    public <I, T> CompletableFuture<List<T>> fetchBatch(List<I> items,
                                                        Function<? super I, ? extends CompletionStage<T>> fetch) {
        return fetchBatch(items, fetch, defaultMaxConcurrent);
    }

    /**
     * @param items keys to fetch, in the order results should be returned
     * @param fetch starts the fetch for one key
     * @param maxConcurrent chunk size
     * @return future of all results in input order, or the first failure
     */
    public <I, T> CompletableFuture<List<T>> fetchBatch(List<I> items,
                                                        Function<? super I, ? extends CompletionStage<T>> fetch,
                                                        int maxConcurrent) {
        if (maxConcurrent < 1) {
            throw new IllegalArgumentException("maxConcurrent must be at least 1, got " + maxConcurrent);
        }
        BatchRun<I, T> run = new BatchRun<>(new ArrayList<>(items), fetch, maxConcurrent);
        run.start();
        return run.batch;
    }

    private final class BatchRun<I, T> {
        private final List<I> items;
        private final Function<? super I, ? extends CompletionStage<T>> fetch;
        private final int chunkSize;
        private final CompletableFuture<List<T>> batch = new CompletableFuture<>();
        private final List<T> results;
        private final Set<Future<?>> inFlight = ConcurrentHashMap.newKeySet();

        private BatchRun(List<I> items, Function<? super I, ? extends CompletionStage<T>> fetch, int chunkSize) {
            this.items = items;
            this.fetch = fetch;
            this.chunkSize = chunkSize;
            this.results = new ArrayList<>(items.size());
        }

        private void start() {
            batch.whenComplete((ignored, ex) -> {
                if (batch.isCancelled()) {
                    log.debug("Batch of {} item(s) cancelled", items.size());
                    AsyncUtils.cancelAll(new ArrayList<>(inFlight));
                }
            });
            runChunk(0);
        }

        private void runChunk(int from) {
            if (batch.isDone()) {
                return;
            }
            if (from >= items.size()) {
                batch.complete(Collections.unmodifiableList(results));
                return;
            }

            int to = Math.min(from + chunkSize, items.size());
            List<CompletableFuture<T>> chunk = new ArrayList<>(to - from);
            for (int i = from; i < to; i++) {
                if (batch.isDone()) {
                    break;
                }
                CompletableFuture<T> future = startFetch(items.get(i));
                inFlight.add(future);
                future.whenComplete((value, ex) -> {
                    if (ex != null && batch.completeExceptionally(AsyncUtils.unwrap(ex))) {
                        log.debug("Batch failed fast: {}", AsyncUtils.unwrap(ex).toString());
                        AsyncUtils.cancelAll(new ArrayList<>(inFlight));
                    }
                });
                if (batch.isDone()) {
                    future.cancel(true);
                }
                chunk.add(future);
            }

            CompletableFuture.allOf(chunk.toArray(new CompletableFuture<?>[0])).whenComplete((ignored, ex) -> {
                inFlight.removeAll(chunk);
                if (ex != null || batch.isDone()) {
                    return;
                }
                chunk.forEach(future -> results.add(future.join()));
                if (to >= items.size()) {
                    batch.complete(Collections.unmodifiableList(results));
                    return;
                }
                CompletableFuture<Void> pause = AsyncUtils.delay(delayBetweenBatches, scheduler);
                inFlight.add(pause);
                pause.whenComplete((done, pauseError) -> {
                    inFlight.remove(pause);
                    if (pauseError == null) {
                        runChunk(to);
                    }
                });
            });
        }

        private CompletableFuture<T> startFetch(I item) {
            try {
                CompletionStage<T> stage = fetch.apply(item);
                return stage == null
                    ? CompletableFuture.failedFuture(new IllegalStateException("Fetch returned no result for " + item))
                    : stage.toCompletableFuture();
            } catch (RuntimeException e) {
                return CompletableFuture.failedFuture(e);
            }
        }
    }
}
