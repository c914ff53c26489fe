/**
 * Utility class for common CompletableFuture patterns
 * Provides cancellable delays and cancellation propagation between futures
 *
 * @author William Callahan
 */

package com.williamcallahan.movie_discovery_engine.util;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

public final class AsyncUtils {

    private AsyncUtils() {
    }

    /**
     * Completes after the given delay
     * Cancelling the returned future removes the pending timer, so nothing chained on it runs
     *
     * @param delay how long to wait
     * @param scheduler scheduler that owns the timer
     * @return future completing with null once the delay has elapsed
     */
    public static CompletableFuture<Void> delay(Duration delay, ScheduledExecutorService scheduler) {
        CompletableFuture<Void> sleep = new CompletableFuture<>();
        if (delay.isZero() || delay.isNegative()) {
            sleep.complete(null);
            return sleep;
        }
        ScheduledFuture<?> timer = scheduler.schedule(() -> sleep.complete(null), delay.toMillis(), TimeUnit.MILLISECONDS);
        sleep.whenComplete((ignored, ex) -> {
            if (sleep.isCancelled()) {
                timer.cancel(false);
            }
        });
        return sleep;
    }

    /**
     * Cancels {@code upstream} when {@code downstream} is cancelled
     *
     * @return {@code downstream}, for chaining
     */
    public static <T> CompletableFuture<T> propagateCancellation(CompletableFuture<T> downstream, Future<?> upstream) {
        downstream.whenComplete((ignored, ex) -> {
            if (downstream.isCancelled()) {
                upstream.cancel(true);
            }
        });
        return downstream;
    }

    /**
     * Cancels every future in the list that has not completed yet
     */
    public static void cancelAll(List<? extends Future<?>> futures) {
        for (Future<?> future : futures) {
            if (!future.isDone()) {
                future.cancel(true);
            }
        }
    }

    /**
     * Strips CompletionException and ExecutionException wrappers
     */
    public static Throwable unwrap(Throwable throwable) {
        Throwable current = throwable;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
