/**
 * Tests for RequestCoalescer
 * - Verifies a single producer invocation per key under concurrency
 * - Checks TTL boundaries against an injected clock
 * - Ensures failures and cancellations leave no stale pending entries
 *
 * @author William Callahan
 */
package com.williamcallahan.movie_discovery_engine.service.cache;

import com.williamcallahan.movie_discovery_engine.testutil.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RequestCoalescerTest {

    private MutableClock clock;
    private RequestCoalescer<String, String> coalescer;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2025-01-01T00:00:00Z");
        coalescer = new RequestCoalescer<>("test", Duration.ofSeconds(120), 100, clock);
        executor = Executors.newFixedThreadPool(8);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void concurrentCallers_shareSingleProducerInvocation() throws Exception {
        AtomicInteger invocations = new AtomicInteger();
        CompletableFuture<String> gate = new CompletableFuture<>();
        CountDownLatch start = new CountDownLatch(1);

        List<Future<CompletableFuture<String>>> callers = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            callers.add(executor.submit(() -> {
                start.await();
                return coalescer.coalesce("popular_1", () -> {
                    invocations.incrementAndGet();
                    return gate;
                });
            }));
        }
        start.countDown();

        List<CompletableFuture<String>> results = new ArrayList<>();
        for (Future<CompletableFuture<String>> caller : callers) {
            results.add(caller.get(5, TimeUnit.SECONDS));
        }
        String shared = new String("shared-result");
        gate.complete(shared);

        for (CompletableFuture<String> result : results) {
            assertThat(result.get(5, TimeUnit.SECONDS)).isSameAs(shared);
        }
        assertThat(invocations).hasValue(1);
        assertThat(coalescer.pendingCount()).isZero();
    }

    @Test
    void cachedValue_isServedUntilTtlElapses() {
        AtomicInteger invocations = new AtomicInteger();

        coalescer.coalesce("k", Duration.ofSeconds(10),
                () -> CompletableFuture.completedFuture("v" + invocations.incrementAndGet())).join();

        clock.advance(Duration.ofMillis(9_999));
        assertThat(coalescer.coalesce("k", Duration.ofSeconds(10),
                () -> CompletableFuture.completedFuture("v" + invocations.incrementAndGet())).join()).isEqualTo("v1");

        clock.advance(Duration.ofMillis(1));
        assertThat(coalescer.coalesce("k", Duration.ofSeconds(10),
                () -> CompletableFuture.completedFuture("v" + invocations.incrementAndGet())).join()).isEqualTo("v2");
        assertThat(invocations).hasValue(2);
    }

    @Test
    void defaultTtl_appliesWhenNoneGiven() {
        coalescer.coalesce("k", () -> CompletableFuture.completedFuture("first")).join();

        clock.advance(Duration.ofSeconds(119));
        assertThat(coalescer.coalesce("k", () -> CompletableFuture.completedFuture("second")).join()).isEqualTo("first");

        clock.advance(Duration.ofSeconds(1));
        assertThat(coalescer.coalesce("k", () -> CompletableFuture.completedFuture("second")).join()).isEqualTo("second");
    }

    @Test
    void failure_reachesEveryWaiterAndDoesNotPoisonKey() {
        CompletableFuture<String> gate = new CompletableFuture<>();
        CompletableFuture<String> first = coalescer.coalesce("k", () -> gate);
        CompletableFuture<String> second = coalescer.coalesce("k", () -> CompletableFuture.completedFuture("unused"));

        gate.completeExceptionally(new IllegalStateException("boom"));

        assertThatThrownBy(first::join).isInstanceOf(CompletionException.class).hasCauseInstanceOf(IllegalStateException.class);
        assertThatThrownBy(second::join).isInstanceOf(CompletionException.class).hasCauseInstanceOf(IllegalStateException.class);
        assertThat(coalescer.pendingCount()).isZero();
        assertThat(coalescer.cacheSize()).isZero();

        assertThat(coalescer.coalesce("k", () -> CompletableFuture.completedFuture("recovered")).join()).isEqualTo("recovered");
    }

    @Test
    void producerThrowing_failsCallerAndClearsPending() {
        CompletableFuture<String> result = coalescer.coalesce("k", () -> {
            throw new IllegalArgumentException("bad key");
        });

        assertThatThrownBy(result::join).hasCauseInstanceOf(IllegalArgumentException.class);
        assertThat(coalescer.pendingCount()).isZero();
    }

    @Test
    void cancellingOneWaiter_leavesOthersWaiting() {
        CompletableFuture<String> gate = new CompletableFuture<>();
        CompletableFuture<String> first = coalescer.coalesce("k", () -> gate);
        CompletableFuture<String> second = coalescer.coalesce("k", () -> gate);

        first.cancel(true);
        gate.complete("value");

        assertThat(first.isCancelled()).isTrue();
        assertThat(second.join()).isEqualTo("value");
        assertThat(gate.isCancelled()).isFalse();
    }

    @Test
    void cancelKey_abortsSharedWorkForAllWaiters() {
        CompletableFuture<String> gate = new CompletableFuture<>();
        CompletableFuture<String> first = coalescer.coalesce("k", () -> gate);
        CompletableFuture<String> second = coalescer.coalesce("k", () -> gate);

        assertThat(coalescer.cancel("k")).isTrue();

        assertThat(gate.isCancelled()).isTrue();
        assertThatThrownBy(first::join).hasCauseInstanceOf(CancellationException.class);
        assertThatThrownBy(second::join).hasCauseInstanceOf(CancellationException.class);
        assertThat(coalescer.pendingCount()).isZero();
        assertThat(coalescer.cancel("k")).isFalse();
    }

    @Test
    void cancelAll_abortsEveryPendingRequest() {
        CompletableFuture<String> a = new CompletableFuture<>();
        CompletableFuture<String> b = new CompletableFuture<>();
        coalescer.coalesce("a", () -> a);
        coalescer.coalesce("b", () -> b);

        coalescer.cancelAll();

        assertThat(a.isCancelled()).isTrue();
        assertThat(b.isCancelled()).isTrue();
        assertThat(coalescer.pendingCount()).isZero();
    }

    @Test
    void evictExpired_removesOnlyExpiredEntries() {
        coalescer.coalesce("short", Duration.ofSeconds(5), () -> CompletableFuture.completedFuture("s")).join();
        coalescer.coalesce("long", Duration.ofMinutes(5), () -> CompletableFuture.completedFuture("l")).join();

        clock.advance(Duration.ofSeconds(6));

        assertThat(coalescer.evictExpired()).isEqualTo(1);
        assertThat(coalescer.cacheSize()).isEqualTo(1);
    }

    @Test
    void invalidate_forcesNextCallToProduce() {
        AtomicInteger invocations = new AtomicInteger();
        coalescer.coalesce("k", () -> CompletableFuture.completedFuture("v" + invocations.incrementAndGet())).join();

        coalescer.invalidate("k");

        assertThat(coalescer.coalesce("k", () -> CompletableFuture.completedFuture("v" + invocations.incrementAndGet())).join())
                .isEqualTo("v2");
    }
}
