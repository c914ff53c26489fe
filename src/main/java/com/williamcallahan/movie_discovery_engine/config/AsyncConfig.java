/**
 * Configuration for the executors behind asynchronous catalog work
 *
 * @author William Callahan
 *
 * Features:
 * - Small scheduler for debounce delays and inter-batch pacing
 * - Bounded pool for offline cache writes, kept off the HTTP client's event loop
 * - Daemon threads, shut down with the application context
 * - Descriptive thread naming for easier debugging
 */

package com.williamcallahan.movie_discovery_engine.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class AsyncConfig {

    public static final String CATALOG_SCHEDULER = "catalogScheduler";
    public static final String OFFLINE_CACHE_EXECUTOR = "offlineCacheExecutor";

    /**
     * Scheduler for cancellable sleeps (search debounce, batch pacing)
     * Runs on daemon threads so it never blocks JVM shutdown
     */
    @Bean(name = CATALOG_SCHEDULER, destroyMethod = "shutdownNow")
    public ScheduledExecutorService catalogScheduler() {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "catalog-scheduler-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newScheduledThreadPool(2, threadFactory);
    }

    /**
     * Executor for offline cache writes, which serialize JSON and replace files on disk
     *
     * Features:
     * - Two threads; writes are short and serialized by the cache itself
     * - Queue capacity of 100 tasks, then falls back to the caller thread (CallerRunsPolicy)
     * - Waits for queued writes on shutdown so the last snapshot reaches disk
     */
    @Bean(OFFLINE_CACHE_EXECUTOR)
    public ThreadPoolTaskExecutor offlineCacheExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(2);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("offline-cache-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();
        return executor;
    }
}
