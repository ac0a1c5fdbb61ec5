package com.advotac.assistant.config;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Thread pools for the blocking external calls of the pipeline.
 *
 * <p>{@code searchExecutor} runs the per-collection vector searches of one query in parallel and
 * may grow to twice its core size under bursts. {@code modelExecutor} runs embedding and
 * generative-model calls so each can be bounded by its own timeout; it is fixed-size because
 * the model server is the bottleneck.</p>
 *
 * <p>A full queue rejects with {@link RejectedExecutionException}; the web layer maps that to 503.</p>
 */
@Configuration
public class RagPerformanceConfig {

    private static final Logger log = LoggerFactory.getLogger(RagPerformanceConfig.class);
    static final int MIN_QUEUE = 10;
    static final long KEEP_ALIVE_SECONDS = 30L;

    @Bean(name = {"searchExecutor"}, destroyMethod = "shutdown")
    public ThreadPoolExecutor searchExecutor(
            @Value("${advotac.performance.search-threads:4}") int threads,
            @Value("${advotac.performance.queue-capacity:200}") int queueCapacity) {
        return newPool(PoolSizing.of("search", threads, threads * 2, queueCapacity));
    }

    @Bean(name = {"modelExecutor"}, destroyMethod = "shutdown")
    public ThreadPoolExecutor modelExecutor(
            @Value("${advotac.performance.model-threads:8}") int threads,
            @Value("${advotac.performance.queue-capacity:200}") int queueCapacity) {
        return newPool(PoolSizing.of("model", threads, threads, queueCapacity));
    }

    /**
     * Normalized pool dimensions: at least one thread, max never below core, queue at least
     * {@link #MIN_QUEUE}.
     */
    record PoolSizing(String name, int core, int max, int queue) {
        static PoolSizing of(String name, int core, int max, int queue) {
            int normalizedCore = Math.max(1, core);
            return new PoolSizing(name, normalizedCore, Math.max(normalizedCore, max), Math.max(MIN_QUEUE, queue));
        }
    }

    static ThreadPoolExecutor newPool(PoolSizing sizing) {
        ThreadPoolExecutor executor = new ThreadPoolExecutor(sizing.core(), sizing.max(), KEEP_ALIVE_SECONDS, TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(sizing.queue()), daemonThreads(sizing.name()), new OverloadRejectionHandler(sizing.name()));
        executor.allowCoreThreadTimeOut(true);
        log.info("Executor '{}' ready: core={}, max={}, queue={}", sizing.name(), sizing.core(), sizing.max(), sizing.queue());
        return executor;
    }

    private static ThreadFactory daemonThreads(String poolName) {
        AtomicInteger sequence = new AtomicInteger(0);
        return runnable -> {
            Thread thread = new Thread(runnable, poolName + "-" + sequence.incrementAndGet());
            // stuck model calls must not hold the JVM open on shutdown
            thread.setDaemon(true);
            return thread;
        };
    }

    /**
     * Counts and logs overload, then fails the submission. Never runs the task on the caller.
     */
    public static final class OverloadRejectionHandler implements RejectedExecutionHandler {
        private final String poolName;
        private final AtomicLong rejected = new AtomicLong(0);

        public OverloadRejectionHandler(String poolName) {
            this.poolName = poolName;
        }

        @Override
        public void rejectedExecution(Runnable task, ThreadPoolExecutor executor) {
            long total = this.rejected.incrementAndGet();
            log.warn("Executor '{}' saturated (active={}, queued={}, rejectedSoFar={})",
                    this.poolName, executor.getActiveCount(), executor.getQueue().size(), total);
            throw new RejectedExecutionException("Executor '" + this.poolName + "' is saturated");
        }

        public long rejectedCount() {
            return this.rejected.get();
        }
    }
}
