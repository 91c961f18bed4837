package com.jreinhal.edbot.config;

import java.util.concurrent.LinkedBlockingQueue;
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
 * Thread pools for tiered retrieval.
 *
 * <p>{@code tierExecutor} runs one tier call at a time per question so the tier timeout can be
 * enforced with {@code Future.get}. {@code lookupExecutor} runs the concurrent store lookups inside
 * a tier. They are separate so a tier never waits on sub-tasks queued behind itself.</p>
 */
@Configuration
public class RetrievalExecutorConfig {

    private static final Logger log = LoggerFactory.getLogger(RetrievalExecutorConfig.class);

    @Bean(name = {"tierExecutor"}, destroyMethod = "shutdown")
    public ThreadPoolExecutor tierExecutor(
            @Value("${edbot.performance.tier-threads:8}") int threads,
            @Value("${edbot.performance.tier-queue-capacity:100}") int queueCapacity) {
        return this.buildExecutor("tier-exec-", threads, threads, queueCapacity);
    }

    @Bean(name = {"lookupExecutor"}, destroyMethod = "shutdown")
    public ThreadPoolExecutor lookupExecutor(
            @Value("${edbot.performance.lookup-core-threads:4}") int coreThreads,
            @Value("${edbot.performance.lookup-max-threads:8}") int maxThreads,
            @Value("${edbot.performance.lookup-queue-capacity:200}") int queueCapacity) {
        return this.buildExecutor("lookup-exec-", coreThreads, maxThreads, queueCapacity);
    }

    ThreadPoolExecutor buildExecutor(String prefix, int coreThreads, int maxThreads, int queueCapacity) {
        int core = Math.max(1, coreThreads);
        int max = Math.max(core, maxThreads);
        int queue = Math.max(10, queueCapacity);
        ThreadFactory threadFactory = new NamedThreadFactory(prefix);
        ThreadPoolExecutor executor = new ThreadPoolExecutor(core, max, 30L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(queue), threadFactory, new MonitoredRejectionHandler(prefix));
        executor.allowCoreThreadTimeOut(true);
        log.info("Thread pool '{}' initialized: core={}, max={}, queue={}", prefix, core, max, queue);
        return executor;
    }

    /**
     * Logs overload and throws {@link RejectedExecutionException} instead of running the task on the
     * caller thread. Tiers and the answer service turn the exception into a degraded result.
     */
    public static final class MonitoredRejectionHandler implements RejectedExecutionHandler {
        private final String poolName;
        private final AtomicLong rejectionCount = new AtomicLong(0);

        public MonitoredRejectionHandler(String poolName) {
            this.poolName = poolName;
        }

        @Override
        public void rejectedExecution(Runnable r, ThreadPoolExecutor executor) {
            long count = this.rejectionCount.incrementAndGet();
            log.warn("Task rejected from pool '{}', queue full. active={}, poolSize={}, queueSize={}, totalRejections={}",
                    this.poolName, executor.getActiveCount(), executor.getPoolSize(), executor.getQueue().size(), count);
            throw new RejectedExecutionException("Thread pool '" + this.poolName + "' overloaded (rejected " + count + " tasks)");
        }

        public long getRejectionCount() {
            return this.rejectionCount.get();
        }
    }

    private static final class NamedThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger(0);

        private NamedThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable);
            thread.setName(this.prefix + this.counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
