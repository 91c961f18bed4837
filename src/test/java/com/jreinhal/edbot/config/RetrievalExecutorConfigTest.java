package com.jreinhal.edbot.config;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RetrievalExecutorConfigTest {

    private ThreadPoolExecutor executor;

    @AfterEach
    void tearDown() {
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    @Test
    void shouldCreateTierExecutorWithFixedSize() {
        RetrievalExecutorConfig config = new RetrievalExecutorConfig();
        executor = config.tierExecutor(6, 100);

        assertEquals(6, executor.getCorePoolSize());
        assertEquals(6, executor.getMaximumPoolSize());
        assertTrue(executor.allowsCoreThreadTimeOut());
    }

    @Test
    void shouldCreateLookupExecutorWithConfiguredValues() {
        RetrievalExecutorConfig config = new RetrievalExecutorConfig();
        executor = config.lookupExecutor(4, 8, 200);

        assertEquals(4, executor.getCorePoolSize());
        assertEquals(8, executor.getMaximumPoolSize());
        assertEquals(200, executor.getQueue().remainingCapacity());
    }

    @Test
    void shouldEnforceMinimumPoolValues() {
        RetrievalExecutorConfig config = new RetrievalExecutorConfig();
        executor = config.lookupExecutor(0, -1, 5);

        // Minimum core = 1, max >= core, queue >= 10
        assertEquals(1, executor.getCorePoolSize());
        assertEquals(1, executor.getMaximumPoolSize());
        assertEquals(10, executor.getQueue().remainingCapacity());
    }

    @Test
    void shouldUseMonitoredRejectionHandler() {
        RetrievalExecutorConfig config = new RetrievalExecutorConfig();
        executor = config.tierExecutor(2, 10);

        assertInstanceOf(RetrievalExecutorConfig.MonitoredRejectionHandler.class,
                executor.getRejectedExecutionHandler());
    }

    @Test
    void shouldRejectAndCountWhenPoolAndQueueFull() throws InterruptedException {
        // Built directly with queue size 1 to bypass minimum enforcement
        RetrievalExecutorConfig.MonitoredRejectionHandler handler =
                new RetrievalExecutorConfig.MonitoredRejectionHandler("test-pool");
        executor = new ThreadPoolExecutor(1, 1, 30L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(1), handler);

        CountDownLatch blockLatch = new CountDownLatch(1);
        Runnable blocker = () -> {
            try {
                blockLatch.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        };
        executor.submit(blocker);
        Thread.sleep(50);
        executor.submit(blocker);

        assertThrows(RejectedExecutionException.class, () -> executor.submit(() -> {}));
        assertThrows(RejectedExecutionException.class, () -> executor.submit(() -> {}));
        assertEquals(2, handler.getRejectionCount());

        blockLatch.countDown();
    }

    @Test
    void shouldNameThreadsWithPrefix() throws Exception {
        RetrievalExecutorConfig config = new RetrievalExecutorConfig();
        executor = config.tierExecutor(1, 10);

        String[] threadName = new String[1];
        CountDownLatch latch = new CountDownLatch(1);
        executor.submit(() -> {
            threadName[0] = Thread.currentThread().getName();
            latch.countDown();
        });

        assertTrue(latch.await(5, TimeUnit.SECONDS));
        assertTrue(threadName[0].startsWith("tier-exec-"),
                "Thread name should start with 'tier-exec-' but was: " + threadName[0]);
    }
}
