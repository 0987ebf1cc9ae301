package com.id.fieldbridge.modules.executor;

import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

public final class BoundedExecutors {

    private static final long QUEUE_WARNING_INTERVAL_MS = 60_000L;

    private BoundedExecutors() {
    }

    /**
     * Fixed-size pool over a bounded queue. Submissions beyond the queue capacity are rejected with
     * {@link java.util.concurrent.RejectedExecutionException}, never blocking the caller.
     */
    public static ThreadPoolExecutor newFixedPool(String name, int threads, int queueSize) {
        if (threads < 1) {
            throw new IllegalArgumentException("%s pool needs at least one thread".formatted(name));
        }
        if (queueSize < 1) {
            throw new IllegalArgumentException("%s queue size must be positive".formatted(name));
        }
        return new ThreadPoolExecutor(
                threads,
                threads,
                0L, TimeUnit.MILLISECONDS,
                new WarningLinkedBlockingQueue<>(name, queueSize, Math.max(1, queueSize / 2), QUEUE_WARNING_INTERVAL_MS),
                new CustomizableThreadFactory(name + "-"),
                new ThreadPoolExecutor.AbortPolicy()
        );
    }
}
