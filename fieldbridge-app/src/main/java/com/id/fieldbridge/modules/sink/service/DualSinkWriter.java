package com.id.fieldbridge.modules.sink.service;

import com.id.fieldbridge.modules.commit.model.CommitRecord;
import com.id.fieldbridge.modules.executor.BoundedExecutors;
import com.id.fieldbridge.modules.executor.RetryBackoff;
import com.id.fieldbridge.modules.metrics.PipelineMetrics;
import com.id.fieldbridge.modules.sink.ReadingSink;
import com.id.fieldbridge.modules.sink.model.CommitResult;
import com.id.fieldbridge.modules.sink.model.SinkSettings;
import com.id.fieldbridge.modules.sink.model.SinkWriteException;
import com.id.fieldbridge.modules.sink.model.SinkWriteResult;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Commits sealed readings to every configured sink.
 * <p>
 * Sinks are written concurrently and independently: each one retries its own transient failures and a
 * failure on one sink never prevents or rolls back the write on another. There is no cross-sink atomicity,
 * the stores converge through the idempotent upserts of later commits of the same key.
 */
@Service
@Slf4j
public class DualSinkWriter {

    // Grace on top of the write timeout before the caller stops waiting for a sink task
    private static final long RESULT_WAIT_SLACK_MS = 1000L;

    private final List<ReadingSink> sinks;
    private final RetryBackoff backoff;
    private final Duration writeTimeout;
    private final PipelineMetrics metrics;
    private final ThreadPoolExecutor executor;

    public DualSinkWriter(List<ReadingSink> sinks, SinkSettings settings, PipelineMetrics metrics) {
        if (sinks == null || sinks.isEmpty()) {
            throw new IllegalArgumentException("At least one sink is required");
        }
        this.sinks = List.copyOf(sinks);
        this.backoff = new RetryBackoff(settings.getMaxAttempts(), settings.getInitialBackoff(), settings.getMaxBackoff());
        this.writeTimeout = settings.getWriteTimeout();
        this.metrics = metrics;
        this.executor = BoundedExecutors.newFixedPool("sink-writer", settings.getWriterThreads(), settings.getWriterQueueSize());

        log.info("Sink writer ready with sinks {}", this.sinks.stream().map(ReadingSink::name).toList());
    }

    /**
     * Writes the record to all sinks and waits until each one succeeded, failed permanently, exhausted its
     * retries or ran out of time.
     */
    public CommitResult commit(CommitRecord record) {
        if (record == null) {
            throw new IllegalArgumentException("Record cannot be null");
        }

        Map<ReadingSink, CompletableFuture<SinkWriteResult>> pending = new LinkedHashMap<>();
        Map<ReadingSink, AtomicInteger> attempts = new LinkedHashMap<>();
        for (ReadingSink sink : sinks) {
            var counter = new AtomicInteger();
            attempts.put(sink, counter);
            try {
                pending.put(sink, CompletableFuture.supplyAsync(() -> writeWithRetry(sink, record, counter), executor));
            } catch (RejectedExecutionException e) {
                log.error("Sink writer queue full, {} write of {} abandoned", sink.name(), record.getIdempotencyKey());
                pending.put(sink, CompletableFuture.completedFuture(
                        SinkWriteResult.failed(sink.name(), 0, "Writer queue full", Duration.ZERO)));
            }
        }

        long deadline = System.nanoTime() + writeTimeout.toNanos() + TimeUnit.MILLISECONDS.toNanos(RESULT_WAIT_SLACK_MS);
        List<SinkWriteResult> results = new ArrayList<>();
        pending.forEach((sink, future) -> results.add(awaitResult(sink, future, attempts.get(sink), deadline)));

        var result = new CommitResult(record.getIdempotencyKey(), results);
        results.forEach(r -> metrics.sinkWrite(r.sink(), r.status(), r.duration()));
        if (result.isFullyWritten()) {
            log.debug("Committed {} (rev {}, partial={}) to all sinks",
                    record.getIdempotencyKey(), record.getRevision(), record.isPartial());
        } else {
            log.error("Commit of {} incomplete: {}", record.getIdempotencyKey(), results);
        }
        return result;
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(writeTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Sink writes still running after {}, interrupting", writeTimeout);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private SinkWriteResult awaitResult(ReadingSink sink, CompletableFuture<SinkWriteResult> future, AtomicInteger attempts, long deadline) {
        long waitNanos = Math.max(0, deadline - System.nanoTime());
        try {
            return future.get(waitNanos, TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            return SinkWriteResult.timedOut(sink.name(), attempts.get(), writeTimeout);
        } catch (ExecutionException e) {
            return SinkWriteResult.failed(sink.name(), attempts.get(), String.valueOf(e.getCause()), Duration.ZERO);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return SinkWriteResult.failed(sink.name(), attempts.get(), "Interrupted while waiting", Duration.ZERO);
        }
    }

    private SinkWriteResult writeWithRetry(ReadingSink sink, CommitRecord record, AtomicInteger attempts) {
        long start = System.nanoTime();
        long deadline = start + writeTimeout.toNanos();

        while (true) {
            int attempt = attempts.incrementAndGet();
            try {
                sink.upsert(record);
                return SinkWriteResult.written(sink.name(), attempt, Duration.ofNanos(System.nanoTime() - start));
            } catch (SinkWriteException e) {
                Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
                if (!e.isRetryable()) {
                    log.error("Permanent {} failure for {}: {}", sink.name(), record.getIdempotencyKey(), e.getMessage());
                    return SinkWriteResult.failed(sink.name(), attempt, e.getMessage(), elapsed);
                }
                if (!backoff.hasAttemptsLeft(attempt)) {
                    log.error("Giving up {} write of {} after {} attempts: {}", sink.name(), record.getIdempotencyKey(), attempt, e.getMessage());
                    return SinkWriteResult.failed(sink.name(), attempt, e.getMessage(), elapsed);
                }

                Duration delay = backoff.delayAfter(attempt);
                if (System.nanoTime() + delay.toNanos() > deadline) {
                    log.error("Write timeout reached for {} write of {} after {} attempts", sink.name(), record.getIdempotencyKey(), attempt);
                    return SinkWriteResult.timedOut(sink.name(), attempt, elapsed);
                }

                log.warn("Transient {} failure for {} (attempt {}/{}), retrying in {} ms: {}",
                        sink.name(), record.getIdempotencyKey(), attempt, backoff.maxAttempts(), delay.toMillis(), e.getMessage());
                metrics.sinkRetry(sink.name());
                try {
                    Thread.sleep(delay.toMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    return SinkWriteResult.failed(sink.name(), attempt, "Interrupted during backoff", elapsed);
                }
            } catch (RuntimeException e) {
                log.error("Unexpected {} failure for {}", sink.name(), record.getIdempotencyKey(), e);
                return SinkWriteResult.failed(sink.name(), attempt, e.toString(), Duration.ofNanos(System.nanoTime() - start));
            }
        }
    }
}
