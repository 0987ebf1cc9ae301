package com.id.fieldbridge.modules.subscription.service;

import com.id.fieldbridge.model.SensorRecord;
import com.id.fieldbridge.modules.aggregation.service.AggregationWindow;
import com.id.fieldbridge.modules.commit.model.CommitRecord;
import com.id.fieldbridge.modules.commit.model.SealReason;
import com.id.fieldbridge.modules.decoder.logic.TopicDecoder;
import com.id.fieldbridge.modules.decoder.model.DecodeResult;
import com.id.fieldbridge.modules.executor.BoundedExecutors;
import com.id.fieldbridge.modules.metrics.PipelineMetrics;
import com.id.fieldbridge.modules.sink.model.CommitResult;
import com.id.fieldbridge.modules.sink.service.DualSinkWriter;
import com.id.fieldbridge.modules.subscription.model.InboundMessage;
import com.id.fieldbridge.modules.subscription.model.PipelineSettings;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Runs every inbound message through decode, ingest and, once an entry seals, commit.
 * <p>
 * Decoding happens on the delivery thread. Ingest runs on a bounded worker pool and commits on a second one, so a
 * slow sink neither holds up the transport nor stalls ingest for other devices. Each stage contains its own failures.
 */
@Service
@Slf4j
public class ReadingPipeline {

    private final TopicDecoder decoder;
    private final AggregationWindow window;
    private final DualSinkWriter writer;
    private final PipelineMetrics metrics;
    private final Duration shutdownGrace;
    private final ThreadPoolExecutor workers;
    private final ThreadPoolExecutor commits;

    public ReadingPipeline(TopicDecoder decoder,
                           AggregationWindow window,
                           DualSinkWriter writer,
                           PipelineSettings settings,
                           PipelineMetrics metrics) {
        this.decoder = decoder;
        this.window = window;
        this.writer = writer;
        this.metrics = metrics;
        this.shutdownGrace = settings.getShutdownGrace();
        this.workers = BoundedExecutors.newFixedPool("pipeline-worker", settings.getWorkerThreads(), settings.getWorkerQueueSize());
        this.commits = BoundedExecutors.newFixedPool("pipeline-commit", settings.getCommitThreads(), settings.getCommitQueueSize());
    }

    @PostConstruct
    public void init() {
        window.setSealedEntryListener(this::submitCommit);
    }

    public List<String> subscriptionFilters() {
        return decoder.subscriptionFilters();
    }

    /**
     * Decodes the message, acknowledges it and queues the decoded record for aggregation.
     * <p>
     * Malformed messages are acknowledged and dropped. Well-formed ones are acknowledged before they are
     * written, retries happen in the writer and not through redelivery.
     */
    public void handle(InboundMessage message, Runnable acknowledge) {
        metrics.messageReceived(message.duplicate());

        DecodeResult result = decoder.decode(message.topic(), message.payload());
        try {
            acknowledge.run();
        } catch (RuntimeException e) {
            log.warn("Could not acknowledge message on '{}': {}", message.topic(), e.getMessage());
            metrics.stageFailure("ack");
        }

        result.record().ifPresent(this::submitIngest);
    }

    /**
     * Ingests one record and commits the entry it completes, if any. Runs on the calling thread.
     */
    public Optional<CommitResult> process(SensorRecord record) {
        return ingest(record).map(this::commit);
    }

    @PreDestroy
    public void shutdown() {
        log.info("Draining pipeline workers (grace {})", shutdownGrace);
        long deadline = System.nanoTime() + shutdownGrace.toNanos();
        // Ingest first, it can still hand sealed entries to the commit pool
        drain(workers, "records", deadline);
        drain(commits, "commits", deadline);

        // Whatever is still open is committed best-effort on this thread
        List<CommitRecord> remaining = window.sealAll(SealReason.SHUTDOWN);
        remaining.forEach(this::commit);
    }

    private Optional<CommitRecord> ingest(SensorRecord record) {
        try {
            return window.ingest(record);
        } catch (RuntimeException e) {
            log.error("Ingest failed for {} of {}", record.variant(), record.deviceId(), e);
            metrics.stageFailure("ingest");
            return Optional.empty();
        }
    }

    private void submitIngest(SensorRecord record) {
        try {
            workers.execute(() -> ingest(record).ifPresent(this::submitCommit));
        } catch (RejectedExecutionException e) {
            log.warn("Pipeline saturated, dropping {} of {} at {}", record.variant(), record.deviceId(), record.timestamp());
            metrics.pipelineRejected();
        }
    }

    private void submitCommit(CommitRecord record) {
        try {
            commits.execute(() -> commit(record));
        } catch (RejectedExecutionException e) {
            // Sealed entries are never dropped, commit on the sealing thread instead
            log.warn("Commit queue saturated, committing {} entry {} inline", record.getSealReason(), record.getIdempotencyKey());
            commit(record);
        }
    }

    private void drain(ThreadPoolExecutor pool, String what, long deadline) {
        pool.shutdown();
        try {
            long remaining = Math.max(0, deadline - System.nanoTime());
            if (!pool.awaitTermination(remaining, TimeUnit.NANOSECONDS)) {
                List<Runnable> dropped = pool.shutdownNow();
                log.warn("Pipeline grace period elapsed, {} queued {} dropped", dropped.size(), what);
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private CommitResult commit(CommitRecord record) {
        try {
            return writer.commit(record);
        } catch (RuntimeException e) {
            log.error("Commit failed for {}", record.getIdempotencyKey(), e);
            metrics.stageFailure("commit");
            return null;
        }
    }
}
