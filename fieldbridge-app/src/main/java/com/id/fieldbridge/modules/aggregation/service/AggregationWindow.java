package com.id.fieldbridge.modules.aggregation.service;

import com.id.fieldbridge.model.SensorRecord;
import com.id.fieldbridge.model.SensorVariant;
import com.id.fieldbridge.modules.aggregation.logic.CompletionPolicy;
import com.id.fieldbridge.modules.aggregation.logic.SealedKeyMemory;
import com.id.fieldbridge.modules.aggregation.model.AggregateEntry;
import com.id.fieldbridge.modules.aggregation.model.AggregationSettings;
import com.id.fieldbridge.modules.aggregation.model.EntryKey;
import com.id.fieldbridge.modules.commit.model.CommitRecord;
import com.id.fieldbridge.modules.commit.model.SealReason;
import com.id.fieldbridge.modules.metrics.PipelineMetrics;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns all open {@link AggregateEntry} instances.
 * <p>
 * Every mutation of an entry, including sealing, runs inside the map slot of its key, so calls for the same
 * key are serialized while calls for different keys proceed in parallel.
 */
@Service
@Slf4j
public class AggregationWindow {

    private final long epochResolutionMs;
    private final long windowTimeoutMs;
    private final int maxOpenEntries;
    private final CompletionPolicy completionPolicy;
    private final SealedKeyMemory sealedKeys;
    private final PipelineMetrics metrics;

    private final Map<EntryKey, AggregateEntry> entries = new ConcurrentHashMap<>();
    private final ScheduledThreadPoolExecutor timers;

    private volatile SealedEntryListener sealedEntryListener = record ->
            log.warn("No listener registered, dropping {} entry {}", record.getSealReason(), record.getIdempotencyKey());

    public AggregationWindow(AggregationSettings settings, PipelineMetrics metrics) {
        if (settings.getEpochResolution().toMillis() <= 0) {
            throw new IllegalArgumentException("Epoch resolution must be positive");
        }
        if (settings.getMaxOpenEntries() <= 0) {
            throw new IllegalArgumentException("Max open entries must be positive");
        }
        this.epochResolutionMs = settings.getEpochResolution().toMillis();
        this.windowTimeoutMs = settings.getWindowTimeout().toMillis();
        this.maxOpenEntries = settings.getMaxOpenEntries();
        this.completionPolicy = CompletionPolicy.from(settings);
        this.sealedKeys = new SealedKeyMemory(settings.getSealedKeyMemory());
        this.metrics = metrics;

        this.timers = new ScheduledThreadPoolExecutor(1, new CustomizableThreadFactory("window-timer-"));
        this.timers.setRemoveOnCancelPolicy(true);

        metrics.registerOpenEntriesGauge(entries::size);
    }

    public void setSealedEntryListener(SealedEntryListener listener) {
        if (listener == null) {
            throw new IllegalArgumentException("Listener cannot be null");
        }
        this.sealedEntryListener = listener;
    }

    /**
     * Adds a record to the entry of its device and epoch, opening the entry if needed.
     *
     * @return the sealed entry if this record completed it
     */
    public Optional<CommitRecord> ingest(SensorRecord record) {
        if (record == null) {
            throw new IllegalArgumentException("Record cannot be null");
        }

        var key = EntryKey.of(record.deviceId(), record.timestamp(), epochResolutionMs);
        Set<SensorVariant> expected = completionPolicy.expectedFor(record.deviceId());
        AtomicReference<CommitRecord> completed = new AtomicReference<>();

        entries.compute(key, (k, current) -> {
            AggregateEntry entry = current;
            if (entry == null) {
                CommitRecord previous = sealedKeys.get(k);
                if (previous != null) {
                    entry = AggregateEntry.reopen(previous, System.nanoTime());
                    if (!entry.push(record)) {
                        log.debug("Dropping duplicate {} for sealed entry {}", record.variant(), k.idempotencyKey());
                        metrics.lateArrival(false);
                        return null;
                    }
                    log.debug("Re-opening sealed entry {} as revision {}", k.idempotencyKey(), entry.getRevision());
                    metrics.lateArrival(true);
                } else {
                    entry = new AggregateEntry(k, System.nanoTime(), 0);
                    entry.push(record);
                }
                scheduleTimeout(entry);
            } else {
                entry.push(record);
            }

            if (entry.covers(expected)) {
                completed.set(sealLocked(entry, SealReason.COMPLETE, expected));
                return null;
            }
            return entry;
        });

        if (entries.size() > maxOpenEntries) {
            evictOldest();
        }
        return Optional.ofNullable(completed.get());
    }

    /**
     * Force-seals every open entry.
     *
     * @return the sealed entries, in no particular order
     */
    public List<CommitRecord> sealAll(SealReason reason) {
        List<CommitRecord> sealed = new ArrayList<>();
        for (EntryKey key : List.copyOf(entries.keySet())) {
            entries.computeIfPresent(key, (k, entry) -> {
                sealed.add(sealLocked(entry, reason, completionPolicy.expectedFor(k.deviceId())));
                return null;
            });
        }
        if (!sealed.isEmpty()) {
            log.info("Force-sealed {} open entries ({})", sealed.size(), reason);
        }
        return sealed;
    }

    public int openEntries() {
        return entries.size();
    }

    @PreDestroy
    public void shutdown() {
        timers.shutdownNow();
    }

    private void scheduleTimeout(AggregateEntry entry) {
        entry.attachTimeout(timers.schedule(() -> sealIfOpen(entry, SealReason.TIMEOUT), windowTimeoutMs, TimeUnit.MILLISECONDS));
    }

    private void evictOldest() {
        while (entries.size() > maxOpenEntries) {
            var oldest = entries.values().stream()
                    .min(Comparator.comparingLong(AggregateEntry::getOpenedAtNanos))
                    .orElse(null);
            if (oldest == null) {
                return;
            }
            log.warn("Open entries above {}, evicting {}", maxOpenEntries, oldest.getKey().idempotencyKey());
            sealIfOpen(oldest, SealReason.EVICTED);
        }
    }

    /**
     * Seals the entry only if it is still the one open for its key, then hands it to the listener.
     */
    private void sealIfOpen(AggregateEntry entry, SealReason reason) {
        AtomicReference<CommitRecord> sealed = new AtomicReference<>();
        entries.computeIfPresent(entry.getKey(), (k, current) -> {
            if (current != entry) {
                return current;
            }
            sealed.set(sealLocked(current, reason, completionPolicy.expectedFor(k.deviceId())));
            return null;
        });

        var record = sealed.get();
        if (record == null) {
            return;
        }
        try {
            sealedEntryListener.onSealed(record);
        } catch (Exception e) {
            log.error("Listener failed for {} entry {}", reason, record.getIdempotencyKey(), e);
            metrics.stageFailure("seal");
        }
    }

    private CommitRecord sealLocked(AggregateEntry entry, SealReason reason, Set<SensorVariant> expected) {
        var record = entry.seal(reason, expected, System.currentTimeMillis());
        sealedKeys.remember(entry.getKey(), record);
        metrics.entrySealed(reason);
        log.debug("Sealed entry {} rev {} ({}, variants {})",
                record.getIdempotencyKey(), record.getRevision(), reason, record.getVariants().keySet());
        return record;
    }
}
