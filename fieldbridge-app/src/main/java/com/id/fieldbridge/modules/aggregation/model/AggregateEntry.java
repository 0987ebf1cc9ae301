package com.id.fieldbridge.modules.aggregation.model;

import com.id.fieldbridge.model.SensorRecord;
import com.id.fieldbridge.model.SensorVariant;
import com.id.fieldbridge.modules.commit.model.CommitRecord;
import com.id.fieldbridge.modules.commit.model.SealReason;
import lombok.Getter;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ScheduledFuture;

/**
 * Open accumulator of the latest values of each variant for one {@link EntryKey}.
 * <p>
 * Not thread-safe: the aggregation window only touches an entry while holding the map slot of its key.
 */
@Getter
public class AggregateEntry {

    private final EntryKey key;
    private final long openedAtNanos;
    private final int revision;
    private final Map<SensorVariant, Map<String, Object>> fields = new EnumMap<>(SensorVariant.class);
    private final Map<SensorVariant, Long> capturedAt = new EnumMap<>(SensorVariant.class);

    private ScheduledFuture<?> timeout;

    public AggregateEntry(EntryKey key, long openedAtNanos, int revision) {
        this.key = key;
        this.openedAtNanos = openedAtNanos;
        this.revision = revision;
    }

    /**
     * Opens a new revision of an already sealed reading, seeded with what was committed for it.
     */
    public static AggregateEntry reopen(CommitRecord sealed, long openedAtNanos) {
        var entry = new AggregateEntry(new EntryKey(sealed.getDeviceId(), sealed.getEpoch()), openedAtNanos, sealed.getRevision() + 1);
        sealed.getVariants().forEach((variant, values) -> {
            entry.fields.put(variant, values);
            entry.capturedAt.put(variant, sealed.getCapturedAt().getOrDefault(variant, sealed.getEpoch()));
        });
        return entry;
    }

    /**
     * Stores the record as the value of its variant unless a later capture is already held.
     *
     * @return true if the entry content changed
     */
    public boolean push(SensorRecord record) {
        var variant = record.variant();
        Long held = capturedAt.get(variant);
        if (held != null && held > record.timestamp()) {
            return false;
        }
        var values = record.fields();
        boolean changed = held == null || !values.equals(fields.get(variant));
        fields.put(variant, values);
        capturedAt.put(variant, record.timestamp());
        return changed;
    }

    public boolean covers(Set<SensorVariant> expected) {
        return fields.keySet().containsAll(expected);
    }

    public Set<SensorVariant> variants() {
        return Collections.unmodifiableSet(fields.keySet());
    }

    public void attachTimeout(ScheduledFuture<?> timeout) {
        this.timeout = timeout;
    }

    public void cancelTimeout() {
        if (timeout != null) {
            timeout.cancel(false);
        }
    }

    /**
     * Snapshots the entry into a commit record. The record's collections are read-only since the same instance
     * is handed to every sink and kept for late data.
     */
    public CommitRecord seal(SealReason reason, Set<SensorVariant> expected, long sealedAt) {
        cancelTimeout();
        Set<SensorVariant> missing = EnumSet.noneOf(SensorVariant.class);
        missing.addAll(expected);
        missing.removeAll(fields.keySet());

        Map<SensorVariant, Map<String, Object>> variants = new EnumMap<>(SensorVariant.class);
        fields.forEach((variant, values) -> variants.put(variant, Collections.unmodifiableMap(new LinkedHashMap<>(values))));

        return CommitRecord.builder()
                .idempotencyKey(key.idempotencyKey())
                .deviceId(key.deviceId())
                .epoch(key.epoch())
                .partial(reason.isPartial())
                .sealReason(reason)
                .variants(Collections.unmodifiableMap(variants))
                .capturedAt(Collections.unmodifiableMap(new EnumMap<>(capturedAt)))
                .missingVariants(Collections.unmodifiableSet(missing))
                .sealedAt(sealedAt)
                .revision(revision)
                .build();
    }
}
