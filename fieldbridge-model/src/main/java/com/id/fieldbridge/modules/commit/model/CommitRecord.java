package com.id.fieldbridge.modules.commit.model;

import com.id.fieldbridge.model.SensorVariant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Sealed, flattened form of an aggregated reading, as handed to every sink.
 * <p>
 * The idempotency key only depends on the device identity and the reading epoch, so re-committing the same
 * logical reading overwrites the stored copy instead of adding a new one.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class CommitRecord {

    private String idempotencyKey;
    private String deviceId;
    private long epoch;
    private boolean partial;
    private SealReason sealReason;

    @Builder.Default
    private Map<SensorVariant, Map<String, Object>> variants = new EnumMap<>(SensorVariant.class);

    @Builder.Default
    private Map<SensorVariant, Long> capturedAt = new EnumMap<>(SensorVariant.class);

    @Builder.Default
    private Set<SensorVariant> missingVariants = EnumSet.noneOf(SensorVariant.class);

    private long sealedAt;

    /**
     * Number of times this key was sealed before; non-zero when late data re-opened it.
     */
    private int revision;

    public static String idempotencyKey(String deviceId, long epoch) {
        return "%s_%d".formatted(deviceId, epoch);
    }

    public boolean hasVariant(SensorVariant variant) {
        return variants != null && variants.containsKey(variant);
    }
}
