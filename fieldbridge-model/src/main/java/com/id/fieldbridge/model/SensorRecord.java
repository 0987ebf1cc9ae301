package com.id.fieldbridge.model;

import java.util.Map;

/**
 * One decoded sensor reading. Implementations are immutable and always carry a device identity and a
 * positive capture timestamp (epoch millis).
 */
public sealed interface SensorRecord
        permits LocationRecord, ThermalRecord, SpectralRecord, EnvironmentalRecord, TransformRecord, PlantMetricRecord {

    String deviceId();

    String topic();

    long timestamp();

    SensorVariant variant();

    /**
     * Non-null field values keyed by their sink field name, in a stable order.
     */
    Map<String, Object> fields();

    static void checkIdentity(String deviceId, long timestamp) {
        if (deviceId == null || deviceId.isBlank()) {
            throw new IllegalArgumentException("Device id cannot be null or blank");
        }
        if (timestamp <= 0) {
            throw new IllegalArgumentException("Timestamp must be positive, got %d".formatted(timestamp));
        }
    }
}
