package com.id.fieldbridge.model;

import java.util.Map;

/**
 * Canopy and ambient temperatures. When the sensor reports individual plants, the canopy temperature and
 * crop water stress index are the means over those plants and {@code entityCount} is the plant count.
 */
public record ThermalRecord(String deviceId,
                            String topic,
                            long timestamp,
                            Double canopyTemperature,
                            Double cwsi,
                            Integer entityCount,
                            Double ambientTemperature) implements SensorRecord {

    public static final String CANOPY_TEMPERATURE = "canopy_temperature";
    public static final String CWSI = "cwsi";
    public static final String ENTITY_COUNT = "entity_count";
    public static final String AMBIENT_TEMPERATURE = "ambient_temperature";

    public ThermalRecord {
        SensorRecord.checkIdentity(deviceId, timestamp);
        if (!RecordFields.anyPresent(canopyTemperature, cwsi, ambientTemperature)) {
            throw new IllegalArgumentException("Thermal reading carries no temperature");
        }
    }

    @Override
    public SensorVariant variant() {
        return SensorVariant.THERMAL;
    }

    @Override
    public Map<String, Object> fields() {
        return RecordFields.create()
                .put(CANOPY_TEMPERATURE, canopyTemperature)
                .put(CWSI, cwsi)
                .put(ENTITY_COUNT, entityCount)
                .put(AMBIENT_TEMPERATURE, ambientTemperature)
                .build();
    }
}
