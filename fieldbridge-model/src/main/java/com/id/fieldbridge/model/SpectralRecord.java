package com.id.fieldbridge.model;

import java.util.Map;

public record SpectralRecord(String deviceId,
                             String topic,
                             long timestamp,
                             Double ndvi,
                             Double ndvi3d,
                             Double infrared,
                             Double visible) implements SensorRecord {

    public static final String NDVI = "ndvi";
    public static final String NDVI_3D = "ndvi_3d";
    public static final String INFRARED = "infrared";
    public static final String VISIBLE = "visible";

    public SpectralRecord {
        SensorRecord.checkIdentity(deviceId, timestamp);
        if (!RecordFields.anyPresent(ndvi, ndvi3d, infrared, visible)) {
            throw new IllegalArgumentException("Spectral reading carries no band value");
        }
    }

    @Override
    public SensorVariant variant() {
        return SensorVariant.SPECTRAL;
    }

    @Override
    public Map<String, Object> fields() {
        return RecordFields.create()
                .put(NDVI, ndvi)
                .put(NDVI_3D, ndvi3d)
                .put(INFRARED, infrared)
                .put(VISIBLE, visible)
                .build();
    }
}
