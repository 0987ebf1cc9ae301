package com.id.fieldbridge.model;

import java.util.Map;

/**
 * Position of the robot base link in UTM coordinates.
 */
public record TransformRecord(String deviceId,
                              String topic,
                              long timestamp,
                              double x,
                              double y,
                              double z) implements SensorRecord {

    public static final String X = "x";
    public static final String Y = "y";
    public static final String Z = "z";

    public TransformRecord {
        SensorRecord.checkIdentity(deviceId, timestamp);
        if (!Double.isFinite(x) || !Double.isFinite(y) || !Double.isFinite(z)) {
            throw new IllegalArgumentException("Transform coordinates must be finite");
        }
    }

    @Override
    public SensorVariant variant() {
        return SensorVariant.TRANSFORM;
    }

    @Override
    public Map<String, Object> fields() {
        return RecordFields.create()
                .put(X, x)
                .put(Y, y)
                .put(Z, z)
                .build();
    }
}
