package com.id.fieldbridge.model;

import java.util.Map;

public record EnvironmentalRecord(String deviceId,
                                  String topic,
                                  long timestamp,
                                  Double relativeHumidity,
                                  Double absoluteHumidity,
                                  Double dewPoint) implements SensorRecord {

    public static final String RELATIVE_HUMIDITY = "relative_humidity";
    public static final String ABSOLUTE_HUMIDITY = "absolute_humidity";
    public static final String DEW_POINT = "dew_point";

    public EnvironmentalRecord {
        SensorRecord.checkIdentity(deviceId, timestamp);
        if (!RecordFields.anyPresent(relativeHumidity, absoluteHumidity, dewPoint)) {
            throw new IllegalArgumentException("Environmental reading carries no value");
        }
    }

    @Override
    public SensorVariant variant() {
        return SensorVariant.ENVIRONMENTAL;
    }

    @Override
    public Map<String, Object> fields() {
        return RecordFields.create()
                .put(RELATIVE_HUMIDITY, relativeHumidity)
                .put(ABSOLUTE_HUMIDITY, absoluteHumidity)
                .put(DEW_POINT, dewPoint)
                .build();
    }
}
