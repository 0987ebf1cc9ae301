package com.id.fieldbridge.model;

import java.util.Map;

public record LocationRecord(String deviceId,
                             String topic,
                             long timestamp,
                             Double latitude,
                             Double longitude,
                             Double altitude,
                             Integer fixStatus,
                             Integer service) implements SensorRecord {

    public static final String LATITUDE = "latitude";
    public static final String LONGITUDE = "longitude";
    public static final String ALTITUDE = "altitude";
    public static final String FIX_STATUS = "fix_status";
    public static final String SERVICE = "service";

    public LocationRecord {
        SensorRecord.checkIdentity(deviceId, timestamp);
        if (latitude == null || longitude == null) {
            throw new IllegalArgumentException("Location requires both latitude and longitude");
        }
        if (latitude < -90.0 || latitude > 90.0 || longitude < -180.0 || longitude > 180.0) {
            throw new IllegalArgumentException("Coordinates out of range: %f, %f".formatted(latitude, longitude));
        }
    }

    @Override
    public SensorVariant variant() {
        return SensorVariant.LOCATION;
    }

    @Override
    public Map<String, Object> fields() {
        return RecordFields.create()
                .put(LATITUDE, latitude)
                .put(LONGITUDE, longitude)
                .put(ALTITUDE, altitude)
                .put(FIX_STATUS, fixStatus)
                .put(SERVICE, service)
                .build();
    }
}
