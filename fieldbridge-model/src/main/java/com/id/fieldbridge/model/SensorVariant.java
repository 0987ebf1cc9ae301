package com.id.fieldbridge.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Sensor families a reading can belong to. The measurement name is the one used by the time-series store.
 */
public enum SensorVariant {

    LOCATION("location"),
    THERMAL("thermal"),
    SPECTRAL("spectral"),
    ENVIRONMENTAL("environmental"),
    TRANSFORM("transform"),
    PLANT_METRIC("plant_metric");

    private final String measurement;

    SensorVariant(String measurement) {
        this.measurement = measurement;
    }

    public String getMeasurement() {
        return measurement;
    }

    public static Optional<SensorVariant> fromMeasurement(String measurement) {
        if (measurement == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(v -> v.measurement.equalsIgnoreCase(measurement) || v.name().equalsIgnoreCase(measurement))
                .findFirst();
    }
}
