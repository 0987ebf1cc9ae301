package com.id.fieldbridge.model;

import java.util.Map;

public record PlantMetricRecord(String deviceId,
                                String topic,
                                long timestamp,
                                Double biomass,
                                String cropType,
                                String lightState,
                                Double area,
                                String locationLabel) implements SensorRecord {

    public static final String BIOMASS = "biomass";
    public static final String CROP_TYPE = "crop_type";
    public static final String LIGHT_STATE = "light_state";
    public static final String AREA = "area";
    public static final String LOCATION_LABEL = "location_label";

    public PlantMetricRecord {
        SensorRecord.checkIdentity(deviceId, timestamp);
        if (!RecordFields.anyPresent(biomass, cropType, lightState, area, locationLabel)) {
            throw new IllegalArgumentException("Plant metric reading carries no value");
        }
    }

    @Override
    public SensorVariant variant() {
        return SensorVariant.PLANT_METRIC;
    }

    @Override
    public Map<String, Object> fields() {
        return RecordFields.create()
                .put(BIOMASS, biomass)
                .put(CROP_TYPE, cropType)
                .put(LIGHT_STATE, lightState)
                .put(AREA, area)
                .put(LOCATION_LABEL, locationLabel)
                .build();
    }
}
