package com.id.fieldbridge.modules.query.model;

import com.id.fieldbridge.model.SensorVariant;
import lombok.Builder;
import lombok.Value;

/**
 * Filters of a time-series read. Null bounds and a null device mean unfiltered; bounds are inclusive epoch
 * millis.
 */
@Value
@Builder
public class PointsQuery {

    SensorVariant variant;
    String deviceId;
    Long start;
    Long end;
    int limit;

}
