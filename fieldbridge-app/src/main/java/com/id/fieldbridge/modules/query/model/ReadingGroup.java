package com.id.fieldbridge.modules.query.model;

import com.id.fieldbridge.modules.sink.timeseries.TimeSeriesPointEntity;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * All points of one idempotency key, as grouped by the readings aggregation.
 */
@Data
@NoArgsConstructor
public class ReadingGroup {

    private String id;
    private long tms;
    private List<TimeSeriesPointEntity> points = new ArrayList<>();

}
