package com.id.fieldbridge.modules.sink.timeseries;

import com.id.fieldbridge.model.SensorVariant;
import com.id.fieldbridge.modules.commit.model.CommitRecord;
import com.id.fieldbridge.modules.query.model.ReadingPoint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Field;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One measurement of one reading in the time-series collection. Field names are shared with the query
 * façade, which reads these points back.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TimeSeriesPointEntity {

    public static final String ID = "id";
    public static final String MEASUREMENT = "measurement";
    public static final String DEVICE_ID = "deviceId";
    public static final String TMS = "tms";
    public static final String IDEMPOTENCY_KEY = "idempotencyKey";
    public static final String PARTIAL = "partial";
    public static final String FIELDS = "fields";

    @Id
    @Field("_id")
    private String id;

    private String measurement;
    private String deviceId;
    private long tms;
    private long capturedAt;
    private String idempotencyKey;
    private boolean partial;
    private int revision;
    private Map<String, Object> fields;

    public static String pointId(String idempotencyKey, SensorVariant variant) {
        return "%s:%s".formatted(idempotencyKey, variant.getMeasurement());
    }

    public static TimeSeriesPointEntity from(CommitRecord record, SensorVariant variant) {
        return TimeSeriesPointEntity.builder()
                .id(pointId(record.getIdempotencyKey(), variant))
                .measurement(variant.getMeasurement())
                .deviceId(record.getDeviceId())
                .tms(record.getEpoch())
                .capturedAt(record.getCapturedAt().getOrDefault(variant, record.getEpoch()))
                .idempotencyKey(record.getIdempotencyKey())
                .partial(record.isPartial())
                .revision(record.getRevision())
                .fields(new LinkedHashMap<>(record.getVariants().get(variant)))
                .build();
    }

    public ReadingPoint toReadingPoint() {
        return ReadingPoint.builder()
                .measurement(measurement)
                .deviceId(deviceId)
                .tms(tms)
                .idempotencyKey(idempotencyKey)
                .partial(partial)
                .fields(fields == null ? new LinkedHashMap<>() : new LinkedHashMap<>(fields))
                .build();
    }
}
