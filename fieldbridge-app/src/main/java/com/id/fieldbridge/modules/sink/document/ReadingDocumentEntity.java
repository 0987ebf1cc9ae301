package com.id.fieldbridge.modules.sink.document;

import com.id.fieldbridge.model.SensorVariant;
import com.id.fieldbridge.modules.commit.model.CommitRecord;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Field;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Full reading as stored in the document collection, one document per idempotency key. Variants are keyed
 * by measurement name.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ReadingDocumentEntity {

    public static final String ID = "id";
    public static final String DEVICE_ID = "deviceId";
    public static final String EPOCH = "epoch";
    public static final String PARTIAL = "partial";
    public static final String REVISION = "revision";

    @Id
    @Field("_id")
    private String id;

    private String deviceId;
    private long epoch;
    private boolean partial;
    private String sealReason;
    private Map<String, Map<String, Object>> variants;
    private Map<String, Long> capturedAt;
    private List<String> missingVariants;
    private long sealedAt;
    private int revision;

    public static ReadingDocumentEntity from(CommitRecord record) {
        Map<String, Map<String, Object>> variants = new LinkedHashMap<>();
        record.getVariants().forEach((variant, fields) -> variants.put(variant.getMeasurement(), new LinkedHashMap<>(fields)));
        Map<String, Long> capturedAt = new LinkedHashMap<>();
        record.getCapturedAt().forEach((variant, tms) -> capturedAt.put(variant.getMeasurement(), tms));

        return ReadingDocumentEntity.builder()
                .id(record.getIdempotencyKey())
                .deviceId(record.getDeviceId())
                .epoch(record.getEpoch())
                .partial(record.isPartial())
                .sealReason(record.getSealReason() == null ? null : record.getSealReason().name())
                .variants(variants)
                .capturedAt(capturedAt)
                .missingVariants(record.getMissingVariants().stream().map(SensorVariant::getMeasurement).toList())
                .sealedAt(record.getSealedAt())
                .revision(record.getRevision())
                .build();
    }
}
