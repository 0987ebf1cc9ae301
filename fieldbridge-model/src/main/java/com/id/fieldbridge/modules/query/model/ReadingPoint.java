package com.id.fieldbridge.modules.query.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One time-series point as read back by the query façade: a measurement of one device at one reading epoch.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ReadingPoint {

    private String measurement;
    private String deviceId;
    private long tms;
    private String idempotencyKey;
    private boolean partial;

    @Builder.Default
    private Map<String, Object> fields = new LinkedHashMap<>();

}
