package com.id.fieldbridge.modules.aggregation.model;

import com.id.fieldbridge.modules.commit.model.CommitRecord;

/**
 * Identity of an aggregate entry: a device and its reading epoch (capture time rounded down to the
 * epoch resolution).
 */
public record EntryKey(String deviceId, long epoch) {

    public static EntryKey of(String deviceId, long timestamp, long resolutionMillis) {
        return new EntryKey(deviceId, timestamp - (timestamp % resolutionMillis));
    }

    public String idempotencyKey() {
        return CommitRecord.idempotencyKey(deviceId, epoch);
    }
}
