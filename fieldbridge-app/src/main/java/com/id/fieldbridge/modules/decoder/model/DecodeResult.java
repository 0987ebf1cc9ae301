package com.id.fieldbridge.modules.decoder.model;

import com.id.fieldbridge.model.SensorRecord;

import java.util.Optional;

/**
 * Outcome of decoding one message: either a record or the reason it was rejected, never both.
 */
public final class DecodeResult {

    private final SensorRecord record;
    private final DecodeError error;

    private DecodeResult(SensorRecord record, DecodeError error) {
        this.record = record;
        this.error = error;
    }

    public static DecodeResult accepted(SensorRecord record) {
        if (record == null) {
            throw new IllegalArgumentException("Record cannot be null");
        }
        return new DecodeResult(record, null);
    }

    public static DecodeResult rejected(DecodeError error) {
        if (error == null) {
            throw new IllegalArgumentException("Error cannot be null");
        }
        return new DecodeResult(null, error);
    }

    public boolean isAccepted() {
        return record != null;
    }

    public Optional<SensorRecord> record() {
        return Optional.ofNullable(record);
    }

    public Optional<DecodeError> error() {
        return Optional.ofNullable(error);
    }
}
