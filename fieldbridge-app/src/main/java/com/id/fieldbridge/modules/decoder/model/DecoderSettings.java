package com.id.fieldbridge.modules.decoder.model;

import lombok.Builder;
import lombok.Value;

import java.util.concurrent.TimeUnit;

@Value
@Builder
public class DecoderSettings {

    @Builder.Default
    String topicPrefix = "fieldbridge";

    @Builder.Default
    String legacyTopic = "mqtt/global";

    /** Used when a payload carries no device identity; null rejects such payloads. */
    String defaultDeviceId;

    @Builder.Default
    boolean stampMissingTimestamp = false;

    /** Device identity for legacy multiplexed messages that carry none. */
    @Builder.Default
    String legacyDeviceId = "robot-01";

    /** Legacy publishers only timestamp gps samples, the others are stamped with the receive time. */
    @Builder.Default
    boolean legacyStampMissingTimestamp = true;

    @Builder.Default
    TimeUnit timestampUnit = TimeUnit.MILLISECONDS;

}
