package com.id.fieldbridge.modules.sink.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

@Value
@Builder
public class SinkSettings {

    @Builder.Default
    String documentCollection = "SensorReadings";

    @Builder.Default
    String timeSeriesCollection = "SensorPoints";

    @Builder.Default
    int maxAttempts = 5;

    @Builder.Default
    Duration initialBackoff = Duration.ofMillis(200);

    @Builder.Default
    Duration maxBackoff = Duration.ofSeconds(5);

    /** Upper bound for all attempts against one sink for one entry. */
    @Builder.Default
    Duration writeTimeout = Duration.ofSeconds(15);

    @Builder.Default
    int writerThreads = 8;

    @Builder.Default
    int writerQueueSize = 1024;

}
