package com.id.fieldbridge.modules.aggregation.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.List;

@Value
@Builder
public class AggregationSettings {

    @Builder.Default
    Duration epochResolution = Duration.ofSeconds(1);

    @Builder.Default
    Duration windowTimeout = Duration.ofSeconds(2);

    @Builder.Default
    int maxOpenEntries = 10_000;

    @Builder.Default
    int sealedKeyMemory = 4096;

    @Builder.Default
    List<String> expectedVariants = List.of("LOCATION", "THERMAL");

    /**
     * Device classes as {@code glob=VARIANT|VARIANT;glob=VARIANT}, first matching glob wins.
     */
    @Builder.Default
    String deviceClasses = "";

}
