package com.id.fieldbridge.modules.subscription.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

@Value
@Builder
public class PipelineSettings {

    @Builder.Default
    int workerThreads = 8;

    @Builder.Default
    int workerQueueSize = 4096;

    /** Sealed entries wait here for the sink writer, apart from the ingest workers. */
    @Builder.Default
    int commitThreads = 4;

    @Builder.Default
    int commitQueueSize = 1024;

    /** Shared by both pools when draining on shutdown. */
    @Builder.Default
    Duration shutdownGrace = Duration.ofSeconds(10);

}
