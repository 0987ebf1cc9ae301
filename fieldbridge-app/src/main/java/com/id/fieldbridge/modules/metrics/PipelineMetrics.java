package com.id.fieldbridge.modules.metrics;

import com.id.fieldbridge.model.SensorVariant;
import com.id.fieldbridge.modules.commit.model.SealReason;
import com.id.fieldbridge.modules.decoder.model.DecodeErrorKind;
import com.id.fieldbridge.modules.sink.model.SinkWriteStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Counters and timers of the bridge pipeline, all published under {@code fieldbridge.*}.
 */
@Component
public class PipelineMetrics {

    private final MeterRegistry meterRegistry;

    private final Counter messagesReceived;
    private final Counter duplicateDeliveries;
    private final Counter pipelineRejected;
    private final Counter reconnects;

    public PipelineMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.messagesReceived = Counter.builder("fieldbridge.transport.messages")
                .description("Messages delivered by the transport")
                .register(meterRegistry);

        this.duplicateDeliveries = Counter.builder("fieldbridge.transport.duplicates")
                .description("Messages flagged as redelivered by the transport")
                .register(meterRegistry);

        this.pipelineRejected = Counter.builder("fieldbridge.pipeline.rejected")
                .description("Decoded records dropped because the worker queue was full")
                .register(meterRegistry);

        this.reconnects = Counter.builder("fieldbridge.transport.reconnects")
                .description("Reconnect attempts after a transport loss")
                .register(meterRegistry);
    }

    public void messageReceived(boolean duplicate) {
        messagesReceived.increment();
        if (duplicate) {
            duplicateDeliveries.increment();
        }
    }

    public void decodeAccepted(SensorVariant variant) {
        meterRegistry.counter("fieldbridge.decode.accepted", "variant", variant.getMeasurement()).increment();
    }

    public void decodeRejected(DecodeErrorKind kind) {
        meterRegistry.counter("fieldbridge.decode.rejected", "reason", kind.name().toLowerCase()).increment();
    }

    public void entrySealed(SealReason reason) {
        meterRegistry.counter("fieldbridge.aggregation.sealed", "reason", reason.name().toLowerCase()).increment();
    }

    public void lateArrival(boolean reopened) {
        meterRegistry.counter("fieldbridge.aggregation.late", "outcome", reopened ? "reopened" : "dropped").increment();
    }

    public void sinkWrite(String sink, SinkWriteStatus status, Duration duration) {
        meterRegistry.counter("fieldbridge.sink.writes", "sink", sink, "status", status.name().toLowerCase()).increment();
        Timer.builder("fieldbridge.sink.latency")
                .tag("sink", sink)
                .register(meterRegistry)
                .record(duration);
    }

    public void sinkRetry(String sink) {
        meterRegistry.counter("fieldbridge.sink.retries", "sink", sink).increment();
    }

    public void pipelineRejected() {
        pipelineRejected.increment();
    }

    public void stageFailure(String stage) {
        meterRegistry.counter("fieldbridge.pipeline.failures", "stage", stage).increment();
    }

    public void reconnectAttempt() {
        reconnects.increment();
    }

    public void registerOpenEntriesGauge(Supplier<Number> openEntries) {
        Gauge.builder("fieldbridge.aggregation.open", openEntries)
                .description("Aggregate entries currently open")
                .register(meterRegistry);
    }
}
