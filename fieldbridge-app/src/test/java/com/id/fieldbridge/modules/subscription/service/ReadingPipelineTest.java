package com.id.fieldbridge.modules.subscription.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.id.fieldbridge.model.LocationRecord;
import com.id.fieldbridge.model.SensorVariant;
import com.id.fieldbridge.model.ThermalRecord;
import com.id.fieldbridge.modules.aggregation.model.AggregationSettings;
import com.id.fieldbridge.modules.aggregation.service.AggregationWindow;
import com.id.fieldbridge.modules.commit.model.CommitRecord;
import com.id.fieldbridge.modules.commit.model.SealReason;
import com.id.fieldbridge.modules.decoder.logic.TopicDecoder;
import com.id.fieldbridge.modules.decoder.model.DecoderSettings;
import com.id.fieldbridge.modules.metrics.PipelineMetrics;
import com.id.fieldbridge.modules.sink.ReadingSink;
import com.id.fieldbridge.modules.sink.model.SinkSettings;
import com.id.fieldbridge.modules.sink.service.DualSinkWriter;
import com.id.fieldbridge.modules.subscription.model.InboundMessage;
import com.id.fieldbridge.modules.subscription.model.PipelineSettings;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ReadingPipelineTest {

    /**
     * Records every commit it receives.
     */
    static class RecordingSink implements ReadingSink {

        private final String name;
        final BlockingQueue<CommitRecord> received = new LinkedBlockingQueue<>();

        RecordingSink(String name) {
            this.name = name;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public void upsert(CommitRecord record) {
            received.add(record);
        }
    }

    /**
     * Holds every upsert until released.
     */
    static class BlockingSink implements ReadingSink {

        final CountDownLatch entered;
        final CountDownLatch release = new CountDownLatch(1);

        BlockingSink(int expectedWrites) {
            this.entered = new CountDownLatch(expectedWrites);
        }

        @Override
        public String name() {
            return "blocking";
        }

        @Override
        public void upsert(CommitRecord record) {
            entered.countDown();
            try {
                release.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private SimpleMeterRegistry registry;
    private RecordingSink documents;
    private RecordingSink points;
    private AggregationWindow window;
    private DualSinkWriter writer;
    private ReadingPipeline pipeline;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        var metrics = new PipelineMetrics(registry);
        documents = new RecordingSink("document");
        points = new RecordingSink("timeseries");

        var decoder = new TopicDecoder(new ObjectMapper(), DecoderSettings.builder().build(), metrics);
        window = new AggregationWindow(AggregationSettings.builder().windowTimeout(Duration.ofMillis(200)).build(), metrics);
        writer = new DualSinkWriter(List.of(documents, points), SinkSettings.builder().writerThreads(2).build(), metrics);
        pipeline = new ReadingPipeline(decoder, window, writer, PipelineSettings.builder().workerThreads(2).build(), metrics);
        pipeline.init();
    }

    @AfterEach
    void tearDown() {
        pipeline.shutdown();
        window.shutdown();
        writer.shutdown();
    }

    private static InboundMessage message(String topic, String json) {
        return new InboundMessage(topic, json.getBytes(StandardCharsets.UTF_8), 1, 1, false);
    }

    @Test
    void locationAndThermalShouldCommitOnceToBothSinks() throws InterruptedException {
        AtomicInteger acks = new AtomicInteger();

        pipeline.handle(message("fieldbridge/gps", "{\"device\":\"rover-1\",\"t\":1000,\"lat\":41.3,\"lon\":2.1}"), acks::incrementAndGet);
        pipeline.handle(message("fieldbridge/temperature", "{\"device\":\"rover-1\",\"t\":1000,\"canopy_temp\":24.5}"), acks::incrementAndGet);

        CommitRecord document = documents.received.poll(5, TimeUnit.SECONDS);
        CommitRecord point = points.received.poll(5, TimeUnit.SECONDS);
        assertNotNull(document);
        assertNotNull(point);
        assertEquals(2, acks.get());

        assertEquals("rover-1_1000", document.getIdempotencyKey());
        assertFalse(document.isPartial());
        assertEquals(SealReason.COMPLETE, document.getSealReason());
        assertEquals(41.3, document.getVariants().get(SensorVariant.LOCATION).get("latitude"));
        assertEquals(24.5, document.getVariants().get(SensorVariant.THERMAL).get("canopy_temperature"));
        assertSame(document, point);

        // Nothing else is committed once the timeout has passed
        assertNull(documents.received.poll(400, TimeUnit.MILLISECONDS));
        assertTrue(points.received.isEmpty());
    }

    @Test
    void locationAloneShouldCommitPartialAfterTimeout() throws InterruptedException {
        pipeline.handle(message("fieldbridge/gps", "{\"device\":\"rover-1\",\"t\":1000,\"lat\":41.3,\"lon\":2.1}"), () -> { });

        CommitRecord document = documents.received.poll(5, TimeUnit.SECONDS);
        assertNotNull(document, "Partial reading was never committed");
        assertTrue(document.isPartial());
        assertEquals(SealReason.TIMEOUT, document.getSealReason());
        assertFalse(document.hasVariant(SensorVariant.THERMAL));
        assertTrue(document.getMissingVariants().contains(SensorVariant.THERMAL));
        assertNotNull(points.received.poll(5, TimeUnit.SECONDS));
    }

    @Test
    void malformedMessageShouldBeAcknowledgedAndDropped() throws InterruptedException {
        AtomicInteger acks = new AtomicInteger();

        pipeline.handle(message("fieldbridge/gps", "{not json"), acks::incrementAndGet);
        pipeline.handle(message("fieldbridge/unknown_sensor", "{\"t\":1000}"), acks::incrementAndGet);

        assertEquals(2, acks.get());
        assertNull(documents.received.poll(400, TimeUnit.MILLISECONDS));
        assertEquals(0, window.openEntries());
        assertEquals(2.0, registry.counter("fieldbridge.transport.messages").count());
    }

    @Test
    void failingAcknowledgementShouldNotStopTheRecord() throws InterruptedException {
        pipeline.handle(message("fieldbridge/gps", "{\"device\":\"rover-1\",\"t\":1000,\"lat\":41.3,\"lon\":2.1}"),
                () -> { throw new IllegalStateException("broker gone"); });
        pipeline.handle(message("fieldbridge/temperature", "{\"device\":\"rover-1\",\"t\":1000,\"canopy_temp\":24.5}"), () -> { });

        assertNotNull(documents.received.poll(5, TimeUnit.SECONDS));
        assertEquals(1.0, registry.counter("fieldbridge.pipeline.failures", "stage", "ack").count());
    }

    @Test
    void slowSinkShouldNotStallIngestForOtherDevices() throws InterruptedException {
        var metrics = new PipelineMetrics(new SimpleMeterRegistry());
        var sink = new BlockingSink(2);
        var slowWindow = new AggregationWindow(AggregationSettings.builder().windowTimeout(Duration.ofSeconds(5)).build(), metrics);
        var slowWriter = new DualSinkWriter(List.of(sink), SinkSettings.builder().writerThreads(4).build(), metrics);
        var slowPipeline = new ReadingPipeline(new TopicDecoder(new ObjectMapper(), DecoderSettings.builder().build(), metrics),
                slowWindow, slowWriter, PipelineSettings.builder().workerThreads(2).build(), metrics);
        slowPipeline.init();

        try {
            for (String device : List.of("a", "b")) {
                slowPipeline.handle(message("fieldbridge/gps", "{\"device\":\"" + device + "\",\"t\":1000,\"lat\":41.3,\"lon\":2.1}"), () -> { });
                slowPipeline.handle(message("fieldbridge/temperature", "{\"device\":\"" + device + "\",\"t\":1000,\"canopy_temp\":24.5}"), () -> { });
            }
            assertTrue(sink.entered.await(5, TimeUnit.SECONDS), "Both commits should be stuck in the sink");

            slowPipeline.handle(message("fieldbridge/gps", "{\"device\":\"c\",\"t\":1000,\"lat\":41.3,\"lon\":2.1}"), () -> { });

            long deadline = System.currentTimeMillis() + 2000;
            while (slowWindow.openEntries() == 0 && System.currentTimeMillis() < deadline) {
                Thread.sleep(10);
            }
            assertEquals(1, slowWindow.openEntries());
        } finally {
            sink.release.countDown();
            slowPipeline.shutdown();
            slowWindow.shutdown();
            slowWriter.shutdown();
        }
    }

    @Test
    void processShouldCommitSynchronously() {
        pipeline.process(new LocationRecord("rover-2", "fieldbridge/gps", 5000, 41.0, 2.0, null, null, null));
        var result = pipeline.process(new ThermalRecord("rover-2", "fieldbridge/temperature", 5000, 21.0, null, null, null));

        assertTrue(result.isPresent());
        assertTrue(result.get().isFullyWritten());
        assertEquals("rover-2_5000", result.get().idempotencyKey());
    }

    @Test
    void shutdownShouldCommitOpenEntries() throws InterruptedException {
        window.ingest(new LocationRecord("rover-3", "fieldbridge/gps", 7000, 41.0, 2.0, null, null, null));

        pipeline.shutdown();

        CommitRecord document = documents.received.poll(1, TimeUnit.SECONDS);
        assertNotNull(document);
        assertEquals(SealReason.SHUTDOWN, document.getSealReason());
        assertTrue(document.isPartial());
    }
}
