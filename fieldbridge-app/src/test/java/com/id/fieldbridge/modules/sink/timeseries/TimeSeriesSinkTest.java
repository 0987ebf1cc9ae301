package com.id.fieldbridge.modules.sink.timeseries;

import com.id.fieldbridge.model.SensorVariant;
import com.id.fieldbridge.modules.commit.model.CommitRecord;
import com.id.fieldbridge.modules.commit.model.SealReason;
import com.id.fieldbridge.modules.sink.model.SinkSettings;
import com.id.fieldbridge.modules.sink.model.SinkWriteException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.data.mongodb.core.BulkOperations;
import org.springframework.data.mongodb.core.FindAndReplaceOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class TimeSeriesSinkTest {

    private MongoTemplate mongoTemplate;
    private BulkOperations bulk;
    private TimeSeriesSink sink;

    @BeforeEach
    void setUp() {
        mongoTemplate = mock(MongoTemplate.class);
        bulk = mock(BulkOperations.class);
        when(mongoTemplate.bulkOps(BulkOperations.BulkMode.UNORDERED, TimeSeriesPointEntity.class, "Points")).thenReturn(bulk);
        sink = new TimeSeriesSink(mongoTemplate, SinkSettings.builder().timeSeriesCollection("Points").build());
    }

    private static CommitRecord reading(Map<SensorVariant, Map<String, Object>> variants) {
        Map<SensorVariant, Long> capturedAt = new EnumMap<>(SensorVariant.class);
        capturedAt.put(SensorVariant.LOCATION, 1010L);
        return CommitRecord.builder()
                .idempotencyKey("rover-1_1000")
                .deviceId("rover-1")
                .epoch(1000)
                .sealReason(SealReason.COMPLETE)
                .variants(variants)
                .capturedAt(capturedAt)
                .revision(1)
                .build();
    }

    private static Map<SensorVariant, Map<String, Object>> locationAndThermal() {
        Map<SensorVariant, Map<String, Object>> variants = new EnumMap<>(SensorVariant.class);
        variants.put(SensorVariant.LOCATION, Map.of("latitude", 41.3, "longitude", 2.1));
        variants.put(SensorVariant.THERMAL, Map.of("canopy_temperature", 24.5));
        return variants;
    }

    @Test
    void upsertShouldReplaceOnePointPerMeasurement() throws SinkWriteException {
        sink.upsert(reading(locationAndThermal()));

        ArgumentCaptor<TimeSeriesPointEntity> points = ArgumentCaptor.forClass(TimeSeriesPointEntity.class);
        verify(bulk, times(2)).replaceOne(any(Query.class), points.capture(), any(FindAndReplaceOptions.class));
        verify(bulk).execute();

        List<TimeSeriesPointEntity> written = points.getAllValues();
        assertEquals(List.of("rover-1_1000:location", "rover-1_1000:thermal"), written.stream().map(TimeSeriesPointEntity::getId).toList());

        var location = written.get(0);
        assertEquals("location", location.getMeasurement());
        assertEquals("rover-1", location.getDeviceId());
        assertEquals(1000, location.getTms());
        assertEquals(1010, location.getCapturedAt());
        assertEquals("rover-1_1000", location.getIdempotencyKey());
        assertEquals(1, location.getRevision());
        assertFalse(location.isPartial());

        // No capture time recorded for thermal, falls back to the reading epoch
        assertEquals(1000, written.get(1).getCapturedAt());
        assertEquals(24.5, written.get(1).getFields().get("canopy_temperature"));
    }

    @Test
    void emptyReadingShouldWriteNothing() throws SinkWriteException {
        sink.upsert(reading(new EnumMap<>(SensorVariant.class)));

        verify(mongoTemplate, never()).bulkOps(any(BulkOperations.BulkMode.class), eq(TimeSeriesPointEntity.class), any(String.class));
    }

    @Test
    void bulkTimeoutShouldBeRetryable() {
        when(bulk.execute()).thenThrow(new QueryTimeoutException("bulk write timed out"));

        var e = assertThrows(SinkWriteException.class, () -> sink.upsert(reading(locationAndThermal())));
        assertTrue(e.isRetryable());
    }

    @Test
    void missingIndexesShouldNotFailStartup() {
        when(mongoTemplate.indexOps("Points")).thenThrow(new IllegalStateException("store down"));

        assertDoesNotThrow(() -> sink.ensureIndexes());
    }

    @Test
    void pointShouldMapBackToReadingPoint() {
        var point = TimeSeriesPointEntity.from(reading(locationAndThermal()), SensorVariant.THERMAL).toReadingPoint();

        assertEquals("thermal", point.getMeasurement());
        assertEquals(1000, point.getTms());
        assertEquals("rover-1_1000", point.getIdempotencyKey());
        assertEquals(Map.of("canopy_temperature", 24.5), point.getFields());
    }
}
