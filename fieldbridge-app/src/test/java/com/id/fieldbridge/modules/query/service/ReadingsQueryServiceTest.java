package com.id.fieldbridge.modules.query.service;

import com.id.fieldbridge.model.SensorVariant;
import com.id.fieldbridge.modules.commit.model.CommitRecord;
import com.id.fieldbridge.modules.commit.model.SealReason;
import com.id.fieldbridge.modules.query.model.PointsQuery;
import com.id.fieldbridge.modules.query.model.ReadingPoint;
import com.id.fieldbridge.modules.sink.timeseries.TimeSeriesSink;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
class ReadingsQueryServiceTest {

    @Container
    static final MongoDBContainer mongoDBContainer = new MongoDBContainer("mongo:8.0");

    @DynamicPropertySource
    static void setMongoUri(DynamicPropertyRegistry registry) {
        registry.add("spring.data.mongodb.uri", mongoDBContainer::getReplicaSetUrl);
    }

    @Autowired
    MongoTemplate mongoTemplate;
    @Autowired
    TimeSeriesSink timeSeriesSink;
    @Autowired
    ReadingsQueryService service;

    @BeforeEach
    void setup() throws Exception {
        mongoTemplate.remove(new Query(), "SensorPoints");

        // rover-1: three epochs with location, the newest also with thermal; rover-2: one older partial
        timeSeriesSink.upsert(reading("rover-1", 1000, false, true));
        timeSeriesSink.upsert(reading("rover-1", 2000, false, true));
        timeSeriesSink.upsert(reading("rover-1", 3000, false, true));
        timeSeriesSink.upsert(reading("rover-2", 500, true, false));
    }

    private static CommitRecord reading(String device, long epoch, boolean partial, boolean withThermal) {
        Map<SensorVariant, Map<String, Object>> variants = new EnumMap<>(SensorVariant.class);
        variants.put(SensorVariant.LOCATION, Map.of("latitude", 41.0 + epoch / 1000.0, "longitude", 2.1));
        if (withThermal) {
            variants.put(SensorVariant.THERMAL, Map.of("canopy_temperature", 20.0 + epoch / 1000.0));
        }
        return CommitRecord.builder()
                .idempotencyKey(CommitRecord.idempotencyKey(device, epoch))
                .deviceId(device)
                .epoch(epoch)
                .partial(partial)
                .sealReason(partial ? SealReason.TIMEOUT : SealReason.COMPLETE)
                .variants(variants)
                .build();
    }

    @Test
    void pointsShouldComeNewestFirstWithLimit() {
        List<ReadingPoint> points = service.findPoints(PointsQuery.builder().variant(SensorVariant.LOCATION).limit(2).build());

        assertEquals(2, points.size());
        assertEquals(3000, points.get(0).getTms());
        assertEquals(2000, points.get(1).getTms());
        assertEquals("location", points.get(0).getMeasurement());
        assertEquals(44.0, points.get(0).getFields().get("latitude"));
    }

    @Test
    void pointsShouldFilterByDeviceAndRange() {
        var byDevice = service.findPoints(PointsQuery.builder().variant(SensorVariant.LOCATION).deviceId("rover-2").limit(10).build());
        assertEquals(1, byDevice.size());
        assertTrue(byDevice.get(0).isPartial());

        var byRange = service.findPoints(PointsQuery.builder().variant(SensorVariant.LOCATION).start(1000L).end(2000L).limit(10).build());
        assertEquals(List.of(2000L, 1000L), byRange.stream().map(ReadingPoint::getTms).toList());
    }

    @Test
    void readingsShouldBeReassembledPerKey() {
        List<CommitRecord> readings = service.findReadings(PointsQuery.builder().limit(2).build());

        assertEquals(2, readings.size());
        CommitRecord newest = readings.get(0);
        assertEquals("rover-1_3000", newest.getIdempotencyKey());
        assertEquals("rover-1", newest.getDeviceId());
        assertEquals(3000, newest.getEpoch());
        assertTrue(newest.hasVariant(SensorVariant.LOCATION));
        assertTrue(newest.hasVariant(SensorVariant.THERMAL));
        assertEquals(23.0, newest.getVariants().get(SensorVariant.THERMAL).get("canopy_temperature"));
        assertEquals("rover-1_2000", readings.get(1).getIdempotencyKey());
    }

    @Test
    void readingsShouldStayWholeWhenDevicesShareATimestamp() throws Exception {
        for (String device : List.of("rover-d", "rover-c", "rover-b", "rover-a")) {
            timeSeriesSink.upsert(reading(device, 9000, false, true));
        }

        List<CommitRecord> readings = service.findReadings(PointsQuery.builder().limit(1).build());

        assertEquals(1, readings.size());
        assertEquals("rover-a_9000", readings.get(0).getIdempotencyKey());
        assertTrue(readings.get(0).hasVariant(SensorVariant.LOCATION));
        assertTrue(readings.get(0).hasVariant(SensorVariant.THERMAL));

        List<CommitRecord> three = service.findReadings(PointsQuery.builder().limit(3).build());
        assertEquals(List.of("rover-a_9000", "rover-b_9000", "rover-c_9000"),
                three.stream().map(CommitRecord::getIdempotencyKey).toList());
        three.forEach(r -> assertEquals(2, r.getVariants().size(), r.getIdempotencyKey()));
    }

    @Test
    void readingsShouldKeepPartialFlag() {
        List<CommitRecord> readings = service.findReadings(PointsQuery.builder().deviceId("rover-2").limit(10).build());

        assertEquals(1, readings.size());
        assertTrue(readings.get(0).isPartial());
        assertFalse(readings.get(0).hasVariant(SensorVariant.THERMAL));
    }
}
