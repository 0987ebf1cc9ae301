package com.id.fieldbridge.modules.query.service;

import com.id.fieldbridge.model.SensorVariant;
import com.id.fieldbridge.modules.commit.model.CommitRecord;
import com.id.fieldbridge.modules.query.model.PointsQuery;
import com.id.fieldbridge.modules.query.model.ReadingGroup;
import com.id.fieldbridge.modules.query.model.ReadingPoint;
import com.id.fieldbridge.modules.sink.model.SinkSettings;
import com.id.fieldbridge.modules.sink.timeseries.TimeSeriesPointEntity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.aggregation.Aggregation;
import org.springframework.data.mongodb.core.aggregation.AggregationOperation;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read side of the time-series sink. Never touches the document store.
 */
@Service
@Slf4j
public class ReadingsQueryService {

    private final MongoTemplate mongoTemplate;
    private final String collection;

    public ReadingsQueryService(MongoTemplate mongoTemplate, SinkSettings settings) {
        this.mongoTemplate = mongoTemplate;
        this.collection = settings.getTimeSeriesCollection();
    }

    /**
     * Newest points first, filtered by measurement, device and time range.
     */
    public List<ReadingPoint> findPoints(PointsQuery req) {
        if (req.getLimit() < 1) {
            throw new IllegalArgumentException("Limit must be positive");
        }
        Query query = new Query();
        if (req.getVariant() != null) {
            query.addCriteria(Criteria.where(TimeSeriesPointEntity.MEASUREMENT).is(req.getVariant().getMeasurement()));
        }
        if (req.getDeviceId() != null) {
            query.addCriteria(Criteria.where(TimeSeriesPointEntity.DEVICE_ID).is(req.getDeviceId()));
        }
        timeCriteria(req).ifPresent(query::addCriteria);
        query.with(Sort.by(Sort.Direction.DESC, TimeSeriesPointEntity.TMS)).limit(req.getLimit());

        log.trace("Points query on {}: {}", collection, query);
        return mongoTemplate.find(query, TimeSeriesPointEntity.class, collection).stream()
                .map(TimeSeriesPointEntity::toReadingPoint)
                .toList();
    }

    /**
     * Newest readings first, each reassembled from the points sharing its idempotency key.
     */
    public List<CommitRecord> findReadings(PointsQuery req) {
        if (req.getLimit() < 1) {
            throw new IllegalArgumentException("Limit must be positive");
        }
        List<AggregationOperation> ops = new ArrayList<>();

        List<Criteria> filters = new ArrayList<>();
        if (req.getDeviceId() != null) {
            filters.add(Criteria.where(TimeSeriesPointEntity.DEVICE_ID).is(req.getDeviceId()));
        }
        timeCriteria(req).ifPresent(filters::add);
        if (!filters.isEmpty()) {
            ops.add(Aggregation.match(new Criteria().andOperator(filters.toArray(Criteria[]::new))));
        }

        // Bound the scan: a reading has at most one point per variant, and the key tie-break keeps the points
        // of one reading adjacent when several devices share a timestamp
        ops.add(Aggregation.sort(Sort.by(Sort.Direction.DESC, TimeSeriesPointEntity.TMS)
                .and(Sort.by(Sort.Direction.ASC, TimeSeriesPointEntity.IDEMPOTENCY_KEY))));
        ops.add(Aggregation.limit((long) req.getLimit() * SensorVariant.values().length));

        // Group points by reading, newest reading first
        ops.add(Aggregation.group(TimeSeriesPointEntity.IDEMPOTENCY_KEY)
                .first(TimeSeriesPointEntity.TMS).as("tms")
                .push("$$ROOT").as("points"));
        ops.add(Aggregation.sort(Sort.by(Sort.Direction.DESC, "tms").and(Sort.by(Sort.Direction.ASC, "_id"))));
        ops.add(Aggregation.limit(req.getLimit()));

        return mongoTemplate.aggregate(Aggregation.newAggregation(ops), collection, ReadingGroup.class)
                .getMappedResults().stream()
                .map(ReadingsQueryService::toCommitRecord)
                .toList();
    }

    static CommitRecord toCommitRecord(ReadingGroup group) {
        Map<SensorVariant, Map<String, Object>> variants = new EnumMap<>(SensorVariant.class);
        Map<SensorVariant, Long> capturedAt = new EnumMap<>(SensorVariant.class);
        String deviceId = null;
        boolean partial = false;
        int revision = 0;

        for (TimeSeriesPointEntity point : group.getPoints()) {
            var variant = SensorVariant.fromMeasurement(point.getMeasurement()).orElse(null);
            if (variant == null) {
                log.warn("Skipping point {} with unknown measurement '{}'", point.getId(), point.getMeasurement());
                continue;
            }
            variants.put(variant, point.getFields() == null ? Map.of() : point.getFields());
            capturedAt.put(variant, point.getCapturedAt());
            deviceId = point.getDeviceId();
            partial |= point.isPartial();
            revision = Math.max(revision, point.getRevision());
        }

        return CommitRecord.builder()
                .idempotencyKey(group.getId())
                .deviceId(deviceId)
                .epoch(group.getTms())
                .partial(partial)
                .variants(variants)
                .capturedAt(capturedAt)
                .missingVariants(EnumSet.noneOf(SensorVariant.class))
                .revision(revision)
                .build();
    }

    private static Optional<Criteria> timeCriteria(PointsQuery req) {
        if (req.getStart() == null && req.getEnd() == null) {
            return Optional.empty();
        }
        Criteria tms = Criteria.where(TimeSeriesPointEntity.TMS);
        if (req.getStart() != null) {
            tms = tms.gte(req.getStart());
        }
        if (req.getEnd() != null) {
            tms = tms.lte(req.getEnd());
        }
        return Optional.of(tms);
    }
}
