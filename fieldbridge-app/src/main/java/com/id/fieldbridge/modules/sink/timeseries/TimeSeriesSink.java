package com.id.fieldbridge.modules.sink.timeseries;

import com.id.fieldbridge.model.SensorVariant;
import com.id.fieldbridge.modules.commit.model.CommitRecord;
import com.id.fieldbridge.modules.sink.ReadingSink;
import com.id.fieldbridge.modules.sink.logic.SinkErrorClassifier;
import com.id.fieldbridge.modules.sink.model.SinkSettings;
import com.id.fieldbridge.modules.sink.model.SinkWriteException;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.BulkOperations;
import org.springframework.data.mongodb.core.FindAndReplaceOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.stereotype.Component;

import static org.springframework.data.mongodb.core.query.Criteria.where;
import static org.springframework.data.mongodb.core.query.Query.query;

/**
 * Writes one point per measurement of a sealed reading, tagged with measurement name and reading epoch.
 */
@Component
@Slf4j
public class TimeSeriesSink implements ReadingSink {

    public static final String NAME = "timeseries";

    private final MongoTemplate mongoTemplate;
    private final String collection;

    public TimeSeriesSink(MongoTemplate mongoTemplate, SinkSettings settings) {
        this.mongoTemplate = mongoTemplate;
        this.collection = settings.getTimeSeriesCollection();
    }

    @PostConstruct
    public void ensureIndexes() {
        try {
            var indexOps = mongoTemplate.indexOps(collection);
            indexOps.ensureIndex(new Index()
                    .on(TimeSeriesPointEntity.MEASUREMENT, Sort.Direction.ASC)
                    .on(TimeSeriesPointEntity.TMS, Sort.Direction.DESC)
                    .named("measurement_tms_idx"));
            indexOps.ensureIndex(new Index()
                    .on(TimeSeriesPointEntity.TMS, Sort.Direction.DESC)
                    .named("tms_idx"));
        } catch (RuntimeException e) {
            // The store may still be down at startup, queries then run unindexed until the next restart
            log.warn("Could not ensure indexes on {}: {}", collection, e.getMessage());
        }
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void upsert(CommitRecord record) throws SinkWriteException {
        if (record.getVariants().isEmpty()) {
            log.debug("Reading {} has no variants, nothing to write", record.getIdempotencyKey());
            return;
        }

        try {
            var bulk = mongoTemplate.bulkOps(BulkOperations.BulkMode.UNORDERED, TimeSeriesPointEntity.class, collection);
            for (SensorVariant variant : record.getVariants().keySet()) {
                var point = TimeSeriesPointEntity.from(record, variant);
                bulk.replaceOne(query(where(TimeSeriesPointEntity.ID).is(point.getId())), point, FindAndReplaceOptions.options().upsert());
            }
            bulk.execute();
        } catch (RuntimeException e) {
            throw SinkErrorClassifier.classify(NAME, e);
        }
        log.trace("Stored {} points for {} in {}", record.getVariants().size(), record.getIdempotencyKey(), collection);
    }
}
