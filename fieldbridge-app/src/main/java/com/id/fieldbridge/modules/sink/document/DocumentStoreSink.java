package com.id.fieldbridge.modules.sink.document;

import com.id.fieldbridge.modules.commit.model.CommitRecord;
import com.id.fieldbridge.modules.sink.ReadingSink;
import com.id.fieldbridge.modules.sink.logic.SinkErrorClassifier;
import com.id.fieldbridge.modules.sink.model.SinkSettings;
import com.id.fieldbridge.modules.sink.model.SinkWriteException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.stereotype.Component;

/**
 * Stores each sealed reading as one document whose id is the idempotency key.
 */
@Component
@Slf4j
public class DocumentStoreSink implements ReadingSink {

    public static final String NAME = "document";

    private final MongoTemplate mongoTemplate;
    private final String collection;

    public DocumentStoreSink(MongoTemplate mongoTemplate, SinkSettings settings) {
        this.mongoTemplate = mongoTemplate;
        this.collection = settings.getDocumentCollection();
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void upsert(CommitRecord record) throws SinkWriteException {
        var entity = ReadingDocumentEntity.from(record);
        try {
            // save() replaces by _id, a repeated key overwrites the stored reading
            mongoTemplate.save(entity, collection);
        } catch (RuntimeException e) {
            throw SinkErrorClassifier.classify(NAME, e);
        }
        log.trace("Stored reading document {} in {}", entity.getId(), collection);
    }

    public ReadingDocumentEntity findById(String idempotencyKey) {
        return mongoTemplate.findById(idempotencyKey, ReadingDocumentEntity.class, collection);
    }
}
