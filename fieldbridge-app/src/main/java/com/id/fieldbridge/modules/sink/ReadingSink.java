package com.id.fieldbridge.modules.sink;

import com.id.fieldbridge.modules.commit.model.CommitRecord;
import com.id.fieldbridge.modules.sink.model.SinkWriteException;

/**
 * Persistence backend for sealed readings.
 * <p>
 * Implementations must be idempotent per {@link CommitRecord#getIdempotencyKey()}: writing the same key again
 * replaces the stored copy.
 */
public interface ReadingSink {

    String name();

    void upsert(CommitRecord record) throws SinkWriteException;
}
