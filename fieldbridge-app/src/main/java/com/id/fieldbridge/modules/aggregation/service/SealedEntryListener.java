package com.id.fieldbridge.modules.aggregation.service;

import com.id.fieldbridge.modules.commit.model.CommitRecord;

/**
 * Receives entries sealed outside of an {@code ingest} call: on timeout or eviction.
 */
@FunctionalInterface
public interface SealedEntryListener {

    void onSealed(CommitRecord record);
}
