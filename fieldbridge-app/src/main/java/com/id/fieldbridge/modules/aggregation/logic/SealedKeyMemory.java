package com.id.fieldbridge.modules.aggregation.logic;

import com.id.fieldbridge.modules.aggregation.model.EntryKey;
import com.id.fieldbridge.modules.commit.model.CommitRecord;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Bounded, least-recently-sealed-first memory of the last commit of each key.
 */
public class SealedKeyMemory {

    private final int capacity;
    private final Map<EntryKey, CommitRecord> sealed;

    public SealedKeyMemory(int capacity) {
        if (capacity < 0) {
            throw new IllegalArgumentException("Capacity cannot be negative");
        }
        this.capacity = capacity;
        this.sealed = new LinkedHashMap<>(16, 0.75f, false) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<EntryKey, CommitRecord> eldest) {
                return size() > SealedKeyMemory.this.capacity;
            }
        };
    }

    public synchronized void remember(EntryKey key, CommitRecord record) {
        if (capacity == 0) {
            return;
        }
        // Re-insert so a re-sealed key counts as recent again. The copy keeps setters on the committed
        // instance from reaching what a reopened entry is seeded with.
        sealed.remove(key);
        sealed.put(key, record.toBuilder().build());
    }

    public synchronized CommitRecord get(EntryKey key) {
        return sealed.get(key);
    }

    public synchronized int size() {
        return sealed.size();
    }
}
