package com.id.fieldbridge.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Small builder for the ordered, null-free field maps exposed by {@link SensorRecord#fields()}.
 */
final class RecordFields {

    private final Map<String, Object> fields = new LinkedHashMap<>();

    private RecordFields() {
    }

    static RecordFields create() {
        return new RecordFields();
    }

    RecordFields put(String name, Object value) {
        if (value != null) {
            fields.put(name, value);
        }
        return this;
    }

    Map<String, Object> build() {
        return Collections.unmodifiableMap(fields);
    }

    static boolean anyPresent(Object... values) {
        for (Object value : values) {
            if (value != null) {
                return true;
            }
        }
        return false;
    }
}
