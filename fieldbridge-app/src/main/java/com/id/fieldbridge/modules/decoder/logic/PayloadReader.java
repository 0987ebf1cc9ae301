package com.id.fieldbridge.modules.decoder.logic;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.concurrent.TimeUnit;

/**
 * Typed, alias-aware access to the fields of a JSON payload object.
 * <p>
 * Absent, null and NaN values read as {@code null}; values of the wrong type throw
 * {@link IllegalArgumentException} naming the offending field.
 */
class PayloadReader {

    private final JsonNode root;

    PayloadReader(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Payload is not a JSON object");
        }
        this.root = root;
    }

    JsonNode root() {
        return root;
    }

    JsonNode node(String... aliases) {
        for (String alias : aliases) {
            JsonNode value = root.get(alias);
            if (value != null && !value.isNull()) {
                return value;
            }
        }
        return null;
    }

    Double optDouble(String... aliases) {
        return toDouble(node(aliases), aliases[0]);
    }

    Integer optInt(String... aliases) {
        Double value = optDouble(aliases);
        if (value == null) {
            return null;
        }
        if (value != Math.rint(value)) {
            throw new IllegalArgumentException("Field '%s' must be an integer, got %s".formatted(aliases[0], value));
        }
        return value.intValue();
    }

    String optString(String... aliases) {
        JsonNode value = node(aliases);
        if (value == null) {
            return null;
        }
        if (!value.isValueNode()) {
            throw new IllegalArgumentException("Field '%s' must be a scalar".formatted(aliases[0]));
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }

    /**
     * Reads a capture time as epoch millis, numbers being expressed in {@code unit}. Returns null when absent.
     */
    Long optTimestamp(TimeUnit unit, String... aliases) {
        JsonNode value = node(aliases);
        if (value == null) {
            return null;
        }
        if (value.isNumber()) {
            return toMillis(value.asDouble(), unit);
        }
        if (value.isTextual()) {
            String text = value.asText().trim();
            try {
                return toMillis(Double.parseDouble(text), unit);
            } catch (NumberFormatException ignored) {
                // not numeric, try ISO-8601 below
            }
            try {
                return Instant.parse(text).toEpochMilli();
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException("Field '%s' is not a timestamp: %s".formatted(aliases[0], text), e);
            }
        }
        throw new IllegalArgumentException("Field '%s' is not a timestamp".formatted(aliases[0]));
    }

    static Double toDouble(JsonNode value, String fieldName) {
        if (value == null || value.isNull()) {
            return null;
        }
        double result;
        if (value.isNumber()) {
            result = value.asDouble();
        } else if (value.isTextual()) {
            try {
                result = Double.parseDouble(value.asText().trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Field '%s' is not numeric: %s".formatted(fieldName, value.asText()), e);
            }
        } else {
            throw new IllegalArgumentException("Field '%s' is not numeric".formatted(fieldName));
        }
        if (Double.isNaN(result)) {
            return null;
        }
        if (Double.isInfinite(result)) {
            throw new IllegalArgumentException("Field '%s' is not finite".formatted(fieldName));
        }
        return result;
    }

    private static long toMillis(double value, TimeUnit unit) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("Timestamp is not finite");
        }
        double millisPerUnit = unit.toNanos(1) / 1_000_000.0;
        return Math.round(value * millisPerUnit);
    }
}
