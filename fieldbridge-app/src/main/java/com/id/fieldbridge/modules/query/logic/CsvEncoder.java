package com.id.fieldbridge.modules.query.logic;

import com.id.fieldbridge.model.SensorVariant;
import com.id.fieldbridge.modules.commit.model.CommitRecord;
import com.id.fieldbridge.modules.query.model.ReadingPoint;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Renders query results as RFC 4180 CSV with a {@code time,device,key,partial} prefix. Field columns follow
 * the order in which fields first appear in the rows.
 */
public final class CsvEncoder {

    public static final String CONTENT_TYPE = "text/csv";

    private static final List<String> PREFIX = List.of("time", "device", "key", "partial");
    private static final String EOL = "\r\n";

    private CsvEncoder() {
    }

    public static String encodePoints(List<ReadingPoint> points) {
        Set<String> columns = new LinkedHashSet<>();
        points.forEach(p -> columns.addAll(p.getFields().keySet()));

        StringBuilder csv = new StringBuilder();
        appendHeader(csv, columns);
        for (ReadingPoint point : points) {
            List<Object> row = new ArrayList<>(List.of(
                    Instant.ofEpochMilli(point.getTms()), point.getDeviceId(), point.getIdempotencyKey(), point.isPartial()));
            columns.forEach(c -> row.add(point.getFields().get(c)));
            appendRow(csv, row);
        }
        return csv.toString();
    }

    /**
     * Flattens readings into one row each, field columns named {@code <measurement>.<field>}.
     */
    public static String encodeReadings(List<CommitRecord> readings) {
        Set<String> columns = new LinkedHashSet<>();
        readings.forEach(r -> r.getVariants().forEach((variant, fields) ->
                fields.keySet().forEach(f -> columns.add(column(variant, f)))));

        StringBuilder csv = new StringBuilder();
        appendHeader(csv, columns);
        for (CommitRecord reading : readings) {
            List<Object> row = new ArrayList<>(List.of(
                    Instant.ofEpochMilli(reading.getEpoch()), reading.getDeviceId(), reading.getIdempotencyKey(), reading.isPartial()));
            for (String c : columns) {
                int dot = c.indexOf('.');
                Object value = SensorVariant.fromMeasurement(c.substring(0, dot))
                        .map(v -> reading.getVariants().getOrDefault(v, Map.of()).get(c.substring(dot + 1)))
                        .orElse(null);
                row.add(value);
            }
            appendRow(csv, row);
        }
        return csv.toString();
    }

    static String escape(Object value) {
        if (value == null) {
            return "";
        }
        String text = value.toString();
        if (text.contains(",") || text.contains("\"") || text.contains("\n") || text.contains("\r")) {
            return "\"" + text.replace("\"", "\"\"") + "\"";
        }
        return text;
    }

    private static String column(SensorVariant variant, String field) {
        return variant.getMeasurement() + "." + field;
    }

    private static void appendHeader(StringBuilder csv, Set<String> columns) {
        List<Object> header = new ArrayList<>(PREFIX);
        header.addAll(columns);
        appendRow(csv, header);
    }

    private static void appendRow(StringBuilder csv, List<Object> values) {
        for (int i = 0; i < values.size(); i++) {
            if (i > 0) {
                csv.append(',');
            }
            csv.append(escape(values.get(i)));
        }
        csv.append(EOL);
    }
}
