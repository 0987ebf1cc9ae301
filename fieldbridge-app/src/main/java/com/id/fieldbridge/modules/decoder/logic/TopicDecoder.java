package com.id.fieldbridge.modules.decoder.logic;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.id.fieldbridge.model.EnvironmentalRecord;
import com.id.fieldbridge.model.LocationRecord;
import com.id.fieldbridge.model.PlantMetricRecord;
import com.id.fieldbridge.model.SensorRecord;
import com.id.fieldbridge.model.SpectralRecord;
import com.id.fieldbridge.model.ThermalRecord;
import com.id.fieldbridge.model.TransformRecord;
import com.id.fieldbridge.modules.decoder.model.DecodeError;
import com.id.fieldbridge.modules.decoder.model.DecodeResult;
import com.id.fieldbridge.modules.decoder.model.DecoderSettings;
import com.id.fieldbridge.modules.metrics.PipelineMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Turns a raw transport message into a typed {@link SensorRecord}.
 * <p>
 * Stateless with respect to persisted data and safe to call concurrently. Rejections are logged and counted,
 * never thrown.
 */
@Component
@Slf4j
public class TopicDecoder {

    static final String MSG_TYPE = "msg_type";

    private static final long UNKNOWN_TOPIC_WARN_INTERVAL_MS = 60_000L;
    private static final int UNKNOWN_TOPIC_WARN_CAPACITY = 1024;

    private final ObjectReader jsonReader;
    private final DecoderSettings settings;
    private final PipelineMetrics metrics;
    private final Map<String, Long> unknownTopicWarnings = new ConcurrentHashMap<>();

    public TopicDecoder(ObjectMapper objectMapper, DecoderSettings settings, PipelineMetrics metrics) {
        // Sensor publishers emit bare NaN for missing samples
        this.jsonReader = objectMapper.reader().with(JsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS);
        this.settings = settings;
        this.metrics = metrics;
    }

    public List<String> subscriptionFilters() {
        return TopicTable.subscriptionFilters(settings.getTopicPrefix(), settings.getLegacyTopic());
    }

    public DecodeResult decode(String topic, byte[] payload) {
        DecodeResult result;
        try {
            result = decodeOrReject(topic, payload);
        } catch (RuntimeException e) {
            // Anything not anticipated by the field readers still only drops the message
            result = DecodeResult.rejected(DecodeError.malformed(topic, "Unexpected decode failure: " + e.getMessage()));
        }

        result.record().ifPresent(record -> metrics.decodeAccepted(record.variant()));
        result.error().ifPresent(this::reportRejection);
        return result;
    }

    private DecodeResult decodeOrReject(String topic, byte[] payload) {
        boolean legacy = topic != null && topic.equals(settings.getLegacyTopic());
        var route = legacy ? null : TopicTable.resolve(topic, settings.getTopicPrefix()).orElse(null);
        if (!legacy && route == null) {
            return DecodeResult.rejected(DecodeError.unknownTopic(topic));
        }

        if (payload == null || payload.length == 0) {
            return DecodeResult.rejected(DecodeError.malformed(topic, "Empty payload"));
        }

        PayloadReader reader;
        try {
            JsonNode root = jsonReader.readTree(payload);
            reader = new PayloadReader(root);
        } catch (JsonProcessingException e) {
            return DecodeResult.rejected(DecodeError.malformed(topic, "Invalid JSON: " + e.getOriginalMessage()));
        } catch (IOException e) {
            return DecodeResult.rejected(DecodeError.malformed(topic, "Unreadable payload: " + e.getMessage()));
        } catch (IllegalArgumentException e) {
            return DecodeResult.rejected(DecodeError.malformed(topic, e.getMessage()));
        }

        if (legacy) {
            String msgType = reader.optString(MSG_TYPE);
            if (msgType == null) {
                return DecodeResult.rejected(DecodeError.malformed(topic, "Missing msg_type on multiplexed topic"));
            }
            route = TopicTable.resolveLegacy(msgType).orElse(null);
            if (route == null) {
                return DecodeResult.rejected(DecodeError.malformed(topic, "Unsupported msg_type '%s'".formatted(msgType)));
            }
        }

        try {
            String deviceId = resolveDeviceId(reader, route, legacy);
            long timestamp = resolveTimestamp(reader, legacy);
            return DecodeResult.accepted(buildRecord(route, reader, topic, deviceId, timestamp));
        } catch (IllegalArgumentException e) {
            return DecodeResult.rejected(DecodeError.malformed(topic, e.getMessage()));
        }
    }

    private String resolveDeviceId(PayloadReader reader, TopicTable.Route route, boolean legacy) {
        String deviceId = reader.optString("device", "device_id", "deviceId");
        if (deviceId == null) {
            deviceId = route.deviceId();
        }
        if (deviceId == null && legacy) {
            // The multiplexed topic is fed by a single robot that never names itself
            deviceId = settings.getLegacyDeviceId();
        }
        if (deviceId == null) {
            deviceId = settings.getDefaultDeviceId();
        }
        if (deviceId == null || deviceId.isBlank()) {
            throw new IllegalArgumentException("Missing device identity");
        }
        return deviceId;
    }

    private long resolveTimestamp(PayloadReader reader, boolean legacy) {
        Long timestamp = reader.optTimestamp(settings.getTimestampUnit(), "t", "timestamp", "tms");
        if (timestamp == null) {
            boolean stamp = settings.isStampMissingTimestamp() || (legacy && settings.isLegacyStampMissingTimestamp());
            if (!stamp) {
                throw new IllegalArgumentException("Missing timestamp");
            }
            timestamp = System.currentTimeMillis();
        }
        return timestamp;
    }

    private SensorRecord buildRecord(TopicTable.Route route, PayloadReader r, String topic, String deviceId, long ts) {
        return switch (route.variant()) {
            case LOCATION -> new LocationRecord(deviceId, topic, ts,
                    r.optDouble("lat", "latitude"),
                    r.optDouble("lon", "lng", "longitude"),
                    r.optDouble("alt", "altitude"),
                    r.optInt("status", "fix_status"),
                    r.optInt("service"));
            case THERMAL -> buildThermal(r, topic, deviceId, ts);
            case SPECTRAL -> new SpectralRecord(deviceId, topic, ts,
                    r.optDouble("ndvi"),
                    r.optDouble("ndvi_3d", "ndvi3d"),
                    r.optDouble("ir", "infrared"),
                    r.optDouble("visible"));
            case ENVIRONMENTAL -> new EnvironmentalRecord(deviceId, topic, ts,
                    r.optDouble("relative_humidity", "humidity"),
                    r.optDouble("absolute_humidity"),
                    r.optDouble("dew_point", "dewPoint"));
            case TRANSFORM -> buildTransform(r, topic, deviceId, ts);
            case PLANT_METRIC -> new PlantMetricRecord(deviceId, topic, ts,
                    r.optDouble("biomass"),
                    r.optString("crop_type", "cropType"),
                    r.optString("light_state", "lightState"),
                    r.optDouble("area"),
                    r.optString("location", "location_label"));
        };
    }

    private ThermalRecord buildThermal(PayloadReader r, String topic, String deviceId, long ts) {
        Double ambient = r.optDouble("ambient_temperature", "ambientTemp", "ambient");
        JsonNode plants = r.node("plants");
        if (plants != null && plants.isArray() && !plants.isEmpty()) {
            double canopySum = 0.0;
            int canopyCount = 0;
            double cwsiSum = 0.0;
            int cwsiCount = 0;
            for (JsonNode plant : plants) {
                if (!plant.isObject()) {
                    throw new IllegalArgumentException("Plant entries must be objects");
                }
                Double canopy = PayloadReader.toDouble(plant.get("canopy_temperature"), "plants.canopy_temperature");
                if (canopy != null) {
                    canopySum += canopy;
                    canopyCount++;
                }
                Double cwsi = PayloadReader.toDouble(plant.get("cwsi"), "plants.cwsi");
                if (cwsi != null) {
                    cwsiSum += cwsi;
                    cwsiCount++;
                }
            }
            return new ThermalRecord(deviceId, topic, ts,
                    canopyCount == 0 ? null : canopySum / canopyCount,
                    cwsiCount == 0 ? null : cwsiSum / cwsiCount,
                    plants.size(),
                    ambient);
        }

        return new ThermalRecord(deviceId, topic, ts,
                r.optDouble("canopy_temp", "canopy_temperature"),
                r.optDouble("cwsi"),
                r.optInt("entity_count"),
                ambient);
    }

    private TransformRecord buildTransform(PayloadReader r, String topic, String deviceId, long ts) {
        PayloadReader source = r;
        JsonNode point = r.node("point");
        if (r.node("x") == null && point != null && point.isObject()) {
            source = new PayloadReader(point);
        }
        Double x = source.optDouble("x");
        Double y = source.optDouble("y");
        Double z = source.optDouble("z");
        if (x == null || y == null || z == null) {
            throw new IllegalArgumentException("Transform requires x, y and z");
        }
        return new TransformRecord(deviceId, topic, ts, x, y, z);
    }

    private void reportRejection(DecodeError error) {
        metrics.decodeRejected(error.kind());
        switch (error.kind()) {
            case UNKNOWN_TOPIC -> {
                // One warning per topic and interval, devices keep publishing on a wrong topic
                long now = System.currentTimeMillis();
                String topic = String.valueOf(error.topic());
                Long next = unknownTopicWarnings.get(topic);
                if (next == null || next < now) {
                    if (unknownTopicWarnings.size() >= UNKNOWN_TOPIC_WARN_CAPACITY) {
                        unknownTopicWarnings.clear();
                    }
                    log.warn("Dropping message on unknown topic '{}'", topic);
                    unknownTopicWarnings.put(topic, now + UNKNOWN_TOPIC_WARN_INTERVAL_MS);
                } else {
                    log.debug("Dropping message on unknown topic '{}'", topic);
                }
            }
            case MALFORMED_PAYLOAD -> log.warn("Dropping malformed payload on '{}': {}", error.topic(), error.detail());
        }
    }
}
