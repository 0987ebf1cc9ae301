package com.id.fieldbridge.modules.decoder.logic;

import com.id.fieldbridge.model.SensorVariant;

import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Static mapping from sensor topic names to record variants.
 * <p>
 * Topics are {@code <prefix>/<sensor>} or {@code <prefix>/<device>/<sensor>}. The legacy multiplexed topic
 * instead names the sensor in the payload's {@code msg_type}, matched by substring in {@link #LEGACY_ORDER}.
 */
public final class TopicTable {

    private static final Map<String, SensorVariant> SENSORS = new LinkedHashMap<>();

    /** Match order for legacy {@code msg_type} values. "ambient_temperature" hits "temperature" first; both are THERMAL. */
    private static final List<String> LEGACY_ORDER = List.of(
            "gps", "temperature", "ndvi", "area", "location", "biomass", "light_state", "crop_type",
            "ambient_temperature", "relative_humidity", "absolute_humidity", "dew_point", "tf_position"
    );

    static {
        SENSORS.put("gps", SensorVariant.LOCATION);
        SENSORS.put("temperature", SensorVariant.THERMAL);
        SENSORS.put("ambient_temperature", SensorVariant.THERMAL);
        SENSORS.put("ndvi", SensorVariant.SPECTRAL);
        SENSORS.put("humidity", SensorVariant.ENVIRONMENTAL);
        SENSORS.put("relative_humidity", SensorVariant.ENVIRONMENTAL);
        SENSORS.put("absolute_humidity", SensorVariant.ENVIRONMENTAL);
        SENSORS.put("dew_point", SensorVariant.ENVIRONMENTAL);
        SENSORS.put("tf_position", SensorVariant.TRANSFORM);
        SENSORS.put("biomass", SensorVariant.PLANT_METRIC);
        SENSORS.put("crop_type", SensorVariant.PLANT_METRIC);
        SENSORS.put("light_state", SensorVariant.PLANT_METRIC);
        SENSORS.put("area", SensorVariant.PLANT_METRIC);
        SENSORS.put("location", SensorVariant.PLANT_METRIC);

        Set<SensorVariant> covered = EnumSet.noneOf(SensorVariant.class);
        covered.addAll(SENSORS.values());
        if (!covered.equals(EnumSet.allOf(SensorVariant.class))) {
            throw new ExceptionInInitializerError("Topic table does not cover every variant: " + covered);
        }
    }

    private TopicTable() {
    }

    /**
     * Where a topic routes to. {@code deviceId} is only set when the topic carries a device segment.
     */
    public record Route(SensorVariant variant, String sensor, String deviceId) {
    }

    public static Optional<Route> resolve(String topic, String prefix) {
        if (topic == null || prefix == null || !topic.startsWith(prefix + "/")) {
            return Optional.empty();
        }
        String[] segments = topic.substring(prefix.length() + 1).split("/");
        if (segments.length == 1) {
            return lookup(segments[0]).map(variant -> new Route(variant, segments[0], null));
        }
        if (segments.length == 2 && !segments[0].isBlank()) {
            return lookup(segments[1]).map(variant -> new Route(variant, segments[1], segments[0]));
        }
        return Optional.empty();
    }

    public static Optional<Route> resolveLegacy(String msgType) {
        if (msgType == null || msgType.isBlank()) {
            return Optional.empty();
        }
        return LEGACY_ORDER.stream()
                .filter(msgType::contains)
                .findFirst()
                .flatMap(sensor -> lookup(sensor).map(variant -> new Route(variant, sensor, null)));
    }

    public static Optional<SensorVariant> lookup(String sensor) {
        return Optional.ofNullable(SENSORS.get(sensor));
    }

    public static Set<String> sensors() {
        return SENSORS.keySet();
    }

    /**
     * Topic filters to subscribe to so that every routable topic is delivered.
     */
    public static List<String> subscriptionFilters(String prefix, String legacyTopic) {
        if (legacyTopic == null || legacyTopic.isBlank()) {
            return List.of(prefix + "/#");
        }
        return List.of(prefix + "/#", legacyTopic);
    }
}
