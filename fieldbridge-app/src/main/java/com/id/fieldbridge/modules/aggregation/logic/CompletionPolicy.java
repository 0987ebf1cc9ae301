package com.id.fieldbridge.modules.aggregation.logic;

import com.id.fieldbridge.model.SensorVariant;
import com.id.fieldbridge.modules.aggregation.model.AggregationSettings;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Decides which variants a device must deliver before its entry counts as complete.
 */
public class CompletionPolicy {

    private record DeviceClass(String glob, Pattern pattern, Set<SensorVariant> expected) {
    }

    private final Set<SensorVariant> defaultExpected;
    private final List<DeviceClass> deviceClasses;

    private CompletionPolicy(Set<SensorVariant> defaultExpected, List<DeviceClass> deviceClasses) {
        this.defaultExpected = defaultExpected;
        this.deviceClasses = deviceClasses;
    }

    public static CompletionPolicy from(AggregationSettings settings) {
        return parse(settings.getExpectedVariants(), settings.getDeviceClasses());
    }

    /**
     * @param defaultVariants variant names expected from devices matching no class
     * @param deviceClasses   {@code glob=VARIANT|VARIANT;glob=VARIANT}, may be blank
     */
    public static CompletionPolicy parse(Collection<String> defaultVariants, String deviceClasses) {
        var defaults = parseVariants(defaultVariants);

        List<DeviceClass> classes = new ArrayList<>();
        if (deviceClasses != null && !deviceClasses.isBlank()) {
            for (String definition : deviceClasses.split(";")) {
                if (definition.isBlank()) {
                    continue;
                }
                int eq = definition.indexOf('=');
                if (eq <= 0 || eq == definition.length() - 1) {
                    throw new IllegalArgumentException("Invalid device class definition: '%s'".formatted(definition));
                }
                String glob = definition.substring(0, eq).trim();
                var expected = parseVariants(List.of(definition.substring(eq + 1).split("\\|")));
                classes.add(new DeviceClass(glob, globToPattern(glob), expected));
            }
        }
        return new CompletionPolicy(defaults, List.copyOf(classes));
    }

    public Set<SensorVariant> expectedFor(String deviceId) {
        return deviceClasses.stream()
                .filter(dc -> dc.pattern().matcher(deviceId).matches())
                .findFirst()
                .map(DeviceClass::expected)
                .orElse(defaultExpected);
    }

    private static Set<SensorVariant> parseVariants(Collection<String> names) {
        if (names == null) {
            throw new IllegalArgumentException("Expected variants cannot be null");
        }
        Set<SensorVariant> variants = EnumSet.noneOf(SensorVariant.class);
        for (String name : names) {
            if (name == null || name.isBlank()) {
                continue;
            }
            variants.add(SensorVariant.fromMeasurement(name.trim())
                    .orElseThrow(() -> new IllegalArgumentException("Unknown sensor variant: '%s'".formatted(name))));
        }
        if (variants.isEmpty()) {
            throw new IllegalArgumentException("At least one expected variant is required");
        }
        return Collections.unmodifiableSet(variants);
    }

    private static Pattern globToPattern(String glob) {
        StringBuilder regex = new StringBuilder();
        for (String part : glob.split("\\*", -1)) {
            if (!regex.isEmpty()) {
                regex.append(".*");
            }
            regex.append(Pattern.quote(part));
        }
        return Pattern.compile(regex.toString());
    }
}
