package com.raditha.unnest.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Loads detection configuration from a YAML file (unnest.yml) with explicit overrides.
 * <p>
 * Configuration priority: overrides > unnest.yml > defaults
 */
public class DetectionSettings {

    private static final Logger logger = LoggerFactory.getLogger(DetectionSettings.class);

    public static final String DEFAULT_RESOURCE = "unnest.yml";
    private static final String CONFIG_KEY = "nesting_detector";

    private static final ObjectMapper mapper = new ObjectMapper(new YAMLFactory());

    private DetectionSettings() {
    }

    /**
     * Load configuration from a YAML file, applying overrides where provided.
     *
     * @param configFile        YAML file to read
     * @param thresholdOverride depth threshold override (0 = use YAML/default)
     * @param presetOverride    preset name override (null = use YAML/default)
     * @return complete detection configuration
     */
    public static DetectionConfig load(Path configFile, int thresholdOverride, String presetOverride)
            throws IOException {
        if (!Files.exists(configFile)) {
            throw new IllegalArgumentException("Config file not found: " + configFile);
        }
        try (InputStream in = Files.newInputStream(configFile)) {
            return fromMap(readSection(in), thresholdOverride, presetOverride);
        }
    }

    /**
     * Load configuration from {@value #DEFAULT_RESOURCE} on the classpath, or defaults when absent.
     */
    public static DetectionConfig loadDefault() throws IOException {
        try (InputStream in = DetectionSettings.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                logger.debug("No {} on classpath, using defaults", DEFAULT_RESOURCE);
                return DetectionConfig.defaults();
            }
            return fromMap(readSection(in), 0, null);
        }
    }

    /**
     * Build configuration from an already parsed {@code nesting_detector} section.
     */
    public static DetectionConfig fromMap(Map<String, Object> config, int thresholdOverride,
            String presetOverride) {
        // Determine preset (override > YAML)
        String preset = presetOverride != null ? presetOverride : getString(config, "preset", null);

        DetectionConfig base = preset != null ? forPreset(preset) : DetectionConfig.defaults();
        if (preset != null && thresholdOverride == 0) {
            return base;
        }

        int threshold = thresholdOverride != 0
                ? thresholdOverride
                : getInt(config, "depth_threshold", base.depthThreshold());

        return new DetectionConfig(
                threshold,
                getInt(config, "max_repair_attempts", base.maxRepairAttempts()),
                getDouble(config, "acceptance_confidence", base.acceptanceConfidence()),
                getInt(config, "medium_severity_depth", base.mediumSeverityDepth()),
                getInt(config, "high_severity_depth", base.highSeverityDepth()),
                getInt(config, "max_passes", base.maxPasses()),
                getLong(config, "suggestion_timeout_millis", base.suggestionTimeoutMillis()));
    }

    static DetectionConfig forPreset(String preset) {
        return switch (preset) {
            case "strict" -> DetectionConfig.strict();
            case "lenient" -> DetectionConfig.lenient();
            default -> DetectionConfig.defaults();
        };
    }

    private static Map<String, Object> readSection(InputStream in) throws IOException {
        Map<String, Object> root = mapper.readValue(in, new TypeReference<Map<String, Object>>() {
        });
        if (root == null) {
            return Map.of();
        }
        Object section = root.get(CONFIG_KEY);
        if (section instanceof Map) {
            @SuppressWarnings("unchecked")
            Map<String, Object> config = (Map<String, Object>) section;
            return config;
        }
        return Map.of();
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        return defaultValue;
    }

    private static long getLong(Map<String, Object> map, String key, long defaultValue) {
        Object value = map.get(key);
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        return defaultValue;
    }

    private static double getDouble(Map<String, Object> map, String key, double defaultValue) {
        Object value = map.get(key);
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        return defaultValue;
    }

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        if (value != null) {
            return value.toString();
        }
        return defaultValue;
    }
}
