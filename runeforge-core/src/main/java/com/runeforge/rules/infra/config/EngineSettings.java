package com.runeforge.rules.infra.config;

import java.util.function.UnaryOperator;
import java.util.logging.Logger;

/**
 * Engine configuration read from environment variables, falling back to system properties.
 *
 * <ul>
 *   <li>RUNEFORGE_PREDICATE_CACHE_SIZE: compiled predicate statements kept (default: 10000)</li>
 *   <li>RUNEFORGE_METRICS_ENABLED: record metrics (default: true)</li>
 *   <li>OTEL_DISABLED: disable tracing entirely (default: false)</li>
 *   <li>OTEL_TRACE_SAMPLING_RATIO: 0.0-1.0 (default: 1.0)</li>
 *   <li>SERVICE_NAME: service identifier on spans (default: runeforge-rules)</li>
 * </ul>
 */
public record EngineSettings(
        long predicateCacheSize,
        boolean metricsEnabled,
        boolean tracingDisabled,
        double samplingRatio,
        String serviceName
) {
    private static final Logger logger = Logger.getLogger(EngineSettings.class.getName());

    public static final long DEFAULT_PREDICATE_CACHE_SIZE = 10_000;
    public static final String DEFAULT_SERVICE_NAME = "runeforge-rules";

    public EngineSettings {
        if (predicateCacheSize < 0) {
            throw new IllegalArgumentException("predicateCacheSize must not be negative: " + predicateCacheSize);
        }
        samplingRatio = Math.max(0.0, Math.min(1.0, samplingRatio));
    }

    public static EngineSettings defaults() {
        return new EngineSettings(DEFAULT_PREDICATE_CACHE_SIZE, true, false, 1.0, DEFAULT_SERVICE_NAME);
    }

    public static EngineSettings fromEnvironment() {
        return from(EngineSettings::getEnvOrProperty);
    }

    /**
     * Builds settings from an arbitrary key lookup; a lookup returning {@code null} means unset.
     */
    static EngineSettings from(UnaryOperator<String> lookup) {
        return new EngineSettings(
                parseLong(lookup, "RUNEFORGE_PREDICATE_CACHE_SIZE", DEFAULT_PREDICATE_CACHE_SIZE),
                Boolean.parseBoolean(valueOr(lookup, "RUNEFORGE_METRICS_ENABLED", "true")),
                Boolean.parseBoolean(valueOr(lookup, "OTEL_DISABLED", "false")),
                parseDouble(lookup, "OTEL_TRACE_SAMPLING_RATIO", 1.0),
                valueOr(lookup, "SERVICE_NAME", DEFAULT_SERVICE_NAME));
    }

    public EngineSettings withPredicateCacheSize(long size) {
        return new EngineSettings(size, metricsEnabled, tracingDisabled, samplingRatio, serviceName);
    }

    private static String valueOr(UnaryOperator<String> lookup, String key, String defaultValue) {
        String value = lookup.apply(key);
        return value == null || value.isBlank() ? defaultValue : value.trim();
    }

    private static long parseLong(UnaryOperator<String> lookup, String key, long defaultValue) {
        String value = valueOr(lookup, key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            long parsed = Long.parseLong(value);
            if (parsed >= 0) {
                return parsed;
            }
        } catch (NumberFormatException e) {
            // fall through to the warning below
        }
        logger.warning("Invalid " + key + "='" + value + "', using default " + defaultValue);
        return defaultValue;
    }

    private static double parseDouble(UnaryOperator<String> lookup, String key, double defaultValue) {
        String value = valueOr(lookup, key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            logger.warning("Invalid " + key + "='" + value + "', using default " + defaultValue);
            return defaultValue;
        }
    }

    /**
     * Get value from environment variable, falling back to system property.
     */
    static String getEnvOrProperty(String key) {
        String value = System.getenv(key);
        if (value == null || value.isEmpty()) {
            value = System.getProperty(key);
        }
        return value;
    }
}
