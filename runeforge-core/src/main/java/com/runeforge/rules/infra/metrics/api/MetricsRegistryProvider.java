package com.runeforge.rules.infra.metrics.api;

import com.runeforge.rules.infra.metrics.MetricsRegistry;

/**
 * Service Provider Interface for {@link MetricsRegistry} implementations.
 *
 * <p>Implementations must have a public no-arg constructor, be thread-safe and be listed in
 * {@code META-INF/services/com.runeforge.rules.infra.metrics.api.MetricsRegistryProvider}.
 */
public interface MetricsRegistryProvider {

    MetricsRegistry create();

    /**
     * Higher values are preferred when multiple providers exist.
     */
    default int priority() {
        return 0;
    }

    default String name() {
        return getClass().getSimpleName();
    }
}
