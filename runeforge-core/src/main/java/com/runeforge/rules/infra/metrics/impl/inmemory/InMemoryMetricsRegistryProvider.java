package com.runeforge.rules.infra.metrics.impl.inmemory;

import com.runeforge.rules.infra.metrics.MetricsRegistry;
import com.runeforge.rules.infra.metrics.api.MetricsRegistryProvider;

/**
 * In-memory metrics provider for testing.
 *
 * <p>To enable in tests, create
 * {@code src/test/resources/META-INF/services/com.runeforge.rules.infra.metrics.api.MetricsRegistryProvider}
 * containing {@code com.runeforge.rules.infra.metrics.impl.inmemory.InMemoryMetricsRegistryProvider}.
 */
public final class InMemoryMetricsRegistryProvider implements MetricsRegistryProvider {

    @Override
    public MetricsRegistry create() {
        return new InMemoryMetricsRegistry();
    }

    @Override
    public int priority() {
        return 1000;  // Highest priority in test environment
    }

    @Override
    public String name() {
        return "InMemory (Test)";
    }
}
