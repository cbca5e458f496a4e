package com.runeforge.rules.infra.metrics.internal;

import com.runeforge.rules.infra.config.EngineSettings;
import com.runeforge.rules.infra.metrics.MetricsRegistry;
import com.runeforge.rules.infra.metrics.api.MetricsRegistryProvider;

import java.util.Comparator;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.logging.Logger;
import java.util.stream.StreamSupport;

/**
 * Lazy holder for the process-wide MetricsRegistry.
 *
 * <p><b>INTERNAL USE ONLY</b> - API may change without notice.
 */
public final class MetricsRegistryHolder {
    private static final Logger logger = Logger.getLogger(MetricsRegistryHolder.class.getName());

    public static final MetricsRegistry INSTANCE = select(EngineSettings.fromEnvironment());

    private MetricsRegistryHolder() {
        throw new AssertionError("No instances");
    }

    static MetricsRegistry select(EngineSettings settings) {
        if (!settings.metricsEnabled()) {
            logger.info("[Metrics] Disabled by configuration, using no-op implementation");
            return NoOpMetricsRegistry.INSTANCE;
        }
        Optional<MetricsRegistryProvider> provider = highestPriority(ServiceLoader.load(MetricsRegistryProvider.class));
        if (provider.isPresent()) {
            logger.info(String.format("[Metrics] Using provider: %s (priority: %d)",
                    provider.get().name(), provider.get().priority()));
            return provider.get().create();
        }
        logger.info("[Metrics] No provider found, using no-op implementation");
        return NoOpMetricsRegistry.INSTANCE;
    }

    static Optional<MetricsRegistryProvider> highestPriority(Iterable<MetricsRegistryProvider> providers) {
        return StreamSupport.stream(providers.spliterator(), false)
                .max(Comparator.comparingInt(MetricsRegistryProvider::priority));
    }
}
