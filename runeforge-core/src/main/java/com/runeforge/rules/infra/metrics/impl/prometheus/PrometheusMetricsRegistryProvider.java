package com.runeforge.rules.infra.metrics.impl.prometheus;

import com.runeforge.rules.infra.metrics.MetricsRegistry;
import com.runeforge.rules.infra.metrics.api.MetricsRegistryProvider;

public final class PrometheusMetricsRegistryProvider implements MetricsRegistryProvider {

    @Override
    public MetricsRegistry create() {
        return new PrometheusMetricsRegistry();
    }

    @Override
    public int priority() {
        return 100;
    }

    @Override
    public String name() {
        return "Prometheus";
    }
}
