package com.runeforge.rules.infra.metrics.impl.prometheus;

import com.runeforge.rules.infra.metrics.Counter;
import com.runeforge.rules.infra.metrics.Gauge;
import com.runeforge.rules.infra.metrics.MetricsRegistry;
import com.runeforge.rules.infra.metrics.Timer;
import io.prometheus.client.CollectorRegistry;

import java.util.Arrays;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link MetricsRegistry} backed by the Prometheus simpleclient.
 *
 * <p>One collector is registered per metric name; each distinct set of tag values is bound to
 * its own child. Tags are key-value pairs and the keys of a metric must not change between
 * calls.
 */
public final class PrometheusMetricsRegistry implements MetricsRegistry {

    private final CollectorRegistry registry;
    private final Map<String, io.prometheus.client.Counter> counterCollectors = new ConcurrentHashMap<>();
    private final Map<String, io.prometheus.client.Gauge> gaugeCollectors = new ConcurrentHashMap<>();
    private final Map<String, io.prometheus.client.Histogram> histogramCollectors = new ConcurrentHashMap<>();
    private final Map<String, Counter> counters = new ConcurrentHashMap<>();
    private final Map<String, Gauge> gauges = new ConcurrentHashMap<>();
    private final Map<String, Timer> timers = new ConcurrentHashMap<>();

    public PrometheusMetricsRegistry() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusMetricsRegistry(CollectorRegistry registry) {
        this.registry = registry;
    }

    @Override
    public Counter counter(String name, String... tags) {
        return counters.computeIfAbsent(childKey(name, tags), k -> {
            io.prometheus.client.Counter collector = counterCollectors.computeIfAbsent(name, n ->
                    io.prometheus.client.Counter.build()
                            .name(sanitizeName(n))
                            .help("Counter for " + n)
                            .labelNames(extractLabelNames(tags))
                            .register(registry));
            return new PrometheusCounterAdapter(collector, extractLabelValues(tags));
        });
    }

    @Override
    public Gauge gauge(String name, String... tags) {
        return gauges.computeIfAbsent(childKey(name, tags), k -> {
            io.prometheus.client.Gauge collector = gaugeCollectors.computeIfAbsent(name, n ->
                    io.prometheus.client.Gauge.build()
                            .name(sanitizeName(n))
                            .help("Gauge for " + n)
                            .labelNames(extractLabelNames(tags))
                            .register(registry));
            return new PrometheusGaugeAdapter(collector, extractLabelValues(tags));
        });
    }

    @Override
    public Timer timer(String name, String... tags) {
        return timers.computeIfAbsent(childKey(name, tags), k -> {
            io.prometheus.client.Histogram collector = histogramCollectors.computeIfAbsent(name, n ->
                    io.prometheus.client.Histogram.build()
                            .name(sanitizeName(n) + "_seconds")
                            .help("Timer for " + n)
                            .buckets(0.0001, 0.0005, 0.001, 0.005, 0.01, 0.05, 0.1, 0.5)
                            .labelNames(extractLabelNames(tags))
                            .register(registry));
            return new PrometheusTimerAdapter(collector, extractLabelValues(tags));
        });
    }

    static String sanitizeName(String name) {
        return name.toLowerCase()
                .replaceAll("[^a-z0-9_:]", "_")
                .replaceAll("_{2,}", "_");
    }

    private static String childKey(String name, String[] tags) {
        return name + Arrays.toString(tags);
    }

    private static String[] extractLabelNames(String[] tags) {
        String[] labels = new String[tags.length / 2];
        for (int i = 0; i < labels.length; i++) {
            labels[i] = tags[i * 2];
        }
        return labels;
    }

    private static String[] extractLabelValues(String[] tags) {
        String[] values = new String[tags.length / 2];
        for (int i = 0; i < values.length; i++) {
            values[i] = tags[i * 2 + 1];
        }
        return values;
    }
}
