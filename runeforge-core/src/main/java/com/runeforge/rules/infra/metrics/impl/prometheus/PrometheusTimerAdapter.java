package com.runeforge.rules.infra.metrics.impl.prometheus;

import com.runeforge.rules.infra.metrics.Timer;

import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * Bridges {@link Timer} to a Prometheus histogram. Durations are observed in seconds.
 *
 * <p>{@link #percentile(double)} is not supported: percentiles are computed by the Prometheus
 * server with {@code histogram_quantile()}.
 */
final class PrometheusTimerAdapter implements Timer {

    private final io.prometheus.client.Histogram.Child histogram;

    PrometheusTimerAdapter(io.prometheus.client.Histogram histogram, String[] labelValues) {
        if (histogram == null) {
            throw new IllegalArgumentException("Histogram cannot be null");
        }
        if (labelValues == null) {
            throw new IllegalArgumentException("Label values cannot be null");
        }
        this.histogram = histogram.labels(labelValues);
    }

    @Override
    public <T> T record(Callable<T> callable) throws Exception {
        if (callable == null) {
            throw new IllegalArgumentException("Callable cannot be null");
        }
        io.prometheus.client.Histogram.Timer timer = histogram.startTimer();
        try {
            return callable.call();
        } finally {
            timer.observeDuration();
        }
    }

    @Override
    public void record(Duration duration) {
        if (duration == null) {
            throw new IllegalArgumentException("Duration cannot be null");
        }
        if (duration.isNegative()) {
            throw new IllegalArgumentException("Duration cannot be negative: " + duration);
        }
        histogram.observe(duration.toNanos() / 1_000_000_000.0);
    }

    @Override
    public Duration percentile(double percentile) {
        throw new UnsupportedOperationException(String.format(
                "Percentiles are calculated by the Prometheus server. "
                        + "Use histogram_quantile(%.2f, rate(metric_name_bucket[5m])).", percentile));
    }

    /**
     * Number of observations, the {@code _count} series.
     */
    long count() {
        // Buckets are cumulative; the last one is +Inf
        double[] buckets = histogram.get().buckets;
        return (long) buckets[buckets.length - 1];
    }
}
