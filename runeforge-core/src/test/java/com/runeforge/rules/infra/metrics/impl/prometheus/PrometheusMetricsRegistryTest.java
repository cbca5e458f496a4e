package com.runeforge.rules.infra.metrics.impl.prometheus;

import com.runeforge.rules.infra.metrics.Counter;
import com.runeforge.rules.infra.metrics.Timer;
import io.prometheus.client.CollectorRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PrometheusMetricsRegistryTest {

    private CollectorRegistry collectorRegistry;
    private PrometheusMetricsRegistry metrics;

    @BeforeEach
    void setUp() {
        collectorRegistry = new CollectorRegistry();
        metrics = new PrometheusMetricsRegistry(collectorRegistry);
    }

    @Test
    @DisplayName("counters with different tag values share one collector")
    void countersShareCollectorAcrossLabelValues() {
        metrics.counter("rule_elements_processed", "kind", "FlatModifier").increment();
        metrics.counter("rule_elements_processed", "kind", "FlatModifier").increment();
        metrics.counter("rule_elements_processed", "kind", "Resistance").increment(3);

        assertThat(collectorRegistry.getSampleValue("rule_elements_processed_total",
                new String[]{"kind"}, new String[]{"FlatModifier"})).isEqualTo(2.0);
        assertThat(collectorRegistry.getSampleValue("rule_elements_processed_total",
                new String[]{"kind"}, new String[]{"Resistance"})).isEqualTo(3.0);
    }

    @Test
    @DisplayName("same name and tags return the same counter")
    void counterIsCached() {
        Counter first = metrics.counter("passes");
        Counter second = metrics.counter("passes");

        assertThat(first).isSameAs(second);
    }

    @Test
    @DisplayName("negative increments are rejected")
    void negativeIncrementRejected() {
        Counter counter = metrics.counter("passes");

        assertThatThrownBy(() -> counter.increment(-1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("negative");
    }

    @Test
    @DisplayName("timer observations land in the seconds histogram")
    void timerRecordsIntoHistogram() throws Exception {
        Timer timer = metrics.timer("rule_element_pass");

        String result = timer.record(() -> "done");
        timer.record(Duration.ofMillis(2));

        assertThat(result).isEqualTo("done");
        assertThat(collectorRegistry.getSampleValue("rule_element_pass_seconds_count")).isEqualTo(2.0);
        assertThat(((PrometheusTimerAdapter) timer).count()).isEqualTo(2L);
    }

    @Test
    @DisplayName("percentiles are left to the server")
    void percentileUnsupported() {
        Timer timer = metrics.timer("rule_element_pass");

        assertThatThrownBy(() -> timer.percentile(0.99))
                .isInstanceOf(UnsupportedOperationException.class)
                .hasMessageContaining("histogram_quantile");
    }

    @Test
    @DisplayName("gauge keeps the last value")
    void gaugeSetsValue() {
        metrics.gauge("predicate_cache_size").set(12);
        metrics.gauge("predicate_cache_size").set(7);

        assertThat(metrics.gauge("predicate_cache_size").value()).isEqualTo(7.0);
        assertThat(collectorRegistry.getSampleValue("predicate_cache_size")).isEqualTo(7.0);
    }

    @Test
    @DisplayName("metric names are sanitized for Prometheus")
    void sanitizesNames() {
        assertThat(PrometheusMetricsRegistry.sanitizeName("Rule-Elements..Skipped"))
                .isEqualTo("rule_elements_skipped");
    }
}
