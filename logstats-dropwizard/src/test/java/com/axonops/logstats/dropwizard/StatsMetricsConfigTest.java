package com.axonops.logstats.dropwizard;

import com.axonops.logstats.metrics.DropwizardMetricsAdapter;
import com.axonops.logstats.registry.StatsConfig;
import com.axonops.logstats.registry.StatsRegistry;
import com.codahale.metrics.MetricRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the Dropwizard convenience configuration.
 */
class StatsMetricsConfigTest {

    @AfterEach
    void cleanup() {
        StatsMetricsConfig.shutdown();
    }

    @Test
    void testWithMetrics_CustomPrefix() {
        MetricRegistry registry = new MetricRegistry();
        StatsConfig config = StatsMetricsConfig.withMetrics(registry, "com.myapp.logstats", false);

        assertThat(config.metricsRegistry()).isInstanceOf(DropwizardMetricsAdapter.class);

        new StatsRegistry(config);
        assertThat(registry.getGauges()).containsKey("com.myapp.logstats.registry.records.current.count");
    }

    @Test
    void testWithMetrics_DefaultPrefix() {
        MetricRegistry registry = new MetricRegistry();
        StatsConfig config = StatsMetricsConfig.withMetrics(registry);

        new StatsRegistry(config);
        assertThat(registry.getGauges())
            .containsKey(StatsMetricsConfig.DEFAULT_PREFIX + ".registry.stats_level.current");
    }

    @Test
    void testWithMetrics_KeepsBuilderSettings() {
        StatsConfig config = StatsMetricsConfig.withMetrics(
            StatsConfig.builder().statsLevel(2).lifetimeSeconds(120),
            new MetricRegistry(), "test", false);

        assertThat(config.statsLevel()).isEqualTo(2);
        assertThat(config.lifetimeSeconds()).isEqualTo(120);
    }

    @Test
    void testJmxReporterStartedOnce() {
        assertThat(StatsMetricsConfig.isJmxReporterRunning()).isFalse();

        StatsMetricsConfig.withMetrics(new MetricRegistry(), "test.first", true);
        assertThat(StatsMetricsConfig.isJmxReporterRunning()).isTrue();

        // Second call reuses the running reporter
        StatsMetricsConfig.withMetrics(new MetricRegistry(), "test.second", true);
        assertThat(StatsMetricsConfig.isJmxReporterRunning()).isTrue();

        StatsMetricsConfig.shutdown();
        assertThat(StatsMetricsConfig.isJmxReporterRunning()).isFalse();
    }

    @Test
    void testJmxDisabled() {
        StatsMetricsConfig.withMetrics(new MetricRegistry(), "test.nojmx", false);

        assertThat(StatsMetricsConfig.isJmxReporterRunning()).isFalse();
    }

    @Test
    void testNullArgumentsRejected() {
        assertThatThrownBy(() -> StatsMetricsConfig.withMetrics(null, "p", false))
            .isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> StatsMetricsConfig.withMetrics(new MetricRegistry(), null, false))
            .isInstanceOf(NullPointerException.class);
    }
}
