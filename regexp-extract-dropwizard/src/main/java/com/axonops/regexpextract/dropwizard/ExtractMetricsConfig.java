/*
 * Copyright 2025 AxonOps
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.axonops.regexpextract.dropwizard;

import com.axonops.regexpextract.cache.ExtractConfig;
import com.axonops.regexpextract.metrics.DropwizardMetricsAdapter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.jmx.JmxReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Convenience factory for ExtractConfig with Dropwizard Metrics integration.
 *
 * <p>Query engines that already keep a Dropwizard {@link MetricRegistry} can report
 * {@code regexp_extract} metrics into it, and optionally expose them through JMX.
 *
 * <p><strong>Usage Examples:</strong>
 * <pre>{@code
 * // Engine with an existing registry:
 * MetricRegistry engineRegistry = getEngineMetricRegistry();
 * ExtractConfig config = ExtractMetricsConfig.withMetrics(engineRegistry, "com.myengine.sql.regexp_extract");
 *
 * // Metrics plus parallel evaluation:
 * ExtractConfig config = ExtractMetricsConfig.builder(registry, "com.myengine.sql.regexp_extract", true)
 *     .parallelism(8)
 *     .build();
 * }</pre>
 *
 * <p><strong>JMX Exposure:</strong> This class sets up a JmxReporter for the provided
 * registry (if not already configured), so every metric in {@code MetricNames} is visible
 * under the {@code metrics} JMX domain.
 *
 * @since 1.0.0
 */
public final class ExtractMetricsConfig {
    private static final Logger logger = LoggerFactory.getLogger(ExtractMetricsConfig.class);
    private static volatile JmxReporter jmxReporter;

    private ExtractMetricsConfig() {
        // Utility class
    }

    /**
     * Creates ExtractConfig with Dropwizard Metrics integration and automatic JMX.
     *
     * @param registry the Dropwizard MetricRegistry to use
     * @param metricPrefix the metric namespace prefix
     * @return configured ExtractConfig with metrics enabled
     */
    public static ExtractConfig withMetrics(MetricRegistry registry, String metricPrefix) {
        return withMetrics(registry, metricPrefix, true);
    }

    /**
     * Creates ExtractConfig with Dropwizard Metrics integration.
     *
     * @param registry the Dropwizard MetricRegistry to use
     * @param metricPrefix the metric namespace prefix
     * @param enableJmx whether to automatically set up JMX exposure
     * @return configured ExtractConfig with metrics enabled
     */
    public static ExtractConfig withMetrics(MetricRegistry registry, String metricPrefix, boolean enableJmx) {
        return builder(registry, metricPrefix, enableJmx).build();
    }

    /**
     * Creates ExtractConfig with Dropwizard Metrics using default prefix.
     *
     * <p>Uses default metric prefix: {@code "com.axonops.regexpextract"}
     *
     * @param registry the Dropwizard MetricRegistry to use
     * @return configured ExtractConfig with metrics enabled
     */
    public static ExtractConfig withMetrics(MetricRegistry registry) {
        return withMetrics(registry, DropwizardMetricsAdapter.DEFAULT_PREFIX, true);
    }

    /**
     * Creates a config builder with Dropwizard Metrics already set, for callers that also tune
     * caching or parallelism.
     *
     * @param registry the Dropwizard MetricRegistry to use
     * @param metricPrefix the metric namespace prefix
     * @param enableJmx whether to automatically set up JMX exposure
     * @return builder with the metrics registry set
     */
    public static ExtractConfig.Builder builder(MetricRegistry registry, String metricPrefix, boolean enableJmx) {
        Objects.requireNonNull(registry, "registry cannot be null");
        Objects.requireNonNull(metricPrefix, "metricPrefix cannot be null");

        if (enableJmx) {
            ensureJmxReporter(registry);
        }

        return ExtractConfig.builder()
            .metricsRegistry(new DropwizardMetricsAdapter(registry, metricPrefix));
    }

    /** Returns true while a JmxReporter started by this class is running. */
    public static synchronized boolean isJmxReporterRunning() {
        return jmxReporter != null;
    }

    /**
     * Ensures JmxReporter is registered for the given MetricRegistry.
     *
     * <p>Idempotent: only the first registry passed here gets a reporter until
     * {@link #shutdown()} is called.
     *
     * @param registry the MetricRegistry to expose via JMX
     */
    private static synchronized void ensureJmxReporter(MetricRegistry registry) {
        if (jmxReporter == null) {
            try {
                logger.info("regexp_extract: Registering JmxReporter for metrics");
                JmxReporter reporter = JmxReporter.forRegistry(registry).build();
                reporter.start();
                jmxReporter = reporter;
                logger.info("regexp_extract: JmxReporter started - metrics available via JMX");
            } catch (RuntimeException e) {
                // Not fatal - the host may already expose the registry via JMX
                logger.warn("regexp_extract: Failed to start JmxReporter (may already be configured)", e);
            }
        }
    }

    /**
     * Stops the JmxReporter started by this class, if any.
     */
    public static synchronized void shutdown() {
        if (jmxReporter != null) {
            logger.info("regexp_extract: Stopping JmxReporter");
            jmxReporter.stop();
            jmxReporter = null;
        }
    }
}
