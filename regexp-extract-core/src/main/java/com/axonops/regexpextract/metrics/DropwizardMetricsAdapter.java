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

package com.axonops.regexpextract.metrics;

import com.codahale.metrics.MetricRegistry;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Reports {@code regexp_extract} measurements into a Dropwizard {@link MetricRegistry}.
 *
 * <p>Each {@link MetricNames} constant becomes one Dropwizard metric named {@code
 * <prefix>.<constant>}: the invocation, row, error and pattern-cache tallies become {@code
 * Counter}s, while invocation latency and compile time become {@code Timer}s. Metrics are created
 * on first use, so a registry only shows the ones an invocation has touched.
 *
 * <pre>{@code
 * MetricRegistry registry = new MetricRegistry();
 * ExtractConfig config = ExtractConfig.builder()
 *     .metricsRegistry(new DropwizardMetricsAdapter(registry, "com.myapp.sql.regexp_extract"))
 *     .build();
 * // registry.counter("com.myapp.sql.regexp_extract.rows.matched.total.count")
 * }</pre>
 *
 * <p>For a JMX-exposed registry use {@code ExtractMetricsConfig} in the
 * regexp-extract-dropwizard module.
 *
 * @since 1.0.0
 */
public final class DropwizardMetricsAdapter implements ExtractMetricsRegistry {

    /** Metric prefix used when none is given. */
    public static final String DEFAULT_PREFIX = "com.axonops.regexpextract";

    private final MetricRegistry registry;
    private final String prefix;

    /** Reports under {@link #DEFAULT_PREFIX}. */
    public DropwizardMetricsAdapter(MetricRegistry registry) {
        this(registry, DEFAULT_PREFIX);
    }

    /**
     * @param registry registry that receives the counters and timers
     * @param prefix prepended to every {@link MetricNames} constant, e.g. {@code "com.myapp.sql"}
     *     yields {@code com.myapp.sql.invocations.total.count}
     * @throws NullPointerException if registry or prefix is null
     */
    public DropwizardMetricsAdapter(MetricRegistry registry, String prefix) {
        this.registry = Objects.requireNonNull(registry, "registry cannot be null");
        this.prefix = Objects.requireNonNull(prefix, "prefix cannot be null");
    }

    @Override
    public void incrementCounter(String name) {
        registry.counter(metricName(name)).inc();
    }

    /** Row and cache tallies arrive once per invocation, so a zero delta still registers the counter. */
    @Override
    public void incrementCounter(String name, long delta) {
        registry.counter(metricName(name)).inc(delta);
    }

    @Override
    public void recordTimer(String name, long durationNanos) {
        registry.timer(metricName(name)).update(durationNanos, TimeUnit.NANOSECONDS);
    }

    private String metricName(String name) {
        return MetricRegistry.name(prefix, name);
    }
}
