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

import com.axonops.regexpextract.api.FunctionArgs;
import com.axonops.regexpextract.api.PatternCompilationException;
import com.axonops.regexpextract.api.RegexpExtract;
import com.axonops.regexpextract.cache.ExtractConfig;
import com.axonops.regexpextract.column.ColumnarValue;
import com.axonops.regexpextract.column.ScalarValue;
import com.axonops.regexpextract.column.StringColumn;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.jmx.JmxReporter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.management.MBeanServer;
import javax.management.ObjectName;
import java.lang.management.ManagementFactory;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

/**
 * JMX integration tests.
 *
 * Verifies that metrics are actually exposed via JMX and accessible
 * through the platform MBean server.
 */
class JmxIntegrationTest {

    private JmxReporter jmxReporter;
    private MetricRegistry registry;

    @BeforeEach
    void setup() {
        registry = new MetricRegistry();

        // Start JMX reporter
        jmxReporter = JmxReporter.forRegistry(registry).build();
        jmxReporter.start();
    }

    @AfterEach
    void cleanup() {
        if (jmxReporter != null) {
            jmxReporter.stop();
        }
    }

    private static void extract(ExtractConfig config, String pattern, String... text) {
        try (RegexpExtract fn = new RegexpExtract(config)) {
            fn.invoke(FunctionArgs.of(text.length,
                ColumnarValue.of(StringColumn.of(text)),
                ColumnarValue.of(ScalarValue.utf8(pattern)),
                ColumnarValue.of(ScalarValue.int64(1))));
        }
    }

    @Test
    void testMetricsExposedViaJmx() throws Exception {
        ExtractConfig config = ExtractMetricsConfig.withMetrics(registry, "com.test.jmx", false);

        extract(config, "(\\d+)", "a1", "b2", "c");

        MBeanServer mBeanServer = ManagementFactory.getPlatformMBeanServer();

        // Dropwizard uses "metrics" domain with type classification
        Set<ObjectName> mbeans = mBeanServer.queryNames(
            new ObjectName("metrics:name=com.test.jmx.*,type=*"), null
        );

        assertThat(mbeans)
            .as("JMX MBeans should be registered for regexp_extract metrics")
            .hasSizeGreaterThan(5);

        boolean foundInvocationCounter = mbeans.stream()
            .anyMatch(name -> name.toString().contains("invocations.total.count") && name.toString().contains("type=counters"));

        boolean foundCompiledCounter = mbeans.stream()
            .anyMatch(name -> name.toString().contains("patterns.compiled.total.count") && name.toString().contains("type=counters"));

        boolean foundCompilationTimer = mbeans.stream()
            .anyMatch(name -> name.toString().contains("patterns.compilation.latency") && name.toString().contains("type=timers"));

        assertThat(foundInvocationCounter)
            .as("invocations.total.count counter should be in JMX")
            .isTrue();

        assertThat(foundCompiledCounter)
            .as("patterns.compiled.total.count counter should be in JMX")
            .isTrue();

        assertThat(foundCompilationTimer)
            .as("patterns.compilation.latency timer should be in JMX")
            .isTrue();
    }

    @Test
    void testRowCountersReadable() throws Exception {
        ExtractConfig config = ExtractMetricsConfig.withMetrics(registry, "jmx.rows.test", false);

        extract(config, "(\\d+)", "a1", null, "c", "d4");

        MBeanServer mBeanServer = ManagementFactory.getPlatformMBeanServer();

        assertThat(((Number) mBeanServer.getAttribute(
            new ObjectName("metrics:name=jmx.rows.test.rows.total.count,type=counters"), "Count")).longValue())
            .isEqualTo(4);
        assertThat(((Number) mBeanServer.getAttribute(
            new ObjectName("metrics:name=jmx.rows.test.rows.null.total.count,type=counters"), "Count")).longValue())
            .isEqualTo(1);
        assertThat(((Number) mBeanServer.getAttribute(
            new ObjectName("metrics:name=jmx.rows.test.rows.matched.total.count,type=counters"), "Count")).longValue())
            .isEqualTo(2);
        assertThat(((Number) mBeanServer.getAttribute(
            new ObjectName("metrics:name=jmx.rows.test.rows.unmatched.total.count,type=counters"), "Count")).longValue())
            .isEqualTo(1);
    }

    @Test
    void testJmxTimerStatistics() throws Exception {
        ExtractConfig config = ExtractMetricsConfig.withMetrics(registry, "jmx.timer.test", false);

        // 50 distinct patterns, each compiled once
        try (RegexpExtract fn = new RegexpExtract(config)) {
            for (int i = 0; i < 50; i++) {
                fn.invoke(FunctionArgs.of(1,
                    ColumnarValue.of(StringColumn.of("timer_pattern_" + i)),
                    ColumnarValue.of(ScalarValue.utf8("timer_(pattern)_" + i)),
                    ColumnarValue.of(ScalarValue.int64(1))));
            }
        }

        assertThat(registry.getTimers().keySet())
            .as("Timer should exist in MetricRegistry")
            .contains("jmx.timer.test.patterns.compilation.latency");

        MBeanServer mBeanServer = ManagementFactory.getPlatformMBeanServer();
        ObjectName timerName = new ObjectName("metrics:name=jmx.timer.test.patterns.compilation.latency,type=timers");

        assertThat(mBeanServer.isRegistered(timerName))
            .as("Compilation latency timer should be in JMX")
            .isTrue();

        long countValue = ((Number) mBeanServer.getAttribute(timerName, "Count")).longValue();
        assertThat(countValue)
            .as("Timer count via JMX")
            .isEqualTo(50);

        // min/max can be 0 for fast operations
        assertThat(mBeanServer.getAttribute(timerName, "Min")).as("Timer min attribute exists").isNotNull();
        assertThat(mBeanServer.getAttribute(timerName, "Max")).as("Timer max attribute exists").isNotNull();
        assertThat(mBeanServer.getAttribute(timerName, "99thPercentile")).as("Timer p99 attribute exists").isNotNull();
        assertThat(mBeanServer.getAttribute(timerName, "OneMinuteRate"))
            .as("Timer should provide 1-minute rate via JMX")
            .isNotNull();

        ObjectName invocationTimer = new ObjectName("metrics:name=jmx.timer.test.invocations.latency,type=timers");
        assertThat(((Number) mBeanServer.getAttribute(invocationTimer, "Count")).longValue()).isEqualTo(50);
    }

    @Test
    void testErrorCounterInJmx() throws Exception {
        ExtractConfig config = ExtractMetricsConfig.withMetrics(registry, "jmx.error.test", false);

        assertThatThrownBy(() -> extract(config, "(invalid", "text"))
            .isInstanceOf(PatternCompilationException.class);

        MBeanServer mBeanServer = ManagementFactory.getPlatformMBeanServer();
        ObjectName failed = new ObjectName("metrics:name=jmx.error.test.errors.compilation.failed.total.count,type=counters");

        assertThat(mBeanServer.isRegistered(failed)).isTrue();
        assertThat(((Number) mBeanServer.getAttribute(failed, "Count")).longValue()).isEqualTo(1);
    }

    @Test
    void testJmxCounterIncrementsCorrectly() throws Exception {
        ExtractConfig config = ExtractMetricsConfig.withMetrics(registry, "jmx.increment.test", false);

        extract(config, "(initial)", "initial");

        MBeanServer mBeanServer = ManagementFactory.getPlatformMBeanServer();
        ObjectName invocations = new ObjectName("metrics:name=jmx.increment.test.invocations.total.count,type=counters");

        long countBefore = ((Number) mBeanServer.getAttribute(invocations, "Count")).longValue();
        assertThat(countBefore).isEqualTo(1);

        for (int i = 0; i < 5; i++) {
            extract(config, "(inc)", "inc_" + i);
        }

        long countAfter = ((Number) mBeanServer.getAttribute(invocations, "Count")).longValue();
        assertThat(countAfter - countBefore)
            .as("Counter should have incremented by 5 via JMX")
            .isEqualTo(5);
    }
}
