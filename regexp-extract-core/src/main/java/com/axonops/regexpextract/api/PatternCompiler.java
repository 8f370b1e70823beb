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

package com.axonops.regexpextract.api;

import com.axonops.regexpextract.metrics.ExtractMetricsRegistry;
import com.axonops.regexpextract.metrics.MetricNames;
import com.axonops.regexpextract.util.PatternHasher;
import com.google.re2j.Pattern;
import com.google.re2j.PatternSyntaxException;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiles RE2-syntax patterns, recording compilation metrics.
 *
 * <p>Patterns are identified in logs by hash only.
 */
final class PatternCompiler {
    private static final Logger logger = LoggerFactory.getLogger(PatternCompiler.class);

    private final ExtractMetricsRegistry metrics;

    PatternCompiler(ExtractMetricsRegistry metrics) {
        this.metrics = Objects.requireNonNull(metrics, "metrics cannot be null");
    }

    /**
     * Compiles a pattern.
     *
     * @param pattern the regex source
     * @return the compiled pattern
     * @throws PatternCompilationException if the pattern is null or not valid RE2 syntax
     */
    Pattern compile(String pattern) {
        if (pattern == null) {
            metrics.incrementCounter(MetricNames.ERRORS_COMPILATION_FAILED);
            throw new PatternCompilationException(null, "pattern is null");
        }

        String hash = PatternHasher.hash(pattern);
        long startNanos = System.nanoTime();
        Pattern compiled;
        try {
            compiled = Pattern.compile(pattern);
        } catch (PatternSyntaxException e) {
            metrics.incrementCounter(MetricNames.ERRORS_COMPILATION_FAILED);
            logger.debug("regexp_extract: Pattern compilation failed - hash: {}, error: {}", hash, e.getDescription());
            throw new PatternCompilationException(pattern, e.getDescription(), e);
        }

        long durationNanos = System.nanoTime() - startNanos;
        metrics.recordTimer(MetricNames.PATTERNS_COMPILATION_LATENCY, durationNanos);
        metrics.incrementCounter(MetricNames.PATTERNS_COMPILED);

        logger.trace("regexp_extract: Pattern compiled - hash: {}, length: {}, timeNs: {}",
            hash, pattern.length(), durationNanos);
        return compiled;
    }
}
