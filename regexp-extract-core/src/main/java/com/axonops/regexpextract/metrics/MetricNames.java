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

/**
 * Metric name constants for regexp-extract instrumentation.
 *
 * <h2>Metric Categories</h2>
 *
 * <ul>
 *   <li><b>Invocations</b> - one per batch handed to {@code RegexpExtract.invoke}
 *   <li><b>Rows</b> - per-row outcomes: null input, matched, unmatched (no match or group out of
 *       range, both of which produce an empty string)
 *   <li><b>Patterns</b> - compilations and the per-invocation compiled-pattern cache
 *   <li><b>Errors</b> - invocations aborted by validation or compilation failures
 * </ul>
 *
 * <h2>Metric Types</h2>
 *
 * <ul>
 *   <li><b>Counter</b> - Monotonically increasing count (suffix: {@code .total.count})
 *   <li><b>Timer</b> - Latency histogram with percentiles (suffix: {@code .latency})
 * </ul>
 *
 * <p>Every invocation is counted and timed. Row and cache counters are recorded only for
 * invocations that complete; an aborted invocation adds its error counter instead.
 *
 * @since 1.0.0
 */
public final class MetricNames {

  private MetricNames() {
    // Utility class
  }

  // ========== Invocations ==========

  /** Invocations, successful or not. */
  public static final String INVOCATIONS = "invocations.total.count";

  /** End-to-end latency of an invocation, including validation. */
  public static final String INVOCATION_LATENCY = "invocations.latency";

  /** Invocations whose rows were split across worker threads. */
  public static final String INVOCATIONS_PARALLEL = "invocations.parallel.total.count";

  // ========== Rows ==========

  /** Rows processed by successful invocations. */
  public static final String ROWS = "rows.total.count";

  /** Rows whose input text was null (result null, pattern not inspected). */
  public static final String ROWS_NULL = "rows.null.total.count";

  /** Rows where the pattern matched and the requested group exists. */
  public static final String ROWS_MATCHED = "rows.matched.total.count";

  /** Rows with no match or an out-of-range group (result is the empty string). */
  public static final String ROWS_UNMATCHED = "rows.unmatched.total.count";

  // ========== Patterns ==========

  /** Successful pattern compilations. */
  public static final String PATTERNS_COMPILED = "patterns.compiled.total.count";

  /** Latency of a single pattern compilation. */
  public static final String PATTERNS_COMPILATION_LATENCY = "patterns.compilation.latency";

  /** Compiled-pattern cache hits. */
  public static final String PATTERNS_CACHE_HITS = "patterns.cache.hits.total.count";

  /** Compiled-pattern cache misses (including every lookup when the cache is disabled). */
  public static final String PATTERNS_CACHE_MISSES = "patterns.cache.misses.total.count";

  /** Patterns evicted because the per-invocation cache was full. */
  public static final String PATTERNS_CACHE_EVICTIONS = "patterns.cache.evictions.total.count";

  // ========== Errors ==========

  /** Row patterns that failed to compile (or were null); each aborts its invocation. */
  public static final String ERRORS_COMPILATION_FAILED = "errors.compilation.failed.total.count";

  /** Invocations rejected for invalid arguments (arity, group index, column length). */
  public static final String ERRORS_INVALID_ARGUMENT = "errors.invalid_argument.total.count";

  /** Invocations rejected because an argument had the wrong type. */
  public static final String ERRORS_TYPE_MISMATCH = "errors.type_mismatch.total.count";
}
