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

package com.axonops.regexpextract.cache;

import com.axonops.regexpextract.metrics.ExtractMetricsRegistry;
import com.axonops.regexpextract.metrics.NoOpMetricsRegistry;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Configuration for {@code regexp_extract} evaluation: compiled-pattern caching, row
 * parallelism and metrics.
 *
 * <p>Immutable configuration using Java 17 records.
 *
 * <h2>Compiled-Pattern Cache</h2>
 *
 * <p>The pattern argument may differ on every row, so each row's pattern is compiled on its own.
 * Most batches repeat the same few patterns, so each invocation keeps a bounded LRU of the
 * patterns it has already compiled. The cache lives for one invocation only; nothing is carried
 * from one batch to the next. Results are identical with the cache disabled.
 *
 * <h2>Parallelism</h2>
 *
 * <p>Rows are independent. When {@code parallelism > 1} and a batch has at least {@code
 * parallelThreshold} rows, the batch is split into {@code parallelism} contiguous ranges evaluated
 * on worker threads and the slices are concatenated in row order. Smaller batches are evaluated on
 * the calling thread, where the hand-off would cost more than it saves.
 *
 * <h2>Configuration Examples</h2>
 *
 * <pre>{@code
 * // Defaults: cache of 1024 patterns, sequential, metrics disabled
 * RegexpExtract fn = new RegexpExtract(ExtractConfig.DEFAULT);
 *
 * // Large batches on a multi-core host, with metrics
 * ExtractConfig config = ExtractConfig.builder()
 *     .parallelism(Runtime.getRuntime().availableProcessors())
 *     .parallelThreshold(8_192)
 *     .metricsRegistry(new DropwizardMetricsAdapter(registry, "myengine.regexp_extract"))
 *     .build();
 * }</pre>
 *
 * @param cacheEnabled Reuse compiled patterns within one invocation
 * @param maxCachedPatterns Maximum distinct patterns kept per invocation (must be > 0 if cache
 *     enabled)
 * @param parallelism Number of row ranges evaluated concurrently (1 = always sequential)
 * @param parallelThreshold Minimum batch row count before parallel evaluation kicks in (must be
 *     > 0)
 * @param metricsRegistry Metrics implementation (use {@link NoOpMetricsRegistry} for zero overhead)
 * @since 1.0.0
 */
public record ExtractConfig(
    boolean cacheEnabled,
    int maxCachedPatterns,
    int parallelism,
    int parallelThreshold,
    ExtractMetricsRegistry metricsRegistry) {

  private static final Logger logger = LoggerFactory.getLogger(ExtractConfig.class);

  /** Default configuration: cache of 1024 patterns, sequential evaluation, metrics disabled. */
  public static final ExtractConfig DEFAULT =
      new ExtractConfig(
          true, // Cache enabled
          1024, // Max 1024 distinct patterns per invocation
          1, // Sequential
          4096, // Ignored while sequential
          NoOpMetricsRegistry.INSTANCE // Metrics disabled
          );

  /** Configuration with caching disabled: every row's pattern is compiled from scratch. */
  public static final ExtractConfig NO_CACHE =
      new ExtractConfig(
          false, // Cache disabled
          0, // Ignored when cache disabled
          1, // Sequential
          4096, // Ignored while sequential
          NoOpMetricsRegistry.INSTANCE // Metrics disabled
          );

  /** Compact constructor with validation. */
  public ExtractConfig {
    Objects.requireNonNull(metricsRegistry, "metricsRegistry cannot be null");
    if (parallelism < 1) {
      throw new IllegalArgumentException("parallelism must be at least 1");
    }
    if (parallelThreshold <= 0) {
      throw new IllegalArgumentException("parallelThreshold must be positive");
    }
    if (cacheEnabled && maxCachedPatterns <= 0) {
      throw new IllegalArgumentException("maxCachedPatterns must be positive when cache enabled");
    }

    int processors = Runtime.getRuntime().availableProcessors();
    if (parallelism > processors) {
      logger.warn(
          "regexp_extract: parallelism ({}) exceeds available processors ({}) - extra workers will contend for CPU",
          parallelism,
          processors);
    }
  }

  /** Returns true if batches of {@code numRows} rows should be split across workers. */
  public boolean isParallel(int numRows) {
    return parallelism > 1 && numRows >= parallelThreshold;
  }

  /**
   * Creates a builder for custom configuration.
   *
   * @return new builder with default values
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Builder for custom configuration.
   *
   * <p>All fields start with the defaults from {@link #DEFAULT}.
   */
  public static class Builder {
    private boolean cacheEnabled = true;
    private int maxCachedPatterns = 1024;
    private int parallelism = 1;
    private int parallelThreshold = 4096;
    private ExtractMetricsRegistry metricsRegistry = NoOpMetricsRegistry.INSTANCE;

    /**
     * Enable or disable the per-invocation compiled-pattern cache.
     *
     * @param enabled true to enable caching (default), false to compile every row
     * @return this builder
     */
    public Builder cacheEnabled(boolean enabled) {
      this.cacheEnabled = enabled;
      return this;
    }

    /**
     * Set maximum number of distinct compiled patterns kept during one invocation.
     *
     * <p><b>Default: 1024</b>
     *
     * <p>Least recently used patterns are dropped beyond this bound. With parallel evaluation,
     * the bound applies to each worker's cache.
     *
     * @param max maximum cached patterns (must be > 0)
     * @return this builder
     */
    public Builder maxCachedPatterns(int max) {
      this.maxCachedPatterns = max;
      return this;
    }

    /**
     * Set how many row ranges are evaluated concurrently.
     *
     * <p><b>Default: 1</b> (sequential on the calling thread)
     *
     * @param parallelism number of worker threads (must be ≥ 1)
     * @return this builder
     */
    public Builder parallelism(int parallelism) {
      this.parallelism = parallelism;
      return this;
    }

    /**
     * Set the minimum batch size for parallel evaluation.
     *
     * <p><b>Default: 4096 rows</b>
     *
     * @param rows minimum row count (must be > 0)
     * @return this builder
     */
    public Builder parallelThreshold(int rows) {
      this.parallelThreshold = rows;
      return this;
    }

    /**
     * Set metrics registry for instrumentation.
     *
     * <p><b>Default: {@link NoOpMetricsRegistry}</b>
     *
     * @param metricsRegistry metrics implementation (must not be null)
     * @return this builder
     * @throws NullPointerException if metricsRegistry is null
     */
    public Builder metricsRegistry(ExtractMetricsRegistry metricsRegistry) {
      this.metricsRegistry =
          Objects.requireNonNull(metricsRegistry, "metricsRegistry cannot be null");
      return this;
    }

    /**
     * Build immutable configuration.
     *
     * @return validated immutable configuration
     * @throws IllegalArgumentException if configuration is invalid
     */
    public ExtractConfig build() {
      return new ExtractConfig(
          cacheEnabled, maxCachedPatterns, parallelism, parallelThreshold, metricsRegistry);
    }
  }
}
