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
 * Discards every invocation, row and pattern-cache measurement.
 *
 * <p>{@link com.axonops.regexpextract.cache.ExtractConfig#DEFAULT} and {@code NO_CACHE} report
 * here, so {@code regexp_extract} runs with no metrics library on the hot path unless a registry
 * is configured.
 *
 * @since 1.0.0
 */
public final class NoOpMetricsRegistry implements ExtractMetricsRegistry {

  /** Shared instance; the registry holds no state. */
  public static final NoOpMetricsRegistry INSTANCE = new NoOpMetricsRegistry();

  private NoOpMetricsRegistry() {}

  @Override
  public void incrementCounter(String name) {}

  @Override
  public void incrementCounter(String name, long delta) {}

  @Override
  public void recordTimer(String name, long durationNanos) {}
}
