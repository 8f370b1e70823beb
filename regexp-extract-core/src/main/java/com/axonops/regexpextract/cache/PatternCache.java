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

import com.axonops.regexpextract.util.PatternHasher;
import com.google.re2j.Pattern;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded LRU cache of compiled patterns for a single invocation.
 *
 * <p>A cache is created at the start of an invocation (one per worker when rows are split) and
 * dropped at the end, so it never outlives the batch it serves. Compilation is pure and
 * deterministic, so serving a row from the cache gives the same result as compiling its pattern
 * again.
 *
 * <p>A pattern that fails to compile is never cached; the compiler's exception propagates to the
 * caller unchanged.
 *
 * <p>NOT thread-safe: each worker owns its own instance.
 *
 * @since 1.0.0
 */
public final class PatternCache {
  private static final Logger logger = LoggerFactory.getLogger(PatternCache.class);

  private final boolean enabled;
  private final int maxSize;
  private final LinkedHashMap<String, Pattern> patterns;

  private long hits;
  private long misses;
  private long evictions;

  /**
   * Creates an empty cache sized from the given configuration.
   *
   * @param config the evaluation configuration
   */
  public PatternCache(ExtractConfig config) {
    Objects.requireNonNull(config, "config cannot be null");
    this.enabled = config.cacheEnabled();
    this.maxSize = enabled ? config.maxCachedPatterns() : 0;
    this.patterns =
        new LinkedHashMap<>(16, 0.75f, true) {
          @Override
          protected boolean removeEldestEntry(Map.Entry<String, Pattern> eldest) {
            if (size() > maxSize) {
              evictions++;
              logger.trace(
                  "regexp_extract: Evicting compiled pattern - hash: {}",
                  PatternHasher.hash(eldest.getKey()));
              return true;
            }
            return false;
          }
        };
  }

  /**
   * Returns the compiled form of {@code pattern}, compiling it on a miss.
   *
   * @param pattern regex source (must not be null)
   * @param compiler compiles the pattern on a cache miss
   * @return cached or newly compiled pattern
   */
  public Pattern getOrCompile(String pattern, Function<String, Pattern> compiler) {
    Objects.requireNonNull(pattern, "pattern cannot be null");

    if (!enabled) {
      misses++;
      return compiler.apply(pattern);
    }

    Pattern cached = patterns.get(pattern);
    if (cached != null) {
      hits++;
      return cached;
    }

    misses++;
    Pattern compiled = compiler.apply(pattern);
    patterns.put(pattern, compiled);
    return compiled;
  }

  /** Returns the number of patterns currently held. */
  public int size() {
    return patterns.size();
  }

  /** Returns a snapshot of this cache's statistics. */
  public CacheStatistics statistics() {
    return new CacheStatistics(hits, misses, evictions, patterns.size(), maxSize);
  }
}
