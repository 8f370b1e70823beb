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

import com.axonops.regexpextract.cache.CacheStatistics;
import com.axonops.regexpextract.cache.ExtractConfig;
import com.axonops.regexpextract.cache.PatternCache;
import com.axonops.regexpextract.column.StringColumn;
import com.axonops.regexpextract.column.StringColumnBuilder;
import com.google.re2j.Matcher;
import com.google.re2j.Pattern;

/**
 * Evaluates a contiguous range of rows.
 *
 * <p>Each call owns a fresh {@link PatternCache}, so calls for different ranges may run on
 * different threads.
 */
final class RangeExtractor {

  private final ExtractConfig config;
  private final PatternCompiler compiler;

  RangeExtractor(ExtractConfig config, PatternCompiler compiler) {
    this.config = config;
    this.compiler = compiler;
  }

  /**
   * Extracts group {@code groupIndex} for rows {@code [from, to)}.
   *
   * @param text text column of the whole batch
   * @param patterns pattern column of the whole batch
   * @param groupIndex the validated group index
   * @param from first row (inclusive)
   * @param to last row (exclusive)
   * @return the result slice for the range
   * @throws PatternCompilationException if any non-null row's pattern fails to compile
   */
  Slice extract(StringColumn text, StringColumn patterns, long groupIndex, int from, int to) {
    // Beyond int range no pattern can have that many groups
    int group = groupIndex > Integer.MAX_VALUE ? Integer.MAX_VALUE : (int) groupIndex;

    PatternCache cache = new PatternCache(config);
    StringColumnBuilder builder = new StringColumnBuilder(to - from);
    long nulls = 0;
    long matched = 0;
    long unmatched = 0;

    for (int row = from; row < to; row++) {
      String value = text.get(row);
      if (value == null) {
        builder.appendNull();
        nulls++;
        continue;
      }

      String source = patterns.get(row);
      Pattern pattern =
          source == null ? compiler.compile(null) : cache.getOrCompile(source, compiler::compile);
      Matcher matcher = pattern.matcher(value);
      if (!matcher.find() || group > matcher.groupCount()) {
        builder.append("");
        unmatched++;
        continue;
      }

      matched++;
      String captured = matcher.group(group);
      builder.append(captured == null ? "" : captured);
    }

    return new Slice(builder.build(), nulls, matched, unmatched, cache.statistics());
  }

  /** Result of one range with its row outcome counts. */
  record Slice(
      StringColumn values, long nulls, long matched, long unmatched, CacheStatistics cache) {

    static Slice empty() {
      return new Slice(StringColumn.empty(), 0, 0, 0, CacheStatistics.EMPTY);
    }
  }
}
