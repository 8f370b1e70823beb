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
import com.axonops.regexpextract.column.ColumnarValue;
import com.axonops.regexpextract.column.DataType;
import com.axonops.regexpextract.column.StringColumn;
import com.axonops.regexpextract.column.StringColumnBuilder;
import com.axonops.regexpextract.metrics.ExtractMetricsRegistry;
import com.axonops.regexpextract.metrics.MetricNames;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code regexp_extract(text, pattern, group_index)}: extracts one capture group from every row
 * of a batch.
 *
 * <p>For each row, the row's pattern is applied to the row's text and the substring captured by
 * group {@code group_index} of the first (leftmost) match is returned. Group 0 is the whole
 * match.
 *
 * <ul>
 *   <li>Null text gives a null result; the row's pattern is not looked at.
 *   <li>No match, a group index beyond the pattern's group count, or a group that did not take
 *       part in the match gives {@code ""}.
 *   <li>A pattern that fails to compile aborts the whole invocation with {@link
 *       PatternCompilationException}. No partial result is returned.
 * </ul>
 *
 * <p>Text and pattern may each be a column or a broadcast scalar. The group index must be a
 * non-negative INT64 scalar. Patterns use RE2 syntax (via RE2/J): matching is linear-time and
 * backreferences are not supported.
 *
 * <p><strong>Usage:</strong>
 * <pre>{@code
 * try (RegexpExtract fn = new RegexpExtract()) {
 *   ColumnarValue result = fn.invoke(FunctionArgs.of(3,
 *       ColumnarValue.of(StringColumn.of("100-200", null, "500-600")),
 *       ColumnarValue.of(ScalarValue.utf8("(\\d+)-(\\d+)")),
 *       ColumnarValue.of(ScalarValue.int64(1))));
 *   // ["100", null, "500"]
 * }
 * }</pre>
 *
 * <p>Thread-safe. Batches larger than {@link ExtractConfig#parallelThreshold()} are split across
 * a worker pool when {@link ExtractConfig#parallelism()} is above 1; the pool is created on first
 * use and released by {@link #close()}.
 *
 * @since 1.0.0
 */
public final class RegexpExtract implements ScalarFunction, AutoCloseable {
  private static final Logger logger = LoggerFactory.getLogger(RegexpExtract.class);

  /** Name the function is registered under. */
  public static final String NAME = "regexp_extract";

  private static final Signature SIGNATURE =
      Signature.exact(List.of(DataType.UTF8, DataType.UTF8, DataType.INT64), Volatility.IMMUTABLE);

  private static final AtomicInteger poolCounter = new AtomicInteger();

  private final ExtractConfig config;
  private final ExtractMetricsRegistry metrics;
  private final RangeExtractor extractor;

  private final Object executorLock = new Object();
  private ExecutorService executor; // guarded by executorLock
  private boolean closed; // guarded by executorLock

  /** Creates the function with {@link ExtractConfig#DEFAULT}. */
  public RegexpExtract() {
    this(ExtractConfig.DEFAULT);
  }

  /**
   * Creates the function with a custom configuration.
   *
   * @param config caching, parallelism and metrics settings
   */
  public RegexpExtract(ExtractConfig config) {
    this.config = Objects.requireNonNull(config, "config cannot be null");
    this.metrics = config.metricsRegistry();
    this.extractor = new RangeExtractor(config, new PatternCompiler(metrics));
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public Signature signature() {
    return SIGNATURE;
  }

  @Override
  public DataType returnType(List<DataType> argumentTypes) {
    return DataType.UTF8;
  }

  public ExtractConfig getConfig() {
    return config;
  }

  /**
   * Evaluates the function over one batch.
   *
   * @param args text, pattern and group index, plus the batch row count
   * @return {@link ColumnarValue.Array} holding a {@link StringColumn} of {@code args.numRows()}
   *     rows
   * @throws InvalidArgumentException if the arity, group index or a column length is invalid
   * @throws TypeMismatchException if text or pattern is not UTF8
   * @throws PatternCompilationException if a pattern evaluated for a non-null row does not compile
   * @throws ExtractionInterruptedException if interrupted while waiting for parallel workers
   */
  @Override
  public ColumnarValue invoke(FunctionArgs args) {
    Objects.requireNonNull(args, "args cannot be null");
    metrics.incrementCounter(MetricNames.INVOCATIONS);
    long startNanos = System.nanoTime();
    try {
      return ColumnarValue.of(evaluate(args));
    } catch (InvalidArgumentException e) {
      metrics.incrementCounter(MetricNames.ERRORS_INVALID_ARGUMENT);
      throw e;
    } catch (TypeMismatchException e) {
      metrics.incrementCounter(MetricNames.ERRORS_TYPE_MISMATCH);
      throw e;
    } finally {
      metrics.recordTimer(MetricNames.INVOCATION_LATENCY, System.nanoTime() - startNanos);
    }
  }

  private StringColumn evaluate(FunctionArgs args) {
    if (args.size() != 3) {
      throw new InvalidArgumentException(
          "expected 3 arguments (text, pattern, group_index) but got " + args.size());
    }
    int numRows = args.numRows();
    long groupIndex = ArgumentReader.groupIndex(args.get(2));
    ArgumentReader.requireUtf8(args.get(0), "text");
    ArgumentReader.requireUtf8(args.get(1), "pattern");
    StringColumn text = ArgumentReader.stringColumn(args.get(0), numRows, "text");
    StringColumn patterns = ArgumentReader.stringColumn(args.get(1), numRows, "pattern");

    RangeExtractor.Slice result;
    if (numRows == 0) {
      result = RangeExtractor.Slice.empty();
    } else if (config.isParallel(numRows)) {
      result = extractParallel(text, patterns, groupIndex, numRows);
    } else {
      result = extractor.extract(text, patterns, groupIndex, 0, numRows);
    }

    recordRowMetrics(result, numRows);
    logger.trace(
        "regexp_extract: Invocation complete - rows: {}, nulls: {}, matched: {}, unmatched: {}, cacheHits: {}, cacheMisses: {}",
        numRows,
        result.nulls(),
        result.matched(),
        result.unmatched(),
        result.cache().hits(),
        result.cache().misses());
    return result.values();
  }

  private RangeExtractor.Slice extractParallel(
      StringColumn text, StringColumn patterns, long groupIndex, int numRows) {
    int ranges = Math.min(config.parallelism(), numRows);
    int rangeSize = (numRows + ranges - 1) / ranges;
    ExecutorService pool = executor();
    metrics.incrementCounter(MetricNames.INVOCATIONS_PARALLEL);

    List<Future<RangeExtractor.Slice>> futures = new ArrayList<>(ranges);
    for (int from = 0; from < numRows; from += rangeSize) {
      int start = from;
      int end = Math.min(numRows, from + rangeSize);
      try {
        futures.add(pool.submit(() -> extractor.extract(text, patterns, groupIndex, start, end)));
      } catch (RejectedExecutionException e) {
        // close() ran between executor() and submit
        cancelFrom(futures, 0);
        throw new IllegalStateException("regexp_extract: function has been closed", e);
      }
    }

    // Ranges are collected in row order, so the first failure seen is the lowest failing range
    StringColumnBuilder builder = new StringColumnBuilder(numRows);
    long nulls = 0;
    long matched = 0;
    long unmatched = 0;
    CacheStatistics cache = CacheStatistics.EMPTY;
    for (int i = 0; i < futures.size(); i++) {
      RangeExtractor.Slice slice;
      try {
        slice = futures.get(i).get();
      } catch (ExecutionException e) {
        cancelFrom(futures, i + 1);
        throw rethrow(e.getCause());
      } catch (CancellationException e) {
        cancelFrom(futures, i + 1);
        throw new IllegalStateException(
            "regexp_extract: row range " + i + " was cancelled before it completed", e);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        cancelFrom(futures, 0);
        throw new ExtractionInterruptedException("waiting for " + futures.size() + " row ranges", e);
      }
      builder.appendAll(slice.values());
      nulls += slice.nulls();
      matched += slice.matched();
      unmatched += slice.unmatched();
      cache = cache.plus(slice.cache());
    }

    logger.trace("regexp_extract: Parallel invocation - rows: {}, ranges: {}", numRows, futures.size());
    return new RangeExtractor.Slice(builder.build(), nulls, matched, unmatched, cache);
  }

  private static void cancelFrom(List<Future<RangeExtractor.Slice>> futures, int first) {
    for (int i = first; i < futures.size(); i++) {
      futures.get(i).cancel(true);
    }
  }

  private static RuntimeException rethrow(Throwable cause) {
    if (cause instanceof RuntimeException) {
      return (RuntimeException) cause;
    }
    if (cause instanceof Error) {
      throw (Error) cause;
    }
    return new IllegalStateException("regexp_extract: worker failed", cause);
  }

  private void recordRowMetrics(RangeExtractor.Slice result, int numRows) {
    metrics.incrementCounter(MetricNames.ROWS, numRows);
    metrics.incrementCounter(MetricNames.ROWS_NULL, result.nulls());
    metrics.incrementCounter(MetricNames.ROWS_MATCHED, result.matched());
    metrics.incrementCounter(MetricNames.ROWS_UNMATCHED, result.unmatched());
    metrics.incrementCounter(MetricNames.PATTERNS_CACHE_HITS, result.cache().hits());
    metrics.incrementCounter(MetricNames.PATTERNS_CACHE_MISSES, result.cache().misses());
    metrics.incrementCounter(MetricNames.PATTERNS_CACHE_EVICTIONS, result.cache().evictions());
  }

  private ExecutorService executor() {
    synchronized (executorLock) {
      if (closed) {
        throw new IllegalStateException("regexp_extract: function has been closed");
      }
      if (executor == null) {
        int poolId = poolCounter.incrementAndGet();
        AtomicInteger threadCounter = new AtomicInteger();
        ThreadFactory threadFactory =
            runnable -> {
              Thread thread =
                  new Thread(
                      runnable,
                      "regexp-extract-" + poolId + "-worker-" + threadCounter.incrementAndGet());
              thread.setDaemon(true);
              return thread;
            };
        executor = Executors.newFixedThreadPool(config.parallelism(), threadFactory);
        logger.debug(
            "regexp_extract: Worker pool started - parallelism: {}", config.parallelism());
      }
      return executor;
    }
  }

  /** Returns true once {@link #close()} has been called. */
  public boolean isClosed() {
    synchronized (executorLock) {
      return closed;
    }
  }

  /**
   * Releases the worker pool, if one was started.
   *
   * <p>Row ranges already submitted by in-flight invocations still run to completion, so those
   * callers get their results. Sequential invocations keep working after close; an invocation that
   * would run in parallel fails with {@link IllegalStateException}. Calling close more than once is
   * a no-op.
   */
  @Override
  public void close() {
    synchronized (executorLock) {
      if (closed) {
        return;
      }
      closed = true;
      if (executor != null) {
        executor.shutdown();
        executor = null;
        logger.debug("regexp_extract: Worker pool shut down");
      }
    }
  }
}
