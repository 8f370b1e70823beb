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

package com.axonops.regexpextract.engine;

import com.axonops.regexpextract.column.Column;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Evaluates a list of named expressions over a batch, producing a new batch.
 *
 * <pre>{@code
 * Projection projection = Projection.builder()
 *     .add(Expr.col("line"), "line")
 *     .add(Expr.call("regexp_extract", Expr.col("line"), Expr.lit("(\\d+)-(\\d+)"), Expr.lit(1L)),
 *         "first")
 *     .build();
 * RecordBatch out = projection.project(batch);
 * }</pre>
 *
 * @since 1.0.0
 */
public final class Projection {

  private final List<Expr> expressions;
  private final List<String> names;
  private final FunctionRegistry registry;

  private Projection(List<Expr> expressions, List<String> names, FunctionRegistry registry) {
    this.expressions = List.copyOf(expressions);
    this.names = List.copyOf(names);
    this.registry = registry;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Evaluates every expression against {@code batch}.
   *
   * <p>Scalar results are broadcast to the batch's row count.
   *
   * @param batch input rows
   * @return batch holding one column per expression, in declaration order
   */
  public RecordBatch project(RecordBatch batch) {
    Objects.requireNonNull(batch, "batch cannot be null");
    List<Column> columns = new ArrayList<>(expressions.size());
    for (Expr expr : expressions) {
      columns.add(expr.evaluate(batch, registry).toColumn(batch.getRowCount()));
    }
    return RecordBatch.of(names, columns);
  }

  /** Builder for {@link Projection}. */
  public static class Builder {
    private final List<Expr> expressions = new ArrayList<>();
    private final List<String> names = new ArrayList<>();
    private FunctionRegistry registry;

    public Builder add(Expr expr, String outputName) {
      expressions.add(Objects.requireNonNull(expr, "expr cannot be null"));
      names.add(Objects.requireNonNull(outputName, "outputName cannot be null"));
      return this;
    }

    /**
     * Set the functions available to calls.
     *
     * <p><b>Default: {@link FunctionRegistry#withDefaults()}</b>
     */
    public Builder registry(FunctionRegistry registry) {
      this.registry = Objects.requireNonNull(registry, "registry cannot be null");
      return this;
    }

    public Projection build() {
      return new Projection(
          expressions, names, registry != null ? registry : FunctionRegistry.withDefaults());
    }
  }
}
