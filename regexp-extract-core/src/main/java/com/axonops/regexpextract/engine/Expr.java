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

import com.axonops.regexpextract.api.FunctionArgs;
import com.axonops.regexpextract.api.InvalidArgumentException;
import com.axonops.regexpextract.api.ScalarFunction;
import com.axonops.regexpextract.api.Signature;
import com.axonops.regexpextract.api.TypeMismatchException;
import com.axonops.regexpextract.column.ColumnarValue;
import com.axonops.regexpextract.column.DataType;
import com.axonops.regexpextract.column.ScalarValue;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A scalar expression evaluated against a {@link RecordBatch}.
 *
 * <pre>{@code
 * Expr expr = Expr.call("regexp_extract", Expr.col("line"), Expr.lit("(\\d+)"), Expr.lit(1L));
 * }</pre>
 *
 * @since 1.0.0
 */
public sealed interface Expr permits Expr.ColumnRef, Expr.Literal, Expr.Call {

  /**
   * Evaluates this expression.
   *
   * @param batch input rows
   * @param registry functions available to {@link Call}
   * @return a column of the batch's length, or a scalar standing for every row
   */
  ColumnarValue evaluate(RecordBatch batch, FunctionRegistry registry);

  /** Returns the type this expression produces against the given batch. */
  DataType resultType(RecordBatch batch, FunctionRegistry registry);

  static Expr col(String name) {
    return new ColumnRef(name);
  }

  static Expr lit(String value) {
    return new Literal(ScalarValue.utf8(value));
  }

  static Expr lit(long value) {
    return new Literal(ScalarValue.int64(value));
  }

  static Expr lit(ScalarValue value) {
    return new Literal(value);
  }

  static Expr call(String functionName, Expr... args) {
    return new Call(functionName, List.of(args));
  }

  /** Reference to a batch column by name. */
  record ColumnRef(String name) implements Expr {
    public ColumnRef {
      Objects.requireNonNull(name, "name cannot be null");
    }

    @Override
    public ColumnarValue evaluate(RecordBatch batch, FunctionRegistry registry) {
      return ColumnarValue.of(batch.column(name));
    }

    @Override
    public DataType resultType(RecordBatch batch, FunctionRegistry registry) {
      return batch.column(name).getType();
    }
  }

  /** A constant, passed to functions as a broadcast scalar. */
  record Literal(ScalarValue value) implements Expr {
    public Literal {
      Objects.requireNonNull(value, "value cannot be null");
    }

    @Override
    public ColumnarValue evaluate(RecordBatch batch, FunctionRegistry registry) {
      return ColumnarValue.of(value);
    }

    @Override
    public DataType resultType(RecordBatch batch, FunctionRegistry registry) {
      return value.type();
    }
  }

  /** Call of a registered scalar function. */
  record Call(String functionName, List<Expr> args) implements Expr {
    public Call {
      Objects.requireNonNull(functionName, "functionName cannot be null");
      args = List.copyOf(args);
    }

    @Override
    public ColumnarValue evaluate(RecordBatch batch, FunctionRegistry registry) {
      ScalarFunction function = resolve(batch, registry);
      List<ColumnarValue> values = new ArrayList<>(args.size());
      for (Expr arg : args) {
        values.add(arg.evaluate(batch, registry));
      }
      return function.invoke(new FunctionArgs(values, batch.getRowCount()));
    }

    @Override
    public DataType resultType(RecordBatch batch, FunctionRegistry registry) {
      ScalarFunction function = resolve(batch, registry);
      return function.returnType(argumentTypes(batch, registry));
    }

    private ScalarFunction resolve(RecordBatch batch, FunctionRegistry registry) {
      ScalarFunction function =
          registry
              .lookup(functionName)
              .orElseThrow(
                  () -> new InvalidArgumentException("unknown function '" + functionName + "'"));

      Signature signature = function.signature();
      List<DataType> actual = argumentTypes(batch, registry);
      if (signature.accepts(actual)) {
        return function;
      }
      if (signature.arity() != actual.size()) {
        throw new InvalidArgumentException(
            function.name()
                + " expects "
                + signature.arity()
                + " arguments but got "
                + actual.size());
      }
      List<DataType> expected = signature.argumentTypes();
      int i = 0;
      while (expected.get(i) == actual.get(i)) {
        i++;
      }
      throw new TypeMismatchException(
          function.name() + " argument " + (i + 1), expected.get(i), actual.get(i));
    }

    private List<DataType> argumentTypes(RecordBatch batch, FunctionRegistry registry) {
      List<DataType> types = new ArrayList<>(args.size());
      for (Expr arg : args) {
        types.add(arg.resultType(batch, registry));
      }
      return types;
    }
  }
}
