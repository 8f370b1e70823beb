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

package com.axonops.regexpextract.column;

import java.util.Objects;

/**
 * A function argument or result: either a materialized column or a single scalar standing for
 * the same value on every row of the batch.
 *
 * <p>A query planner may fold any argument into a literal, so functions must accept both shapes
 * for every argument. {@link #toColumn(int)} performs the broadcast.
 *
 * @since 1.0.0
 */
public sealed interface ColumnarValue permits ColumnarValue.Array, ColumnarValue.Scalar {

  /** Returns the logical type of the value. */
  DataType dataType();

  /**
   * Returns this value as a column of {@code numRows} rows.
   *
   * <p>A scalar is repeated {@code numRows} times; an array is returned as is (its length is not
   * checked here).
   *
   * @param numRows the batch row count
   * @return a materialized column
   */
  Column toColumn(int numRows);

  static ColumnarValue of(Column column) {
    return new Array(column);
  }

  static ColumnarValue of(ScalarValue scalar) {
    return new Scalar(scalar);
  }

  /** A materialized column. */
  record Array(Column column) implements ColumnarValue {
    public Array {
      Objects.requireNonNull(column, "column cannot be null");
    }

    @Override
    public DataType dataType() {
      return column.getType();
    }

    @Override
    public Column toColumn(int numRows) {
      return column;
    }
  }

  /** A broadcast scalar. */
  record Scalar(ScalarValue value) implements ColumnarValue {
    public Scalar {
      Objects.requireNonNull(value, "value cannot be null");
    }

    @Override
    public DataType dataType() {
      return value.type();
    }

    @Override
    public Column toColumn(int numRows) {
      return value.toColumn(numRows);
    }
  }
}
