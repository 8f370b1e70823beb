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
 * A single typed value, used by the host engine as a broadcast placeholder for "this value on
 * every row".
 *
 * <p>The value is either null or an instance matching the declared type ({@link String} for
 * {@link DataType#UTF8}, {@link Long} for {@link DataType#INT64}).
 *
 * @param type the logical type of the value
 * @param value the value, or null for a typed SQL {@code NULL}
 * @since 1.0.0
 */
public record ScalarValue(DataType type, Object value) {

  public ScalarValue {
    Objects.requireNonNull(type, "type cannot be null");
    if (value != null) {
      Class<?> expected = type == DataType.UTF8 ? String.class : Long.class;
      if (!expected.isInstance(value)) {
        throw new IllegalArgumentException(
            "Value of class "
                + value.getClass().getSimpleName()
                + " does not match type "
                + type);
      }
    }
  }

  /** Creates a UTF-8 scalar; {@code null} gives a typed null. */
  public static ScalarValue utf8(String value) {
    return new ScalarValue(DataType.UTF8, value);
  }

  /** Creates an INT64 scalar; {@code null} gives a typed null. */
  public static ScalarValue int64(Long value) {
    return new ScalarValue(DataType.INT64, value);
  }

  /** Creates an INT64 scalar. */
  public static ScalarValue int64(long value) {
    return new ScalarValue(DataType.INT64, value);
  }

  public boolean isNull() {
    return value == null;
  }

  /**
   * Returns the value as a string.
   *
   * @throws IllegalStateException if this scalar is not UTF8
   */
  public String stringValue() {
    if (type != DataType.UTF8) {
      throw new IllegalStateException("Scalar of type " + type + " is not UTF8");
    }
    return (String) value;
  }

  /**
   * Returns the value as a long.
   *
   * @throws IllegalStateException if this scalar is not INT64
   */
  public Long longValue() {
    if (type != DataType.INT64) {
      throw new IllegalStateException("Scalar of type " + type + " is not INT64");
    }
    return (Long) value;
  }

  /**
   * Expands this scalar to a column of {@code numRows} identical values.
   *
   * @param numRows the batch row count
   * @return a materialized column
   */
  public Column toColumn(int numRows) {
    if (type == DataType.UTF8) {
      return StringColumn.repeat(stringValue(), numRows);
    }
    return Int64Column.repeat(longValue(), numRows);
  }

  @Override
  public String toString() {
    return type + "(" + value + ")";
  }
}
