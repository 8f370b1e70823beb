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

import java.util.Arrays;

/**
 * Builds a {@link StringColumn} value by value.
 *
 * <p>Call {@link #append(String)} or {@link #appendNull()} once per row, then {@link #build()}.
 * The builder resets after {@code build()} and can be reused. Not thread-safe.
 *
 * @since 1.0.0
 */
public final class StringColumnBuilder {

  private String[] values;
  private int size;

  public StringColumnBuilder() {
    this(16);
  }

  /**
   * Creates a builder sized for an expected number of rows.
   *
   * @param expectedPositions expected row count (a hint, not a limit)
   */
  public StringColumnBuilder(int expectedPositions) {
    if (expectedPositions < 0) {
      throw new IllegalArgumentException(
          "expectedPositions must be non-negative: " + expectedPositions);
    }
    this.values = new String[Math.max(expectedPositions, 1)];
  }

  /**
   * Appends a value. A null value is recorded as a null row.
   *
   * @param value the value to append
   * @return this builder
   */
  public StringColumnBuilder append(String value) {
    ensureCapacity(size + 1);
    values[size++] = value;
    return this;
  }

  /** Appends a null row. */
  public StringColumnBuilder appendNull() {
    return append(null);
  }

  /**
   * Appends every row of another column, in order.
   *
   * @param column the column to copy
   * @return this builder
   */
  public StringColumnBuilder appendAll(StringColumn column) {
    int count = column.getPositionCount();
    ensureCapacity(size + count);
    for (int i = 0; i < count; i++) {
      values[size++] = column.get(i);
    }
    return this;
  }

  /** Returns the number of rows appended so far. */
  public int getPositionCount() {
    return size;
  }

  /** Builds the column from all appended rows and resets the builder. */
  public StringColumn build() {
    StringColumn column =
        size == 0 ? StringColumn.empty() : new StringColumn(Arrays.copyOf(values, size));
    Arrays.fill(values, 0, size, null);
    size = 0;
    return column;
  }

  private void ensureCapacity(int required) {
    if (required > values.length) {
      int newCapacity = Math.max(required, values.length + (values.length >> 1));
      values = Arrays.copyOf(values, newCapacity);
    }
  }
}
