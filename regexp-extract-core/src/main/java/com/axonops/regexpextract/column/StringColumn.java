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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable column of nullable UTF-8 strings.
 *
 * <p>Null entries represent SQL {@code NULL}. The backing array is never exposed, so a
 * StringColumn is safe to share between threads.
 *
 * <pre>{@code
 * StringColumn text = StringColumn.of("100-200", null, "500-600");
 * text.get(0);       // "100-200"
 * text.isNull(1);    // true
 * }</pre>
 *
 * @since 1.0.0
 */
public final class StringColumn implements Column {

  private static final StringColumn EMPTY = new StringColumn(new String[0]);

  private final String[] values;

  // Takes ownership of the array; callers must not modify it afterwards
  StringColumn(String[] values) {
    this.values = Objects.requireNonNull(values, "values cannot be null");
  }

  /**
   * Creates a column holding the given values, in order.
   *
   * @param values the values (individual entries may be null)
   * @return new column
   */
  public static StringColumn of(String... values) {
    Objects.requireNonNull(values, "values cannot be null");
    return new StringColumn(values.clone());
  }

  /**
   * Creates a column from a list of values.
   *
   * @param values the values (individual entries may be null)
   * @return new column
   */
  public static StringColumn ofList(List<String> values) {
    Objects.requireNonNull(values, "values cannot be null");
    return new StringColumn(values.toArray(new String[0]));
  }

  /**
   * Creates a column holding {@code value} repeated {@code count} times.
   *
   * @param value the value to repeat (may be null)
   * @param count number of rows
   * @return new column
   * @throws IllegalArgumentException if count is negative
   */
  public static StringColumn repeat(String value, int count) {
    if (count < 0) {
      throw new IllegalArgumentException("count must be non-negative: " + count);
    }
    String[] values = new String[count];
    Arrays.fill(values, value);
    return new StringColumn(values);
  }

  /** Returns the empty column. */
  public static StringColumn empty() {
    return EMPTY;
  }

  /**
   * Returns the value at the given position.
   *
   * @param position the row index (0-based)
   * @return the value, or null if the position is null
   */
  public String get(int position) {
    checkPosition(position);
    return values[position];
  }

  @Override
  public int getPositionCount() {
    return values.length;
  }

  @Override
  public boolean isNull(int position) {
    checkPosition(position);
    return values[position] == null;
  }

  @Override
  public DataType getType() {
    return DataType.UTF8;
  }

  /** Estimates 16 bytes per reference plus two bytes per character. */
  @Override
  public long getRetainedSizeBytes() {
    long size = 16L + 8L * values.length;
    for (String value : values) {
      if (value != null) {
        size += 40L + 2L * value.length();
      }
    }
    return size;
  }

  @Override
  public StringColumn getRegion(int positionOffset, int length) {
    if (positionOffset < 0 || length < 0 || positionOffset + length > values.length) {
      throw new IndexOutOfBoundsException(
          "Region ["
              + positionOffset
              + ", "
              + (positionOffset + length)
              + ") out of range [0, "
              + values.length
              + ")");
    }
    return new StringColumn(Arrays.copyOfRange(values, positionOffset, positionOffset + length));
  }

  /** Returns the number of null entries. */
  public int nullCount() {
    int count = 0;
    for (String value : values) {
      if (value == null) {
        count++;
      }
    }
    return count;
  }

  /**
   * Returns the values as an unmodifiable list (nulls preserved).
   *
   * @return list view of a copy of the values
   */
  public List<String> toList() {
    return Collections.unmodifiableList(new ArrayList<>(Arrays.asList(values)));
  }

  private void checkPosition(int position) {
    if (position < 0 || position >= values.length) {
      throw new IndexOutOfBoundsException(
          "Position " + position + " out of range [0, " + values.length + ")");
    }
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof StringColumn other)) {
      return false;
    }
    return Arrays.equals(values, other.values);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(values);
  }

  @Override
  public String toString() {
    return "StringColumn" + Arrays.toString(values);
  }
}
