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
import java.util.Objects;

/**
 * Immutable column of nullable 64-bit integers.
 *
 * @since 1.0.0
 */
public final class Int64Column implements Column {

  private final long[] values;
  private final boolean[] nulls;

  private Int64Column(long[] values, boolean[] nulls) {
    this.values = values;
    this.nulls = nulls;
  }

  /**
   * Creates a column holding the given values, in order.
   *
   * @param values the values (individual entries may be null)
   * @return new column
   */
  public static Int64Column of(Long... values) {
    Objects.requireNonNull(values, "values cannot be null");
    long[] data = new long[values.length];
    boolean[] nulls = new boolean[values.length];
    for (int i = 0; i < values.length; i++) {
      if (values[i] == null) {
        nulls[i] = true;
      } else {
        data[i] = values[i];
      }
    }
    return new Int64Column(data, nulls);
  }

  /**
   * Creates a column holding {@code value} repeated {@code count} times.
   *
   * @param value the value to repeat, or null for an all-null column
   * @param count number of rows
   * @return new column
   */
  public static Int64Column repeat(Long value, int count) {
    if (count < 0) {
      throw new IllegalArgumentException("count must be non-negative: " + count);
    }
    long[] data = new long[count];
    boolean[] nulls = new boolean[count];
    if (value == null) {
      Arrays.fill(nulls, true);
    } else {
      Arrays.fill(data, value);
    }
    return new Int64Column(data, nulls);
  }

  /**
   * Returns the value at the given position.
   *
   * @param position the row index (0-based)
   * @return the value, or null if the position is null
   */
  public Long get(int position) {
    checkPosition(position);
    return nulls[position] ? null : values[position];
  }

  @Override
  public int getPositionCount() {
    return values.length;
  }

  @Override
  public boolean isNull(int position) {
    checkPosition(position);
    return nulls[position];
  }

  @Override
  public DataType getType() {
    return DataType.INT64;
  }

  @Override
  public long getRetainedSizeBytes() {
    return 32L + 9L * values.length;
  }

  @Override
  public Int64Column getRegion(int positionOffset, int length) {
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
    return new Int64Column(
        Arrays.copyOfRange(values, positionOffset, positionOffset + length),
        Arrays.copyOfRange(nulls, positionOffset, positionOffset + length));
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
    if (!(obj instanceof Int64Column other)) {
      return false;
    }
    return Arrays.equals(values, other.values) && Arrays.equals(nulls, other.nulls);
  }

  @Override
  public int hashCode() {
    return 31 * Arrays.hashCode(values) + Arrays.hashCode(nulls);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("Int64Column[");
    for (int i = 0; i < values.length; i++) {
      if (i > 0) {
        sb.append(", ");
      }
      sb.append(nulls[i] ? "null" : Long.toString(values[i]));
    }
    return sb.append(']').toString();
  }
}
