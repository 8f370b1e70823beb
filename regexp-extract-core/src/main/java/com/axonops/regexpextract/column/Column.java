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

/**
 * A column of values for a single argument across all rows of a batch.
 *
 * <p>Implementations are immutable, so a column can be shared between worker threads without
 * synchronization.
 *
 * @since 1.0.0
 */
public interface Column {

  /** Returns the number of values (rows) in this column. */
  int getPositionCount();

  /**
   * Returns true if the value at the given position is null.
   *
   * @param position the row index (0-based)
   * @return true if null
   * @throws IndexOutOfBoundsException if position is outside {@code [0, getPositionCount())}
   */
  boolean isNull(int position);

  /** Returns the data type of this column's values. */
  DataType getType();

  /** Returns the estimated heap memory retained by this column in bytes. */
  long getRetainedSizeBytes();

  /**
   * Returns a sub-region of this column.
   *
   * @param positionOffset the starting row index
   * @param length the number of rows in the region
   * @return a new column representing the sub-region
   * @throws IndexOutOfBoundsException if the region is outside this column
   */
  Column getRegion(int positionOffset, int length);
}
