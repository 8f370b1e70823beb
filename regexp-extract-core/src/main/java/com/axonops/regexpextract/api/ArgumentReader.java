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

import com.axonops.regexpextract.column.Column;
import com.axonops.regexpextract.column.ColumnarValue;
import com.axonops.regexpextract.column.DataType;
import com.axonops.regexpextract.column.ScalarValue;
import com.axonops.regexpextract.column.StringColumn;

/**
 * Narrows loosely typed arguments to the shapes the extractor works on.
 *
 * <p>Every check runs before any row is evaluated.
 */
final class ArgumentReader {

  private ArgumentReader() {
    // Utility class
  }

  /**
   * Fails with {@link TypeMismatchException} unless {@code value} is UTF8.
   *
   * @param value the argument
   * @param argument argument name used in the error message
   */
  static void requireUtf8(ColumnarValue value, String argument) {
    if (value.dataType() != DataType.UTF8) {
      throw new TypeMismatchException(argument, DataType.UTF8, value.dataType());
    }
  }

  /**
   * Returns a UTF8 argument as a column of exactly {@code numRows} rows, broadcasting a scalar.
   *
   * @param value the argument (must already be known to be UTF8)
   * @param numRows the batch row count
   * @param argument argument name used in error messages
   * @return the materialized column
   */
  static StringColumn stringColumn(ColumnarValue value, int numRows, String argument) {
    Column column = value.toColumn(numRows);
    if (column.getPositionCount() != numRows) {
      throw new InvalidArgumentException(
          argument
              + " column has "
              + column.getPositionCount()
              + " rows but the batch has "
              + numRows);
    }
    if (!(column instanceof StringColumn)) {
      // A foreign Column implementation that claims UTF8
      throw new TypeMismatchException(argument, DataType.UTF8, column.getType());
    }
    return (StringColumn) column;
  }

  /**
   * Reads the group index, which must be a present, non-negative INT64 scalar.
   *
   * @param value the argument
   * @return the group index
   */
  static long groupIndex(ColumnarValue value) {
    if (!(value instanceof ColumnarValue.Scalar)) {
      throw new InvalidArgumentException("group index must be a scalar, not a column");
    }
    ScalarValue scalar = ((ColumnarValue.Scalar) value).value();
    if (scalar.type() != DataType.INT64) {
      throw new InvalidArgumentException(
          "group index must be an INT64 scalar but was " + scalar.type());
    }
    if (scalar.isNull()) {
      throw new InvalidArgumentException("group index must not be null");
    }
    long index = scalar.longValue();
    if (index < 0) {
      throw new InvalidArgumentException("group index must be non-negative but was " + index);
    }
    return index;
  }
}
